package com.fenci.application.analyze;

import com.fenci.application.segment.exception.TextTooLongException;
import com.fenci.domain.segment.model.ContentProfile;
import com.fenci.domain.segment.model.RepositoryLinks;
import com.fenci.domain.segment.model.TextFeature;
import com.fenci.infrastructure.ai.TextFeatureExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class TextAnalysisAppService {

    private final TextFeatureExtractor textFeatureExtractor;

    @Value("${segmenter.max-text-length:20000}")
    private int maxTextLength;

    public TextAnalysis analyze(String text) {
        checkLength(text);
        return new TextAnalysis(
                textFeatureExtractor.detectContentType(text),
                textFeatureExtractor.analyze(text));
    }

    public Optional<RepositoryLinks> repositoryLinks(String input) {
        checkLength(input);
        return textFeatureExtractor.generateRepositoryLinks(input);
    }

    private void checkLength(String text) {
        if (text != null && text.length() > maxTextLength) {
            throw new TextTooLongException(text.length(), maxTextLength);
        }
    }

    public record TextAnalysis(ContentProfile profile, List<TextFeature> features) {}
}
