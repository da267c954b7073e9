package com.fenci.infrastructure.settings;

import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.domain.segment.repository.SettingsRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Stored defaults backed by {@code application.yml}.
 */
@Repository
public class PropertySettingsRepository implements SettingsRepository {

    @Value("${segmenter.use-dictionary:true}")
    private boolean useDictionary;

    @Value("${segmenter.use-algorithm:true}")
    private boolean useAlgorithm;

    @Value("${segmenter.random.min-length:1}")
    private int randomMinLength;

    @Value("${segmenter.random.max-length:10}")
    private int randomMaxLength;

    @Value("${segmenter.chaos.min-tokens:3}")
    private int chaosMinTokens;

    @Value("${segmenter.naming.remove-symbols:true}")
    private boolean namingRemoveSymbols;

    @Value("${segmenter.char-break.line-limit:100}")
    private int lineCharLimit;

    @Override
    public SegmentOptions loadDefaults() {
        return SegmentOptions.builder()
                .useDictionary(useDictionary)
                .useAlgorithm(useAlgorithm)
                .randomMinLength(randomMinLength)
                .randomMaxLength(randomMaxLength)
                .chaosMinTokens(chaosMinTokens)
                .namingRemoveSymbols(namingRemoveSymbols)
                .lineCharLimit(lineCharLimit)
                .build();
    }
}
