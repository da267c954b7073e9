package com.fenci.interfaces.api.dto;

import com.fenci.application.analyze.TextAnalysisAppService.TextAnalysis;
import com.fenci.domain.segment.model.ContentProfile;

import java.util.List;

public record AnalyzeResponse(ContentTypeInfo contentType, List<Feature> features) {

    public record ContentTypeInfo(
            String type,
            double confidence,
            boolean hasUrl,
            boolean hasEmail,
            boolean hasPath,
            boolean hasRepo,
            int chineseCount,
            int englishCount
    ) {}

    public record Feature(String kind, String name, List<String> values) {}

    public static AnalyzeResponse from(TextAnalysis analysis) {
        ContentProfile p = analysis.profile();
        return new AnalyzeResponse(
                new ContentTypeInfo(p.type().id(), p.confidence(), p.hasUrl(), p.hasEmail(),
                        p.hasPath(), p.hasRepo(), p.chineseCount(), p.englishCount()),
                analysis.features().stream()
                        .map(f -> new Feature(f.kind().id(), f.kind().displayName(), f.values()))
                        .toList());
    }
}
