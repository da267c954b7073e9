package com.fenci.interfaces.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record KeywordRequest(
        @NotNull(message = "Text is required")
        String text,

        @Min(value = 1, message = "topK must be at least 1")
        @Max(value = 100, message = "topK must not exceed 100")
        Integer topK
) {
    public int topKOrDefault() {
        return topK == null ? 10 : topK;
    }
}
