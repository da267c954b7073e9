package com.fenci.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record AnalyzeRequest(
        @NotNull(message = "Text is required")
        String text
) {}
