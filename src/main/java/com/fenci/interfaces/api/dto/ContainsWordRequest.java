package com.fenci.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record ContainsWordRequest(
        @NotNull(message = "Text is required")
        String text
) {}
