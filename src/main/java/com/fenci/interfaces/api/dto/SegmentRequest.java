package com.fenci.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record SegmentRequest(
        @NotNull(message = "Text is required")
        String text,

        String mode,

        @Valid
        SegmentOptionsRequest options
) {}
