package com.fenci.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record MultiRuleRequest(
        @NotNull(message = "Text is required")
        String text,

        List<String> rules,

        @Valid
        SegmentOptionsRequest options
) {}
