package com.fenci.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SingleRuleRequest(
        @NotNull(message = "Tokens are required")
        List<String> tokens,

        @NotBlank(message = "Rule is required")
        String rule,

        @Valid
        SegmentOptionsRequest options
) {}
