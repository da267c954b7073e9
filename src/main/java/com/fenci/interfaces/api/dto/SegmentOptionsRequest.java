package com.fenci.interfaces.api.dto;

import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentOverrides;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.Set;

/**
 * Optional per-call knobs; omitted fields keep the stored defaults.
 */
public record SegmentOptionsRequest(
        Boolean useDictionary,
        Boolean useAlgorithm,

        @Min(value = 1, message = "randomMinLength must be at least 1")
        @Max(value = 10000, message = "randomMinLength must not exceed 10000")
        Integer randomMinLength,

        @Min(value = 1, message = "randomMaxLength must be at least 1")
        @Max(value = 10000, message = "randomMaxLength must not exceed 10000")
        Integer randomMaxLength,

        @Min(value = 1, message = "chaosMinTokens must be at least 1")
        @Max(value = 1000, message = "chaosMinTokens must not exceed 1000")
        Integer chaosMinTokens,

        Boolean namingRemoveSymbols,

        @Min(value = 1, message = "lineCharLimit must be at least 1")
        Integer lineCharLimit,

        List<String> rules
) {
    public SegmentOverrides toOverrides(Set<RuleId> resolvedRules) {
        return new SegmentOverrides(useDictionary, useAlgorithm, randomMinLength, randomMaxLength,
                chaosMinTokens, namingRemoveSymbols, lineCharLimit, rules == null ? null : resolvedRules);
    }
}
