package com.fenci.domain.segment.model;

import java.util.Set;

/**
 * Per-call knobs. A null field means "keep the stored default".
 */
public record SegmentOverrides(
        Boolean useDictionary,
        Boolean useAlgorithm,
        Integer randomMinLength,
        Integer randomMaxLength,
        Integer chaosMinTokens,
        Boolean namingRemoveSymbols,
        Integer lineCharLimit,
        Set<RuleId> rules
) {
    public static SegmentOverrides none() {
        return new SegmentOverrides(null, null, null, null, null, null, null, null);
    }
}
