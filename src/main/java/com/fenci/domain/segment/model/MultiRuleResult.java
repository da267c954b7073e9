package com.fenci.domain.segment.model;

import java.util.List;

/**
 * Output of the multi-rule composer.
 */
public record MultiRuleResult(
        List<String> tokens,
        List<RuleId> appliedRules,
        List<ConflictRecord> conflicts,
        Stats stats
) {
    public record Stats(int inputLength, int outputCount, int avgLength) {

        public static Stats of(int inputLength, int outputCount) {
            int avg = outputCount > 0 ? Math.round((float) inputLength / outputCount) : 0;
            return new Stats(inputLength, outputCount, avg);
        }
    }

    public static MultiRuleResult empty() {
        return new MultiRuleResult(List.of(), List.of(), List.of(), new Stats(0, 0, 0));
    }
}
