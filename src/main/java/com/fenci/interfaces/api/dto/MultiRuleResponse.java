package com.fenci.interfaces.api.dto;

import com.fenci.domain.segment.model.ConflictRecord;
import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleId;

import java.util.List;

public record MultiRuleResponse(
        List<String> tokens,
        List<String> appliedRules,
        List<ConflictEntry> conflicts,
        Stats stats
) {
    public record ConflictEntry(String rule, String action, String reason) {}

    public record Stats(int inputLength, int outputCount, int avgLength) {}

    public static MultiRuleResponse from(MultiRuleResult result) {
        return new MultiRuleResponse(
                result.tokens(),
                result.appliedRules().stream().map(RuleId::id).toList(),
                result.conflicts().stream().map(MultiRuleResponse::toEntry).toList(),
                new Stats(result.stats().inputLength(), result.stats().outputCount(), result.stats().avgLength()));
    }

    private static ConflictEntry toEntry(ConflictRecord conflict) {
        return new ConflictEntry(conflict.rule().id(), conflict.action(), conflict.reason());
    }
}
