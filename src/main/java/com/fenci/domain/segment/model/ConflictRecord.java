package com.fenci.domain.segment.model;

/**
 * A rule dropped during conflict resolution.
 *
 * @param rule   the dropped rule
 * @param action always "skipped" for now
 * @param reason human-readable explanation
 */
public record ConflictRecord(RuleId rule, String action, String reason) {

    public static final String SKIPPED = "skipped";

    public static ConflictRecord skipped(RuleId rule, String reason) {
        return new ConflictRecord(rule, SKIPPED, reason);
    }
}
