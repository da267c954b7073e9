package com.fenci.domain.segment.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable per-call configuration. Built once, merged with overrides into a new
 * instance, never mutated afterwards.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SegmentOptions {

    public static final int DEFAULT_RANDOM_MIN_LENGTH = 1;
    public static final int DEFAULT_RANDOM_MAX_LENGTH = 10;
    public static final int DEFAULT_CHAOS_MIN_TOKENS = 3;
    public static final int DEFAULT_LINE_CHAR_LIMIT = 100;

    private final boolean useDictionary;
    private final boolean useAlgorithm;
    private final int randomMinLength;
    private final int randomMaxLength;
    private final int chaosMinTokens;
    private final boolean namingRemoveSymbols;
    private final int lineCharLimit;
    private final Set<RuleId> rules;

    @Builder(toBuilder = true)
    private SegmentOptions(boolean useDictionary,
                           boolean useAlgorithm,
                           int randomMinLength,
                           int randomMaxLength,
                           int chaosMinTokens,
                           boolean namingRemoveSymbols,
                           int lineCharLimit,
                           Set<RuleId> rules) {
        if (randomMinLength < 1) {
            throw new IllegalArgumentException("randomMinLength must be >= 1, got " + randomMinLength);
        }
        if (randomMaxLength < randomMinLength) {
            throw new IllegalArgumentException(String.format(
                    "randomMaxLength (%d) must be >= randomMinLength (%d)", randomMaxLength, randomMinLength));
        }
        if (chaosMinTokens < 1) {
            throw new IllegalArgumentException("chaosMinTokens must be >= 1, got " + chaosMinTokens);
        }
        if (lineCharLimit < 1) {
            throw new IllegalArgumentException("lineCharLimit must be >= 1, got " + lineCharLimit);
        }
        this.useDictionary = useDictionary;
        this.useAlgorithm = useAlgorithm;
        this.randomMinLength = randomMinLength;
        this.randomMaxLength = randomMaxLength;
        this.chaosMinTokens = chaosMinTokens;
        this.namingRemoveSymbols = namingRemoveSymbols;
        this.lineCharLimit = lineCharLimit;
        this.rules = rules == null || rules.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(rules));
    }

    public static SegmentOptions defaults() {
        return builder().build();
    }

    /**
     * Return a new options object where every non-null override wins.
     */
    public SegmentOptions mergeFrom(SegmentOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        SegmentOptionsBuilder merged = toBuilder();
        if (overrides.useDictionary() != null) merged.useDictionary(overrides.useDictionary());
        if (overrides.useAlgorithm() != null) merged.useAlgorithm(overrides.useAlgorithm());
        if (overrides.randomMinLength() != null) merged.randomMinLength(overrides.randomMinLength());
        if (overrides.randomMaxLength() != null) merged.randomMaxLength(overrides.randomMaxLength());
        if (overrides.chaosMinTokens() != null) merged.chaosMinTokens(overrides.chaosMinTokens());
        if (overrides.namingRemoveSymbols() != null) merged.namingRemoveSymbols(overrides.namingRemoveSymbols());
        if (overrides.lineCharLimit() != null) merged.lineCharLimit(overrides.lineCharLimit());
        if (overrides.rules() != null) merged.rules(overrides.rules());
        return merged.build();
    }

    /**
     * Builder prefilled with the process-wide defaults.
     */
    public static class SegmentOptionsBuilder {
        private boolean useDictionary = true;
        private boolean useAlgorithm = true;
        private int randomMinLength = DEFAULT_RANDOM_MIN_LENGTH;
        private int randomMaxLength = DEFAULT_RANDOM_MAX_LENGTH;
        private int chaosMinTokens = DEFAULT_CHAOS_MIN_TOKENS;
        private boolean namingRemoveSymbols = true;
        private int lineCharLimit = DEFAULT_LINE_CHAR_LIMIT;
        private Set<RuleId> rules = Set.of();
    }
}
