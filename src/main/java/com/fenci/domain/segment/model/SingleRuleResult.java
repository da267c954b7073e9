package com.fenci.domain.segment.model;

import java.util.List;

/**
 * Result of applying exactly one rule to an existing token list.
 * A conflict is informational; the rule has been applied regardless.
 */
public record SingleRuleResult(List<String> tokens, boolean hasConflict, String conflictMessage) {}
