package com.fenci.domain.segment.model;

import java.util.Optional;

/**
 * Closed set of composable rules usable in multi-rule mode.
 * Metadata (group, priority, dependencies, conflicts) lives in the rule catalogue.
 */
public enum RuleId {
    SYMBOL_SPLIT("symbolSplit"),
    WHITESPACE_SPLIT("whitespaceSplit"),
    NEWLINE_SPLIT("newlineSplit"),
    CHINESE_ENGLISH_SPLIT("chineseEnglishSplit"),
    UPPERCASE_SPLIT("uppercaseSplit"),
    NAMING_SPLIT("namingSplit"),
    DIGIT_SPLIT("digitSplit"),
    REMOVE_WHITESPACE("removeWhitespace"),
    REMOVE_SYMBOLS("removeSymbols"),
    REMOVE_CHINESE("removeChinese"),
    REMOVE_ENGLISH("removeEnglish"),
    REMOVE_DIGITS("removeDigits");

    private final String id;

    RuleId(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<RuleId> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String trimmed = id.trim();
        for (RuleId rule : values()) {
            if (rule.id.equalsIgnoreCase(trimmed) || rule.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
