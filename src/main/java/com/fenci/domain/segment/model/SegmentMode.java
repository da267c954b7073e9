package com.fenci.domain.segment.model;

import java.util.List;

/**
 * Mutually exclusive top-level segmentation strategies.
 */
public enum SegmentMode {
    SMART("smart", "Smart",
            "English words, whole CJK runs, digit runs and single punctuation marks; whitespace dropped",
            List.of()),
    CHINESE("chinese", "Chinese",
            "Chinese/English separation, digit runs, dictionary maximum match for the rest",
            List.of("useDictionary", "useAlgorithm")),
    ENGLISH("english", "English",
            "Chinese/English separation, symbol and whitespace splitting, naming-convention splitting",
            List.of()),
    CODE("code", "Code",
            "Brace or indentation structure analysis of source code",
            List.of()),
    AI("ai", "AI",
            "Link detection and completion, remaining text tokenized by a language model",
            List.of()),
    SENTENCE("sentence", "Sentence",
            "Split on newlines and sentence-ending punctuation",
            List.of()),
    HALF_SENTENCE("halfSentence", "Half sentence",
            "Split on punctuation, whitespace and newlines",
            List.of()),
    CHAR_BREAK("charBreak", "Line break",
            "Wrap at a fixed column, preferring a nearby separator",
            List.of("lineCharLimit")),
    REMOVE_SYMBOLS("removeSymbols", "Remove symbols",
            "Strip symbols, then split on language and number boundaries",
            List.of()),
    RANDOM("random", "Random",
            "Random-length order-preserving chunks; never reproducible",
            List.of("randomMinLength", "randomMaxLength", "chaosMinTokens")),
    MULTI("multi", "Multi-rule",
            "User-selected combination of split and remove rules",
            List.of("rules", "namingRemoveSymbols"));

    private final String id;
    private final String displayName;
    private final String description;
    private final List<String> optionKeys;

    SegmentMode(String id, String displayName, String description, List<String> optionKeys) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.optionKeys = optionKeys;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public List<String> optionKeys() {
        return optionKeys;
    }

    /**
     * Resolve a mode identifier. Unknown or missing identifiers resolve to {@link #SMART}.
     */
    public static SegmentMode fromId(String id) {
        if (id == null || id.isBlank()) {
            return SMART;
        }
        for (SegmentMode mode : values()) {
            if (mode.id.equalsIgnoreCase(id.trim()) || mode.name().equalsIgnoreCase(id.trim())) {
                return mode;
            }
        }
        return SMART;
    }

    public static boolean isKnown(String id) {
        if (id == null) {
            return false;
        }
        for (SegmentMode mode : values()) {
            if (mode.id.equalsIgnoreCase(id.trim()) || mode.name().equalsIgnoreCase(id.trim())) {
                return true;
            }
        }
        return false;
    }
}
