package com.fenci.domain.segment.model;

/**
 * Kinds of structured data recognised by text analysis, in report order.
 */
public enum FeatureKind {
    URL("url", "Links"),
    EMAIL("email", "E-mail addresses"),
    PHONE("phone", "Phone numbers"),
    IP_ADDRESS("ip", "IP addresses"),
    PATH("path", "File paths"),
    GITHUB("github", "GitHub links"),
    DATE("date", "Dates");

    private final String id;
    private final String displayName;

    FeatureKind(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }
}
