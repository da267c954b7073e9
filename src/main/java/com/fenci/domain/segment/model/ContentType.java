package com.fenci.domain.segment.model;

public enum ContentType {
    EMPTY("empty"),
    URL_COLLECTION("url_collection"),
    CONTACT_INFO("contact_info"),
    REPOSITORY("repository"),
    FILE_PATH("file_path"),
    CHINESE_TEXT("chinese_text"),
    ENGLISH_TEXT("english_text"),
    MIXED_TEXT("mixed_text");

    private final String id;

    ContentType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
