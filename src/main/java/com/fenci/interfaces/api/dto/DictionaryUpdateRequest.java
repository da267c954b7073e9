package com.fenci.interfaces.api.dto;

import com.fenci.infrastructure.segmentation.chinese.DictionaryDocument;

import java.util.List;

public record DictionaryUpdateRequest(
        List<String> w2,
        List<String> w3,
        List<String> w4,
        List<String> stopWords
) {
    public DictionaryDocument toDocument() {
        return new DictionaryDocument(w2, w3, w4, stopWords);
    }
}
