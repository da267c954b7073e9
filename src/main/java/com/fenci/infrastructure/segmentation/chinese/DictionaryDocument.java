package com.fenci.infrastructure.segmentation.chinese;

import com.fenci.domain.segment.model.ChineseDictionary;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a dictionary resource: {@code {"w2": [...], "w3": [...], "w4": [...], "stopWords": [...]}}.
 */
public record DictionaryDocument(
        List<String> w2,
        List<String> w3,
        List<String> w4,
        List<String> stopWords
) {
    public ChineseDictionary toDictionary() {
        List<String> words = new ArrayList<>();
        if (w2 != null) words.addAll(w2);
        if (w3 != null) words.addAll(w3);
        if (w4 != null) words.addAll(w4);
        return ChineseDictionary.of(words, stopWords);
    }

    public boolean isEmpty() {
        return (w2 == null || w2.isEmpty())
                && (w3 == null || w3.isEmpty())
                && (w4 == null || w4.isEmpty());
    }
}
