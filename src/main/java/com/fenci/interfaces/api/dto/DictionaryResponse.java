package com.fenci.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fenci.domain.segment.model.ChineseDictionary;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DictionaryResponse(
        int twoCharWords,
        int threeCharWords,
        int fourCharWords,
        int stopWords,
        List<String> added,
        List<String> ignored
) {
    public static DictionaryResponse from(ChineseDictionary dictionary) {
        return from(dictionary, null, null);
    }

    public static DictionaryResponse from(ChineseDictionary dictionary, List<String> added, List<String> ignored) {
        return new DictionaryResponse(
                dictionary.twoCharWords().size(),
                dictionary.threeCharWords().size(),
                dictionary.fourCharWords().size(),
                dictionary.stopWords().size(),
                added,
                ignored);
    }
}
