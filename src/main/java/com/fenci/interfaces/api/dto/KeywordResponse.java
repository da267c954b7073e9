package com.fenci.interfaces.api.dto;

import java.util.List;

public record KeywordResponse(List<Keyword> keywords) {

    public record Keyword(String word, int weight) {}
}
