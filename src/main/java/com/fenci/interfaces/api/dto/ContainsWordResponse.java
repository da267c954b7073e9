package com.fenci.interfaces.api.dto;

public record ContainsWordResponse(boolean containsDictionaryWord) {}
