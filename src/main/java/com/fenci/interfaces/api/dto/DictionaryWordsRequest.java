package com.fenci.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record DictionaryWordsRequest(
        @NotEmpty(message = "At least one word is required")
        @Size(max = 1000, message = "At most 1000 words per request")
        List<String> words
) {}
