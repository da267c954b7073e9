package com.fenci.infrastructure.segmentation.chinese;

import com.fenci.domain.segment.model.ChineseDictionary;
import com.fenci.domain.segment.model.KeywordScore;
import com.fenci.infrastructure.segmentation.CharClasses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cascading forward maximum-match segmenter over the dictionary store.
 *
 * At each ideograph the longest dictionary word of length 4, 3 or 2 wins; matched stop words
 * are dropped, unmatched ideographs are emitted one by one. Letter and digit runs become
 * their own tokens and whitespace is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChineseSegmenter {

    private final DictionaryStore dictionaryStore;

    public List<String> cut(String text, boolean useDictionary, boolean useAlgorithm) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }
        if (!useDictionary && !useAlgorithm) {
            return List.of(text);
        }
        return cut(text, useDictionary ? dictionaryStore.snapshot() : null);
    }

    private List<String> cut(String text, ChineseDictionary dictionary) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();

        while (i < length) {
            int cp = text.codePointAt(i);

            if (CharClasses.isWhitespace(cp)) {
                i += Character.charCount(cp);
            } else if (CharClasses.isAsciiLetter(cp)) {
                i = takeRun(text, i, true, tokens);
            } else if (CharClasses.isDigit(cp)) {
                i = takeRun(text, i, false, tokens);
            } else if (CharClasses.isCjk(cp)) {
                int matched = dictionary == null ? 0 : longestMatch(text, i, dictionary);
                if (matched > 0) {
                    String word = text.substring(i, i + matched);
                    if (!dictionary.isStopWord(word)) {
                        tokens.add(word);
                    }
                    i += matched;
                } else {
                    tokens.add(text.substring(i, i + 1));
                    i++;
                }
            } else {
                tokens.add(new String(Character.toChars(cp)));
                i += Character.charCount(cp);
            }
        }
        return tokens;
    }

    private static int longestMatch(String text, int start, ChineseDictionary dictionary) {
        for (int len = ChineseDictionary.MAX_WORD_LENGTH; len >= ChineseDictionary.MIN_WORD_LENGTH; len--) {
            if (start + len <= text.length()
                    && dictionary.wordsOfLength(len).contains(text.substring(start, start + len))) {
                return len;
            }
        }
        return 0;
    }

    private static int takeRun(String text, int start, boolean letters, List<String> out) {
        int end = start;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (letters ? !CharClasses.isAsciiLetter(c) : !CharClasses.isDigit(c)) {
                break;
            }
            end++;
        }
        out.add(text.substring(start, end));
        return end;
    }

    /**
     * Most frequent tokens of two characters or more; ties keep first appearance.
     */
    public List<KeywordScore> extractKeywords(String text, int topK) {
        if (CharClasses.isBlank(text) || topK <= 0) {
            return List.of();
        }
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (String token : cut(text, dictionaryStore.snapshot())) {
            if (token.length() >= 2) {
                frequency.merge(token, 1, Integer::sum);
            }
        }
        List<KeywordScore> keywords = frequency.entrySet().stream()
                .map(e -> new KeywordScore(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(KeywordScore::weight).reversed())
                .limit(topK)
                .toList();
        log.debug("[ChineseSegmenter] {} distinct keywords, returning top {}", frequency.size(), keywords.size());
        return keywords;
    }

    public boolean containsDictionaryWord(String text) {
        if (text == null || text.length() < ChineseDictionary.MIN_WORD_LENGTH) {
            return false;
        }
        ChineseDictionary dictionary = dictionaryStore.snapshot();
        for (int i = 0; i < text.length(); i++) {
            if (longestMatch(text, i, dictionary) > 0) {
                return true;
            }
        }
        return false;
    }
}
