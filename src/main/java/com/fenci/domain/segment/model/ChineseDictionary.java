package com.fenci.domain.segment.model;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Immutable dictionary snapshot: known words keyed by length class plus a stop-word set.
 * A snapshot is never modified; updates produce a new instance.
 */
public record ChineseDictionary(
        Set<String> twoCharWords,
        Set<String> threeCharWords,
        Set<String> fourCharWords,
        Set<String> stopWords
) {
    public static final int MIN_WORD_LENGTH = 2;
    public static final int MAX_WORD_LENGTH = 4;

    public ChineseDictionary {
        twoCharWords = twoCharWords == null ? Set.of() : Set.copyOf(twoCharWords);
        threeCharWords = threeCharWords == null ? Set.of() : Set.copyOf(threeCharWords);
        fourCharWords = fourCharWords == null ? Set.of() : Set.copyOf(fourCharWords);
        stopWords = stopWords == null ? Set.of() : Set.copyOf(stopWords);
    }

    public static ChineseDictionary empty() {
        return new ChineseDictionary(Set.of(), Set.of(), Set.of(), Set.of());
    }

    /**
     * Build a snapshot from raw word lists, filing each word under its actual length.
     * Words outside 2..4 characters are ignored.
     */
    public static ChineseDictionary of(Collection<String> words, Collection<String> stopWords) {
        return empty().withWords(words).withStopWords(stopWords);
    }

    public Set<String> wordsOfLength(int length) {
        return switch (length) {
            case 2 -> twoCharWords;
            case 3 -> threeCharWords;
            case 4 -> fourCharWords;
            default -> Set.of();
        };
    }

    public boolean contains(String word) {
        return word != null && wordsOfLength(word.length()).contains(word);
    }

    public boolean isStopWord(String word) {
        return stopWords.contains(word);
    }

    public int size() {
        return twoCharWords.size() + threeCharWords.size() + fourCharWords.size();
    }

    /**
     * Copy of this snapshot with the given words added to their length classes.
     */
    public ChineseDictionary withWords(Collection<String> words) {
        if (words == null || words.isEmpty()) {
            return this;
        }
        Set<String> two = new HashSet<>(twoCharWords);
        Set<String> three = new HashSet<>(threeCharWords);
        Set<String> four = new HashSet<>(fourCharWords);
        for (String word : words) {
            if (word == null) {
                continue;
            }
            switch (word.length()) {
                case 2 -> two.add(word);
                case 3 -> three.add(word);
                case 4 -> four.add(word);
                default -> {
                    // outside the supported length classes
                }
            }
        }
        return new ChineseDictionary(two, three, four, stopWords);
    }

    public ChineseDictionary withStopWords(Collection<String> words) {
        if (words == null || words.isEmpty()) {
            return this;
        }
        Set<String> stops = new HashSet<>(stopWords);
        words.stream().filter(w -> w != null && !w.isEmpty()).forEach(stops::add);
        return new ChineseDictionary(twoCharWords, threeCharWords, fourCharWords, stops);
    }
}
