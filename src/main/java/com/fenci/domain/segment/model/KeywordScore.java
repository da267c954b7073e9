package com.fenci.domain.segment.model;

/**
 * @param word   dictionary word (two characters or more)
 * @param weight occurrence count in the analysed text
 */
public record KeywordScore(String word, int weight) {}
