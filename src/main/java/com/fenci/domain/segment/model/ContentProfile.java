package com.fenci.domain.segment.model;

/**
 * Best-guess classification of a piece of text.
 *
 * @param englishCount number of ASCII letter runs, not letters
 */
public record ContentProfile(
        ContentType type,
        double confidence,
        boolean hasUrl,
        boolean hasEmail,
        boolean hasPath,
        boolean hasRepo,
        int chineseCount,
        int englishCount
) {

    public static ContentProfile empty() {
        return new ContentProfile(ContentType.EMPTY, 1.0, false, false, false, false, 0, 0);
    }
}
