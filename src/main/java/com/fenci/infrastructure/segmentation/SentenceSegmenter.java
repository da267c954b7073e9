package com.fenci.infrastructure.segmentation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Sentence and half-sentence modes. Separators are discarded and each piece is trimmed.
 * The ASCII period is not a sentence separator, so decimals and abbreviations survive.
 */
@Component
public class SentenceSegmenter {

    /** Split on newlines and sentence-ending punctuation. */
    public List<String> sentences(String text) {
        return splitOn(text, CharClasses::isSentenceTerminator);
    }

    /** Split on punctuation, whitespace and newlines. */
    public List<String> halfSentences(String text) {
        return splitOn(text, CharClasses::isBreakSeparator);
    }

    private List<String> splitOn(String text, IntPredicate separator) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }

        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        text.codePoints().forEach(cp -> {
            if (separator.test(cp)) {
                addTrimmed(current, pieces);
            } else {
                current.appendCodePoint(cp);
            }
        });
        addTrimmed(current, pieces);
        return pieces;
    }

    private static void addTrimmed(StringBuilder current, List<String> pieces) {
        String piece = current.toString().strip();
        if (!piece.isEmpty()) {
            pieces.add(piece);
        }
        current.setLength(0);
    }
}
