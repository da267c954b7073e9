package com.fenci.infrastructure.segmentation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Default heuristic tokenizer and fallback for every other mode.
 *
 * Single left-to-right pass: whitespace is dropped, each punctuation mark is its own token,
 * maximal runs of CJK ideographs, ASCII letters and digits are one token each, and any other
 * character is emitted alone.
 */
@Component
public class SmartSegmenter {

    public List<String> segment(String text) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();

        while (i < length) {
            int cp = text.codePointAt(i);

            if (CharClasses.isWhitespace(cp)) {
                i += Character.charCount(cp);
            } else if (CharClasses.isPunctuation(cp)) {
                tokens.add(new String(Character.toChars(cp)));
                i += Character.charCount(cp);
            } else if (CharClasses.isCjk(cp)) {
                i = takeRun(text, i, CharClasses::isCjk, tokens);
            } else if (CharClasses.isDigit(cp)) {
                i = takeRun(text, i, CharClasses::isDigit, tokens);
            } else if (CharClasses.isAsciiLetter(cp)) {
                i = takeRun(text, i, CharClasses::isAsciiLetter, tokens);
            } else {
                tokens.add(new String(Character.toChars(cp)));
                i += Character.charCount(cp);
            }
        }

        return tokens;
    }

    /**
     * Append the maximal run starting at {@code start} whose code points satisfy the predicate.
     *
     * @return index just past the run
     */
    static int takeRun(String text, int start, IntPredicate predicate, List<String> out) {
        int end = start;
        while (end < text.length()) {
            int cp = text.codePointAt(end);
            if (!predicate.test(cp)) {
                break;
            }
            end += Character.charCount(cp);
        }
        if (end > start) {
            out.add(text.substring(start, end));
        }
        return end;
    }
}
