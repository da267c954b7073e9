package com.fenci.infrastructure.segmentation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps text at a fixed column. A line is broken right after the last separator
 * (whitespace or punctuation) before the limit when the resulting fragment is at least
 * {@link #MIN_FRAGMENT_LENGTH} characters long; otherwise it is hard-broken at the limit.
 * No character is dropped.
 */
@Component
public class CharBreakSegmenter {

    static final int MIN_FRAGMENT_LENGTH = 50;

    public List<String> segment(String text, int lineCharLimit) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }
        if (lineCharLimit < 1) {
            throw new IllegalArgumentException("lineCharLimit must be >= 1, got " + lineCharLimit);
        }

        List<String> lines = new ArrayList<>();
        String remaining = text;

        while (remaining.length() > lineCharLimit) {
            int breakPoint = -1;
            for (int i = lineCharLimit - 1; i >= 0; i--) {
                if (CharClasses.isBreakSeparator(remaining.charAt(i))) {
                    breakPoint = i + 1;
                    break;
                }
            }

            int cut = breakPoint >= MIN_FRAGMENT_LENGTH ? breakPoint : lineCharLimit;
            // never split a surrogate pair
            if (Character.isHighSurrogate(remaining.charAt(cut - 1)) && cut < remaining.length()) {
                cut = cut > 1 ? cut - 1 : cut + 1;
            }
            lines.add(remaining.substring(0, cut));
            remaining = remaining.substring(cut);
        }

        if (!remaining.isEmpty()) {
            lines.add(remaining);
        }
        return lines;
    }
}
