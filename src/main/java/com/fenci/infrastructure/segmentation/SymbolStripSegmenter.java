package com.fenci.infrastructure.segmentation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * removeSymbols mode: cut the text at punctuation, drop the punctuation, collapse whitespace,
 * then separate ASCII-letter runs and digit runs from the remaining (typically CJK) text.
 */
@Component
public class SymbolStripSegmenter {

    private static final Pattern LETTER_OR_DIGIT_RUN = Pattern.compile("[a-zA-Z]+|[0-9]+");

    public List<String> segment(String text) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        StringBuilder part = new StringBuilder();
        text.codePoints().forEach(cp -> {
            if (CharClasses.isPunctuation(cp)) {
                splitPart(part.toString(), tokens);
                part.setLength(0);
            } else {
                part.appendCodePoint(cp);
            }
        });
        splitPart(part.toString(), tokens);
        return tokens;
    }

    private void splitPart(String part, List<String> tokens) {
        String cleaned = part.replaceAll("\\s+", " ").strip();
        if (cleaned.isEmpty()) {
            return;
        }

        Matcher matcher = LETTER_OR_DIGIT_RUN.matcher(cleaned);
        int last = 0;
        while (matcher.find()) {
            addTrimmed(cleaned.substring(last, matcher.start()), tokens);
            tokens.add(matcher.group());
            last = matcher.end();
        }
        addTrimmed(cleaned.substring(last), tokens);
    }

    private static void addTrimmed(String piece, List<String> tokens) {
        String trimmed = piece.strip();
        if (!trimmed.isEmpty()) {
            tokens.add(trimmed);
        }
    }
}
