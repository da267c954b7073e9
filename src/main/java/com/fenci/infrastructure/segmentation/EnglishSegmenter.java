package com.fenci.infrastructure.segmentation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * English mode: CJK runs are kept whole, symbols and whitespace separate words,
 * pure digit words are kept whole and every other word goes through the naming splitter
 * with {@code _}/{@code -} always dropped.
 */
@Component
@RequiredArgsConstructor
public class EnglishSegmenter {

    private final NamingSplitter namingSplitter;

    public List<String> segment(String text) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        int i = 0;

        while (i < text.length()) {
            int cp = text.codePointAt(i);

            if (CharClasses.isCjk(cp)) {
                emitWord(word, tokens);
                i = SmartSegmenter.takeRun(text, i, CharClasses::isCjk, tokens);
                continue;
            }

            if (CharClasses.isWhitespace(cp) || CharClasses.isSymbol(cp)) {
                emitWord(word, tokens);
            } else {
                word.appendCodePoint(cp);
            }
            i += Character.charCount(cp);
        }
        emitWord(word, tokens);

        return tokens;
    }

    private void emitWord(StringBuilder word, List<String> tokens) {
        if (word.length() == 0) {
            return;
        }
        String w = word.toString();
        word.setLength(0);
        if (CharClasses.allAsciiDigits(w)) {
            tokens.add(w);
        } else {
            tokens.addAll(namingSplitter.split(w, true));
        }
    }
}
