package com.fenci.infrastructure.segmentation.chinese;

import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.infrastructure.segmentation.CharClasses;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Chinese mode: ASCII-letter runs are separated first, Chinese punctuation and whitespace
 * cut the rest into words, pure digit words are kept whole and every other word is handed
 * to the maximum-match segmenter.
 */
@Component
@RequiredArgsConstructor
public class ChineseAnalyzer {

    private final ChineseSegmenter chineseSegmenter;

    public List<String> segment(String text, SegmentOptions options) {
        if (CharClasses.isBlank(text)) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        StringBuilder rest = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (CharClasses.isAsciiLetter(c)) {
                emitWords(rest, options, tokens);
                int end = i;
                while (end < text.length() && CharClasses.isAsciiLetter(text.charAt(end))) {
                    end++;
                }
                tokens.add(text.substring(i, end));
                i = end;
            } else {
                rest.append(c);
                i++;
            }
        }
        emitWords(rest, options, tokens);
        return tokens;
    }

    private void emitWords(StringBuilder rest, SegmentOptions options, List<String> tokens) {
        if (rest.length() == 0) {
            return;
        }
        StringBuilder word = new StringBuilder();
        rest.codePoints().forEach(cp -> {
            if (CharClasses.isWhitespace(cp) || CharClasses.isChinesePunctuation(cp)) {
                emitWord(word, options, tokens);
            } else {
                word.appendCodePoint(cp);
            }
        });
        emitWord(word, options, tokens);
        rest.setLength(0);
    }

    private void emitWord(StringBuilder word, SegmentOptions options, List<String> tokens) {
        if (word.length() == 0) {
            return;
        }
        String w = word.toString();
        word.setLength(0);
        if (CharClasses.allAsciiDigits(w)) {
            tokens.add(w);
        } else {
            tokens.addAll(chineseSegmenter.cut(w, options.isUseDictionary(), options.isUseAlgorithm()));
        }
    }
}
