package com.fenci.infrastructure.segmentation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits identifiers at camelCase, PascalCase, snake_case and kebab-case boundaries.
 *
 * <ul>
 *   <li>{@code DarkSoul} → Dark, Soul</li>
 *   <li>{@code dark_soul}, {@code dark-soul} → dark, soul</li>
 *   <li>{@code DARKSOUL} → DARKSOUL</li>
 *   <li>{@code DarkSOUL} → Dark, SOUL</li>
 *   <li>{@code DarkSOULSword} → Dark, SOUL, Sword</li>
 *   <li>{@code HTTPSConnection} → HTTPSConnection</li>
 *   <li>{@code XMLHttpRequest} → XMLHttp, Request</li>
 * </ul>
 *
 * An uppercase run that opens a word stays attached to the lowercase run after it.
 * Whitespace is always a boundary and is dropped.
 */
@Component
public class NamingSplitter {

    public List<String> split(String text, boolean removeSeparators) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }

        StringBuilder buffer = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);

            if (CharClasses.isWhitespace(c)) {
                flush(buffer, tokens);
                i++;
                continue;
            }

            if (c == '_' || c == '-') {
                if (!removeSeparators) {
                    if (buffer.length() > 0) {
                        buffer.append(c);
                    } else if (!tokens.isEmpty()) {
                        int last = tokens.size() - 1;
                        tokens.set(last, tokens.get(last) + c);
                    } else {
                        tokens.add(String.valueOf(c));
                    }
                }
                flush(buffer, tokens);
                i++;
                continue;
            }

            if (CharClasses.isUpper(c)) {
                int runEnd = i;
                while (runEnd < text.length() && CharClasses.isUpper(text.charAt(runEnd))) {
                    runEnd++;
                }
                if (runEnd - i >= 2) {
                    boolean lowerFollows = runEnd < text.length() && CharClasses.isLower(text.charAt(runEnd));
                    boolean opensWord = buffer.length() == 0;
                    if (lowerFollows && !opensWord) {
                        flush(buffer, tokens);
                        tokens.add(text.substring(i, runEnd - 1));
                        buffer.append(text.charAt(runEnd - 1));
                    } else {
                        if (!opensWord && !lowerFollows) {
                            flush(buffer, tokens);
                        }
                        buffer.append(text, i, runEnd);
                    }
                    i = runEnd;
                    continue;
                }
                if (buffer.length() > 0 && CharClasses.isLower(buffer.charAt(buffer.length() - 1))) {
                    flush(buffer, tokens);
                }
            }

            buffer.append(c);
            i++;
        }
        flush(buffer, tokens);
        return tokens;
    }

    private static void flush(StringBuilder buffer, List<String> tokens) {
        if (buffer.length() > 0) {
            tokens.add(buffer.toString());
            buffer.setLength(0);
        }
    }
}
