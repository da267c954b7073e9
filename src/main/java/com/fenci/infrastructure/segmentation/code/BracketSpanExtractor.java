package com.fenci.infrastructure.segmentation.code;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Finds the single "largest" bracketed span in a chunk of code.
 *
 * Every opening symbol is tried as a candidate start. Nesting pairs ({@code () {} [] <> «»})
 * track depth against their own kind; quote-like pairs ({@code "" '' ``}) close at the next
 * identical character. A candidate must be balanced over all nesting pairs. The winner is the
 * candidate holding the most {@code (}; the earliest candidate wins ties and a candidate with
 * no parenthesis never wins.
 */
@Component
public class BracketSpanExtractor {

    private record Pair(char open, char close, boolean nested) {}

    private static final List<Pair> PAIRS = List.of(
            new Pair('(', ')', true),
            new Pair('"', '"', false),
            new Pair('\'', '\'', false),
            new Pair('{', '}', true),
            new Pair('[', ']', true),
            new Pair('<', '>', true),
            new Pair('`', '`', false),
            new Pair('«', '»', true)
    );

    /**
     * @param prefix  trimmed text before the span
     * @param bracket the span itself, delimiters included
     * @param suffix  trimmed text after the span
     */
    public record BracketSplit(String prefix, String bracket, String suffix) {}

    public Optional<BracketSplit> extract(String text) {
        int bestStart = -1;
        int bestEnd = -1;
        int bestScore = 0;

        for (int i = 0; i < text.length(); i++) {
            Pair pair = openerAt(text.charAt(i));
            if (pair == null) {
                continue;
            }
            int end = closingIndex(text, i, pair);
            if (end < 0) {
                continue;
            }
            String candidate = text.substring(i, end + 1);
            if (!isBalanced(candidate)) {
                continue;
            }
            int score = countParens(candidate);
            if (score > bestScore) {
                bestScore = score;
                bestStart = i;
                bestEnd = end + 1;
            }
        }

        if (bestStart < 0) {
            return Optional.empty();
        }
        return Optional.of(new BracketSplit(
                text.substring(0, bestStart).strip(),
                text.substring(bestStart, bestEnd).strip(),
                text.substring(bestEnd).strip()));
    }

    private static int closingIndex(String text, int openIndex, Pair pair) {
        int depth = 0;
        for (int j = openIndex + 1; j < text.length(); j++) {
            char c = text.charAt(j);
            if (!pair.nested()) {
                if (c == pair.close()) {
                    return j;
                }
            } else if (c == pair.open()) {
                depth++;
            } else if (c == pair.close()) {
                if (depth == 0) {
                    return j;
                }
                depth--;
            }
        }
        return -1;
    }

    static boolean isBalanced(String text) {
        Deque<Character> expected = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            Pair opener = openerAt(c);
            if (opener != null && opener.nested()) {
                expected.push(opener.close());
            } else if (isNestedCloser(c) && !expected.isEmpty() && expected.peek() == c) {
                expected.pop();
            }
        }
        return expected.isEmpty();
    }

    private static Pair openerAt(char c) {
        for (Pair pair : PAIRS) {
            if (pair.open() == c) {
                return pair;
            }
        }
        return null;
    }

    private static boolean isNestedCloser(char c) {
        for (Pair pair : PAIRS) {
            if (pair.nested() && pair.close() == c) {
                return true;
            }
        }
        return false;
    }

    private static int countParens(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '(') {
                count++;
            }
        }
        return count;
    }
}
