package com.fenci.infrastructure.segmentation.random;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Random-length, order-preserving partitioning. Every character, whitespace included, lands in
 * exactly one chunk.
 *
 * Each chunk length is drawn from {@code [minLen, maxLen]} but capped so the tail can still
 * yield the tokens still owed to {@code minTokens}. If the random pass still comes up short and
 * the text is long enough, chunks of a fixed size are emitted instead.
 *
 * Output is deliberately non-reproducible in production; tests inject a seeded generator.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChaosTokenizer {

    private final RandomGenerator random;

    public List<String> tokenize(String text, int minLen, int maxLen, int minTokens) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (minLen < 1 || maxLen < minLen || minTokens < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid chaos parameters: minLen=%d, maxLen=%d, minTokens=%d", minLen, maxLen, minTokens));
        }

        int[] codePoints = text.codePoints().toArray();
        int total = codePoints.length;
        List<String> chunks = new ArrayList<>();
        int i = 0;

        while (i < total) {
            int remaining = total - i;
            int tokensNeeded = Math.max(1, minTokens - chunks.size());
            int upper = Math.min(Math.min(maxLen, remaining), Math.max(minLen, remaining / tokensNeeded));
            int lower = Math.min(minLen, upper);
            int length = lower == upper ? lower : random.nextInt(lower, upper + 1);

            chunks.add(new String(codePoints, i, length));
            i += length;
        }

        if (chunks.size() < minTokens && total >= (long) minTokens * minLen) {
            log.debug("[ChaosTokenizer] {} chunks < {}, redistributing", chunks.size(), minTokens);
            return redistribute(codePoints, minTokens, minLen, maxLen);
        }
        return chunks;
    }

    static List<String> redistribute(int[] codePoints, int minTokens, int minLen, int maxLen) {
        int total = codePoints.length;
        int size = clamp((int) (((long) total + minTokens - 1) / minTokens), minLen, maxLen);
        if (chunkCount(total, size) < minTokens) {
            size = clamp(total / minTokens, minLen, maxLen);
        }

        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < total; i += size) {
            chunks.add(new String(codePoints, i, Math.min(size, total - i)));
        }
        return chunks;
    }

    private static int chunkCount(int total, int size) {
        return (int) (((long) total + size - 1) / size);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
