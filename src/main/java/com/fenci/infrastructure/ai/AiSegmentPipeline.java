package com.fenci.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenci.domain.segment.model.LinkSpan;
import com.fenci.domain.segment.model.LinkType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * AI mode.
 *
 * Flow:
 *   1. Detect literal URLs and suspect bare domains, completing the latter
 *   2. Mask every link with a {{LINK_n}} placeholder
 *   3. Ask the model to tokenize the masked text, returning a JSON array of strings
 *   4. Output literal URLs, then completed suspect links, then the model tokens minus placeholders,
 *      stripping placeholders the model glued onto other text
 *
 * Every failure surfaces as {@link AiSegmentException}; the caller owns the fallback.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AiSegmentPipeline {

    static final String SYSTEM_PROMPT =
            "You are a strict tokenizer. Split the input text into tokens.\n\n" +
            "Rules:\n" +
            "1. Every Chinese character is its own token\n" +
            "2. A run of English letters is one token (one word)\n" +
            "3. A run of digits is one token\n" +
            "4. Every punctuation mark is its own token\n" +
            "5. Whitespace is removed and never becomes a token\n" +
            "6. Keep the original order; never change, add or merge characters\n" +
            "7. Placeholders such as {{LINK_0}} are one token and must be copied unchanged\n\n" +
            "Output ONLY a JSON array of strings. No explanation, no markdown code block.\n\n" +
            "Example input: Hello世界123！\n" +
            "Example output: [\"Hello\", \"世\", \"界\", \"123\", \"！\"]";

    private final CompletionClient completionClient;
    private final LinkExtractor linkExtractor;
    private final LinkMasker linkMasker;
    private final ObjectMapper objectMapper;
    private final ExecutorService aiExecutor;

    @Value("${ai.timeout-seconds:30}")
    private long timeoutSeconds;

    @Value("${ai.default-protocol:https://}")
    private String defaultProtocol;

    public boolean isAvailable() {
        return completionClient.isAvailable();
    }

    public List<String> segment(String text) {
        List<LinkSpan> links = linkExtractor.extract(text, defaultProtocol);
        String masked = linkMasker.mask(text, links);

        List<String> modelTokens = masked.isBlank() ? List.of() : requestTokens(masked);

        List<String> result = new ArrayList<>();
        List<String> literalUrls = links.stream()
                .filter(link -> link.type() == LinkType.LITERAL)
                .map(LinkSpan::url)
                .toList();
        result.addAll(literalUrls);
        links.stream()
                .filter(link -> link.type() == LinkType.SUSPECT)
                .map(LinkSpan::url)
                .filter(url -> !literalUrls.contains(url))
                .forEach(result::add);
        modelTokens.stream()
                .filter(token -> !linkMasker.isPlaceholder(token))
                .map(linkMasker::stripPlaceholders)
                .filter(token -> !token.isEmpty())
                .forEach(result::add);

        log.info("[AiSegmentPipeline] {} links, {} model tokens → {} tokens",
                links.size(), modelTokens.size(), result.size());
        return result;
    }

    /**
     * Runs the completion on the bounded AI executor. On timeout the call is cancelled and its
     * worker interrupted so a hung request does not hold a thread.
     */
    private List<String> requestTokens(String masked) {
        Future<String> future;
        try {
            future = aiExecutor.submit(() -> completionClient.complete(SYSTEM_PROMPT, masked));
        } catch (RejectedExecutionException e) {
            throw new AiSegmentException("AI executor is saturated", e);
        }

        String content;
        try {
            content = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AiSegmentException("AI tokenization timed out after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AiSegmentException("AI tokenization interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AiSegmentException aiError) {
                throw aiError;
            }
            throw new AiSegmentException("AI tokenization failed", cause);
        }
        return parseTokens(content);
    }

    List<String> parseTokens(String content) {
        if (content == null || content.isBlank()) {
            throw new AiSegmentException("AI response is empty");
        }
        String json = stripCodeFence(content.trim());
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isArray()) {
                throw new AiSegmentException("AI response is not a JSON array");
            }
            List<String> tokens = new ArrayList<>();
            for (JsonNode node : root) {
                if (!node.isTextual()) {
                    throw new AiSegmentException("AI response array contains a non-string element");
                }
                tokens.add(node.asText());
            }
            return tokens;
        } catch (AiSegmentException e) {
            throw e;
        } catch (Exception e) {
            throw new AiSegmentException("AI response is not valid JSON", e);
        }
    }

    private static String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int firstLineEnd = content.indexOf('\n');
        int closing = content.lastIndexOf("```");
        if (firstLineEnd < 0 || closing <= firstLineEnd) {
            return content;
        }
        return content.substring(firstLineEnd + 1, closing).trim();
    }
}
