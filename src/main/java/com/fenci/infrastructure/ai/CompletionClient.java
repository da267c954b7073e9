package com.fenci.infrastructure.ai;

/**
 * Text-completion collaborator used by the AI mode.
 */
public interface CompletionClient {

    /**
     * @return false when AI is disabled or not configured
     */
    boolean isAvailable();

    /**
     * Send one system + user exchange and return the raw assistant content.
     *
     * @throws AiSegmentException on transport failure or an empty response
     */
    String complete(String systemPrompt, String userMessage);
}
