package com.fenci.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Chat-completion call through the OpenAI Java SDK. The client bean only exists when
 * {@code ai.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompletionClient implements CompletionClient {

    private final ObjectProvider<OpenAIClient> openAIClient;

    @Value("${ai.enabled:false}")
    private boolean enabled;

    @Value("${ai.api-key:}")
    private String apiKey;

    @Value("${ai.model:gpt-4o-mini}")
    private String model;

    @Value("${ai.temperature:0.1}")
    private double temperature;

    @Value("${ai.max-tokens:4096}")
    private int maxTokens;

    @Override
    public boolean isAvailable() {
        return enabled && apiKey != null && !apiKey.isBlank() && openAIClient.getIfAvailable() != null;
    }

    @Override
    public String complete(String systemPrompt, String userMessage) {
        OpenAIClient client = openAIClient.getIfAvailable();
        if (client == null) {
            throw new AiSegmentException("AI client is not configured");
        }

        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .build();

            ChatCompletion completion = client.chat().completions().create(params);

            completion.usage().ifPresent(usage ->
                    log.debug("[OpenAiCompletionClient] Token usage [{}] - prompt: {}, completion: {}",
                            model, usage.promptTokens(), usage.completionTokens()));

            return completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .map(String::trim)
                    .orElseThrow(() -> new AiSegmentException("AI response has no content"));
        } catch (AiSegmentException e) {
            throw e;
        } catch (Exception e) {
            throw new AiSegmentException("AI completion call failed [" + model + "]", e);
        }
    }
}
