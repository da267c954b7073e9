package com.fenci.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "ai.enabled", havingValue = "true")
public class OpenAiConfig {

    @Value("${ai.api-key:}")
    private String apiKey;

    @Value("${ai.base-url:}")
    private String baseUrl;

    @Value("${ai.timeout-seconds:30}")
    private long timeoutSeconds;

    @Bean
    public OpenAIClient openAIClient() {
        OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(Duration.ofSeconds(timeoutSeconds));
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        log.info("[OpenAiConfig] AI client configured (baseUrl={}, timeout={}s)",
                baseUrl == null || baseUrl.isBlank() ? "default" : baseUrl, timeoutSeconds);
        return builder.build();
    }
}
