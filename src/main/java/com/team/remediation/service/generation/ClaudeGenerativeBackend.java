package com.team.remediation.service.generation;

import com.team.remediation.config.ClaudeApiConfig;
import com.team.remediation.exception.GenerationFailedException;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Generative backend on Anthropic's Messages API, called through WebClient behind a token-bucket rate limit.
 */
@Service
@Slf4j
public class ClaudeGenerativeBackend implements GenerativeBackend {

    private static final String ANTHROPIC_API_URL = "https://api.anthropic.com/v1/messages";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final ClaudeApiConfig config;
    private final Bucket rateLimiter;
    private final WebClient webClient;

    public ClaudeGenerativeBackend(ClaudeApiConfig config,
                                   @Qualifier("generationRateLimiter") Bucket rateLimiter) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.webClient = WebClient.builder()
                .baseUrl(ANTHROPIC_API_URL)
                .defaultHeader("x-api-key", config.getApiKey() != null ? config.getApiKey() : "")
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public Mono<String> generate(String prompt, double temperature) {
        if (!isAvailable()) {
            return Mono.error(new GenerationFailedException("Generative backend is not configured"));
        }
        if (!rateLimiter.tryConsume(1)) {
            log.warn("Generation rate limit exceeded, skipping request");
            return Mono.error(new GenerationFailedException("Rate limit exceeded for generative backend"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "max_tokens", config.getMaxTokens(),
                "temperature", temperature,
                "messages", List.of(
                        Map.of("role", "user", "content", prompt)
                )
        );

        log.info("Calling generative backend with model: {}", config.getModel());

        return webClient.post()
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .map(this::extractResponseText)
                .doOnSuccess(response -> log.info("Generative backend response received ({} chars)", response.length()))
                .doOnError(error -> log.warn("Generative backend call failed: {}", error.getMessage()));
    }

    @SuppressWarnings("unchecked")
    private String extractResponseText(Map<String, Object> response) {
        List<Map<String, Object>> content = (List<Map<String, Object>>) response.get("content");
        if (content == null || content.isEmpty()) {
            throw new GenerationFailedException("Empty response from generative backend");
        }
        Object text = content.get(0).get("text");
        if (!(text instanceof String value)) {
            throw new GenerationFailedException("Response content has no text block");
        }
        return value;
    }
}
