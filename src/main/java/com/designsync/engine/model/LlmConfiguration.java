package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connection settings of the external classifier (OpenAI, OpenRouter, Anthropic or a
 * LangChain4j chat model).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmConfiguration {

    /**
     * LLM provider (e.g., "OPENAI", "ANTHROPIC", "OPENROUTER", "LANGCHAIN4J")
     */
    private String provider;

    /**
     * Base URL for the API (e.g., "https://api.openai.com/v1", "https://api.anthropic.com/v1")
     */
    private String baseUrl;

    private String apiKey;

    /**
     * Model to use (e.g., "gpt-4o-mini", "claude-3-haiku-20240307")
     */
    private String model;

    private Integer maxTokens;

    /**
     * Temperature for generation (0.0 - 1.0)
     */
    private Double temperature;

    @Builder.Default
    private Boolean active = false;

    private int connectTimeoutMs;

    private int readTimeoutMs;

    /**
     * Issue calls for independent nodes concurrently instead of one after another.
     */
    private boolean parallel;

    /**
     * Active and usable: a key is present.
     */
    public boolean isUsable() {
        return Boolean.TRUE.equals(active) && apiKey != null && !apiKey.isBlank();
    }
}
