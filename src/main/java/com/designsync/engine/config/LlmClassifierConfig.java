package com.designsync.engine.config;

import com.designsync.engine.model.LlmConfiguration;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration of the optional external classifier.
 * Reads provider, key and model from application.yml properties.
 */
@Configuration
@Slf4j
public class LlmClassifierConfig {

    @Value("${designsync.classifier.enabled:false}")
    private boolean enabled;

    @Value("${designsync.classifier.provider:OPENAI}")
    private String provider;

    @Value("${designsync.classifier.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${designsync.classifier.api-key:}")
    private String apiKey;

    @Value("${designsync.classifier.model:gpt-4o-mini}")
    private String model;

    @Value("${designsync.classifier.max-tokens:50}")
    private int maxTokens;

    @Value("${designsync.classifier.temperature:0.0}")
    private double temperature;

    @Value("${designsync.classifier.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${designsync.classifier.read-timeout-ms:30000}")
    private int readTimeoutMs;

    @Value("${designsync.classifier.parallel:true}")
    private boolean parallel;

    @Bean
    public LlmConfiguration classifierLlmConfiguration() {
        LlmConfiguration config = LlmConfiguration.builder()
                .provider(provider)
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .active(enabled)
                .connectTimeoutMs(connectTimeoutMs)
                .readTimeoutMs(readTimeoutMs)
                .parallel(parallel)
                .build();

        if (enabled && !config.isUsable()) {
            log.warn("[Classifier Config] External classifier enabled but no API key configured; using local rules only");
        } else {
            log.info("[Classifier Config] External classifier enabled: {}, provider: {}, model: {}", enabled, provider, model);
        }
        return config;
    }

    /**
     * HTTP client for the REST providers. Timeouts are the only time limit on an external call.
     */
    @Bean
    public RestTemplate classifierRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }

    /**
     * LangChain4j chat model, only when the LANGCHAIN4J provider is selected.
     */
    @Bean
    @ConditionalOnProperty(name = "designsync.classifier.provider", havingValue = "LANGCHAIN4J")
    public ChatLanguageModel classifierChatLanguageModel() {
        log.info("[Classifier Config] Initializing ChatLanguageModel with model: {}", model);

        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(model)
                .temperature(temperature)
                .timeout(Duration.ofMillis(readTimeoutMs))
                .maxRetries(0) // failures degrade to the local result, never retried
                .maxTokens(maxTokens)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
