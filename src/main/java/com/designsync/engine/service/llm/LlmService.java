package com.designsync.engine.service.llm;

import com.designsync.engine.exception.ExternalClassifierException;
import com.designsync.engine.model.LlmConfiguration;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * Sends a single prompt to the configured LLM provider (OpenAI, OpenRouter, Anthropic, or a
 * LangChain4j chat model) and returns the raw text answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmService {

    private final RestTemplate classifierRestTemplate;
    private final ObjectProvider<ChatLanguageModel> chatLanguageModel;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Generate text using the configured LLM
     */
    public String generate(LlmConfiguration config, String systemPrompt, String userPrompt) {
        if (config.getProvider() == null) {
            throw new ExternalClassifierException("No LLM provider configured");
        }
        log.debug("Generating response using {} - model: {}", config.getProvider(), config.getModel());

        try {
            return switch (config.getProvider().toUpperCase()) {
                case "OPENAI", "OPENROUTER" -> generateOpenAI(config, systemPrompt, userPrompt);
                case "ANTHROPIC", "CLAUDE" -> generateAnthropic(config, systemPrompt, userPrompt);
                case "LANGCHAIN4J" -> generateLangChain(systemPrompt, userPrompt);
                default -> throw new ExternalClassifierException("Unsupported provider: " + config.getProvider());
            };
        } catch (ExternalClassifierException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalClassifierException("Failed to generate LLM response: " + e.getMessage(), e);
        }
    }

    /**
     * Generate using OpenAI-compatible API (OpenAI, OpenRouter)
     */
    private String generateOpenAI(LlmConfiguration config, String systemPrompt, String userPrompt) throws Exception {
        String endpoint = config.getBaseUrl() + "/chat/completions";

        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", config.getModel());
        if (config.getMaxTokens() != null) {
            requestBody.put("max_tokens", config.getMaxTokens());
        }
        if (config.getTemperature() != null) {
            requestBody.put("temperature", config.getTemperature());
        }

        ArrayNode messages = requestBody.putArray("messages");
        ObjectNode systemMessage = messages.addObject();
        systemMessage.put("role", "system");
        systemMessage.put("content", systemPrompt);
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.put("content", userPrompt);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(config.getApiKey());

        JsonNode responseJson = post(endpoint, requestBody, headers);
        return requireText(responseJson.path("choices").path(0).path("message").path("content"));
    }

    /**
     * Generate using Anthropic Claude API
     */
    private String generateAnthropic(LlmConfiguration config, String systemPrompt, String userPrompt) throws Exception {
        String endpoint = config.getBaseUrl() + "/messages";

        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", config.getModel());
        requestBody.put("system", systemPrompt);
        requestBody.put("max_tokens", config.getMaxTokens() != null ? config.getMaxTokens() : 50);
        if (config.getTemperature() != null) {
            requestBody.put("temperature", config.getTemperature());
        }

        ArrayNode messages = requestBody.putArray("messages");
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.put("content", userPrompt);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", config.getApiKey());
        headers.set("anthropic-version", "2023-06-01");

        JsonNode responseJson = post(endpoint, requestBody, headers);
        return requireText(responseJson.path("content").path(0).path("text"));
    }

    private String generateLangChain(String systemPrompt, String userPrompt) {
        ChatLanguageModel model = chatLanguageModel.getIfAvailable();
        if (model == null) {
            throw new ExternalClassifierException("LANGCHAIN4J provider selected but no chat model is configured");
        }
        return model.generate(systemPrompt + "\n\n" + userPrompt);
    }

    private JsonNode post(String endpoint, ObjectNode requestBody, HttpHeaders headers) throws Exception {
        HttpEntity<String> request = new HttpEntity<>(objectMapper.writeValueAsString(requestBody), headers);
        ResponseEntity<String> response = classifierRestTemplate.exchange(endpoint, HttpMethod.POST, request, String.class);
        if (response.getBody() == null) {
            throw new ExternalClassifierException("Empty response body from " + endpoint);
        }
        return objectMapper.readTree(response.getBody());
    }

    private String requireText(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            throw new ExternalClassifierException("Response did not contain a text answer");
        }
        return node.asText();
    }
}
