package com.ai.reservation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls an OpenAI-compatible Chat Completions endpoint (OpenRouter by default) and returns the
 * raw JSON content the model produced.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;

    @Value("${llm.base-url:https://openrouter.ai/api/v1}")
    private String baseUrl;

    @Value("${llm.api-key:${OPENROUTER_API_KEY:}}")
    private String apiKey;

    @Value("${llm.model:openai/gpt-4o-mini}")
    private String model;

    @Value("${llm.temperature:0.2}")
    private double temperature;

    @Value("${llm.max-output-tokens:1200}")
    private int maxOutputTokens;

    public LlmService(RestTemplateBuilder builder, ObjectMapper mapper) {
        this.restTemplate = builder.build();
        this.mapper = mapper;
    }

    /**
     * Sends the prompt as a single system message and asks for a JSON object back.
     *
     * @throws IllegalStateException when no API key is configured or the model returned nothing
     */
    public String completeJson(String prompt) {
        if (StringUtils.isBlank(apiKey)) {
            throw new IllegalStateException("OPENROUTER_API_KEY is not set. Configure llm.api-key to use the live model.");
        }

        String url = StringUtils.removeEnd(baseUrl, "/") + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", prompt);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("max_tokens", maxOutputTokens);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(systemMsg));

        log.debug("Calling {} with model {} ({} prompt chars)", url, model, prompt.length());
        ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

        String content;
        try {
            JsonNode root = mapper.readTree(response.getBody());
            content = root.path("choices").path(0).path("message").path("content").asText("").trim();
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable completion response", e);
        }
        if (content.isEmpty()) {
            throw new IllegalStateException("Model returned an empty completion");
        }
        return stripCodeFence(content);
    }

    /** Some models wrap JSON in a markdown fence even in JSON mode. */
    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        String body = StringUtils.substringAfter(trimmed, "\n");
        return StringUtils.removeEnd(body.trim(), "```").trim();
    }
}
