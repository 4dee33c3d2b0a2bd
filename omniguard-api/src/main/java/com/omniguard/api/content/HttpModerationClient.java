package com.omniguard.api.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.omniguard.api.config.OmniGuardProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Moderation client for an HTTP moderation endpoint that accepts {@code {"input": text}}
 * and answers with {@code results[0].flagged} and a map of category flags.
 */
@Component
public class HttpModerationClient implements ModerationClient {

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String apiKey;

    public HttpModerationClient(@Qualifier("moderationRestTemplate") RestTemplate restTemplate,
                                OmniGuardProperties properties) {
        this.restTemplate = restTemplate;
        this.endpoint = properties.getModeration().getEndpoint();
        this.apiKey = properties.getModeration().getApiKey();
    }

    @Override
    public ModerationResult moderate(String text) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        JsonNode response = restTemplate.postForObject(endpoint, new HttpEntity<>(Map.of("input", text), headers),
                JsonNode.class);
        if (response == null || !response.path("results").isArray() || response.path("results").isEmpty()) {
            throw new IllegalStateException("Moderation response has no results");
        }

        JsonNode result = response.path("results").get(0);
        List<String> categories = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = result.path("categories").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().asBoolean(false)) {
                categories.add(field.getKey());
            }
        }
        return new ModerationResult(result.path("flagged").asBoolean(false), categories);
    }
}
