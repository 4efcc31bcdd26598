package com.ironcage.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ironcage.gateway.vault.ProviderCredential;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Anthropic messages API.
 *
 * System messages are lifted out of the conversation into the top level {@code system}
 * field (joined with newlines), {@code max_tokens} is mandatory and defaults to 4096,
 * stop strings become {@code stop_sequences}. Text content blocks of the answer are
 * concatenated.
 */
public class AnthropicAdapter extends HttpProviderAdapter {

    static final int DEFAULT_MAX_TOKENS = 4096;
    static final String API_VERSION = "2023-06-01";

    public AnthropicAdapter(String providerId, WebClient webClient, ObjectMapper objectMapper) {
        super(providerId, webClient, objectMapper);
    }

    @Override
    public ProviderType type() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    protected String path() {
        return "/messages";
    }

    @Override
    protected void authenticate(HttpHeaders headers, ProviderCredential credential) {
        headers.set("x-api-key", credential.secret());
        headers.set("anthropic-version", API_VERSION);
    }

    @Override
    protected ObjectNode buildRequestBody(ProviderCall call) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", call.model());

        StringBuilder system = null;
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : call.messages()) {
            if (message.isSystem()) {
                if (system == null) {
                    system = new StringBuilder(message.content());
                } else {
                    system.append('\n').append(message.content());
                }
            } else {
                messages.addObject()
                        .put("role", message.role())
                        .put("content", message.content());
            }
        }

        body.put("max_tokens", call.maxOutputTokens() != null ? call.maxOutputTokens() : DEFAULT_MAX_TOKENS);
        if (system != null) {
            body.put("system", system.toString());
        }
        if (call.temperature() != null) {
            body.put("temperature", call.temperature());
        }
        if (!call.stop().isEmpty()) {
            ArrayNode stop = body.putArray("stop_sequences");
            call.stop().forEach(stop::add);
        }
        return body;
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body) {
        JsonNode blocks = body.path("content");
        if (!blocks.isArray()) {
            throw malformed("content");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : blocks) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = body.path("usage");
        return new ProviderResponse(
                body.path("model").asText(null),
                text.toString(),
                usage.path("input_tokens").asLong(0),
                usage.path("output_tokens").asLong(0));
    }
}
