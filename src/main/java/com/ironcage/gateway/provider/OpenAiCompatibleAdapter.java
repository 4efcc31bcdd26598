package com.ironcage.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ironcage.gateway.vault.ProviderCredential;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OpenAI compatible chat completions. Also serves self-hosted and proxy providers that
 * implement the same API.
 */
public class OpenAiCompatibleAdapter extends HttpProviderAdapter {

    public OpenAiCompatibleAdapter(String providerId, WebClient webClient, ObjectMapper objectMapper) {
        super(providerId, webClient, objectMapper);
    }

    @Override
    public ProviderType type() {
        return ProviderType.OPENAI;
    }

    @Override
    protected String path() {
        return "/chat/completions";
    }

    @Override
    protected void authenticate(HttpHeaders headers, ProviderCredential credential) {
        headers.setBearerAuth(credential.secret());
    }

    @Override
    protected ObjectNode buildRequestBody(ProviderCall call) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", call.model());
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : call.messages()) {
            messages.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        if (call.maxOutputTokens() != null) {
            body.put("max_tokens", call.maxOutputTokens());
        }
        if (call.temperature() != null) {
            body.put("temperature", call.temperature());
        }
        if (!call.stop().isEmpty()) {
            ArrayNode stop = body.putArray("stop");
            call.stop().forEach(stop::add);
        }
        return body;
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body) {
        JsonNode message = body.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw malformed("choices[0].message");
        }
        JsonNode usage = body.path("usage");
        return new ProviderResponse(
                body.path("model").asText(null),
                message.path("content").asText(""),
                usage.path("prompt_tokens").asLong(0),
                usage.path("completion_tokens").asLong(0));
    }
}
