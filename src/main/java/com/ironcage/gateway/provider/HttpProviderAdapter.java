package com.ironcage.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ironcage.gateway.vault.ProviderCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Shared WebClient plumbing for JSON-over-HTTP providers. Subclasses own the request
 * body, the authentication headers and the response mapping.
 */
@Slf4j
public abstract class HttpProviderAdapter implements ProviderAdapter {

    private static final int MAX_ERROR_DETAIL = 200;

    protected final String providerId;
    protected final ObjectMapper objectMapper;
    private final WebClient webClient;

    protected HttpProviderAdapter(String providerId, WebClient webClient, ObjectMapper objectMapper) {
        this.providerId = providerId;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ProviderResponse> call(ProviderCall call, ProviderCredential credential) {
        ObjectNode body = buildRequestBody(call);
        return webClient.post()
                .uri(path())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> authenticate(headers, credential))
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(detail -> new ProviderCallException(providerId, response.statusCode().value(),
                                "Provider " + providerId + " returned " + response.statusCode().value()
                                        + ": " + abbreviate(detail))))
                .bodyToMono(JsonNode.class)
                .map(this::parseResponse)
                .onErrorMap(WebClientRequestException.class, e -> new ProviderCallException(providerId,
                        ProviderCallException.NO_STATUS, "Provider " + providerId + " unreachable: " + e.getMessage(), e))
                .doOnNext(response -> log.debug("Provider {} answered with model {} ({} in / {} out tokens)",
                        providerId, response.model(), response.inputTokens(), response.outputTokens()));
    }

    protected abstract String path();

    protected abstract void authenticate(HttpHeaders headers, ProviderCredential credential);

    protected abstract ObjectNode buildRequestBody(ProviderCall call);

    protected abstract ProviderResponse parseResponse(JsonNode body);

    protected ProviderCallException malformed(String what) {
        return new ProviderCallException(providerId, 502, "Provider " + providerId + " response is missing " + what);
    }

    private static String abbreviate(String detail) {
        return detail.length() <= MAX_ERROR_DETAIL ? detail : detail.substring(0, MAX_ERROR_DETAIL) + "...";
    }
}
