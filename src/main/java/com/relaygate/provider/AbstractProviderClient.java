package com.relaygate.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.exception.UpstreamCallException;
import com.relaygate.model.AuthMethod;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Shared plumbing for HTTP provider clients: auth headers, status mapping and
 * scrubbing of upstream error bodies.
 */
@Slf4j
public abstract class AbstractProviderClient implements ProviderClient {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;

    protected AbstractProviderClient(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ProviderResult> invoke(ProviderDescriptor provider, ProviderInvocation invocation) {
        JsonNode payload = buildRequest(invocation);
        String endpoint = provider.getBaseEndpoint() + path();

        log.debug("Forwarding request to {}: model={}", provider.getId(), invocation.getModel());

        return webClient.post()
                .uri(endpoint)
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    applyAuth(provider, headers);
                    applyExtraHeaders(headers);
                })
                .bodyValue(payload.toString())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.releaseBody()
                        .then(Mono.error(new UpstreamCallException(
                                "Provider " + provider.getId() + " returned HTTP " + response.statusCode().value()))))
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(new UpstreamCallException(
                        "Provider " + provider.getId() + " returned an empty body")))
                .map(body -> parseResponse(provider, invocation, body))
                .onErrorMap(WebClientRequestException.class, e -> new UpstreamCallException(
                        "Provider " + provider.getId() + " unreachable", e));
    }

    /**
     * Path appended to the provider's base endpoint.
     */
    protected abstract String path();

    protected abstract JsonNode buildRequest(ProviderInvocation invocation);

    /**
     * Map a provider body to a result. Throw {@link UpstreamCallException} when the
     * body is not usable.
     */
    protected abstract ProviderResult parseResponse(ProviderDescriptor provider,
                                                    ProviderInvocation invocation,
                                                    JsonNode body);

    protected void applyExtraHeaders(HttpHeaders headers) {
    }

    private void applyAuth(ProviderDescriptor provider, HttpHeaders headers) {
        AuthMethod method = provider.getAuthMethod();
        if (method == AuthMethod.BEARER) {
            headers.setBearerAuth(provider.getApiKey());
        } else if (method == AuthMethod.API_KEY_HEADER) {
            headers.set("x-api-key", provider.getApiKey());
        }
    }

    protected long longOrZero(JsonNode node, String field) {
        return node != null && node.has(field) ? node.get(field).asLong() : 0L;
    }
}
