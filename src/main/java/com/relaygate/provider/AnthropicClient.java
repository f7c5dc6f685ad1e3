package com.relaygate.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaygate.exception.UpstreamCallException;
import com.relaygate.model.ApiStyle;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Anthropic Messages API client.
 */
@Component
public class AnthropicClient extends AbstractProviderClient {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    public AnthropicClient(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public ApiStyle getApiStyle() {
        return ApiStyle.ANTHROPIC;
    }

    @Override
    protected String path() {
        return "/v1/messages";
    }

    @Override
    protected void applyExtraHeaders(HttpHeaders headers) {
        headers.set("anthropic-version", ANTHROPIC_VERSION);
    }

    @Override
    protected JsonNode buildRequest(ProviderInvocation invocation) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", invocation.getModel());
        request.put("max_tokens", invocation.getMaxTokens());

        // Anthropic uses an array of content blocks per message
        ArrayNode messages = request.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", invocation.getPrompt());

        return request;
    }

    @Override
    protected ProviderResult parseResponse(ProviderDescriptor provider, ProviderInvocation invocation, JsonNode body) {
        JsonNode content = body.get("content");
        if (content == null || !content.isArray()) {
            throw new UpstreamCallException("Provider " + provider.getId() + " returned no content blocks");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }

        JsonNode usage = body.get("usage");
        return ProviderResult.builder()
                .providerId(provider.getId())
                .model(body.hasNonNull("model") ? body.get("model").asText() : invocation.getModel())
                .content(text.toString())
                .inputUnits(longOrZero(usage, "input_tokens"))
                .outputUnits(longOrZero(usage, "output_tokens"))
                .build();
    }
}
