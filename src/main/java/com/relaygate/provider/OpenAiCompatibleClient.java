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
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Client for OpenAI-compatible chat completion APIs (OpenAI, Groq, Mistral, DeepSeek,
 * Moonshot, GLM, Perplexity and self-hosted gateways).
 */
@Component
public class OpenAiCompatibleClient extends AbstractProviderClient {

    public OpenAiCompatibleClient(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public ApiStyle getApiStyle() {
        return ApiStyle.OPENAI;
    }

    @Override
    protected String path() {
        return "/chat/completions";
    }

    @Override
    protected JsonNode buildRequest(ProviderInvocation invocation) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", invocation.getModel());

        ArrayNode messages = request.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", invocation.getPrompt());

        request.put("max_tokens", invocation.getMaxTokens());
        return request;
    }

    @Override
    protected ProviderResult parseResponse(ProviderDescriptor provider, ProviderInvocation invocation, JsonNode body) {
        JsonNode choices = body.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new UpstreamCallException("Provider " + provider.getId() + " returned no choices");
        }

        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.hasNonNull("content")) {
            throw new UpstreamCallException("Provider " + provider.getId() + " returned no message content");
        }

        JsonNode usage = body.get("usage");
        return ProviderResult.builder()
                .providerId(provider.getId())
                .model(body.hasNonNull("model") ? body.get("model").asText() : invocation.getModel())
                .content(message.get("content").asText())
                .inputUnits(longOrZero(usage, "prompt_tokens"))
                .outputUnits(longOrZero(usage, "completion_tokens"))
                .build();
    }
}
