package com.relaygate.provider;

import com.relaygate.exception.UpstreamCallException;
import com.relaygate.model.ApiStyle;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import com.relaygate.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the provider from the registry and hands the call to the client for its
 * api style.
 */
@Slf4j
@Component
public class HttpProviderGateway implements ProviderGateway {

    private final ProviderRegistry registry;
    private final Map<ApiStyle, ProviderClient> clients = new EnumMap<>(ApiStyle.class);

    public HttpProviderGateway(ProviderRegistry registry, List<ProviderClient> clients) {
        this.registry = registry;
        clients.forEach(client -> this.clients.put(client.getApiStyle(), client));
        log.info("Initialized provider gateway with clients for {}", this.clients.keySet());
    }

    @Override
    public Mono<ProviderResult> invoke(String providerId, ProviderInvocation invocation) {
        ProviderDescriptor provider = registry.get(providerId).orElse(null);
        if (provider == null) {
            return Mono.error(new UpstreamCallException("Provider " + providerId + " is not registered"));
        }

        ProviderClient client = clients.get(provider.getApiStyle());
        if (client == null) {
            return Mono.error(new UpstreamCallException(
                    "No client for api style " + provider.getApiStyle() + " (provider " + providerId + ")"));
        }

        ProviderInvocation resolved = invocation.getModel() != null
                ? invocation
                : ProviderInvocation.builder()
                        .prompt(invocation.getPrompt())
                        .model(provider.defaultModel())
                        .maxTokens(invocation.getMaxTokens())
                        .build();

        return Mono.defer(() -> client.invoke(provider, resolved));
    }
}
