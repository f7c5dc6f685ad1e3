package com.relaygate.provider;

import com.relaygate.model.ApiStyle;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import reactor.core.publisher.Mono;

/**
 * Protocol adapter for one family of provider APIs.
 * Implementations handle authentication headers, request/response mapping and
 * error normalization; they do not retry.
 */
public interface ProviderClient {

    /**
     * Wire protocol this client speaks.
     *
     * @return api style
     */
    ApiStyle getApiStyle();

    /**
     * Send one completion request.
     *
     * @param provider   catalog entry holding endpoint and credentials
     * @param invocation prompt and model
     * @return normalized result; errors are {@code UpstreamCallException}
     */
    Mono<ProviderResult> invoke(ProviderDescriptor provider, ProviderInvocation invocation);
}
