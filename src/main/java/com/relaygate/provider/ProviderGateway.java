package com.relaygate.provider;

import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import reactor.core.publisher.Mono;

/**
 * The "invoke a provider by id" capability the routing core depends on.
 * Cancelling the returned Mono aborts the underlying call.
 */
public interface ProviderGateway {

    Mono<ProviderResult> invoke(String providerId, ProviderInvocation invocation);
}
