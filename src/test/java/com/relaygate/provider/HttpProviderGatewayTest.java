package com.relaygate.provider;

import com.relaygate.exception.UpstreamCallException;
import com.relaygate.model.ApiStyle;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import com.relaygate.registry.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static com.relaygate.TestFixtures.provider;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpProviderGateway dispatch.
 */
class HttpProviderGatewayTest {

    private final List<ProviderInvocation> openAiCalls = new ArrayList<>();
    private HttpProviderGateway gateway;

    @BeforeEach
    void setUp() {
        ProviderDescriptor openai = provider("openai", 0.9, 0.03, 0.06);
        ProviderDescriptor anthropic = provider("anthropic", 0.95, 0.015, 0.075).toBuilder()
                .apiStyle(ApiStyle.ANTHROPIC)
                .build();
        ProviderRegistry registry = new ProviderRegistry(List.of(openai, anthropic));

        ProviderClient openAiClient = new ProviderClient() {
            @Override
            public ApiStyle getApiStyle() {
                return ApiStyle.OPENAI;
            }

            @Override
            public Mono<ProviderResult> invoke(ProviderDescriptor provider, ProviderInvocation invocation) {
                openAiCalls.add(invocation);
                return Mono.just(ProviderResult.builder()
                        .providerId(provider.getId())
                        .content("hello")
                        .model(invocation.getModel())
                        .inputUnits(1)
                        .outputUnits(1)
                        .build());
            }
        };

        gateway = new HttpProviderGateway(registry, List.of(openAiClient));
    }

    @Test
    void testDispatchesByApiStyleAndFillsDefaultModel() {
        ProviderInvocation invocation = ProviderInvocation.builder()
                .prompt("hi")
                .maxTokens(32)
                .build();

        StepVerifier.create(gateway.invoke("openai", invocation))
                .assertNext(result -> {
                    assertEquals("openai", result.getProviderId());
                    assertEquals("openai-model", result.getModel());
                })
                .verifyComplete();

        assertEquals(1, openAiCalls.size());
        assertEquals("openai-model", openAiCalls.get(0).getModel());
        assertEquals(32, openAiCalls.get(0).getMaxTokens());
    }

    @Test
    void testExplicitModelIsKept() {
        ProviderInvocation invocation = ProviderInvocation.builder()
                .prompt("hi")
                .model("gpt-4o-mini")
                .maxTokens(32)
                .build();

        StepVerifier.create(gateway.invoke("openai", invocation))
                .assertNext(result -> assertEquals("gpt-4o-mini", result.getModel()))
                .verifyComplete();
    }

    @Test
    void testUnknownProviderFails() {
        StepVerifier.create(gateway.invoke("nope", ProviderInvocation.builder().prompt("hi").build()))
                .expectError(UpstreamCallException.class)
                .verify();
        assertTrue(openAiCalls.isEmpty());
    }

    @Test
    void testMissingClientForApiStyleFails() {
        StepVerifier.create(gateway.invoke("anthropic", ProviderInvocation.builder().prompt("hi").build()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(UpstreamCallException.class, error);
                    assertTrue(error.getMessage().contains("ANTHROPIC"));
                })
                .verify();
    }
}
