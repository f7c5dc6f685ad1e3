package com.relaygate.controller;

import com.relaygate.exception.UpstreamCallException;
import com.relaygate.model.GatewayHeaders;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import com.relaygate.provider.ProviderGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * HTTP tests for the route, admin, health and metrics endpoints.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@AutoConfigureObservability
class RouteControllerTest {

    private static final String BODY = "{\"prompt\":\"What is 2+2?\",\"tenantId\":\"acme\"}";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ProviderGateway providerGateway;

    @BeforeEach
    void setUp() {
        when(providerGateway.invoke(anyString(), any(ProviderInvocation.class)))
                .thenAnswer(invocation -> {
                    String providerId = invocation.getArgument(0);
                    return Mono.just(ProviderResult.builder()
                            .providerId(providerId)
                            .content("4")
                            .inputUnits(10)
                            .outputUnits(1)
                            .build());
                });
    }

    @Test
    void testRouteReturnsProviderResponse() {
        webTestClient.post().uri("/v1/route")
                .header(GatewayHeaders.IDEMPOTENCY_KEY, UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().exists(GatewayHeaders.ROUTE_PROVIDER)
                .expectHeader().exists(GatewayHeaders.ROUTE_COST_USD)
                .expectHeader().exists(GatewayHeaders.RATE_LIMIT_LIMIT)
                .expectBody()
                .jsonPath("$.content").isEqualTo("4")
                .jsonPath("$.providerId").isNotEmpty();
    }

    @Test
    void testRepeatedKeyIsAnsweredWithoutCallingProvider() {
        String key = UUID.randomUUID().toString();

        for (int i = 0; i < 2; i++) {
            webTestClient.post().uri("/v1/route")
                    .header(GatewayHeaders.IDEMPOTENCY_KEY, key)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(BODY)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.content").isEqualTo("4");
        }

        verify(providerGateway, times(1)).invoke(anyString(), any(ProviderInvocation.class));
    }

    @Test
    void testMissingIdempotencyKeyIsRejected() {
        webTestClient.post().uri("/v1/route")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("VALIDATION_ERROR");

        verifyNoInteractions(providerGateway);
    }

    @Test
    void testUnknownStrategyIsRejected() {
        webTestClient.post().uri("/v1/route")
                .header(GatewayHeaders.IDEMPOTENCY_KEY, UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"prompt\":\"hi\",\"tenantId\":\"acme\",\"strategy\":\"cheapest\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("VALIDATION_ERROR");
    }

    @Test
    @DirtiesContext(methodMode = DirtiesContext.MethodMode.AFTER_METHOD)
    void testAllProvidersFailedIsNotStored() {
        reset(providerGateway);
        when(providerGateway.invoke(anyString(), any(ProviderInvocation.class)))
                .thenReturn(Mono.error(new UpstreamCallException("Provider returned HTTP 500")));
        String key = UUID.randomUUID().toString();

        for (int i = 0; i < 2; i++) {
            webTestClient.post().uri("/v1/route")
                    .header(GatewayHeaders.IDEMPOTENCY_KEY, key)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(BODY)
                    .exchange()
                    .expectStatus().isEqualTo(503)
                    .expectBody()
                    .jsonPath("$.errorCode").isEqualTo("ALL_PROVIDERS_FAILED")
                    .jsonPath("$.failures.length()").isEqualTo(2);
        }

        // alpha and beta on each request
        verify(providerGateway, times(4)).invoke(anyString(), any(ProviderInvocation.class));
    }

    @Test
    void testAdminListsProvidersWithoutCredentials() {
        webTestClient.get().uri("/v1/admin/providers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].id").isEqualTo("alpha")
                .jsonPath("$[0].breaker.state").isEqualTo("CLOSED")
                .jsonPath("$[0].apiKey").doesNotExist();
    }

    @Test
    void testUsageSummaryRejectsUnknownPeriod() {
        webTestClient.get().uri("/v1/admin/usage/summary?period=fortnight")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void testHealthReportsUp() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP");
    }

    @Test
    void testMetricsExposesBreakerState() {
        webTestClient.get().uri("/metrics")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .value(body -> assertTrue(body.contains("resilience4j_circuitbreaker_state")));
    }
}
