package com.relaygate.idempotency;

import com.relaygate.TestFixtures;
import com.relaygate.config.GatewayProperties;
import com.relaygate.exception.ValidationException;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.GatewayResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IdempotencyService.
 */
class IdempotencyServiceTest {

    private static final String BODY = "{\"prompt\":\"x\"}";

    private final AtomicInteger handlerCalls = new AtomicInteger();
    private SimpleMeterRegistry meterRegistry;
    private TestFixtures.MutableClock clock;
    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = TestFixtures.clock();
        service = new IdempotencyService(
                new CaffeineIdempotencyStore(100, Duration.ofHours(24)),
                new GatewayMetrics(meterRegistry),
                clock,
                new GatewayProperties());
    }

    @Test
    void testRepeatedKeyAndBodyReplaysResponse() {
        GatewayResponse first = service.execute("k1", BODY, handler(200)).block();
        GatewayResponse second = service.execute("k1", BODY, handler(200)).block();

        assertNotNull(first);
        assertEquals(first, second);
        assertEquals(1, handlerCalls.get());
        assertEquals(1.0, meterRegistry.get("gateway.idempotency.replays").counter().count());
    }

    @Test
    void testSameKeyDifferentBodyIsDifferentRequest() {
        service.execute("k1", BODY, handler(200)).block();
        service.execute("k1", "{\"prompt\":\"y\"}", handler(200)).block();

        assertEquals(2, handlerCalls.get());
        assertNotEquals(service.recordKey("k1", BODY), service.recordKey("k1", "{\"prompt\":\"y\"}"));
    }

    @Test
    void testRetryableStatusesAreNotStored() {
        service.execute("k1", BODY, handler(503)).block();
        service.execute("k1", BODY, handler(503)).block();
        service.execute("k2", BODY, handler(429)).block();
        service.execute("k2", BODY, handler(429)).block();

        assertEquals(4, handlerCalls.get());
    }

    @Test
    void testFinalClientErrorsAreStored() {
        service.execute("k1", BODY, handler(400)).block();
        GatewayResponse replay = service.execute("k1", BODY, handler(200)).block();

        assertNotNull(replay);
        assertEquals(400, replay.getStatus());
        assertEquals(1, handlerCalls.get());
    }

    @Test
    void testRecordExpiresAfterTtl() {
        service.execute("k1", BODY, handler(200)).block();
        clock.advance(Duration.ofHours(25));
        service.execute("k1", BODY, handler(200)).block();

        assertEquals(2, handlerCalls.get());
    }

    @Test
    void testConcurrentRequestsShareOneExecution() {
        Sinks.One<GatewayResponse> upstream = Sinks.one();
        Supplier<Mono<GatewayResponse>> slowHandler = () -> {
            handlerCalls.incrementAndGet();
            return upstream.asMono();
        };

        AtomicReference<GatewayResponse> first = new AtomicReference<>();
        AtomicReference<GatewayResponse> second = new AtomicReference<>();
        service.execute("k1", BODY, slowHandler).subscribe(first::set);
        service.execute("k1", BODY, slowHandler).subscribe(second::set);

        assertEquals(1, handlerCalls.get());
        assertNull(first.get());

        GatewayResponse response = response(200);
        upstream.tryEmitValue(response);

        assertSame(response, first.get());
        assertSame(response, second.get());
        assertEquals(0, service.inFlightCount());
    }

    @Test
    void testInvalidKeysAreRejected() {
        StepVerifier.create(service.execute(null, BODY, handler(200)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(service.execute("  ", BODY, handler(200)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(service.execute("k".repeat(256), BODY, handler(200)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(service.execute("ключ", BODY, handler(200)))
                .expectError(ValidationException.class)
                .verify();

        assertEquals(0, handlerCalls.get());
    }

    @Test
    void testMaximumLengthKeyIsAccepted() {
        assertDoesNotThrow(() -> service.validateKey("k".repeat(255)));
        assertDoesNotThrow(() -> service.validateKey("order-42:retry/1"));
    }

    private Supplier<Mono<GatewayResponse>> handler(int status) {
        return () -> {
            handlerCalls.incrementAndGet();
            return Mono.just(response(status));
        };
    }

    private static GatewayResponse response(int status) {
        return GatewayResponse.builder()
                .status(status)
                .body("{\"status\":" + status + "}")
                .build();
    }
}
