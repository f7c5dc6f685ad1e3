package com.relaygate;

import com.relaygate.model.ApiStyle;
import com.relaygate.model.AuthMethod;
import com.relaygate.model.ProviderDescriptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Shared builders for tests.
 */
public final class TestFixtures {

    public static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private TestFixtures() {
    }

    public static ProviderDescriptor provider(String id, double quality, double priceIn, double priceOut) {
        return ProviderDescriptor.builder()
                .id(id)
                .baseEndpoint("http://localhost/" + id)
                .authMethod(AuthMethod.BEARER)
                .apiStyle(ApiStyle.OPENAI)
                .apiKey("test-key")
                .supportedModel(id + "-model")
                .priceInputPer1k(priceIn)
                .priceOutputPer1k(priceOut)
                .qualityScore(quality)
                .priority(100)
                .enabled(true)
                .build();
    }

    public static MutableClock clock() {
        return new MutableClock(NOW);
    }

    /**
     * Clock that only moves when told to.
     */
    public static final class MutableClock extends Clock {

        private Instant instant;

        public MutableClock(Instant instant) {
            this.instant = instant;
        }

        public void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        public void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
