package com.relaygate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.idempotency.IdempotencyStore;
import com.relaygate.idempotency.RedisIdempotencyStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis idempotency store, for deployments running more than one gateway instance.
 * Connection host and port come from {@code spring.data.redis.*}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "gateway.idempotency", name = "store", havingValue = "REDIS")
public class RedisConfiguration {

    /**
     * Lettuce timeouts and reconnect behaviour applied to Boot's connection factory.
     */
    @Bean
    public LettuceClientConfigurationBuilderCustomizer lettuceResilienceCustomizer() {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(10))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(Duration.ofSeconds(5)))
                .build();

        return builder -> builder
                .clientOptions(clientOptions)
                .commandTimeout(Duration.ofSeconds(5));
    }

    /**
     * Redis template for byte array storage (gzipped JSON records).
     */
    @Bean
    public RedisTemplate<String, byte[]> idempotencyRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public IdempotencyStore idempotencyStore(RedisTemplate<String, byte[]> idempotencyRedisTemplate,
                                             ObjectMapper objectMapper,
                                             GatewayProperties properties) {
        Duration ttl = properties.getIdempotency().getTtl();
        log.info("Idempotency store: redis, ttl={}", ttl);
        return new RedisIdempotencyStore(idempotencyRedisTemplate, objectMapper, ttl);
    }
}
