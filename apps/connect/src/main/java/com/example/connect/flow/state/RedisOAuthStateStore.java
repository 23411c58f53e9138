package com.example.connect.flow.state;

import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis implementation of OAuthStateStore.
 * Entries carry a key TTL equal to the state TTL; redemption uses GETDEL so only one
 * caller across all instances can obtain an entry.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "connect.store.state", havingValue = "redis")
public class RedisOAuthStateStore implements OAuthStateStore {

    static final String KEY_PREFIX = "connect:oauth:state:";

    private final ReactiveStringRedisTemplate redisOps;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public RedisOAuthStateStore(
            @NonNull ReactiveStringRedisTemplate redisOps,
            @NonNull ObjectMapper objectMapper,
            @NonNull ConnectProperties properties,
            @NonNull Clock clock) {
        this.redisOps = redisOps;
        this.objectMapper = objectMapper;
        this.ttl = properties.getOauth().getStateTtl();
        this.clock = clock;
        log.info("Redis OAuth state store initialized with TTL {}", ttl);
    }

    @Override
    @NonNull
    public Mono<Boolean> save(@NonNull OAuthStateEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize OAuth state: {}", e.getMessage());
            return Mono.error(new StateStoreException("Failed to serialize OAuth state", e));
        }

        return redisOps.opsForValue()
                .setIfAbsent(keyFor(entry.state()), json, ttl)
                .map(Boolean.TRUE::equals)
                .onErrorMap(e -> !(e instanceof StateStoreException), e -> {
                    log.error("Failed to store OAuth state: {}", e.getMessage());
                    return new StateStoreException("OAuth state store unavailable", e);
                });
    }

    @Override
    @NonNull
    public Mono<OAuthStateEntry> consume(@NonNull String state) {
        return redisOps.opsForValue()
                .getAndDelete(keyFor(state))
                .onErrorMap(e -> {
                    log.error("Failed to redeem OAuth state: {}", e.getMessage());
                    return new StateStoreException("OAuth state store unavailable", e);
                })
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, OAuthStateEntry.class));
                    } catch (JsonProcessingException e) {
                        log.error("Failed to deserialize OAuth state {}: {}", StringSanitizer.mask(state), e.getMessage());
                        return Mono.empty();
                    }
                })
                // Redis expiry is not exact; the entry's own timestamp is authoritative
                .filter(entry -> !entry.isExpired(clock.instant(), ttl));
    }

    private String keyFor(String state) {
        return KEY_PREFIX + state;
    }
}
