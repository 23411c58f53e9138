package com.example.connect.token.lock;

import com.example.connect.config.ConnectProperties;
import com.example.connect.credential.model.CredentialKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Refresh lock backed by a Redis key written with SET NX PX. The key expires on its own
 * if the holder dies; release deletes it only while it still carries the holder's token.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "connect.store.state", havingValue = "redis")
public class RedisRefreshLock implements RefreshLock {

    static final String KEY_PREFIX = "connect:oauth:refresh-lock:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisRefreshLock(@NonNull ReactiveStringRedisTemplate redisTemplate,
                            @NonNull ConnectProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getRefreshLock().getTtl();
    }

    @Override
    @NonNull
    public Mono<RefreshLease> acquire(@NonNull CredentialKey key) {
        String owner = UUID.randomUUID().toString();
        return redisTemplate.opsForValue()
                .setIfAbsent(lockKey(key), owner, ttl)
                .map(acquired -> Boolean.TRUE.equals(acquired)
                        ? RefreshLease.held(key, owner)
                        : RefreshLease.busy(key))
                .onErrorResume(e -> {
                    // Refresh still proceeds; only cross-instance exclusion is lost
                    log.warn("Refresh lock unavailable for {}, continuing without it: {}", key, e.getMessage());
                    return Mono.just(RefreshLease.unguarded(key));
                });
    }

    @Override
    @NonNull
    public Mono<Void> release(@NonNull RefreshLease lease) {
        if (lease.owner() == null) {
            return Mono.empty();
        }
        return redisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey(lease.key())), List.of(lease.owner()))
                .next()
                .doOnNext(deleted -> {
                    if (deleted == 0L) {
                        log.warn("Refresh lock for {} lapsed before release", lease.key());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Failed to release refresh lock for {}: {}", lease.key(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    static String lockKey(CredentialKey key) {
        return KEY_PREFIX + key.userId() + ":" + key.providerId();
    }
}
