package com.example.connect.flow.state;

import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory state store for single-pod deployments. Entries do not survive a restart,
 * so flows begun before a restart fail with an invalid state.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "connect.store.state", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryOAuthStateStore implements OAuthStateStore {

    private final ConcurrentHashMap<String, OAuthStateEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryOAuthStateStore(@NonNull ConnectProperties properties, @NonNull Clock clock) {
        this.ttl = properties.getOauth().getStateTtl();
        this.clock = clock;
        log.info("In-memory OAuth state store initialized with TTL {}", ttl);
    }

    @Override
    @NonNull
    public Mono<Boolean> save(@NonNull OAuthStateEntry entry) {
        return Mono.fromSupplier(() -> entries.putIfAbsent(entry.state(), entry) == null);
    }

    @Override
    @NonNull
    public Mono<OAuthStateEntry> consume(@NonNull String state) {
        return Mono.fromSupplier(() -> {
            OAuthStateEntry entry = entries.remove(state);
            if (entry == null) {
                log.debug("State {} not found", StringSanitizer.mask(state));
                return null;
            }
            if (entry.isExpired(clock.instant(), ttl)) {
                log.debug("State {} expired", StringSanitizer.mask(state));
                return null;
            }
            return entry;
        });
    }

    @Scheduled(fixedRate = 60000)
    public void cleanupExpiredStates() {
        int removed = purgeExpired(clock.instant());
        if (removed > 0) {
            log.info("Cleaned up {} expired OAuth states", removed);
        }
    }

    int size() {
        return entries.size();
    }

    private int purgeExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now, ttl));
        return Math.max(0, before - entries.size());
    }
}
