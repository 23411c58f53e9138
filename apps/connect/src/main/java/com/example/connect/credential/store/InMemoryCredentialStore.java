package com.example.connect.credential.store;

import com.example.connect.common.util.StringSanitizer;
import com.example.connect.credential.model.CredentialKey;
import com.example.connect.credential.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of CredentialStore for single-pod deployments and tests.
 * Records are lost on restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "connect.store.credentials", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryCredentialStore implements CredentialStore {

    private final ConcurrentHashMap<CredentialKey, CredentialRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCredentialStore(@NonNull Clock clock) {
        this.clock = clock;
        log.info("In-memory credential store initialized (single-pod mode)");
    }

    @Override
    @NonNull
    public Mono<CredentialRecord> save(@NonNull String userId, @NonNull String providerId,
                                       @NonNull CredentialRecord record) {
        if (!StringSanitizer.isValidUserId(userId) || !StringSanitizer.isValidProviderId(providerId)) {
            return Mono.error(new IllegalArgumentException("Invalid credential key"));
        }

        return Mono.fromSupplier(() -> {
            CredentialRecord stored = record.withUpdatedAt(clock.instant());
            records.put(new CredentialKey(userId, providerId), stored);
            log.debug("Stored credential for user={}, provider={}", StringSanitizer.forLog(userId), providerId);
            return stored;
        });
    }

    @Override
    @NonNull
    public Mono<CredentialRecord> get(@NonNull String userId, @NonNull String providerId) {
        return Mono.fromSupplier(() -> records.get(new CredentialKey(userId, providerId)));
    }

    @Override
    @NonNull
    public Mono<Set<String>> list(@NonNull String userId) {
        return Mono.fromSupplier(() -> Collections.unmodifiableSet(records.keySet().stream()
                .filter(key -> key.userId().equals(userId))
                .map(CredentialKey::providerId)
                .collect(Collectors.<String, Set<String>>toCollection(TreeSet::new))));
    }

    @Override
    @NonNull
    public Mono<Boolean> delete(@NonNull String userId, @NonNull String providerId) {
        return Mono.fromSupplier(() -> {
            boolean removed = records.remove(new CredentialKey(userId, providerId)) != null;
            log.debug("Delete credential for user={}, provider={}: removed={}",
                    StringSanitizer.forLog(userId), providerId, removed);
            return removed;
        });
    }
}
