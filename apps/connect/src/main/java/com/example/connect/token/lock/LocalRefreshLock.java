package com.example.connect.token.lock;

import com.example.connect.credential.model.CredentialKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Single-instance deployments: the in-process single-flight is the whole guarantee.
 */
@Component
@ConditionalOnProperty(name = "connect.store.state", havingValue = "in-memory", matchIfMissing = true)
public class LocalRefreshLock implements RefreshLock {

    @Override
    @NonNull
    public Mono<RefreshLease> acquire(@NonNull CredentialKey key) {
        return Mono.just(RefreshLease.unguarded(key));
    }

    @Override
    @NonNull
    public Mono<Void> release(@NonNull RefreshLease lease) {
        return Mono.empty();
    }
}
