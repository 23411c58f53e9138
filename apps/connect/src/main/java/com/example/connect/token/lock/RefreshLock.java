package com.example.connect.token.lock;

import com.example.connect.credential.model.CredentialKey;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Cross-instance mutual exclusion for refresh grants on one credential.
 * Within a single process, concurrent refreshes are already collapsed by the
 * lifecycle manager; this lock extends that guarantee across instances.
 */
public interface RefreshLock {

    @NonNull
    Mono<RefreshLease> acquire(@NonNull CredentialKey key);

    /**
     * Releases a lease obtained from {@link #acquire}. Releasing a lease that is not held,
     * or that has already lapsed and been taken by another holder, has no effect.
     */
    @NonNull
    Mono<Void> release(@NonNull RefreshLease lease);
}
