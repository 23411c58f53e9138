package com.example.connect.credential.store;

import com.example.connect.credential.model.CredentialRecord;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Secret-backed persistence of one credential record per (user, provider).
 * Implementations can use Vault (shared) or in-memory (single pod) storage.
 * Backend failures surface as {@link CredentialStoreException}.
 */
public interface CredentialStore {

    /**
     * Upserts the record, replacing every stored field. The returned record carries
     * the store's update timestamp.
     */
    @NonNull
    Mono<CredentialRecord> save(@NonNull String userId, @NonNull String providerId, @NonNull CredentialRecord record);

    /**
     * Completes empty when no record exists.
     */
    @NonNull
    Mono<CredentialRecord> get(@NonNull String userId, @NonNull String providerId);

    /**
     * Provider ids with a stored record for the user.
     */
    @NonNull
    Mono<Set<String>> list(@NonNull String userId);

    /**
     * @return true if a record existed and was removed
     */
    @NonNull
    Mono<Boolean> delete(@NonNull String userId, @NonNull String providerId);

    @NonNull
    default Mono<Boolean> has(@NonNull String userId, @NonNull String providerId) {
        return get(userId, providerId).hasElement();
    }
}
