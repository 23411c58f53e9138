package com.example.connect.token.lock;

import com.example.connect.credential.model.CredentialKey;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Outcome of a refresh lock attempt.
 *
 * @param owner    token identifying the holder, null when no shared lock backs the lease
 * @param acquired whether the caller may perform the refresh itself
 */
public record RefreshLease(@NonNull CredentialKey key, @Nullable String owner, boolean acquired) {

    public static RefreshLease held(@NonNull CredentialKey key, @NonNull String owner) {
        return new RefreshLease(key, owner, true);
    }

    /**
     * Granted without a shared lock, either because the deployment is single-instance or
     * because the lock backend could not be reached.
     */
    public static RefreshLease unguarded(@NonNull CredentialKey key) {
        return new RefreshLease(key, null, true);
    }

    public static RefreshLease busy(@NonNull CredentialKey key) {
        return new RefreshLease(key, null, false);
    }
}
