package com.example.connect.credential.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Tokens held for one (user, provider) connection.
 *
 * @param userId       opaque user id from the session verifier
 * @param providerId   catalog provider id
 * @param accessToken  current access token
 * @param refreshToken refresh token, null when the provider issued none
 * @param expiresAt    absolute access token expiry
 * @param scope        granted scope, empty when unknown
 * @param updatedAt    last write, stamped by the credential store
 */
public record CredentialRecord(
        String userId,
        String providerId,
        String accessToken,
        @Nullable String refreshToken,
        Instant expiresAt,
        String scope,
        @Nullable Instant updatedAt
) {

    @NonNull
    public CredentialKey key() {
        return new CredentialKey(userId, providerId);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @NonNull
    public Duration remaining(@NonNull Instant now) {
        return Duration.between(now, expiresAt);
    }

    /**
     * A token is served from the store only while more than {@code buffer} of its
     * lifetime remains.
     */
    public boolean isUsableFor(@NonNull Instant now, @NonNull Duration buffer) {
        return remaining(now).compareTo(buffer) > 0;
    }

    @NonNull
    public CredentialRecord withUpdatedAt(@NonNull Instant instant) {
        return new CredentialRecord(userId, providerId, accessToken, refreshToken, expiresAt, scope, instant);
    }

    @Override
    public String toString() {
        return "CredentialRecord{" +
                "userId='" + userId + '\'' +
                ", providerId='" + providerId + '\'' +
                ", refreshToken=" + (hasRefreshToken() ? "present" : "absent") +
                ", expiresAt=" + expiresAt +
                ", scope='" + scope + '\'' +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
