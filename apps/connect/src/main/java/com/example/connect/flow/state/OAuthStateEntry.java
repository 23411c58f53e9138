package com.example.connect.flow.state;

import org.springframework.lang.NonNull;

import java.time.Duration;
import java.time.Instant;

/**
 * One issued CSRF state token and the connection it will produce.
 */
public record OAuthStateEntry(
        String state,
        String userId,
        String providerId,
        Instant createdAt
) {

    public boolean isExpired(@NonNull Instant now, @NonNull Duration ttl) {
        return !createdAt.plus(ttl).isAfter(now);
    }

    @Override
    public String toString() {
        return "OAuthStateEntry{" +
                "userId='" + userId + '\'' +
                ", providerId='" + providerId + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
