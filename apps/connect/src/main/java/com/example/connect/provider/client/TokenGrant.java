package com.example.connect.provider.client;

import org.springframework.lang.Nullable;

/**
 * Parsed token endpoint response. Optional fields are null when the provider omits them.
 */
public record TokenGrant(
        String accessToken,
        @Nullable String refreshToken,
        @Nullable Long expiresIn,
        @Nullable String scope
) {

    public long expiresInOr(long defaultSeconds) {
        return expiresIn != null && expiresIn > 0 ? expiresIn : defaultSeconds;
    }

    @Override
    public String toString() {
        return "TokenGrant{" +
                "refreshToken=" + (refreshToken != null ? "present" : "absent") +
                ", expiresIn=" + expiresIn +
                ", scope='" + scope + '\'' +
                '}';
    }
}
