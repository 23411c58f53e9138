package com.example.connect.common.error;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * A classified failure. Upstream status and detail are only present for
 * failures reported by a provider token endpoint.
 */
public record OAuthError(
        @NonNull OAuthErrorType type,
        @NonNull String message,
        @Nullable Integer upstreamStatus,
        @Nullable String upstreamDetail
) {

    public static OAuthError of(@NonNull OAuthErrorType type, @NonNull String message) {
        return new OAuthError(type, message, null, null);
    }

    public static OAuthError upstream(@NonNull OAuthErrorType type, @NonNull String message,
                                      @Nullable Integer upstreamStatus, @Nullable String upstreamDetail) {
        return new OAuthError(type, message, upstreamStatus, upstreamDetail);
    }

    public boolean is(@NonNull OAuthErrorType other) {
        return type == other;
    }
}
