package com.example.connect.common.error;

import org.springframework.lang.NonNull;

/**
 * Carries an {@link OAuthError} through a reactive pipeline until the
 * operation boundary turns it into an {@link OAuthResult}.
 */
public class OAuthException extends RuntimeException {

    private final transient OAuthError error;

    public OAuthException(@NonNull OAuthError error) {
        super(error.message());
        this.error = error;
    }

    public OAuthException(@NonNull OAuthError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public OAuthException(@NonNull OAuthErrorType type, @NonNull String message) {
        this(OAuthError.of(type, message));
    }

    @NonNull
    public OAuthError getError() {
        return error;
    }

    @NonNull
    public OAuthErrorType getType() {
        return error.type();
    }
}
