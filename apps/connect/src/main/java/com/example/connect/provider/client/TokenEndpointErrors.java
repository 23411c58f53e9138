package com.example.connect.provider.client;

import com.example.connect.common.error.OAuthError;
import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthException;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.util.concurrent.TimeoutException;

/**
 * Translates token endpoint failures into the error taxonomy, keeping the upstream status
 * and body detail where the provider returned one.
 */
public final class TokenEndpointErrors {

    private TokenEndpointErrors() {
    }

    @NonNull
    public static OAuthException translate(@NonNull OAuthErrorType type, @NonNull String message, @NonNull Throwable error) {
        if (error instanceof OAuthException oauthException) {
            return oauthException;
        }
        if (error instanceof TokenEndpointException endpointError) {
            return new OAuthException(OAuthError.upstream(type, message,
                    endpointError.getStatusCode(), endpointError.getDetail()), error);
        }
        if (error instanceof TimeoutException) {
            return new OAuthException(OAuthError.upstream(type, message, null, "Token endpoint timed out"), error);
        }
        if (error instanceof WebClientRequestException) {
            return new OAuthException(OAuthError.upstream(type, message, null,
                    "Token endpoint unreachable: " + error.getMessage()), error);
        }
        return new OAuthException(OAuthError.upstream(type, message, null, error.getMessage()), error);
    }
}
