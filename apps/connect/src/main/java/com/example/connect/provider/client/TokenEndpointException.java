package com.example.connect.provider.client;

import org.springframework.lang.Nullable;

/**
 * A provider token endpoint answered, but not with a usable grant.
 */
public class TokenEndpointException extends RuntimeException {

    private final String providerId;
    private final int statusCode;
    private final String detail;

    public TokenEndpointException(String providerId, int statusCode, @Nullable String detail) {
        super("Token endpoint of " + providerId + " returned " + statusCode);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public String getProviderId() {
        return providerId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Nullable
    public String getDetail() {
        return detail;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
