package com.example.connect.common.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the credential lifecycle engine.
 * Each type carries the HTTP status the connection endpoints answer with.
 */
public enum OAuthErrorType {

    UNKNOWN_PROVIDER("unknown_provider", HttpStatus.BAD_REQUEST),
    NOT_CONFIGURED("provider_not_configured", HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_STATE("invalid_state", HttpStatus.BAD_REQUEST),
    PROVIDER_MISMATCH("provider_mismatch", HttpStatus.BAD_REQUEST),
    EXCHANGE_FAILED("exchange_failed", HttpStatus.BAD_REQUEST),
    NO_CREDENTIAL("no_credential", HttpStatus.NOT_FOUND),
    NO_REFRESH_TOKEN("no_refresh_token", HttpStatus.BAD_REQUEST),
    REFRESH_FAILED("refresh_failed", HttpStatus.BAD_GATEWAY),
    STORE_UNAVAILABLE("store_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    INVALID_SESSION("invalid_session", HttpStatus.UNAUTHORIZED);

    private final String code;
    private final HttpStatus httpStatus;

    OAuthErrorType(String code, HttpStatus httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
