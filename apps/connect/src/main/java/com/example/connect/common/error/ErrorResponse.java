package com.example.connect.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Integer upstreamStatus,
        String detail
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, null, null);
    }

    public static ErrorResponse of(OAuthError error, String path) {
        return new ErrorResponse(Instant.now(), error.type().httpStatus().value(), error.type().code(),
                error.message(), path, error.upstreamStatus(), error.upstreamDetail());
    }
}
