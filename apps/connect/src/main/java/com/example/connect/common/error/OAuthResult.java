package com.example.connect.common.error;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Outcome of a lifecycle operation: either a value or a classified error, never both.
 * Callers branch on {@link #isSuccess()} instead of catching exceptions.
 *
 * @param value the value on success, null on failure
 * @param error the error on failure, null on success
 * @param <T>   value type
 */
public record OAuthResult<T>(@Nullable T value, @Nullable OAuthError error) {

    public OAuthResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> OAuthResult<T> success(@NonNull T value) {
        return new OAuthResult<>(value, null);
    }

    public static <T> OAuthResult<T> failure(@NonNull OAuthError error) {
        return new OAuthResult<>(null, error);
    }

    public static <T> OAuthResult<T> failure(@NonNull OAuthErrorType type, @NonNull String message) {
        return failure(OAuthError.of(type, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public boolean isFailure(@NonNull OAuthErrorType type) {
        return error != null && error.type() == type;
    }

    public <R> OAuthResult<R> map(@NonNull Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    /**
     * Unwraps into a reactive value, signalling failures as {@link OAuthException}.
     */
    public Mono<T> toMono() {
        return isSuccess() ? Mono.just(value) : Mono.error(new OAuthException(error));
    }

    /**
     * Closes a pipeline at the operation boundary: classified failures become
     * {@link #failure(OAuthError)} values, anything else is propagated as-is.
     */
    public static <T> Mono<OAuthResult<T>> capture(@NonNull Mono<T> pipeline) {
        return pipeline
                .map(OAuthResult::success)
                .onErrorResume(OAuthException.class, e -> Mono.just(failure(e.getError())));
    }
}
