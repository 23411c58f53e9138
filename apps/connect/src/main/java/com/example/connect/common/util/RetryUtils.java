package com.example.connect.common.util;

import com.example.connect.provider.client.TokenEndpointException;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Utility methods for retry logic in provider calls.
 * Centralizes retry conditions for consistent behavior.
 */
public final class RetryUtils {

    private RetryUtils() {}

    /**
     * Determines if an exception is retryable. Retryable conditions:
     * - TokenEndpointException or WebClientResponseException with 5xx status
     * - WebClientRequestException (connection refused, reset, DNS)
     * - TimeoutException
     *
     * @param throwable the exception to check
     * @return true if the exception is transient
     */
    public static boolean isRetryable(@NonNull Throwable throwable) {
        if (throwable instanceof TokenEndpointException ex) {
            return ex.isServerError();
        }
        if (throwable instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError();
        }
        if (throwable instanceof WebClientRequestException) {
            return true;
        }
        return throwable instanceof TimeoutException;
    }

    @NonNull
    public static Predicate<Throwable> retryablePredicate() {
        return RetryUtils::isRetryable;
    }

    /**
     * Bounded exponential backoff over transient failures only. The last
     * failure is rethrown as-is once attempts are exhausted.
     *
     * @param maxAttempts total attempts including the first one
     * @param firstBackoff delay before the second attempt
     */
    @NonNull
    public static RetryBackoffSpec transientBackoff(int maxAttempts, @NonNull Duration firstBackoff) {
        return Retry.backoff(Math.max(0, maxAttempts - 1), firstBackoff)
                .filter(retryablePredicate())
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
