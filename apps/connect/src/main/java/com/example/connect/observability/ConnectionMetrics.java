package com.example.connect.observability;

import com.example.connect.common.error.OAuthError;
import com.example.connect.provider.service.ProviderRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Counters for the connection lifecycle.
 * Provider tags are limited to catalog ids; anything else is reported as "unknown".
 */
@Component
public class ConnectionMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String TAG_UNKNOWN = "unknown";

    private final MeterRegistry registry;
    private final Set<String> knownProviders;

    public ConnectionMetrics(@NonNull MeterRegistry registry, @NonNull ProviderRegistry providers) {
        this.registry = registry;
        this.knownProviders = Set.copyOf(providers.listSupported());
    }

    public void flowStarted(@Nullable String providerId) {
        Counter.builder("oauth.flow.started")
                .tag("provider", sanitizeTag(providerId))
                .description("Authorization flows started")
                .register(registry)
                .increment();
    }

    public void flowCompleted(@Nullable String providerId, @Nullable OAuthError error) {
        Counter.builder("oauth.flow.completed")
                .tag("provider", sanitizeTag(providerId))
                .tag("outcome", outcome(error))
                .description("Authorization callbacks processed")
                .register(registry)
                .increment();
    }

    public void tokenRefresh(@Nullable String providerId, @Nullable OAuthError error) {
        Counter.builder("oauth.token.refresh")
                .tag("provider", sanitizeTag(providerId))
                .tag("outcome", outcome(error))
                .description("Token refresh grants")
                .register(registry)
                .increment();
    }

    public void tokenCache(@Nullable String providerId, boolean hit) {
        Counter.builder("oauth.token.cache")
                .tag("provider", sanitizeTag(providerId))
                .tag("result", hit ? "hit" : "miss")
                .description("Stored token reuse versus refresh")
                .register(registry)
                .increment();
    }

    public void disconnected(@Nullable String providerId) {
        Counter.builder("oauth.disconnect")
                .tag("provider", sanitizeTag(providerId))
                .description("Provider disconnections")
                .register(registry)
                .increment();
    }

    private String outcome(@Nullable OAuthError error) {
        return error == null ? OUTCOME_SUCCESS : error.type().code();
    }

    private String sanitizeTag(@Nullable String providerId) {
        return providerId != null && knownProviders.contains(providerId) ? providerId : TAG_UNKNOWN;
    }
}
