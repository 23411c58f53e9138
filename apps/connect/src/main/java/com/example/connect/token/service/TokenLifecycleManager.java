package com.example.connect.token.service;

import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthException;
import com.example.connect.common.error.OAuthResult;
import com.example.connect.common.util.RetryUtils;
import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.example.connect.credential.model.CredentialKey;
import com.example.connect.credential.model.CredentialRecord;
import com.example.connect.credential.store.CredentialStore;
import com.example.connect.credential.store.CredentialStoreException;
import com.example.connect.observability.ConnectionMetrics;
import com.example.connect.provider.client.TokenEndpointClient;
import com.example.connect.provider.client.TokenEndpointErrors;
import com.example.connect.provider.client.TokenGrant;
import com.example.connect.provider.model.ProviderDescriptor;
import com.example.connect.provider.service.ProviderRegistry;
import com.example.connect.token.lock.RefreshLease;
import com.example.connect.token.lock.RefreshLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out valid access tokens, refreshing them shortly before expiry.
 *
 * <p>Refreshes are single-flight per (user, provider): callers arriving while a refresh is
 * running join it and observe the same outcome. This matters for providers that rotate
 * refresh tokens, where a second grant with the old refresh token would be rejected.
 * Across instances the {@link RefreshLock} gives the same guarantee; an instance that loses
 * the lock waits for the winner's record to show up in the store.
 */
@Slf4j
@Service
public class TokenLifecycleManager {

    private final CredentialStore credentialStore;
    private final ProviderRegistry providerRegistry;
    private final TokenEndpointClient tokenEndpointClient;
    private final RefreshLock refreshLock;
    private final ConnectionMetrics metrics;
    private final ConnectProperties.OAuth settings;
    private final ConnectProperties.RefreshLock lockSettings;
    private final Clock clock;

    private final ConcurrentHashMap<CredentialKey, Mono<String>> inFlight = new ConcurrentHashMap<>();

    public TokenLifecycleManager(
            @NonNull CredentialStore credentialStore,
            @NonNull ProviderRegistry providerRegistry,
            @NonNull TokenEndpointClient tokenEndpointClient,
            @NonNull RefreshLock refreshLock,
            @NonNull ConnectionMetrics metrics,
            @NonNull ConnectProperties properties,
            @NonNull Clock clock) {
        this.credentialStore = credentialStore;
        this.providerRegistry = providerRegistry;
        this.tokenEndpointClient = tokenEndpointClient;
        this.refreshLock = refreshLock;
        this.metrics = metrics;
        this.settings = properties.getOauth();
        this.lockSettings = properties.getRefreshLock();
        this.clock = clock;
    }

    /**
     * Returns an access token that stays valid for at least the refresh buffer,
     * refreshing the stored credential first if needed.
     */
    @NonNull
    public Mono<OAuthResult<String>> getValidToken(@NonNull String userId, @NonNull String providerId) {
        CredentialKey key = new CredentialKey(userId, providerId);
        return OAuthResult.capture(load(key).flatMap(record -> {
            if (isFresh(record)) {
                log.debug("Using stored token: user={}, provider={}",
                        StringSanitizer.forLog(userId), StringSanitizer.forLog(providerId));
                metrics.tokenCache(providerId, true);
                return Mono.just(record.accessToken());
            }
            metrics.tokenCache(providerId, false);
            log.info("Token for user={}, provider={} expires at {}, refreshing",
                    StringSanitizer.forLog(userId), StringSanitizer.forLog(providerId), record.expiresAt());
            return singleFlight(key, null, true);
        }));
    }

    /**
     * Forces a refresh grant. When {@code current} is null the record is read from the store.
     */
    @NonNull
    public Mono<OAuthResult<String>> refresh(@NonNull String userId,
                                             @NonNull String providerId,
                                             @Nullable CredentialRecord current) {
        return OAuthResult.capture(singleFlight(new CredentialKey(userId, providerId), current, false));
    }

    private Mono<String> singleFlight(CredentialKey key, @Nullable CredentialRecord current, boolean onlyIfStale) {
        // cache() keeps the grant running when every subscriber cancels
        return Mono.defer(() -> inFlight.computeIfAbsent(key, k -> refreshOnce(k, current, onlyIfStale)
                .doFinally(signal -> inFlight.remove(k))
                .cache()));
    }

    private Mono<String> refreshOnce(CredentialKey key, @Nullable CredentialRecord current, boolean onlyIfStale) {
        Mono<CredentialRecord> record = current != null ? Mono.just(current) : loadForRefresh(key);
        return record.flatMap(existing -> {
            if (onlyIfStale && isFresh(existing)) {
                // a flight that finished while this caller was reading already refreshed it
                return Mono.just(existing.accessToken());
            }
            if (!existing.hasRefreshToken()) {
                log.warn("No refresh token for user={}, provider={}",
                        StringSanitizer.forLog(key.userId()), StringSanitizer.forLog(key.providerId()));
                return Mono.error(new OAuthException(OAuthErrorType.NO_REFRESH_TOKEN,
                        "No refresh token available for provider " + StringSanitizer.forLog(key.providerId())));
            }
            return providerRegistry.resolve(key.providerId()).toMono()
                    .flatMap(provider -> Mono.usingWhen(
                            refreshLock.acquire(key),
                            lease -> lease.acquired()
                                    ? grantAndStore(existing, provider)
                                    : awaitPeerRefresh(lease),
                            refreshLock::release,
                            (lease, error) -> refreshLock.release(lease),
                            refreshLock::release));
        });
    }

    private Mono<String> grantAndStore(CredentialRecord existing, ProviderDescriptor provider) {
        return tokenEndpointClient.refresh(provider, existing.refreshToken())
                .retryWhen(RetryUtils.transientBackoff(settings.getRefreshMaxAttempts(), settings.getRefreshBackoff())
                        .doBeforeRetry(signal -> log.warn("Retrying refresh for {} after transient failure (attempt {}): {}",
                                existing.key(), signal.totalRetries() + 2, signal.failure().getMessage())))
                .onErrorMap(e -> TokenEndpointErrors.translate(OAuthErrorType.REFRESH_FAILED, "Token refresh failed", e))
                .map(grant -> refreshed(existing, grant))
                .flatMap(this::persist)
                .map(CredentialRecord::accessToken)
                .doOnNext(token -> {
                    metrics.tokenRefresh(provider.id(), null);
                    log.info("Token refreshed: user={}, provider={}",
                            StringSanitizer.forLog(existing.userId()), provider.id());
                })
                .doOnError(OAuthException.class, e -> {
                    metrics.tokenRefresh(provider.id(), e.getError());
                    log.warn("Token refresh failed: user={}, provider={}, error={}",
                            StringSanitizer.forLog(existing.userId()), provider.id(), e.getMessage());
                });
    }

    private Mono<CredentialRecord> persist(CredentialRecord updated) {
        return Mono.defer(() -> credentialStore.save(updated.userId(), updated.providerId(), updated))
                .retryWhen(storeRetry())
                .onErrorMap(CredentialStoreException.class, e -> {
                    log.error("Refreshed token for {} could not be stored: {}", updated.key(), e.getMessage());
                    return TokenEndpointErrors.translate(OAuthErrorType.REFRESH_FAILED,
                            "Refreshed token could not be stored", e.getCause() != null ? e.getCause() : e);
                });
    }

    /**
     * Reads the record a refresh starts from; a store outage is retried like a failed write.
     */
    private Mono<CredentialRecord> loadForRefresh(CredentialKey key) {
        return Mono.defer(() -> load(key))
                .retryWhen(storeRetry())
                .onErrorMap(CredentialStoreException.class, e -> {
                    log.error("Credential for {} could not be read for refresh: {}", key, e.getMessage());
                    return TokenEndpointErrors.translate(OAuthErrorType.REFRESH_FAILED,
                            "Stored credential could not be read", e.getCause() != null ? e.getCause() : e);
                });
    }

    private Retry storeRetry() {
        return Retry.backoff(Math.max(0, settings.getRefreshMaxAttempts() - 1), settings.getRefreshBackoff())
                .filter(CredentialStoreException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Another instance holds the lock: poll the store until its refreshed record appears.
     */
    private Mono<String> awaitPeerRefresh(RefreshLease lease) {
        long polls = Math.max(1, lockSettings.getWait().toMillis() / Math.max(1, lockSettings.getPollInterval().toMillis()));
        log.debug("Refresh of {} running on another instance, waiting", lease.key());
        return Mono.defer(() -> load(lease.key()))
                .filter(this::isFresh)
                .map(CredentialRecord::accessToken)
                .repeatWhenEmpty(repeats -> repeats.take(polls).delayElements(lockSettings.getPollInterval()))
                .switchIfEmpty(Mono.error(() -> {
                    log.warn("Timed out waiting for concurrent refresh of {}", lease.key());
                    return new OAuthException(OAuthErrorType.REFRESH_FAILED,
                            "Concurrent refresh did not complete in time");
                }));
    }

    private CredentialRecord refreshed(CredentialRecord existing, TokenGrant grant) {
        return new CredentialRecord(
                existing.userId(),
                existing.providerId(),
                grant.accessToken(),
                grant.refreshToken() != null ? grant.refreshToken() : existing.refreshToken(),
                clock.instant().plusSeconds(grant.expiresInOr(settings.getDefaultExpiresIn())),
                grant.scope() != null ? grant.scope() : existing.scope(),
                null);
    }

    private Mono<CredentialRecord> load(CredentialKey key) {
        return credentialStore.get(key.userId(), key.providerId())
                .switchIfEmpty(Mono.error(() -> new OAuthException(OAuthErrorType.NO_CREDENTIAL,
                        "No OAuth tokens found for provider " + StringSanitizer.forLog(key.providerId()))));
    }

    private boolean isFresh(CredentialRecord record) {
        Duration buffer = settings.getRefreshBuffer();
        return record.isUsableFor(clock.instant(), buffer);
    }
}
