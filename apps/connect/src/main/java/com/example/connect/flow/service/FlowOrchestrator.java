package com.example.connect.flow.service;

import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthException;
import com.example.connect.common.error.OAuthResult;
import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.example.connect.credential.model.CredentialRecord;
import com.example.connect.credential.store.CredentialStore;
import com.example.connect.flow.state.OAuthStateEntry;
import com.example.connect.flow.state.OAuthStateStore;
import com.example.connect.observability.ConnectionMetrics;
import com.example.connect.provider.client.TokenEndpointClient;
import com.example.connect.provider.client.TokenEndpointErrors;
import com.example.connect.provider.client.TokenGrant;
import com.example.connect.provider.model.ProviderDescriptor;
import com.example.connect.provider.service.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Drives the authorization-code flow: issues CSRF state, builds the provider
 * authorization URL, and on callback redeems the state and exchanges the code.
 */
@Slf4j
@Service
public class FlowOrchestrator {

    static final String CALLBACK_PATH = "/oauth/callback/";
    private static final int STATE_ISSUE_ATTEMPTS = 3;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final ProviderRegistry providerRegistry;
    private final OAuthStateStore stateStore;
    private final TokenEndpointClient tokenEndpointClient;
    private final CredentialStore credentialStore;
    private final ConnectionMetrics metrics;
    private final ConnectProperties.OAuth settings;
    private final Clock clock;

    public FlowOrchestrator(
            @NonNull ProviderRegistry providerRegistry,
            @NonNull OAuthStateStore stateStore,
            @NonNull TokenEndpointClient tokenEndpointClient,
            @NonNull CredentialStore credentialStore,
            @NonNull ConnectionMetrics metrics,
            @NonNull ConnectProperties properties,
            @NonNull Clock clock) {
        this.providerRegistry = providerRegistry;
        this.stateStore = stateStore;
        this.tokenEndpointClient = tokenEndpointClient;
        this.credentialStore = credentialStore;
        this.metrics = metrics;
        this.settings = properties.getOauth();
        this.clock = clock;
    }

    /**
     * Starts a flow for the user and returns the provider authorization URL to redirect to.
     */
    @NonNull
    public Mono<OAuthResult<String>> begin(@NonNull String userId, @NonNull String providerId) {
        if (!StringSanitizer.isValidUserId(userId)) {
            return Mono.just(OAuthResult.failure(OAuthErrorType.INVALID_SESSION, "Invalid user id"));
        }
        OAuthResult<ProviderDescriptor> resolved = providerRegistry.resolve(providerId);
        if (resolved.isFailure()) {
            return Mono.just(OAuthResult.failure(resolved.error()));
        }
        ProviderDescriptor provider = resolved.value();

        return OAuthResult.capture(issueState(userId, provider.id(), STATE_ISSUE_ATTEMPTS)
                .map(state -> authorizationUrl(provider, state))
                .doOnNext(url -> {
                    metrics.flowStarted(provider.id());
                    log.info("OAuth flow started: user={}, provider={}",
                            StringSanitizer.forLog(userId), provider.id());
                }));
    }

    /**
     * Handles the provider callback. The state entry is consumed before anything else is
     * checked, so a state token can never be replayed whatever the outcome.
     */
    @NonNull
    public Mono<OAuthResult<CredentialRecord>> complete(@NonNull String providerId,
                                                        @Nullable String code,
                                                        @Nullable String state) {
        if (!StringUtils.hasText(code) || !StringUtils.hasText(state)) {
            OAuthResult<CredentialRecord> missing =
                    OAuthResult.failure(OAuthErrorType.INVALID_STATE, "Missing code or state parameter");
            metrics.flowCompleted(providerId, missing.error());
            return Mono.just(missing);
        }

        Mono<CredentialRecord> pipeline = stateStore.consume(state)
                .switchIfEmpty(Mono.error(() -> {
                    log.warn("Rejected callback for provider={}: unknown or expired state {}",
                            StringSanitizer.forLog(providerId), StringSanitizer.mask(state));
                    return new OAuthException(OAuthErrorType.INVALID_STATE, "Invalid or expired state token");
                }))
                .flatMap(entry -> {
                    if (!entry.providerId().equals(providerId)) {
                        log.warn("Rejected callback: state bound to provider={} used for provider={}",
                                entry.providerId(), StringSanitizer.forLog(providerId));
                        return Mono.error(new OAuthException(OAuthErrorType.PROVIDER_MISMATCH,
                                "State token was issued for a different provider"));
                    }
                    return providerRegistry.resolve(providerId).toMono()
                            .flatMap(provider -> exchange(entry, provider, code));
                });

        return OAuthResult.capture(pipeline)
                .doOnNext(result -> metrics.flowCompleted(providerId, result.error()));
    }

    @NonNull
    String redirectUri(@NonNull String providerId) {
        String base = settings.getCallbackBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + CALLBACK_PATH + providerId;
    }

    private Mono<CredentialRecord> exchange(OAuthStateEntry entry, ProviderDescriptor provider, String code) {
        return tokenEndpointClient.exchangeCode(provider, code, redirectUri(provider.id()))
                .onErrorMap(e -> {
                    log.warn("Code exchange failed: user={}, provider={}, error={}",
                            StringSanitizer.forLog(entry.userId()), provider.id(), e.getMessage());
                    return TokenEndpointErrors.translate(OAuthErrorType.EXCHANGE_FAILED,
                            "Failed to exchange code for tokens", e);
                })
                .map(grant -> toRecord(entry, provider, grant))
                .flatMap(record -> credentialStore.save(entry.userId(), provider.id(), record))
                .doOnNext(saved -> log.info("Provider connected: user={}, provider={}, expiresAt={}",
                        StringSanitizer.forLog(saved.userId()), saved.providerId(), saved.expiresAt()));
    }

    private CredentialRecord toRecord(OAuthStateEntry entry, ProviderDescriptor provider, TokenGrant grant) {
        Instant now = clock.instant();
        return new CredentialRecord(
                entry.userId(),
                provider.id(),
                grant.accessToken(),
                grant.refreshToken(),
                now.plusSeconds(grant.expiresInOr(settings.getDefaultExpiresIn())),
                grant.scope() != null ? grant.scope() : provider.scope(),
                null);
    }

    private Mono<String> issueState(String userId, String providerId, int attemptsLeft) {
        String state = generateState();
        OAuthStateEntry entry = new OAuthStateEntry(state, userId, providerId, clock.instant());
        return stateStore.save(entry).flatMap(stored -> {
            if (stored) {
                return Mono.just(state);
            }
            if (attemptsLeft <= 1) {
                return Mono.error(new OAuthException(OAuthErrorType.STORE_UNAVAILABLE,
                        "Could not issue a unique state token"));
            }
            log.warn("State token collision, regenerating");
            return issueState(userId, providerId, attemptsLeft - 1);
        });
    }

    private String generateState() {
        byte[] bytes = new byte[settings.getStateBytes()];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String authorizationUrl(ProviderDescriptor provider, String state) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(provider.authorizationUri())
                .queryParam("client_id", provider.clientId())
                .queryParam("redirect_uri", redirectUri(provider.id()))
                .queryParam("response_type", provider.responseType())
                .queryParam("state", state);
        if (provider.hasScope()) {
            builder.queryParam("scope", provider.scope());
        }
        return builder.encode().build().toUriString();
    }
}
