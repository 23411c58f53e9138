package com.example.connect.credential.service;

import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthResult;
import com.example.connect.common.util.StringSanitizer;
import com.example.connect.credential.store.CredentialStore;
import com.example.connect.observability.ConnectionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * User-facing view over stored credentials: which providers are connected, and disconnecting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionService {

    private final CredentialStore credentialStore;
    private final ConnectionMetrics metrics;

    @NonNull
    public Mono<OAuthResult<List<String>>> listConnected(@NonNull String userId) {
        return OAuthResult.capture(credentialStore.list(userId)
                .map(providers -> List.copyOf(providers))
                .doOnNext(providers -> log.debug("User {} has {} connected providers",
                        StringSanitizer.forLog(userId), providers.size())));
    }

    /**
     * Removes the stored credential. Fails with NO_CREDENTIAL when nothing was connected.
     */
    @NonNull
    public Mono<OAuthResult<String>> disconnect(@NonNull String userId, @NonNull String providerId) {
        return OAuthResult.capture(credentialStore.delete(userId, providerId)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return OAuthResult.<String>failure(OAuthErrorType.NO_CREDENTIAL,
                                "Provider " + StringSanitizer.forLog(providerId) + " not connected").toMono();
                    }
                    metrics.disconnected(providerId);
                    log.info("Provider disconnected: user={}, provider={}",
                            StringSanitizer.forLog(userId), StringSanitizer.forLog(providerId));
                    return Mono.just(providerId);
                }));
    }
}
