package com.example.connect.credential.store;

import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.example.connect.credential.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.vault.core.VaultKeyValueMetadataOperations;
import org.springframework.vault.core.VaultKeyValueOperations;
import org.springframework.vault.core.VaultKeyValueOperationsSupport.KeyValueBackend;
import org.springframework.vault.core.VaultOperations;
import org.springframework.vault.support.VaultResponse;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Vault KV v2 implementation of CredentialStore.
 * Records live at {mount}/{pathPrefix}/{userId}/{providerId}; each save is a single
 * secret write, so readers see either the previous or the new version.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "connect.store.credentials", havingValue = "vault")
public class VaultCredentialStore implements CredentialStore {

    private final VaultKeyValueOperations keyValue;
    private final VaultKeyValueMetadataOperations metadata;
    private final String pathPrefix;
    private final Duration timeout;
    private final Clock clock;

    public VaultCredentialStore(
            @NonNull VaultOperations vaultOperations,
            @NonNull ConnectProperties properties,
            @NonNull Clock clock) {
        ConnectProperties.Vault vault = properties.getVault();
        this.keyValue = vaultOperations.opsForKeyValue(vault.getMount(), KeyValueBackend.KV_2);
        this.metadata = vaultOperations.opsForVersionedKeyValue(vault.getMount()).opsForKeyValueMetadata();
        this.pathPrefix = trimSlashes(vault.getPathPrefix());
        this.timeout = vault.getTimeout();
        this.clock = clock;
        log.info("Vault credential store initialized: mount={}, prefix={}", vault.getMount(), pathPrefix);
    }

    @Override
    @NonNull
    public Mono<CredentialRecord> save(@NonNull String userId, @NonNull String providerId,
                                       @NonNull CredentialRecord record) {
        if (!StringSanitizer.isValidUserId(userId) || !StringSanitizer.isValidProviderId(providerId)) {
            log.warn("Invalid credential key in save");
            return Mono.error(new IllegalArgumentException("Invalid credential key"));
        }

        return blocking("save", () -> {
            CredentialRecord stored = record.withUpdatedAt(clock.instant());
            keyValue.put(recordPath(userId, providerId), CredentialSecrets.toSecret(stored));
            log.info("Saved OAuth credential for user={}, provider={}", StringSanitizer.forLog(userId), providerId);
            return stored;
        });
    }

    @Override
    @NonNull
    public Mono<CredentialRecord> get(@NonNull String userId, @NonNull String providerId) {
        if (!StringSanitizer.isValidUserId(userId) || !StringSanitizer.isValidProviderId(providerId)) {
            return Mono.empty();
        }

        return blocking("get", () -> {
            VaultResponse response = keyValue.get(recordPath(userId, providerId));
            if (response == null || response.getData() == null) {
                log.debug("No credential for user={}, provider={}", StringSanitizer.forLog(userId), providerId);
                return null;
            }
            return CredentialSecrets.fromSecret(userId, providerId, response.getData());
        });
    }

    @Override
    @NonNull
    public Mono<Set<String>> list(@NonNull String userId) {
        if (!StringSanitizer.isValidUserId(userId)) {
            return Mono.just(Collections.emptySet());
        }

        return blocking("list", () -> {
            List<String> keys = keyValue.list(userPath(userId));
            Set<String> providers = new TreeSet<>();
            if (keys != null) {
                keys.stream()
                        .filter(key -> !key.endsWith("/"))
                        .forEach(providers::add);
            }
            log.debug("User {} has {} connected providers", StringSanitizer.forLog(userId), providers.size());
            return Collections.unmodifiableSet(providers);
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> delete(@NonNull String userId, @NonNull String providerId) {
        if (!StringSanitizer.isValidUserId(userId) || !StringSanitizer.isValidProviderId(providerId)) {
            return Mono.just(false);
        }

        return blocking("delete", () -> {
            String path = recordPath(userId, providerId);
            if (keyValue.get(path) == null) {
                log.debug("No credential to delete for user={}, provider={}",
                        StringSanitizer.forLog(userId), providerId);
                return false;
            }
            // data/ delete only soft-deletes the latest version and the key stays listable
            metadata.delete(path);
            log.info("Deleted OAuth credential for user={}, provider={}", StringSanitizer.forLog(userId), providerId);
            return true;
        });
    }

    private <T> Mono<T> blocking(String operation, Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof CredentialStoreException), e -> {
                    log.error("Vault {} failed: {}", operation, e.getMessage());
                    return new CredentialStoreException("Credential store unavailable during " + operation, e);
                });
    }

    String userPath(String userId) {
        return pathPrefix + "/" + userId;
    }

    String recordPath(String userId, String providerId) {
        return userPath(userId) + "/" + providerId;
    }

    private static String trimSlashes(String value) {
        String trimmed = value == null ? "" : value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
