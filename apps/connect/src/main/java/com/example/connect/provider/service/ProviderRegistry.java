package com.example.connect.provider.service;

import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthResult;
import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.example.connect.provider.model.ProviderDescriptor;
import com.example.connect.provider.model.ProviderEndpoints;
import com.example.connect.provider.model.ProviderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves provider ids to descriptors. Built once from the static catalog and the
 * credentials injected at startup; performs no I/O afterwards.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderDescriptor> descriptors;

    public ProviderRegistry(@NonNull Map<String, ProviderEndpoints> catalog,
                            @NonNull Map<String, ConnectProperties.ProviderCredentials> credentials) {
        Map<String, ProviderDescriptor> resolved = new LinkedHashMap<>();
        catalog.forEach((id, endpoints) -> {
            ConnectProperties.ProviderCredentials creds = credentials.get(id);
            resolved.put(id, ProviderDescriptor.of(
                    endpoints,
                    creds != null ? creds.getClientId() : null,
                    creds != null ? creds.getClientSecret() : null));
        });
        credentials.keySet().stream()
                .filter(id -> !catalog.containsKey(id))
                .forEach(id -> log.warn("Ignoring credentials for provider {} absent from the catalog",
                        StringSanitizer.forLog(id)));
        this.descriptors = Collections.unmodifiableMap(resolved);

        log.info("Provider registry initialized: supported={}, configured={}",
                descriptors.keySet(), configuredIds());
    }

    /**
     * Resolves a usable descriptor.
     *
     * @return the descriptor, or UNKNOWN_PROVIDER / NOT_CONFIGURED
     */
    @NonNull
    public OAuthResult<ProviderDescriptor> resolve(@Nullable String providerId) {
        ProviderDescriptor descriptor = providerId != null ? descriptors.get(providerId) : null;
        if (descriptor == null) {
            return OAuthResult.failure(OAuthErrorType.UNKNOWN_PROVIDER,
                    "Unknown provider: " + StringSanitizer.forLog(providerId)
                            + ". Available: " + descriptors.keySet());
        }
        if (!descriptor.isUsable()) {
            return OAuthResult.failure(OAuthErrorType.NOT_CONFIGURED,
                    "Provider " + providerId + " not configured. Set client id and client secret.");
        }
        return OAuthResult.success(descriptor);
    }

    /**
     * Catalog ids, whether or not credentials are present.
     */
    @NonNull
    public Set<String> listSupported() {
        return descriptors.keySet();
    }

    public boolean isSupported(@Nullable String providerId) {
        return providerId != null && descriptors.containsKey(providerId);
    }

    public boolean isConfigured(@Nullable String providerId) {
        return resolve(providerId).isSuccess();
    }

    @NonNull
    public List<ProviderStatus> catalog() {
        return descriptors.values().stream()
                .map(d -> new ProviderStatus(d.id(), d.displayName(), d.isUsable()))
                .toList();
    }

    private Set<String> configuredIds() {
        Set<String> configured = new LinkedHashSet<>();
        descriptors.values().stream()
                .filter(ProviderDescriptor::isUsable)
                .forEach(d -> configured.add(d.id()));
        return configured;
    }
}
