package com.example.connect.provider.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Catalog entry joined with the client credentials injected from configuration.
 */
public record ProviderDescriptor(
        String id,
        String displayName,
        String authorizationUri,
        String tokenUri,
        String scope,
        String responseType,
        String clientId,
        String clientSecret
) {

    public static ProviderDescriptor of(@NonNull ProviderEndpoints endpoints,
                                        @Nullable String clientId,
                                        @Nullable String clientSecret) {
        return new ProviderDescriptor(
                endpoints.id(),
                endpoints.displayName(),
                endpoints.authorizationUri(),
                endpoints.tokenUri(),
                endpoints.scope() != null ? endpoints.scope() : "",
                endpoints.responseType() != null ? endpoints.responseType() : "code",
                clientId,
                clientSecret
        );
    }

    /**
     * A descriptor can drive a flow only with both client id and secret present.
     */
    public boolean isUsable() {
        return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }

    public boolean hasScope() {
        return scope != null && !scope.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderDescriptor{" +
                "id='" + id + '\'' +
                ", displayName='" + displayName + '\'' +
                ", tokenUri='" + tokenUri + '\'' +
                ", configured=" + isUsable() +
                '}';
    }
}
