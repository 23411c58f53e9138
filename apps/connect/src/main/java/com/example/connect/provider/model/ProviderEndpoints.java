package com.example.connect.provider.model;

/**
 * Static catalog entry for an OAuth provider, without client credentials.
 */
public record ProviderEndpoints(
        String id,
        String displayName,
        String authorizationUri,
        String tokenUri,
        String scope,
        String responseType
) {
}
