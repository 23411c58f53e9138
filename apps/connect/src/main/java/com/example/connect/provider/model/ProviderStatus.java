package com.example.connect.provider.model;

public record ProviderStatus(
        String id,
        String name,
        boolean configured
) {
}
