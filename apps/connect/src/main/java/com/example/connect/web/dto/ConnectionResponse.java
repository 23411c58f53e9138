package com.example.connect.web.dto;

public record ConnectionResponse(
        boolean success,
        String provider,
        String message
) {
    public static ConnectionResponse connected(String providerId, String displayName) {
        return new ConnectionResponse(true, providerId, displayName + " connected successfully");
    }

    public static ConnectionResponse disconnected(String providerId) {
        return new ConnectionResponse(true, providerId, "Disconnected from " + providerId);
    }
}
