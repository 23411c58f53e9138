package com.example.connect.credential.model;

/**
 * Identity of a stored credential and of every per-connection lock.
 */
public record CredentialKey(String userId, String providerId) {

    @Override
    public String toString() {
        return userId + "/" + providerId;
    }
}
