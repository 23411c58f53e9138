package com.example.connect.util;

import com.example.connect.credential.model.CredentialRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Test builder for CredentialRecord.
 */
public class CredentialRecordTestBuilder {

    private String userId = "user-123";
    private String providerId = "github";
    private String accessToken = "test-access-token";
    private String refreshToken = "test-refresh-token";
    private Instant expiresAt = Instant.parse("2026-01-01T01:00:00Z");
    private String scope = "repo user";
    private Instant updatedAt;

    public static CredentialRecordTestBuilder aCredentialRecord() {
        return new CredentialRecordTestBuilder();
    }

    public CredentialRecordTestBuilder withUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public CredentialRecordTestBuilder withProviderId(String providerId) {
        this.providerId = providerId;
        return this;
    }

    public CredentialRecordTestBuilder withAccessToken(String accessToken) {
        this.accessToken = accessToken;
        return this;
    }

    public CredentialRecordTestBuilder withRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
        return this;
    }

    public CredentialRecordTestBuilder withoutRefreshToken() {
        this.refreshToken = null;
        return this;
    }

    public CredentialRecordTestBuilder withExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
        return this;
    }

    public CredentialRecordTestBuilder expiringIn(Instant now, Duration remaining) {
        this.expiresAt = now.plus(remaining);
        return this;
    }

    public CredentialRecordTestBuilder withScope(String scope) {
        this.scope = scope;
        return this;
    }

    public CredentialRecordTestBuilder withUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
        return this;
    }

    public CredentialRecord build() {
        return new CredentialRecord(userId, providerId, accessToken, refreshToken, expiresAt, scope, updatedAt);
    }
}
