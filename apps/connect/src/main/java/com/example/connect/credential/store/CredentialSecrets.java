package com.example.connect.credential.store;

import com.example.connect.credential.model.CredentialRecord;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field layout of a credential secret:
 * access_token, refresh_token, expires_at, scope, updated_at.
 */
final class CredentialSecrets {

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String EXPIRES_AT = "expires_at";
    static final String SCOPE = "scope";
    static final String UPDATED_AT = "updated_at";

    private CredentialSecrets() {}

    @NonNull
    static Map<String, Object> toSecret(@NonNull CredentialRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ACCESS_TOKEN, record.accessToken());
        data.put(REFRESH_TOKEN, record.refreshToken());
        data.put(EXPIRES_AT, record.expiresAt().toString());
        data.put(SCOPE, record.scope() != null ? record.scope() : "");
        data.put(UPDATED_AT, record.updatedAt() != null ? record.updatedAt().toString() : null);
        return data;
    }

    @NonNull
    static CredentialRecord fromSecret(@NonNull String userId, @NonNull String providerId,
                                       @NonNull Map<String, Object> data) {
        Object accessToken = data.get(ACCESS_TOKEN);
        Instant expiresAt = parseInstant(data.get(EXPIRES_AT));
        if (accessToken == null || expiresAt == null) {
            throw new IllegalStateException("Credential secret is missing access_token or expires_at");
        }
        return new CredentialRecord(
                userId,
                providerId,
                accessToken.toString(),
                textOrNull(data.get(REFRESH_TOKEN)),
                expiresAt,
                data.get(SCOPE) != null ? data.get(SCOPE).toString() : "",
                parseInstant(data.get(UPDATED_AT))
        );
    }

    /**
     * Accepts ISO instants and zone-less ISO date-times (read as UTC), which older
     * writers of the same secret path produced.
     */
    @Nullable
    static Instant parseInstant(@Nullable Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        String text = value.toString();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    @Nullable
    private static String textOrNull(@Nullable Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString();
    }
}
