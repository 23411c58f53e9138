package com.example.connect.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.-]{1,128}$");
    private static final Pattern PROVIDER_ID_PATTERN = Pattern.compile("^[a-z0-9_-]{1,64}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int MASK_VISIBLE_CHARS = 6;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Keeps only a short prefix of a secret-bearing value (state tokens, lock owners).
     */
    @NonNull
    public static String mask(@Nullable String value) {
        if (value == null || value.length() <= MASK_VISIBLE_CHARS) {
            return "***";
        }
        return forLog(value.substring(0, MASK_VISIBLE_CHARS)) + "***";
    }

    /**
     * User ids become secret-backend path segments, so slashes and other
     * separators are rejected.
     */
    public static boolean isValidUserId(@Nullable String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(userId).matches();
    }

    public static boolean isValidProviderId(@Nullable String providerId) {
        return providerId != null && PROVIDER_ID_PATTERN.matcher(providerId).matches();
    }
}
