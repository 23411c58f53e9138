package com.example.connect.session;

import org.springframework.http.HttpCookie;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Locates the session credential on an incoming request: the session token header
 * first (API clients), then the browser session cookie.
 */
public final class SessionCredentials {

    public static final String SESSION_TOKEN_HEADER = "X-Session-Token";
    public static final String SESSION_COOKIE_NAME = "ory_kratos_session";

    private SessionCredentials() {
    }

    @NonNull
    public static Optional<String> extract(@NonNull ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(SESSION_TOKEN_HEADER);
        if (StringUtils.hasText(header)) {
            return Optional.of(header.trim());
        }
        HttpCookie cookie = request.getCookies().getFirst(SESSION_COOKIE_NAME);
        if (cookie != null && StringUtils.hasText(cookie.getValue())) {
            return Optional.of(cookie.getValue());
        }
        return Optional.empty();
    }
}
