package com.example.connect.session;

import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Verifies sessions against the Ory Kratos public API ({@code GET /sessions/whoami}).
 * Any failure to verify, including Kratos being unreachable, counts as no session.
 */
@Slf4j
@Component
public class KratosSessionVerifier implements SessionVerifier {

    private static final String WHOAMI_PATH = "/sessions/whoami";

    private final WebClient webClient;
    private final Duration timeout;

    public KratosSessionVerifier(@NonNull WebClient.Builder webClientBuilder,
                                 @NonNull ConnectProperties properties) {
        ConnectProperties.Kratos kratos = properties.getKratos();
        this.webClient = webClientBuilder.clone()
                .baseUrl(kratos.getPublicUrl())
                .build();
        this.timeout = kratos.getTimeout();
    }

    @Override
    @NonNull
    public Mono<String> verify(@NonNull String sessionCredential) {
        if (!StringUtils.hasText(sessionCredential)) {
            return Mono.empty();
        }

        return webClient.get()
                .uri(WHOAMI_PATH)
                .header(SessionCredentials.SESSION_TOKEN_HEADER, sessionCredential)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class);
                    }
                    if (response.statusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                            || response.statusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                        log.debug("Session rejected by Kratos: status={}", response.statusCode().value());
                    } else {
                        log.error("Unexpected Kratos response: status={}", response.statusCode().value());
                    }
                    return response.releaseBody().then(Mono.<JsonNode>empty());
                })
                .timeout(timeout)
                .flatMap(this::userIdOf)
                .onErrorResume(e -> {
                    log.error("Session verification failed: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<String> userIdOf(JsonNode session) {
        if (session.has("active") && !session.path("active").asBoolean(false)) {
            log.debug("Session is not active");
            return Mono.empty();
        }
        String userId = session.path("identity").path("id").asText("");
        if (userId.isBlank()) {
            log.warn("Kratos session without identity id");
            return Mono.empty();
        }
        log.debug("Session verified for user={}", StringSanitizer.forLog(userId));
        return Mono.just(userId);
    }
}
