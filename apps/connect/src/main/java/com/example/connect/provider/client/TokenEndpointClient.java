package com.example.connect.provider.client;

import com.example.connect.common.util.StringSanitizer;
import com.example.connect.config.ConnectProperties;
import com.example.connect.provider.model.ProviderDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Talks to provider token endpoints: authorization-code and refresh-token grants.
 * Each call is bounded by the configured HTTP timeout and is attempted exactly once;
 * retry policy belongs to the caller.
 */
@Slf4j
@Component
public class TokenEndpointClient {

    private static final int MAX_DETAIL_LENGTH = 512;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public TokenEndpointClient(
            @NonNull WebClient.Builder webClientBuilder,
            @NonNull ObjectMapper objectMapper,
            @NonNull ConnectProperties properties) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.timeout = properties.getOauth().getHttpTimeout();
    }

    @NonNull
    public Mono<TokenGrant> exchangeCode(@NonNull ProviderDescriptor provider,
                                         @NonNull String code,
                                         @NonNull String redirectUri) {
        log.debug("Exchanging authorization code with {}", provider.id());

        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "authorization_code");
        formData.add("code", code);
        formData.add("redirect_uri", redirectUri);
        formData.add("client_id", provider.clientId());
        formData.add("client_secret", provider.clientSecret());

        return post(provider, formData);
    }

    @NonNull
    public Mono<TokenGrant> refresh(@NonNull ProviderDescriptor provider, @NonNull String refreshToken) {
        log.debug("Requesting refresh-token grant from {}", provider.id());

        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "refresh_token");
        formData.add("refresh_token", refreshToken);
        formData.add("client_id", provider.clientId());
        formData.add("client_secret", provider.clientSecret());

        return post(provider, formData);
    }

    private Mono<TokenGrant> post(ProviderDescriptor provider, MultiValueMap<String, String> formData) {
        return webClient.post()
                .uri(provider.tokenUri())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(formData))
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> toGrant(provider, response.statusCode(), body)))
                .timeout(timeout);
    }

    private Mono<TokenGrant> toGrant(ProviderDescriptor provider, HttpStatusCode status, String body) {
        if (!status.is2xxSuccessful()) {
            log.warn("Token endpoint of {} returned {}", provider.id(), status.value());
            return Mono.error(new TokenEndpointException(provider.id(), status.value(), detail(body)));
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable token response from {}: {}", provider.id(), e.getOriginalMessage());
            return Mono.error(new TokenEndpointException(provider.id(), status.value(),
                    "Unparseable token response"));
        }

        // GitHub reports grant errors with a 200 status
        if (json.hasNonNull("error")) {
            String error = json.path("error").asText();
            String description = json.path("error_description").asText("");
            log.warn("Token endpoint of {} rejected the grant: {}", provider.id(), StringSanitizer.forLog(error));
            return Mono.error(new TokenEndpointException(provider.id(), status.value(),
                    description.isEmpty() ? error : error + ": " + detail(description)));
        }

        String accessToken = json.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            return Mono.error(new TokenEndpointException(provider.id(), status.value(),
                    "No access_token in token response"));
        }

        return Mono.just(new TokenGrant(
                accessToken,
                textOrNull(json, "refresh_token"),
                json.hasNonNull("expires_in") ? json.path("expires_in").asLong() : null,
                textOrNull(json, "scope")
        ));
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static String detail(String body) {
        return StringSanitizer.forLog(body, MAX_DETAIL_LENGTH);
    }
}
