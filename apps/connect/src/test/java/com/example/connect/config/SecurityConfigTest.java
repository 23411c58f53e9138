package com.example.connect.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockUser;

@SpringBootTest
@AutoConfigureWebTestClient
@DisplayName("SecurityConfig")
class SecurityConfigTest {

    @Autowired
    private WebTestClient webTestClient;

    @Nested
    @DisplayName("OAuth connection API")
    class OAuthChain {

        @Test
        @DisplayName("Should let anonymous callers reach the catalog")
        void catalogIsOpen() {
            webTestClient.get().uri("/oauth/catalog")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.providers[?(@.id == 'github')]").exists();
        }

        @Test
        @DisplayName("Should leave session checks to the controller")
        void providersWithoutSession() {
            webTestClient.get().uri("/oauth/providers")
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("invalid_session");
        }
    }

    @Nested
    @DisplayName("public endpoints")
    class PublicChain {

        @Test
        @DisplayName("Should expose health without authentication")
        void health() {
            webTestClient.get().uri("/actuator/health")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("UP");
        }
    }

    @Nested
    @DisplayName("catch-all")
    class CatchAll {

        @Test
        @DisplayName("Should reject anonymous access to other actuator endpoints")
        void metricsAnonymous() {
            webTestClient.get().uri("/actuator/metrics")
                    .exchange()
                    .expectStatus().isUnauthorized();
        }

        @Test
        @DisplayName("Should deny unmatched paths even to an authenticated principal")
        void deniedForAuthenticatedUser() {
            webTestClient.mutateWith(mockUser("user-123"))
                    .get().uri("/actuator/metrics")
                    .exchange()
                    .expectStatus().isForbidden();
        }

        @Test
        @DisplayName("Should deny paths outside every chain")
        void unknownPath() {
            webTestClient.mutateWith(mockUser("user-123"))
                    .post().uri("/internal/anything")
                    .exchange()
                    .expectStatus().isForbidden();
        }
    }
}
