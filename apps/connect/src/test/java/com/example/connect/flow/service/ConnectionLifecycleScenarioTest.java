package com.example.connect.flow.service;

import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.config.ConnectProperties;
import com.example.connect.credential.service.ConnectionService;
import com.example.connect.credential.store.InMemoryCredentialStore;
import com.example.connect.flow.state.InMemoryOAuthStateStore;
import com.example.connect.observability.ConnectionMetrics;
import com.example.connect.provider.client.TokenEndpointClient;
import com.example.connect.provider.service.ProviderRegistry;
import com.example.connect.token.lock.LocalRefreshLock;
import com.example.connect.token.service.TokenLifecycleManager;
import com.example.connect.util.ConnectTestFixtures;
import com.example.connect.util.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Connect, use, refresh and disconnect one provider through the real collaborators.
 */
@DisplayName("Connection lifecycle")
class ConnectionLifecycleScenarioTest {

    private WireMockServer wireMock;
    private MutableClock clock;
    private FlowOrchestrator orchestrator;
    private TokenLifecycleManager tokens;
    private ConnectionService connections;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();

        clock = MutableClock.at("2026-03-01T12:00:00Z");
        ConnectProperties properties = ConnectTestFixtures.properties();
        ProviderRegistry registry = ConnectTestFixtures.registry(wireMock.baseUrl());
        InMemoryCredentialStore credentialStore = new InMemoryCredentialStore(clock);
        ConnectionMetrics metrics = new ConnectionMetrics(new SimpleMeterRegistry(), registry);
        TokenEndpointClient tokenEndpointClient =
                new TokenEndpointClient(WebClient.builder(), new ObjectMapper(), properties);

        orchestrator = new FlowOrchestrator(registry, new InMemoryOAuthStateStore(properties, clock),
                tokenEndpointClient, credentialStore, metrics, properties, clock);
        tokens = new TokenLifecycleManager(credentialStore, registry, tokenEndpointClient,
                new LocalRefreshLock(), metrics, properties, clock);
        connections = new ConnectionService(credentialStore, metrics);
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    @DisplayName("Should connect, serve, refresh and disconnect GitHub for one user")
    void fullLifecycle() {
        String url = orchestrator.begin("u1", "github").block().value();
        String state = UriComponentsBuilder.fromUriString(url).build().getQueryParams().getFirst("state");
        assertThat(url).contains("state=" + state);

        wireMock.stubFor(post(urlEqualTo(ConnectTestFixtures.TOKEN_PATH))
                .willReturn(okJson("{\"access_token\":\"at-1\",\"refresh_token\":\"rt-1\"}")));
        assertThat(orchestrator.complete("github", "c1", state).block().value().expiresAt())
                .isEqualTo(clock.instant().plusSeconds(3600));
        assertThat(connections.listConnected("u1").block().value()).contains("github");

        assertThat(tokens.getValidToken("u1", "github").block().value()).isEqualTo("at-1");
        wireMock.verify(1, postRequestedFor(urlEqualTo(ConnectTestFixtures.TOKEN_PATH)));

        clock.advance(Duration.ofMinutes(56));
        wireMock.stubFor(post(urlEqualTo(ConnectTestFixtures.TOKEN_PATH))
                .willReturn(okJson("{\"access_token\":\"at-2\",\"expires_in\":3600}")));
        assertThat(tokens.getValidToken("u1", "github").block().value()).isEqualTo("at-2");
        wireMock.verify(2, postRequestedFor(urlEqualTo(ConnectTestFixtures.TOKEN_PATH)));

        assertThat(connections.disconnect("u1", "github").block().isSuccess()).isTrue();
        assertThat(connections.listConnected("u1").block().value()).doesNotContain("github");
        assertThat(tokens.getValidToken("u1", "github").block().isFailure(OAuthErrorType.NO_CREDENTIAL)).isTrue();
        assertThat(connections.disconnect("u1", "github").block().isFailure(OAuthErrorType.NO_CREDENTIAL)).isTrue();
    }
}
