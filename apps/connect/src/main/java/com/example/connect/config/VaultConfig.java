package com.example.connect.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.util.Assert;
import org.springframework.vault.authentication.SimpleSessionManager;
import org.springframework.vault.authentication.TokenAuthentication;
import org.springframework.vault.client.ClientHttpRequestFactoryFactory;
import org.springframework.vault.client.VaultEndpoint;
import org.springframework.vault.core.VaultTemplate;
import org.springframework.vault.support.ClientOptions;
import org.springframework.vault.support.SslConfiguration;

import java.net.URI;

/**
 * Vault client for the credential store, only when {@code connect.store.credentials=vault}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "connect.store.credentials", havingValue = "vault")
public class VaultConfig {

    @Bean
    public VaultTemplate vaultTemplate(ConnectProperties properties) {
        ConnectProperties.Vault vault = properties.getVault();
        Assert.hasText(vault.getToken(), "connect.vault.token must be set when using the Vault credential store");

        VaultEndpoint endpoint = VaultEndpoint.from(URI.create(vault.getUri()));
        ClientHttpRequestFactory requestFactory = ClientHttpRequestFactoryFactory.create(
                new ClientOptions(vault.getTimeout(), vault.getTimeout()),
                SslConfiguration.unconfigured());

        log.info("Vault client configured: {}", vault.getUri());
        return new VaultTemplate(endpoint, requestFactory,
                new SimpleSessionManager(new TokenAuthentication(vault.getToken())));
    }
}
