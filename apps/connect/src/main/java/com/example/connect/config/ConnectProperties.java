package com.example.connect.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "connect")
public class ConnectProperties {

    @Valid
    private OAuth oauth = new OAuth();
    private Store store = new Store();
    private Vault vault = new Vault();
    private RefreshLock refreshLock = new RefreshLock();
    private Kratos kratos = new Kratos();

    @Data
    public static class OAuth {
        @NotBlank
        private String callbackBaseUrl = "http://localhost:8080";
        private Duration stateTtl = Duration.ofMinutes(10);
        @Min(16)
        private int stateBytes = 32;
        private Duration refreshBuffer = Duration.ofMinutes(5);
        private long defaultExpiresIn = 3600;
        private Duration httpTimeout = Duration.ofSeconds(10);
        @Min(1)
        private int refreshMaxAttempts = 2;
        private Duration refreshBackoff = Duration.ofMillis(200);
        private Map<String, ProviderCredentials> providers = new HashMap<>();
    }

    @Data
    public static class ProviderCredentials {
        private String clientId;
        private String clientSecret;
    }

    @Data
    public static class Store {
        private String state = "in-memory";        // "in-memory" or "redis"
        private String credentials = "in-memory";  // "in-memory" or "vault"
    }

    @Data
    public static class Vault {
        private String uri = "http://localhost:8200";
        private String token;
        private String mount = "secret";
        private String pathPrefix = "oauth/users";
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class RefreshLock {
        private Duration ttl = Duration.ofSeconds(30);
        private Duration wait = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofMillis(250);
    }

    @Data
    public static class Kratos {
        private String publicUrl = "http://localhost:4433";
        private Duration timeout = Duration.ofSeconds(10);
    }
}
