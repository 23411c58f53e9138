package com.example.connect.provider.service;

import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthResult;
import com.example.connect.config.ConnectProperties;
import com.example.connect.provider.model.ProviderDescriptor;
import com.example.connect.provider.model.ProviderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.example.connect.util.ConnectTestFixtures.credentials;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProviderRegistry")
class ProviderRegistryTest {

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        Map<String, ConnectProperties.ProviderCredentials> creds = new HashMap<>();
        creds.put("github", credentials("gh-client", "gh-secret"));
        creds.put("gmail", credentials("gm-client", ""));
        creds.put("dropbox", credentials("db-client", "db-secret"));
        registry = new ProviderRegistry(ProviderCatalog.builtIn(), creds);
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("Should return a usable descriptor for a configured provider")
        void configuredProvider() {
            OAuthResult<ProviderDescriptor> result = registry.resolve("github");

            assertThat(result.isSuccess()).isTrue();
            ProviderDescriptor github = result.value();
            assertThat(github.clientId()).isEqualTo("gh-client");
            assertThat(github.clientSecret()).isEqualTo("gh-secret");
            assertThat(github.scope()).isEqualTo("repo user");
            assertThat(github.responseType()).isEqualTo("code");
            assertThat(github.tokenUri()).isEqualTo("https://github.com/login/oauth/access_token");
        }

        @Test
        @DisplayName("Should fail with UNKNOWN_PROVIDER for an id outside the catalog")
        void unknownProvider() {
            OAuthResult<ProviderDescriptor> result = registry.resolve("dropbox");

            assertThat(result.isFailure(OAuthErrorType.UNKNOWN_PROVIDER)).isTrue();
            assertThat(result.error().message()).contains("dropbox", "notion", "gmail", "github");
        }

        @Test
        @DisplayName("Should fail with UNKNOWN_PROVIDER for a null id")
        void nullProvider() {
            assertThat(registry.resolve(null).isFailure(OAuthErrorType.UNKNOWN_PROVIDER)).isTrue();
        }

        @Test
        @DisplayName("Should fail with NOT_CONFIGURED when the secret is blank")
        void blankSecret() {
            assertThat(registry.resolve("gmail").isFailure(OAuthErrorType.NOT_CONFIGURED)).isTrue();
        }

        @Test
        @DisplayName("Should fail with NOT_CONFIGURED when no credentials were supplied")
        void noCredentials() {
            assertThat(registry.resolve("notion").isFailure(OAuthErrorType.NOT_CONFIGURED)).isTrue();
        }
    }

    @Nested
    @DisplayName("catalog")
    class Catalog {

        @Test
        @DisplayName("Should list every catalog entry regardless of configuration")
        void listSupported() {
            assertThat(registry.listSupported()).containsExactly("notion", "gmail", "github");
            assertThat(registry.isSupported("gmail")).isTrue();
            assertThat(registry.isSupported("dropbox")).isFalse();
        }

        @Test
        @DisplayName("Should flag which entries are configured")
        void configurationStatus() {
            assertThat(registry.catalog()).containsExactly(
                    new ProviderStatus("notion", "Notion", false),
                    new ProviderStatus("gmail", "Gmail", false),
                    new ProviderStatus("github", "GitHub", true));
            assertThat(registry.isConfigured("github")).isTrue();
            assertThat(registry.isConfigured("notion")).isFalse();
        }

        @Test
        @DisplayName("Should keep Notion's scope empty and hide the secret")
        void notionHasNoScope() {
            Map<String, ConnectProperties.ProviderCredentials> creds = Map.of("notion", credentials("notion-client", "notion-secret-value"));
            ProviderDescriptor notion = new ProviderRegistry(ProviderCatalog.builtIn(), creds).resolve("notion").value();

            assertThat(notion.hasScope()).isFalse();
            assertThat(notion.toString()).doesNotContain("notion-secret-value");
        }
    }
}
