package com.example.connect.config;

import com.example.connect.provider.service.ProviderCatalog;
import com.example.connect.provider.service.ProviderRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Credentials are resolved once here and injected; nothing downstream reads
     * provider configuration on its own.
     */
    @Bean
    public ProviderRegistry providerRegistry(ConnectProperties properties) {
        return new ProviderRegistry(ProviderCatalog.builtIn(), properties.getOauth().getProviders());
    }
}
