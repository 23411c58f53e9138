package com.example.connect.config;

import io.netty.channel.ChannelOption;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * Connection pool and timeouts shared by every outbound WebClient
 * (provider token endpoints, session verification).
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClientCustomizer outboundWebClientCustomizer(ConnectProperties properties) {
        Duration timeout = properties.getOauth().getHttpTimeout();

        ConnectionProvider connectionProvider = ConnectionProvider.builder("connect-outbound-pool")
                .maxConnections(100)
                .pendingAcquireMaxCount(500)
                .pendingAcquireTimeout(timeout)
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), 5000))
                .responseTimeout(timeout)
                .keepAlive(true);

        return builder -> builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024));
    }
}
