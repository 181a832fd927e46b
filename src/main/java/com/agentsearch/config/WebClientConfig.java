package com.agentsearch.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final AgentSearchProperties properties;

    @Bean
    public WebClient searxngWebClient() {
        AgentSearchProperties.Searxng searxng = properties.getSearxng();
        log.info("SearXNG client: {} (timeout {}s)", searxng.getBaseUrl(), searxng.getTimeoutSeconds());

        return WebClient.builder()
                .baseUrl(searxng.getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .defaultHeader("User-Agent", properties.getFetch().getUserAgent())
                .clientConnector(connector(searxng.getTimeoutSeconds()))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }

    @Bean
    public WebClient qdrantWebClient() {
        AgentSearchProperties.Qdrant qdrant = properties.getQdrant();
        log.info("Qdrant client: {} (timeout {}s)", qdrant.getBaseUrl(), qdrant.getTimeoutSeconds());

        return WebClient.builder()
                .baseUrl(qdrant.getBaseUrl())
                .clientConnector(connector(qdrant.getTimeoutSeconds()))
                .build();
    }

    private ReactorClientHttpConnector connector(int timeoutSeconds) {
        return new ReactorClientHttpConnector(
                HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds))
        );
    }
}
