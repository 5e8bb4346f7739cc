package com.peoplescourt.config;

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
public class EmbeddingConfig {

    private final CourtProperties properties;

    @Bean
    public WebClient embeddingWebClient() {
        log.info("==============================================");
        log.info("EMBEDDING SERVICE CONFIGURATION");
        log.info("==============================================");
        log.info("  Base URL  : {}", properties.getEmbeddingBaseUrl());
        log.info("  Dimension : {}", properties.getEmbeddingDimension());
        log.info("  Timeout   : {}s", properties.getEmbeddingTimeoutSeconds());
        log.info("==============================================");

        return WebClient.builder()
                .baseUrl(properties.getEmbeddingBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .responseTimeout(Duration.ofSeconds(properties.getEmbeddingTimeoutSeconds()))
                ))
                .build();
    }
}
