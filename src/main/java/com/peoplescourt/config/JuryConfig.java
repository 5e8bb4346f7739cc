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
public class JuryConfig {

    private final CourtProperties properties;

    @Bean
    public WebClient juryWebClient() {
        log.info("Initializing jury classifier client: {} (timeout {}s)",
                properties.getJuryBaseUrl(), properties.getJuryTimeoutSeconds());

        return WebClient.builder()
                .baseUrl(properties.getJuryBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .responseTimeout(Duration.ofSeconds(properties.getJuryTimeoutSeconds()))
                ))
                .build();
    }
}
