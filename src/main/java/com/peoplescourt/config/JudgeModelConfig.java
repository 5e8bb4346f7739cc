package com.peoplescourt.config;

import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import com.peoplescourt.service.llm.JudgeResponseSchema;

import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat model backing the Judge. The endpoint speaks the Ollama API; the
 * configured API key is sent as a bearer token on every call.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class JudgeModelConfig {

    private final CourtProperties properties;

    @Bean
    public OllamaApi judgeOllamaApi() {
        log.info("Initializing Judge API with base URL: {}", properties.getJudgeBaseUrl());

        RestClient.Builder restClientBuilder = RestClient.builder();
        WebClient.Builder webClientBuilder = WebClient.builder();

        String apiKey = properties.getJudgeApiKey();
        if (StringUtils.hasText(apiKey)) {
            restClientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
            webClientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        } else {
            log.warn("No Judge API key configured; adjudications will be rejected");
        }

        return OllamaApi.builder()
                .baseUrl(properties.getJudgeBaseUrl())
                .restClientBuilder(restClientBuilder)
                .webClientBuilder(webClientBuilder)
                .build();
    }

    @Bean
    public OllamaOptions judgeOllamaOptions(JudgeResponseSchema responseSchema) {
        return OllamaOptions.builder()
                .model(properties.getJudgeModel())
                .temperature(properties.getJudgeTemperature())
                .numPredict(properties.getJudgeNumPredict()) // Max output tokens
                .format(responseSchema.asMap())
                .build();
    }

    @Bean
    public OllamaChatModel judgeChatModel(
            OllamaApi judgeOllamaApi,
            OllamaOptions judgeOllamaOptions,
            ObjectProvider<ObservationRegistry> observationRegistry) {

        return OllamaChatModel.builder()
                .ollamaApi(judgeOllamaApi)
                .defaultOptions(judgeOllamaOptions)
                .observationRegistry(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(ModelManagementOptions.builder().build())
                .build();
    }
}
