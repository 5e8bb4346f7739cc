package com.peoplescourt.service.embedding;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.exception.EmbeddingException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioEmbeddingService {

    private static final ParameterizedTypeReference<Map<String, List<List<Double>>>> EMBED_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final CourtProperties properties;
    private final WebClient embeddingWebClient;

    /**
     * Embed text via the embedding service and truncate to the configured
     * dimension. The model emits Matryoshka embeddings, so a prefix is itself
     * a valid lower-dimension embedding.
     */
    @CircuitBreaker(name = "embedding")
    public Mono<float[]> encode(String text) {
        if (text == null || text.isBlank()) {
            return Mono.error(new EmbeddingException("Text is empty"));
        }

        int dimension = properties.getEmbeddingDimension();
        int timeout = properties.getEmbeddingTimeoutSeconds();

        return embeddingWebClient.post()
                .uri("/embed")
                .bodyValue(Map.of("texts", List.of(text)))
                .retrieve()
                .bodyToMono(EMBED_RESPONSE)
                .timeout(Duration.ofSeconds(timeout))
                .map(response -> truncate(firstEmbedding(response), dimension))
                .switchIfEmpty(Mono.error(new EmbeddingException("Empty response from embedding service")))
                .doOnSubscribe(s -> log.debug("Calling embedding service"))
                .onErrorMap(e -> !(e instanceof EmbeddingException), e -> e instanceof TimeoutException
                        ? new EmbeddingException("Embedding service timed out after " + timeout + "s", e)
                        : new EmbeddingException("Failed to generate embedding: " + e.getMessage(), e));
    }

    private List<Double> firstEmbedding(Map<String, List<List<Double>>> response) {
        List<List<Double>> embeddings = response.get("embeddings");
        if (embeddings == null || embeddings.isEmpty() || embeddings.get(0) == null) {
            throw new EmbeddingException("Invalid response from embedding service");
        }
        return embeddings.get(0);
    }

    private float[] truncate(List<Double> embedding, int dimension) {
        if (embedding.size() < dimension) {
            log.warn("Embedding dimension mismatch: expected {}, got {}", dimension, embedding.size());
        }

        int size = Math.min(dimension, embedding.size());
        float[] vector = new float[size];
        for (int i = 0; i < size; i++) {
            vector[i] = embedding.get(i).floatValue();
        }
        return vector;
    }
}
