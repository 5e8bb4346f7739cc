package com.peoplescourt.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.peoplescourt.dto.internal.Verdict;

import lombok.Data;

/**
 * Settings under the {@code peoples-court} prefix.
 * Absent groups fall back to the defaults in the convenience getters.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "peoples-court")
public class CourtProperties {

    private Retrieval retrieval;
    private Embedding embedding;
    private Jury jury;
    private Judge judge;
    private Monitoring monitoring;
    private List<String> allowedOrigins;

    // ============================================================
    // Retrieval
    // ============================================================
    @Data
    public static class Retrieval {
        private Integer candidatePool;     // hits taken from each search before fusion
        private Integer defaultPrecedents;
        private Integer rrfK;
        private Double topRankBonus;
        private List<Verdict> verdicts;
    }

    // ============================================================
    // Collaborators
    // ============================================================
    @Data
    public static class Embedding {
        private String baseUrl;
        private Integer dimension;
        private Integer timeoutSeconds;
    }

    @Data
    public static class Jury {
        private String baseUrl;
        private Integer timeoutSeconds;
    }

    @Data
    public static class Judge {
        private String baseUrl;
        private String apiKey;
        private String model;
        private Double temperature;
        private Integer numPredict;
        /** Longest silence tolerated between two streamed fragments. */
        private Integer timeoutSeconds;
    }

    @Data
    public static class Monitoring {
        private Integer maxQueryHistory;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getCandidatePool() {
        return retrieval != null && retrieval.getCandidatePool() != null
                ? retrieval.getCandidatePool()
                : 20;
    }

    public int getDefaultPrecedents() {
        return retrieval != null && retrieval.getDefaultPrecedents() != null
                ? retrieval.getDefaultPrecedents()
                : 3;
    }

    public int getRrfK() {
        return retrieval != null && retrieval.getRrfK() != null
                ? retrieval.getRrfK()
                : 60;
    }

    public double getTopRankBonus() {
        return retrieval != null && retrieval.getTopRankBonus() != null
                ? retrieval.getTopRankBonus()
                : 0.01;
    }

    public List<Verdict> getVerdicts() {
        return retrieval != null && retrieval.getVerdicts() != null && !retrieval.getVerdicts().isEmpty()
                ? retrieval.getVerdicts()
                : List.of(Verdict.values());
    }

    public String getEmbeddingBaseUrl() {
        return embedding != null && embedding.getBaseUrl() != null
                ? embedding.getBaseUrl()
                : "http://localhost:8001";
    }

    public int getEmbeddingDimension() {
        return embedding != null && embedding.getDimension() != null
                ? embedding.getDimension()
                : 256;
    }

    public int getEmbeddingTimeoutSeconds() {
        return embedding != null && embedding.getTimeoutSeconds() != null
                ? embedding.getTimeoutSeconds()
                : 30;
    }

    public String getJuryBaseUrl() {
        return jury != null && jury.getBaseUrl() != null
                ? jury.getBaseUrl()
                : "http://localhost:8002";
    }

    public int getJuryTimeoutSeconds() {
        return jury != null && jury.getTimeoutSeconds() != null
                ? jury.getTimeoutSeconds()
                : 30;
    }

    public String getJudgeBaseUrl() {
        return judge != null && judge.getBaseUrl() != null
                ? judge.getBaseUrl()
                : "http://localhost:11434";
    }

    public String getJudgeApiKey() {
        return judge != null ? judge.getApiKey() : null;
    }

    public String getJudgeModel() {
        return judge != null && judge.getModel() != null
                ? judge.getModel()
                : "gemma3:12b";
    }

    public double getJudgeTemperature() {
        return judge != null && judge.getTemperature() != null
                ? judge.getTemperature()
                : 0.2;
    }

    public int getJudgeNumPredict() {
        return judge != null && judge.getNumPredict() != null
                ? judge.getNumPredict()
                : 2048;
    }

    public int getJudgeTimeoutSeconds() {
        return judge != null && judge.getTimeoutSeconds() != null
                ? judge.getTimeoutSeconds()
                : 60;
    }

    public int getMaxQueryHistory() {
        return monitoring != null && monitoring.getMaxQueryHistory() != null
                ? monitoring.getMaxQueryHistory()
                : 100;
    }

    public List<String> getCorsOrigins() {
        return allowedOrigins != null && !allowedOrigins.isEmpty()
                ? allowedOrigins
                : List.of("http://localhost:3000", "http://127.0.0.1:3000");
    }
}
