package com.peoplescourt.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.peoplescourt.service.corpus.CorpusStore;
import com.peoplescourt.service.llm.JudgeLlmService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final CorpusStore corpusStore;
    private final JudgeLlmService judgeLlmService;
    private final CourtProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("OPENING THE PEOPLE'S COURT");
        log.info("{}\n", "=".repeat(70));

        try {
            long cases = corpusStore.countLabeledCases(properties.getVerdicts());
            log.info("Corpus holds {} labeled cases ({})", cases, properties.getVerdicts());
            if (cases == 0) {
                log.warn("Corpus has no labeled cases; every adjudication will end without precedents");
            }
        } catch (Exception e) {
            log.error("Corpus check failed: {}", e.getMessage(), e);
            log.warn("Application started but retrieval may not work");
        }

        if (!judgeLlmService.hasCredential()) {
            log.warn("JUDGE_API_KEY is not set; adjudications will be refused");
        }

        log.info("\n{}", "=".repeat(70));
        log.info("COURT IN SESSION");
        log.info("{}\n", "=".repeat(70));
    }
}
