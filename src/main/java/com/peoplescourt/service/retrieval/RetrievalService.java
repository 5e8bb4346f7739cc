package com.peoplescourt.service.retrieval;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.internal.Precedent;
import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.RetrievalResult;
import com.peoplescourt.dto.internal.Verdict;
import com.peoplescourt.service.corpus.CorpusStore;
import com.peoplescourt.util.DiagnosticsTableFormatter;
import com.peoplescourt.util.KeywordQuerySanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hybrid retrieval: dense and keyword searches over the labeled corpus,
 * fused by rank, the best {@code k} hydrated into precedents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private final CorpusStore corpusStore;
    private final RankFusionService rankFusionService;
    private final PrecedentAssembler precedentAssembler;
    private final KeywordQuerySanitizer keywordQuerySanitizer;
    private final DiagnosticsTableFormatter diagnosticsTableFormatter;
    private final CourtProperties properties;

    public RetrievalResult retrieve(float[] scenarioVector, String scenarioText, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }

        int pool = properties.getCandidatePool();
        List<Verdict> verdicts = properties.getVerdicts();

        List<RankedHit> vectorHits = corpusStore.searchByVector(scenarioVector, verdicts, pool);

        String terms = keywordQuerySanitizer.sanitize(scenarioText);
        List<RankedHit> keywordHits = terms.isEmpty()
                ? List.of()
                : corpusStore.searchByKeywords(terms, verdicts, pool);

        List<RankedHit> fused = rankFusionService.fuse(vectorHits, keywordHits);
        List<RankedHit> top = fused.subList(0, Math.min(k, fused.size()));

        if (top.isEmpty()) {
            log.info("No candidates from vector ({}) or keyword ({}) search", vectorHits.size(), keywordHits.size());
            return RetrievalResult.empty(vectorHits, keywordHits, fused);
        }

        List<Precedent> precedents = precedentAssembler.assemble(top);

        RetrievalResult result = RetrievalResult.builder()
                .precedents(precedents)
                .vectorHits(vectorHits)
                .keywordHits(keywordHits)
                .fusedRanking(fused)
                .build();

        log.info("Retrieved {} precedents from {} fused candidates", precedents.size(), fused.size());
        if (log.isDebugEnabled()) {
            log.debug("\n{}", diagnosticsTableFormatter.format(result));
        }
        return result;
    }
}
