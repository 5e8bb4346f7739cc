package com.peoplescourt.service.adjudication;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.JudgeRuling;
import com.peoplescourt.dto.internal.Precedent;
import com.peoplescourt.dto.internal.RetrievalResult;
import com.peoplescourt.dto.response.AdjudicationResult;
import com.peoplescourt.dto.response.CitedPrecedent;
import com.peoplescourt.dto.response.HydratedCitation;
import com.peoplescourt.dto.response.UnresolvedCitation;
import com.peoplescourt.exception.MalformedVerdictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads the Judge's accumulated output and joins its citations with the
 * hydrated precedents. Citations of cases outside the hydrated set are kept
 * as written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerdictEnricher {

    private final ObjectMapper objectMapper;

    public AdjudicationResult enrich(String rawRuling, RetrievalResult retrieval, ConsensusDistribution consensus) {
        JudgeRuling ruling = parse(rawRuling);

        Map<String, Precedent> hydrated = retrieval.getPrecedents().stream()
                .collect(Collectors.toMap(Precedent::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<CitedPrecedent> cited = new ArrayList<>(ruling.getPrecedents().size());
        for (JudgeRuling.Citation citation : ruling.getPrecedents()) {
            Precedent precedent = hydrated.get(citation.getCaseId());
            if (precedent != null) {
                cited.add(new HydratedCitation(precedent, citation.getComparison()));
            } else {
                log.warn("Judge cited case {} outside the retrieved precedents", citation.getCaseId());
                cited.add(new UnresolvedCitation(citation.getCaseId(), citation.getComparison()));
            }
        }

        return AdjudicationResult.builder()
                .verdict(ruling.getVerdict())
                .openingStatement(ruling.getOpeningStatement())
                .facts(ruling.getFacts())
                .precedents(List.copyOf(cited))
                .deliberation(ruling.getDeliberation())
                .consensus(consensus)
                .diagnostics(retrieval.getDiagnostics())
                .build();
    }

    JudgeRuling parse(String rawRuling) {
        JudgeRuling ruling;
        try {
            ruling = objectMapper.readValue(stripCodeFence(rawRuling), JudgeRuling.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Unreadable ruling from Judge: {}\n{}", e.getMessage(), rawRuling);
            throw new MalformedVerdictException("The Judge returned a ruling that could not be read", e);
        }

        List<String> missing = missingFields(ruling);
        if (!missing.isEmpty()) {
            log.error("Incomplete ruling from Judge, missing {}:\n{}", missing, rawRuling);
            throw new MalformedVerdictException("The Judge's ruling is missing required fields: " + missing);
        }
        return ruling;
    }

    private List<String> missingFields(JudgeRuling ruling) {
        if (ruling == null) {
            return List.of("ruling");
        }

        List<String> missing = new ArrayList<>();
        if (ruling.getVerdict() == null) missing.add("verdict");
        if (ruling.getOpeningStatement() == null) missing.add("opening_statement");
        if (ruling.getFacts() == null) missing.add("facts");
        if (ruling.getDeliberation() == null) missing.add("deliberation");
        if (ruling.getPrecedents() == null) {
            missing.add("precedents");
        } else {
            for (int i = 0; i < ruling.getPrecedents().size(); i++) {
                JudgeRuling.Citation citation = ruling.getPrecedents().get(i);
                if (citation == null || citation.getCaseId() == null) missing.add("precedents[" + i + "].case_id");
                else if (citation.getComparison() == null) missing.add("precedents[" + i + "].comparison");
            }
        }
        return missing;
    }

    private String stripCodeFence(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int closing = text.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return text.substring(firstNewline + 1, closing).strip();
            }
        }
        return text;
    }
}
