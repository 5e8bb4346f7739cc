package com.peoplescourt.service.retrieval;

import com.peoplescourt.dto.internal.CaseDocument;
import com.peoplescourt.dto.internal.Precedent;
import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.TopComment;
import com.peoplescourt.service.corpus.CorpusStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns top-ranked ids into precedents: case bodies and top comments are
 * fetched in two batch queries, then joined in ranking order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrecedentAssembler {

    static final int COMMENTS_PER_CASE = 3;

    private final CorpusStore corpusStore;

    public List<Precedent> assemble(List<RankedHit> ranked) {
        if (ranked.isEmpty()) {
            return List.of();
        }

        List<String> ids = ranked.stream().map(RankedHit::getId).toList();

        Map<String, CaseDocument> cases = corpusStore.findCases(ids).stream()
                .collect(Collectors.toMap(CaseDocument::getId, Function.identity(), (a, b) -> a));
        Map<String, List<TopComment>> comments = corpusStore.findTopComments(ids, COMMENTS_PER_CASE);

        List<Precedent> precedents = new ArrayList<>(ranked.size());
        for (RankedHit hit : ranked) {
            CaseDocument document = cases.get(hit.getId());
            if (document == null) {
                log.warn("Ranked case {} could not be hydrated, skipping", hit.getId());
                continue;
            }

            List<TopComment> top = comments.getOrDefault(hit.getId(), List.of());
            if (top.size() > COMMENTS_PER_CASE) {
                top = top.subList(0, COMMENTS_PER_CASE);
            }

            precedents.add(Precedent.from(document.toBuilder().comments(List.copyOf(top)).build(), hit.getScore()));
        }
        return precedents;
    }
}
