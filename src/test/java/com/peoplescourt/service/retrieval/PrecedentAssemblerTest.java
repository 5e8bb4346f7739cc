package com.peoplescourt.service.retrieval;

import com.peoplescourt.dto.internal.CaseDocument;
import com.peoplescourt.dto.internal.Precedent;
import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.TopComment;
import com.peoplescourt.dto.internal.Verdict;
import com.peoplescourt.service.corpus.CorpusStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrecedentAssemblerTest {

    @Mock
    private CorpusStore corpusStore;

    @InjectMocks
    private PrecedentAssembler assembler;

    private static CaseDocument document(String id, Verdict verdict) {
        return CaseDocument.builder().id(id).title("T-" + id).text("story " + id).verdict(verdict).score(42).build();
    }

    @Test
    void keepsRankingOrderAndAttachesFusedScore() {
        List<RankedHit> ranked = List.of(RankedHit.of("b", 0.05), RankedHit.of("a", 0.03));
        // store returns rows in its own order
        when(corpusStore.findCases(anyCollection())).thenReturn(List.of(document("a", Verdict.YTA), document("b", Verdict.NAH)));
        when(corpusStore.findTopComments(anyCollection(), eq(3))).thenReturn(Map.of(
                "b", List.of(new TopComment("judge1", "NAH, just talk", 300))));

        List<Precedent> precedents = assembler.assemble(ranked);

        assertThat(precedents).extracting(Precedent::getId).containsExactly("b", "a");
        assertThat(precedents.get(0).getRelevanceScore()).isEqualTo(0.05);
        assertThat(precedents.get(0).getVerdict()).isEqualTo(Verdict.NAH);
        assertThat(precedents.get(0).getComments()).extracting(TopComment::getAuthor).containsExactly("judge1");
        assertThat(precedents.get(1).getComments()).isEmpty();
    }

    @Test
    void skipsIdsMissingFromCorpus() {
        when(corpusStore.findCases(anyCollection())).thenReturn(List.of(document("a", Verdict.NTA)));
        when(corpusStore.findTopComments(anyCollection(), eq(3))).thenReturn(Map.of());

        List<Precedent> precedents = assembler.assemble(List.of(RankedHit.of("gone", 0.1), RankedHit.of("a", 0.09)));

        assertThat(precedents).extracting(Precedent::getId).containsExactly("a");
    }

    @Test
    void trimsCommentsToThree() {
        List<TopComment> five = List.of(
                new TopComment("u1", "c1", 50), new TopComment("u2", "c2", 40), new TopComment("u3", "c3", 30),
                new TopComment("u4", "c4", 20), new TopComment("u5", "c5", 10));
        when(corpusStore.findCases(anyCollection())).thenReturn(List.of(document("a", Verdict.ESH)));
        when(corpusStore.findTopComments(anyCollection(), eq(3))).thenReturn(Map.of("a", five));

        List<Precedent> precedents = assembler.assemble(List.of(RankedHit.of("a", 0.2)));

        assertThat(precedents.get(0).getComments()).extracting(TopComment::getAuthor).containsExactly("u1", "u2", "u3");
    }

    @Test
    void emptyRankingDoesNotQuery() {
        assertThat(assembler.assemble(List.of())).isEmpty();
        verifyNoInteractions(corpusStore);
    }
}
