package com.peoplescourt.service.corpus;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.peoplescourt.dto.internal.CaseDocument;
import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.TopComment;
import com.peoplescourt.dto.internal.Verdict;

/**
 * Read-only access to the precedent corpus. Implementations must be safe for
 * concurrent use by many requests.
 */
public interface CorpusStore {

    /**
     * Nearest cases by cosine similarity ({@code 1 - cosine distance}), best first.
     */
    List<RankedHit> searchByVector(float[] vector, Collection<Verdict> verdicts, int limit);

    /**
     * Cases ranked by full-text relevance, title weighted twice the body, best first.
     *
     * @param terms already sanitized search terms
     */
    List<RankedHit> searchByKeywords(String terms, Collection<Verdict> verdicts, int limit);

    /**
     * Cases by id, without comments. Unknown ids are absent from the result.
     */
    List<CaseDocument> findCases(Collection<String> ids);

    /**
     * Highest-scoring top-level, non-deleted, non-bot comments per case id,
     * best first, at most {@code perCase} each.
     */
    Map<String, List<TopComment>> findTopComments(Collection<String> ids, int perCase);

    long countLabeledCases(Collection<Verdict> verdicts);
}
