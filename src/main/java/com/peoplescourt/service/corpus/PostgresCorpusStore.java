package com.peoplescourt.service.corpus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import com.peoplescourt.dto.internal.CaseDocument;
import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.TopComment;
import com.peoplescourt.dto.internal.Verdict;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Corpus on PostgreSQL: pgvector for similarity, ParadeDB BM25 for keywords.
 * Every call borrows its own pooled connection, so concurrent requests never
 * share a cursor.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PostgresCorpusStore implements CorpusStore {

    static final Set<String> BOT_AUTHORS = Set.of(
            "AutoModerator", "AITA-Bot", "JudgementBot", "AITA-Verdict-Bot", "[deleted]", "[removed]");

    static final Set<String> REMOVED_MARKERS = Set.of("[deleted]", "[removed]");

    private static final String VECTOR_SEARCH = """
            SELECT e.submission_id, 1 - (e.vector <=> CAST(:vector AS vector)) AS similarity
            FROM embeddings e
            JOIN submissions s ON e.submission_id = s.id
            WHERE s.verdict IN (:verdicts)
            ORDER BY similarity DESC
            LIMIT :limit
            """;

    private static final String KEYWORD_SEARCH = """
            SELECT id, paradedb.score(submissions) AS bm25_score
            FROM submissions
            WHERE submissions @@@ :query
            AND verdict IN (:verdicts)
            ORDER BY bm25_score DESC
            LIMIT :limit
            """;

    private static final String FIND_CASES = """
            SELECT id, title, selftext, verdict, score
            FROM submissions
            WHERE id IN (:ids)
            """;

    private static final String FIND_TOP_COMMENTS = """
            SELECT submission_id, author, body, score
            FROM (
                SELECT c.submission_id, c.author, c.body, c.score,
                       ROW_NUMBER() OVER (PARTITION BY c.submission_id ORDER BY c.score DESC) AS position
                FROM comments c
                WHERE c.submission_id IN (:ids)
                AND left(c.parent_id, 3) = 't3_'
                AND c.author NOT IN (:botAuthors)
                AND c.body NOT IN (:removedMarkers)
                AND c.body <> ''
            ) ranked
            WHERE position <= :perCase
            ORDER BY submission_id, score DESC
            """;

    private static final String COUNT_LABELED = """
            SELECT COUNT(*) FROM submissions WHERE verdict IN (:verdicts)
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public List<RankedHit> searchByVector(float[] vector, Collection<Verdict> verdicts, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("vector", toVectorLiteral(vector))
                .addValue("verdicts", labels(verdicts))
                .addValue("limit", limit);

        List<RankedHit> hits = jdbcTemplate.query(VECTOR_SEARCH, params,
                (rs, rowNum) -> RankedHit.of(rs.getString("submission_id"), rs.getDouble("similarity")));

        log.debug("Vector search: {} hits", hits.size());
        return hits;
    }

    @Override
    public List<RankedHit> searchByKeywords(String terms, Collection<Verdict> verdicts, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", toBm25Query(terms))
                .addValue("verdicts", labels(verdicts))
                .addValue("limit", limit);

        List<RankedHit> hits = jdbcTemplate.query(KEYWORD_SEARCH, params,
                (rs, rowNum) -> RankedHit.of(rs.getString("id"), rs.getDouble("bm25_score")));

        log.debug("Keyword search: {} hits", hits.size());
        return hits;
    }

    @Override
    public List<CaseDocument> findCases(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        return jdbcTemplate.query(FIND_CASES, new MapSqlParameterSource("ids", ids),
                (rs, rowNum) -> CaseDocument.builder()
                        .id(rs.getString("id"))
                        .title(rs.getString("title"))
                        .text(rs.getString("selftext"))
                        .verdict(Verdict.fromLabel(rs.getString("verdict")))
                        .score(rs.getInt("score"))
                        .build());
    }

    @Override
    public Map<String, List<TopComment>> findTopComments(Collection<String> ids, int perCase) {
        if (ids.isEmpty() || perCase <= 0) {
            return Map.of();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ids", ids)
                .addValue("botAuthors", BOT_AUTHORS)
                .addValue("removedMarkers", REMOVED_MARKERS)
                .addValue("perCase", perCase);

        Map<String, List<TopComment>> comments = new LinkedHashMap<>();
        jdbcTemplate.query(FIND_TOP_COMMENTS, params, (RowCallbackHandler) rs -> {
            comments.computeIfAbsent(rs.getString("submission_id"), k -> new ArrayList<>())
                    .add(TopComment.builder()
                            .author(rs.getString("author"))
                            .body(rs.getString("body"))
                            .score(rs.getInt("score"))
                            .build());
        });
        return comments;
    }

    @Override
    public long countLabeledCases(Collection<Verdict> verdicts) {
        Long count = jdbcTemplate.queryForObject(COUNT_LABELED,
                new MapSqlParameterSource("verdicts", labels(verdicts)), Long.class);
        return count != null ? count : 0L;
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder literal = new StringBuilder(vector.length * 10).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) literal.append(',');
            literal.append(vector[i]);
        }
        return literal.append(']').toString();
    }

    static String toBm25Query(String terms) {
        return String.format(Locale.ROOT, "title:(%s)^2 OR selftext:(%s)", terms, terms);
    }

    private List<String> labels(Collection<Verdict> verdicts) {
        return verdicts.stream().map(Verdict::name).toList();
    }
}
