package com.peoplescourt.service.retrieval;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.internal.RankedHit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Reciprocal Rank Fusion with a bonus for first place. Only rank positions
 * matter; the input scores are ignored.
 */
@Service
@RequiredArgsConstructor
public class RankFusionService {

    private final CourtProperties properties;

    public List<RankedHit> fuse(List<RankedHit> vectorHits, List<RankedHit> keywordHits) {
        return fuse(vectorHits, keywordHits, properties.getRrfK(), properties.getTopRankBonus());
    }

    /**
     * Ids are ordered by descending fused score. Equal scores keep the order
     * in which ids were first seen, vector hits before keyword hits.
     */
    public static List<RankedHit> fuse(
            List<RankedHit> vectorHits,
            List<RankedHit> keywordHits,
            int k,
            double topRankBonus
    ) {
        Map<String, Double> scores = new LinkedHashMap<>();

        accumulate(scores, vectorHits, k, topRankBonus);
        accumulate(scores, keywordHits, k, topRankBonus);

        List<RankedHit> fused = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> fused.add(RankedHit.of(id, score)));

        // List.sort is stable
        fused.sort((a, b) -> Double.compare(b.getScore(), a.getScore()));
        return fused;
    }

    private static void accumulate(Map<String, Double> scores, List<RankedHit> hits, int k, double topRankBonus) {
        for (int i = 0; i < hits.size(); i++) {
            int rank = i + 1;
            double contribution = 1.0 / (k + rank) + (rank == 1 ? topRankBonus : 0.0);
            scores.merge(hits.get(i).getId(), contribution, Double::sum);
        }
    }
}
