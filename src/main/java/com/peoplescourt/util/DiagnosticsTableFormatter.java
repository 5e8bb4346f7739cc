package com.peoplescourt.util;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.RetrievalResult;

/**
 * Side-by-side text table of the vector, keyword and hybrid rankings.
 */
@Component
public class DiagnosticsTableFormatter {

    static final int MAX_ROWS = 10;
    private static final String RULE = "-".repeat(80);

    public String format(RetrievalResult result) {
        List<RankedHit> vector = result.getVectorHits();
        List<RankedHit> keyword = result.getKeywordHits();
        List<RankedHit> hybrid = result.getFusedRanking();

        StringBuilder table = new StringBuilder();
        table.append("Judicial Diagnostics: Retrieval & Ranking\n");
        table.append(RULE).append("\n");
        table.append(String.format(Locale.ROOT, "%-5s | %-25s | %-20s | %-15s\n",
                "Rank", "Vector Search (Cos Sim)", "Keyword (BM25)", "Hybrid (RRF)"));
        table.append(RULE).append("\n");

        int rows = Math.min(MAX_ROWS, hybrid.size());
        for (int i = 0; i < rows; i++) {
            table.append(String.format(Locale.ROOT, "%-5d | %-25s | %-20s | %-15s\n",
                    i + 1,
                    cell(vector, i, "%s (%.3f)"),
                    cell(keyword, i, "%s (%.2f)"),
                    cell(hybrid, i, "%s (%.4f)")));
        }
        table.append(RULE);

        return table.toString();
    }

    private String cell(List<RankedHit> hits, int row, String pattern) {
        if (row >= hits.size()) {
            return "-";
        }
        RankedHit hit = hits.get(row);
        return String.format(Locale.ROOT, pattern, hit.getId(), hit.getScore());
    }
}
