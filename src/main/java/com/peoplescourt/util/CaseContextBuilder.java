package com.peoplescourt.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.Precedent;
import com.peoplescourt.dto.internal.TopComment;
import com.peoplescourt.dto.internal.Verdict;

/**
 * Renders the evidence block handed to the Judge. The layout is relied on by
 * the Judge prompt, so output must stay byte-for-byte deterministic.
 */
@Component
public class CaseContextBuilder {

    static final int MAX_FACTS_CHARS = 1000;
    static final int MAX_COMMENT_CHARS = 200;

    public String build(String scenario, ConsensusDistribution consensus, List<Precedent> precedents) {
        StringBuilder context = new StringBuilder();

        context.append("### CURRENT EVIDENCE PROVIDED BY THE PLAINTIFF:\n\n");
        context.append(scenario).append("\n\n");

        context.append("### PRE-DELIBERATION JURY POLLING:\n");
        for (Map.Entry<Verdict, Double> entry : consensus.asMap().entrySet()) {
            context.append("- ").append(entry.getKey().name())
                    .append(": ").append(percent(entry.getValue())).append("%\n");
        }
        context.append("\n");

        context.append("### RELEVANT CASE LAW (PRECEDENTS):\n\n");
        for (int i = 0; i < precedents.size(); i++) {
            appendCase(context, i + 1, precedents.get(i));
        }

        return context.toString();
    }

    private void appendCase(StringBuilder context, int number, Precedent precedent) {
        context.append("CASE ").append(number)
                .append(": ID `").append(precedent.getId()).append("`")
                .append(" - Title: ").append(precedent.getTitle()).append("\n");
        context.append("Official Reddit Verdict: ").append(precedent.getVerdict()).append("\n");
        context.append("Facts: ").append(head(precedent.getText(), MAX_FACTS_CHARS)).append("...\n");
        context.append("Top Judgments from the Jury:\n");

        List<TopComment> comments = precedent.getComments() != null ? precedent.getComments() : List.of();
        for (TopComment comment : comments) {
            context.append("- ").append(comment.getAuthor())
                    .append(" (Score ").append(comment.getScore()).append("): ")
                    .append(head(comment.getBody(), MAX_COMMENT_CHARS)).append("...\n");
        }
        context.append("\n---\n");
    }

    /**
     * Two decimals, rounded from the exact binary value of the percentage.
     */
    static String percent(double probability) {
        return new BigDecimal(probability * 100).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    // Cut counts code points so a surrogate pair is never split.
    private String head(String text, int max) {
        if (text == null) return "";
        if (text.codePointCount(0, text.length()) <= max) return text;
        return text.substring(0, text.offsetByCodePoints(0, max));
    }
}
