package com.peoplescourt.dto.internal;

/**
 * Closed set of verdicts a case can carry. Corpus entries outside this set
 * (unlabeled or junk flairs) are never retrieved.
 */
public enum Verdict {

    YTA,
    NTA,
    ESH,
    NAH;

    public static Verdict fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Verdict label is null");
        }
        try {
            return Verdict.valueOf(label.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown verdict label: " + label, e);
        }
    }
}
