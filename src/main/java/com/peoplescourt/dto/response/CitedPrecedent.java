package com.peoplescourt.dto.response;

/**
 * A precedent as cited by the Judge. Either resolved against the hydrated
 * retrieval set ({@link HydratedCitation}) or passed through as the Judge
 * wrote it ({@link UnresolvedCitation}).
 */
public interface CitedPrecedent {

    String getCaseId();

    String getComparison();

    boolean isHydrated();
}
