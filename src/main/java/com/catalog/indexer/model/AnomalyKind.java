package com.catalog.indexer.model;

public enum AnomalyKind {
    /** Matched none of the course-row patterns. */
    UNMATCHED,
    /** Matched only the fallback pattern, so no course code could be extracted. */
    NO_CODE
}
