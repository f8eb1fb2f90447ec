package com.delta.jobfeed.sync.model;

/**
 * How the association and search surfaces of one collection were reconciled.
 */
public enum CrossCheckOutcome {
    /** Association total at or below the small-collection threshold; its members were used directly. */
    ASSOCIATION_TRUSTED,
    /** Both surfaces agreed on the member count. */
    CONSISTENT,
    /** Association total was smaller; search results were filtered down to association members. */
    ASSOCIATION_AUTHORITATIVE,
    /** Association total was larger; search results were kept as returned. */
    SEARCH_AUTHORITATIVE,
    /** Association pagination fell short of its own total; no filtering and no removals. */
    ABORTED
}
