package com.delta.jobfeed.sync.remote;

/**
 * Association pagination collected fewer member ids than the surface itself reported.
 */
public class PaginationInconsistencyException extends RuntimeException {
    private final long collectionId;
    private final int collected;
    private final int reportedTotal;

    public PaginationInconsistencyException(long collectionId, int collected, int reportedTotal) {
        super("Collection " + collectionId + " association pagination collected " + collected + " of " + reportedTotal + " ids");
        this.collectionId = collectionId;
        this.collected = collected;
        this.reportedTotal = reportedTotal;
    }

    public long getCollectionId() {
        return collectionId;
    }

    public int getCollected() {
        return collected;
    }

    public int getReportedTotal() {
        return reportedTotal;
    }
}
