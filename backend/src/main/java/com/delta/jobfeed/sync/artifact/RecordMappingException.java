package com.delta.jobfeed.sync.artifact;

/**
 * A record cannot be turned into a feed entry. The record is skipped for the current cycle only.
 */
public class RecordMappingException extends RuntimeException {
    private final String externalId;

    public RecordMappingException(String externalId, String message) {
        super("Record " + externalId + ": " + message);
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
