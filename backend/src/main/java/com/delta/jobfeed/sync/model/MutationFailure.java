package com.delta.jobfeed.sync.model;

public record MutationFailure(
    String externalId,
    String operation,
    String reason
) {
}
