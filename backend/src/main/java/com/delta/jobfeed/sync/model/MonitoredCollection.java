package com.delta.jobfeed.sync.model;

public record MonitoredCollection(
    long id,
    String name,
    String companyName,
    String applyDomain
) {
}
