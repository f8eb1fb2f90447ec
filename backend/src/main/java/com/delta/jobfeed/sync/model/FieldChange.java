package com.delta.jobfeed.sync.model;

public record FieldChange(
    String field,
    String oldValue,
    String newValue
) {
}
