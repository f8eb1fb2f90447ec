package com.delta.jobfeed.sync.model;

import java.util.List;

public record ValidationReport(
    boolean valid,
    int entryCount,
    List<String> errors
) {
    public ValidationReport {
        errors = List.copyOf(errors);
    }

    public static ValidationReport ok(int entryCount) {
        return new ValidationReport(true, entryCount, List.of());
    }

    public static ValidationReport invalid(int entryCount, List<String> errors) {
        return new ValidationReport(false, entryCount, errors);
    }
}
