package com.delta.jobfeed.sync.artifact;

import java.util.List;

public class ArtifactValidationException extends RuntimeException {
    private final List<String> errors;

    public ArtifactValidationException(String operation, List<String> errors) {
        super(operation + " failed validation: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
