package com.delta.jobfeed.sync.artifact;

public class ArtifactLockTimeoutException extends RuntimeException {
    public ArtifactLockTimeoutException(String message) {
        super(message);
    }

    public ArtifactLockTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
