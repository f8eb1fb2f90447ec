package com.delta.jobfeed.sync.artifact;

/**
 * The artifact could not be restored from its backup. The document on disk is in an unknown state.
 */
public class ArtifactRollbackException extends RuntimeException {
    public ArtifactRollbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
