package com.delta.jobfeed.sync.artifact;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Serializes access to the artifact with a bounded wait.
 */
public class ArtifactLock {
    private final Semaphore permit = new Semaphore(1, true);
    private final Duration maxWait;

    public ArtifactLock(Duration maxWait) {
        this.maxWait = maxWait;
    }

    public void acquire() {
        try {
            if (!permit.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ArtifactLockTimeoutException("Artifact lock not acquired within " + maxWait.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArtifactLockTimeoutException("Interrupted while waiting for the artifact lock", e);
        }
    }

    public void release() {
        permit.release();
    }
}
