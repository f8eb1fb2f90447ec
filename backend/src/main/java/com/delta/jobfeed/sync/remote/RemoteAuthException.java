package com.delta.jobfeed.sync.remote;

/**
 * One of the token exchange steps against the remote system failed. Fatal for the current cycle.
 */
public class RemoteAuthException extends RuntimeException {
    public RemoteAuthException(String message) {
        super(message);
    }

    public RemoteAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
