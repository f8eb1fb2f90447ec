package com.delta.jobfeed.sync.remote;

public class TransientFetchException extends RuntimeException {
    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
