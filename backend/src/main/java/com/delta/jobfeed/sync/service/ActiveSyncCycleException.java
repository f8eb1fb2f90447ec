package com.delta.jobfeed.sync.service;

public class ActiveSyncCycleException extends RuntimeException {
    public ActiveSyncCycleException(String message) {
        super(message);
    }
}
