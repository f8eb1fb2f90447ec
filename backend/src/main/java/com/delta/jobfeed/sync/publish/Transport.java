package com.delta.jobfeed.sync.publish;

/**
 * Pushes the finished feed document to its downstream destination.
 */
public interface Transport {

    boolean publish(byte[] artifact);
}
