package com.modelmonitor.retraining;

import java.util.Optional;

/**
 * FIFO store of serialized retraining jobs that survives restarts.
 * Payloads are opaque strings; encoding is the caller's concern.
 */
public interface DurableQueue {

    /** Appends a payload at the tail. */
    void push(String payload);

    /** Removes and returns the head, or empty when the queue is empty. */
    Optional<String> pop();

    long size();

    /** Parks a payload that could not be decoded so it is never executed but stays inspectable. */
    void deadLetter(String payload, String reason);
}
