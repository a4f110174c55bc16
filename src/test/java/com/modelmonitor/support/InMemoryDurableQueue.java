package com.modelmonitor.support;

import com.modelmonitor.retraining.DurableQueue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** FIFO {@link DurableQueue} kept in memory. Records dead-lettered payloads for assertions. */
public class InMemoryDurableQueue implements DurableQueue {

    private final Deque<String> payloads = new ArrayDeque<>();
    private final List<String> deadLetters = new ArrayList<>();

    @Override
    public synchronized void push(String payload) {
        payloads.addLast(payload);
    }

    @Override
    public synchronized Optional<String> pop() {
        return Optional.ofNullable(payloads.pollFirst());
    }

    @Override
    public synchronized long size() {
        return payloads.size();
    }

    @Override
    public synchronized void deadLetter(String payload, String reason) {
        deadLetters.add(payload);
    }

    public synchronized List<String> getPayloads() {
        return List.copyOf(payloads);
    }

    public synchronized List<String> getDeadLetters() {
        return List.copyOf(deadLetters);
    }
}
