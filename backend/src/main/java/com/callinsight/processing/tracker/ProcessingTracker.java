package com.callinsight.processing.tracker;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide registry of call ids that currently have an active processing attempt.
 *
 * <p>Every trigger (API, webhook, poller thread, CDR sync) goes through the same instance, so
 * the guard is a plain {@link ReentrantLock} rather than anything bound to one scheduler. Real
 * exclusion lives in {@link #tryAcquire(String)}; {@link #isProcessing(String)} is advisory only.
 *
 * <p>A caller that acquired a key must release it exactly once, from a {@code finally} block.
 */
public class ProcessingTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> processing = new HashSet<>();

    /**
     * Atomically marks {@code callId} as in flight.
     *
     * @return {@code true} if the caller is now the sole holder, {@code false} if another attempt
     *         already holds it
     */
    public boolean tryAcquire(String callId) {
        requireKey(callId);
        lock.lock();
        try {
            return processing.add(callId);
        } finally {
            lock.unlock();
        }
    }

    public void release(String callId) {
        if (callId == null) {
            return;
        }
        lock.lock();
        try {
            processing.remove(callId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing(String callId) {
        if (callId == null) {
            return false;
        }
        lock.lock();
        try {
            return processing.contains(callId);
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return processing.size();
        } finally {
            lock.unlock();
        }
    }

    private static void requireKey(String callId) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId must not be blank");
        }
    }
}
