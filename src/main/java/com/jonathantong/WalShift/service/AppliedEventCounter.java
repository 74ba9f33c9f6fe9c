package com.jonathantong.WalShift.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide count of change events written to the replica. Shared by every consumer thread.
 */
@Component
public class AppliedEventCounter {

    private final AtomicLong applied = new AtomicLong();

    public long increment() {
        return applied.incrementAndGet();
    }

    public long get() {
        return applied.get();
    }
}
