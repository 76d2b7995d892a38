package com.purchasingpower.depgraph.core;

import java.time.Duration;

/**
 * Monotonic deadline threaded through traversals and query execution.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            return NONE;
        }
        long now = System.nanoTime();
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (ArithmeticException e) {
            return NONE;
        }
        long expires = now + nanos;
        // overflow
        return expires < now ? NONE : new Deadline(expires);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return this != NONE && System.nanoTime() - expiresAtNanos >= 0;
    }

    public Duration remaining() {
        if (this == NONE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0, expiresAtNanos - System.nanoTime()));
    }
}
