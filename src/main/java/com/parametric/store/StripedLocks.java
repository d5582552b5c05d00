package com.parametric.store;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A fixed set of reentrant locks that keys are hashed onto. Two keys may share a
 * stripe; the number of locks never grows with the number of keys seen.
 */
public final class StripedLocks {

    public static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public StripedLocks() {
        this(DEFAULT_STRIPES);
    }

    public StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }

    public <T> T withLock(String key, Supplier<T> work) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public int stripeCount() {
        return stripes.length;
    }
}
