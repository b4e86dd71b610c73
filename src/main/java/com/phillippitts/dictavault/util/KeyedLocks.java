package com.phillippitts.dictavault.util;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion.
 *
 * <p>Callers holding the same key are serialized; callers on different keys never block each
 * other. Locks are created lazily and kept for the lifetime of the instance, which is fine for
 * the bounded number of documents and sessions a single user touches.
 */
public final class KeyedLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     *
     * @return the action's result
     */
    public <T> T withLock(String key, Supplier<T> action) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(action, "action must not be null");
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    public void runWithLock(String key, Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    // Package-private for tests
    int size() {
        return locks.size();
    }
}
