package com.purchasingpower.flowgraph.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per name. Writers of the same workflow name are serialized,
 * writers of different names proceed in parallel.
 *
 * <p>Locks are never evicted; the number of names is bounded by the catalog size.
 */
public class NamedLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String name, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(name, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String name, Runnable action) {
        withLock(name, () -> {
            action.run();
            return null;
        });
    }

    boolean isLocked(String name) {
        ReentrantLock lock = locks.get(name);
        return lock != null && lock.isLocked();
    }
}
