package com.leasehold.access;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One re-entrant lock per entity. Everything that reads and then mutates an entity's state
 * runs under its lock, so concurrent actions on the same entity are applied one at a time.
 */
public final class EntityLocks {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long entityId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(entityId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(long entityId, Runnable work) {
        withLock(entityId, () -> {
            work.run();
            return null;
        });
    }
}
