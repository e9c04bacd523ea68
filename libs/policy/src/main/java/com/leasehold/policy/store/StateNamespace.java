package com.leasehold.policy.store;

import java.util.Optional;
import java.util.function.Function;

/**
 * Per-entity key-value slot owned by exactly one component.
 *
 * @param <T> value type, expected to be immutable
 */
public interface StateNamespace<T> {

    String name();

    Optional<T> get(long entityId);

    void put(long entityId, T value);

    /** Removes the entry and reports whether one was present. */
    boolean remove(long entityId);

    /**
     * Atomically replaces the entry with {@code update.apply(current)}. A {@code null} result
     * removes the entry.
     */
    Optional<T> compute(long entityId, Function<Optional<T>, T> update);
}
