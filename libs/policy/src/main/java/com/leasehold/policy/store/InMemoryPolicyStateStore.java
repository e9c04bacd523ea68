package com.leasehold.policy.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link PolicyStateStore} backed by concurrent hash maps. State lives for the lifetime of the
 * process.
 */
public final class InMemoryPolicyStateStore implements PolicyStateStore {

    private final Map<String, InMemoryNamespace<?>> namespaces = new ConcurrentHashMap<>();

    @Override
    public <T> StateNamespace<T> claim(String namespace, Class<T> type) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(type, "type");
        InMemoryNamespace<T> created = new InMemoryNamespace<>(namespace, type);
        if (namespaces.putIfAbsent(namespace, created) != null) {
            throw new IllegalStateException("State namespace already claimed: " + namespace);
        }
        return created;
    }

    @Override
    public boolean isClaimed(String namespace) {
        return namespaces.containsKey(namespace);
    }

    private static final class InMemoryNamespace<T> implements StateNamespace<T> {

        private final String name;
        private final Class<T> type;
        private final Map<Long, T> entries = new ConcurrentHashMap<>();

        InMemoryNamespace(String name, Class<T> type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<T> get(long entityId) {
            return Optional.ofNullable(entries.get(entityId));
        }

        @Override
        public void put(long entityId, T value) {
            entries.put(entityId, type.cast(Objects.requireNonNull(value, "value")));
        }

        @Override
        public boolean remove(long entityId) {
            return entries.remove(entityId) != null;
        }

        @Override
        public Optional<T> compute(long entityId, Function<Optional<T>, T> update) {
            return Optional.ofNullable(entries.compute(entityId,
                    (id, current) -> {
                        T next = update.apply(Optional.ofNullable(current));
                        return next == null ? null : type.cast(next);
                    }));
        }
    }
}
