package com.leasehold.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that always carry the owning service as a tag.
 * <p>
 * Meters are looked up by name and tags on every call, so callers may request the same
 * counter repeatedly (e.g. once per action with an outcome tag) without caching it.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the outcome of an operation (e.g. "executed", "rejected"). */
    public static final String TAG_OUTCOME = "outcome";

    /** Tag key for the policy type involved in a decision. */
    public static final String TAG_POLICY = "policy";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns (registering on first use) a counter with the service tag.
     *
     * @param name        metric name (e.g., "leasehold.actions")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns (registering on first use) a timer with the service tag.
     *
     * @param name        metric name (e.g., "leasehold.action.duration")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
