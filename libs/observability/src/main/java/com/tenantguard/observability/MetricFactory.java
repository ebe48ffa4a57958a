package com.tenantguard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Tenant ids are never used as tags since their cardinality is unbounded. Callers tag by
 * operation name and outcome only. Registering the same name and tags twice returns the meter
 * already held by the registry, so lookups per call are safe.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the registry meters are bound to
     * @param serviceName value of the {@code service} tag
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
     * Returns the counter for {@code name} with the service tag plus {@code tags}
     * (alternating key/value pairs).
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tagsOf(tags))
                .register(registry);
    }

    /**
     * Returns the timer for {@code name} with the service tag plus {@code tags}.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tagsOf(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Tags tagsOf(String... extra) {
        if (extra.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extra);
    }
}
