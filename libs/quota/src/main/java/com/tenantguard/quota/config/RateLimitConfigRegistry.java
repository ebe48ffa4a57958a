package com.tenantguard.quota.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable table of {@link RateLimitConfig} by operation name.
 * <p>
 * Keys are matched exactly. {@link #find(String)} reports a miss as an empty optional;
 * {@link #resolve(String)} is the one place that falls back to {@value #DEFAULT_OPERATION}.
 */
public final class RateLimitConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfigRegistry.class);

    public static final String DEFAULT_OPERATION = "query.default";

    private final Map<String, RateLimitConfig> configs;

    public RateLimitConfigRegistry(Map<String, RateLimitConfig> configs) {
        if (configs == null || !configs.containsKey(DEFAULT_OPERATION)) {
            throw new IllegalArgumentException("configs must define " + DEFAULT_OPERATION);
        }
        configs.forEach((operation, config) -> {
            if (operation == null || operation.isBlank() || config == null) {
                throw new IllegalArgumentException("invalid entry for operation '" + operation + "'");
            }
        });
        this.configs = Collections.unmodifiableMap(new LinkedHashMap<>(configs));
    }

    /**
     * The built-in limits.
     */
    public static RateLimitConfigRegistry defaults() {
        var table = new LinkedHashMap<String, RateLimitConfig>();
        table.put("query.default", new RateLimitConfig(100, 60, 1));
        table.put("query.search", new RateLimitConfig(30, 20, 2));
        table.put("query.analytics", new RateLimitConfig(20, 10, 5));

        table.put("mutation.create", new RateLimitConfig(20, 10, 2));
        table.put("mutation.update", new RateLimitConfig(30, 15, 1));
        table.put("mutation.delete", new RateLimitConfig(10, 5, 3));
        table.put("mutation.bulk", new RateLimitConfig(5, 2, 5));

        table.put("action.fileUpload", new RateLimitConfig(5, 2, 2));
        table.put("action.analysis", new RateLimitConfig(3, 1, 1));
        table.put("action.export", new RateLimitConfig(2, 1, 1));

        table.put("auth.login", new RateLimitConfig(10, 5, 1));
        table.put("auth.register", new RateLimitConfig(5, 2, 2));
        table.put("auth.passwordReset", new RateLimitConfig(3, 1, 1));
        return new RateLimitConfigRegistry(table);
    }

    /**
     * A registry holding these entries plus {@code overrides}, which win on equal keys.
     */
    public RateLimitConfigRegistry withOverrides(Map<String, RateLimitConfig> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(configs);
        merged.putAll(overrides);
        return new RateLimitConfigRegistry(merged);
    }

    /** The config registered under exactly {@code operation}. */
    public Optional<RateLimitConfig> find(String operation) {
        return Optional.ofNullable(configs.get(operation));
    }

    /**
     * The config for {@code operation}, or the {@value #DEFAULT_OPERATION} config when none is
     * registered.
     */
    public RateLimitConfig resolve(String operation) {
        return find(operation).orElseGet(() -> {
            log.debug("No rate limit configured for '{}', using {}", operation, DEFAULT_OPERATION);
            return configs.get(DEFAULT_OPERATION);
        });
    }

    /** Every registered operation name, sorted. */
    public SortedSet<String> operations() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(configs.keySet()));
    }

    public int size() {
        return configs.size();
    }
}
