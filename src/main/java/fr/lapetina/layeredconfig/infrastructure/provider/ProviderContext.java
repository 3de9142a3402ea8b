package fr.lapetina.layeredconfig.infrastructure.provider;

import fr.lapetina.layeredconfig.infrastructure.metrics.ConfigMetrics;
import fr.lapetina.layeredconfig.infrastructure.schema.SchemaBinder;
import fr.lapetina.layeredconfig.infrastructure.store.SettingsStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Everything a provider shares with the manager that owns it.
 *
 * @param store     the manager's settings store
 * @param lock      the lock guarding the store; loads take its write side
 * @param defaults  lowest-precedence values, re-applied on every load
 * @param envPrefix environment overlay prefix, or null when disabled
 * @param binder    binds and validates the schema
 * @param schema    caller-owned schema, or null when none is configured
 * @param metrics   load meters
 */
public record ProviderContext(
        SettingsStore store,
        ReadWriteLock lock,
        Map<String, Object> defaults,
        String envPrefix,
        SchemaBinder binder,
        Object schema,
        ConfigMetrics metrics
) {
    public ProviderContext {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(lock, "lock is required");
        Objects.requireNonNull(binder, "binder is required");
        Objects.requireNonNull(metrics, "metrics is required");
        defaults = defaults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults))
                : Map.of();
        if (envPrefix != null && envPrefix.isBlank()) {
            envPrefix = null;
        }
    }

    public boolean hasDefaults() {
        return !defaults.isEmpty();
    }
}
