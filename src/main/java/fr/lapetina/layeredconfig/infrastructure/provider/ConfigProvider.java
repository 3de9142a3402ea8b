package fr.lapetina.layeredconfig.infrastructure.provider;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;

/**
 * Populates the settings store from one source.
 *
 * Implementations must be thread-safe: a load may be triggered by the
 * application and by a watch loop at the same time.
 */
public interface ConfigProvider extends AutoCloseable {

    /**
     * Performs a full reload: reset, defaults, source merge, environment
     * overlay, schema binding. Either every step succeeds or the store and
     * schema keep their previous content.
     *
     * @throws ConfigException if the source cannot be read, decoded or validated
     */
    void load();

    /**
     * Human-readable description of the source, for logs.
     */
    String describe();

    @Override
    default void close() {
        // Default no-op, override for providers holding resources
    }
}
