package fr.lapetina.layeredconfig.domain.exception;

import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;

import java.util.Objects;

/**
 * Exception thrown when configuration cannot be loaded or watched.
 *
 * The {@link ConfigErrorType} lets callers tell, for instance, a remote
 * timeout apart from a validation failure without parsing messages.
 */
public class ConfigException extends RuntimeException {

    private final ConfigErrorType type;

    public ConfigException(ConfigErrorType type, String message) {
        super(message);
        this.type = Objects.requireNonNull(type, "type is required");
    }

    public ConfigException(ConfigErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = Objects.requireNonNull(type, "type is required");
    }

    public ConfigErrorType getType() {
        return type;
    }

    public boolean is(ConfigErrorType candidate) {
        return type == candidate;
    }

    public static ConfigException closed() {
        return new ConfigException(ConfigErrorType.MANAGER_CLOSED, "Config manager is closed");
    }
}
