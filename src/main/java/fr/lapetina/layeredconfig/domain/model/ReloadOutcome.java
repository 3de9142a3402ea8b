package fr.lapetina.layeredconfig.domain.model;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of the reload that precedes a change notification.
 *
 * @param failure    the reload error, or null when the reload succeeded
 * @param reloadedAt when the reload finished
 */
public record ReloadOutcome(ConfigException failure, Instant reloadedAt) {

    public ReloadOutcome {
        Objects.requireNonNull(reloadedAt, "reloadedAt is required");
    }

    public static ReloadOutcome success() {
        return new ReloadOutcome(null, Instant.now());
    }

    public static ReloadOutcome failed(ConfigException failure) {
        Objects.requireNonNull(failure, "failure is required");
        return new ReloadOutcome(failure, Instant.now());
    }

    /**
     * True when the store and schema reflect the source that changed.
     * False means the listener sees the last-known-good data.
     */
    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<ConfigException> error() {
        return Optional.ofNullable(failure);
    }
}
