package fr.lapetina.layeredconfig.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Describes an external configuration source.
 * Immutable and thread-safe.
 *
 * @param type     backend selector, e.g. {@code http}, {@code consul}, {@code etcd3}
 * @param endpoint network address of the backend, e.g. {@code localhost:8500}
 * @param path     logical location of the configuration inside the backend
 */
public record RemoteProvider(String type, String endpoint, String path) {

    public RemoteProvider {
        Objects.requireNonNull(type, "Type is required");
        Objects.requireNonNull(endpoint, "Endpoint is required");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Type must not be blank");
        }
        if (endpoint.isBlank()) {
            throw new IllegalArgumentException("Endpoint must not be blank");
        }
        type = type.trim().toLowerCase(Locale.ROOT);
        path = path != null ? path : "";
    }

    public static RemoteProvider of(String type, String endpoint, String path) {
        return new RemoteProvider(type, endpoint, path);
    }

    @Override
    public String toString() {
        return type + "://" + endpoint + (path.startsWith("/") ? path : "/" + path);
    }
}
