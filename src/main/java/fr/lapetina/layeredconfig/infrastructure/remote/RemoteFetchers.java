package fr.lapetina.layeredconfig.infrastructure.remote;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import fr.lapetina.layeredconfig.domain.model.RemoteProvider;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the built-in fetcher for a remote descriptor's type.
 *
 * Supported types: {@code http}, {@code https}, {@code consul}, {@code etcd3}.
 * Other backends are plugged in by passing a {@link RemoteConfigFetcher}
 * to the manager's builder.
 */
public final class RemoteFetchers {

    private static final Set<String> SUPPORTED_TYPES = Set.of("http", "https", "consul", "etcd3");

    private RemoteFetchers() {
        // Utility class
    }

    /**
     * Creates the built-in fetcher for the descriptor's type.
     *
     * @param provider       remote descriptor
     * @param requestTimeout per-request HTTP timeout
     * @return the fetcher, or empty when the type has no built-in support
     */
    public static Optional<RemoteConfigFetcher> forDescriptor(RemoteProvider provider, Duration requestTimeout) {
        Duration connectTimeout = Duration.ofSeconds(10).compareTo(requestTimeout) < 0
                ? Duration.ofSeconds(10)
                : requestTimeout;
        return switch (provider.type()) {
            case "http" -> Optional.of(new HttpRemoteConfigFetcher(
                    HttpRemoteConfigFetcher.Dialect.PLAIN, "http", connectTimeout, requestTimeout));
            case "https" -> Optional.of(new HttpRemoteConfigFetcher(
                    HttpRemoteConfigFetcher.Dialect.PLAIN, "https", connectTimeout, requestTimeout));
            case "consul" -> Optional.of(new HttpRemoteConfigFetcher(
                    HttpRemoteConfigFetcher.Dialect.CONSUL, "http", connectTimeout, requestTimeout));
            case "etcd3" -> Optional.of(new HttpRemoteConfigFetcher(
                    HttpRemoteConfigFetcher.Dialect.ETCD3, "http", connectTimeout, requestTimeout));
            default -> Optional.empty();
        };
    }

    /**
     * A fetcher that always fails with {@link ConfigErrorType#REMOTE_PROVIDER_UNSUPPORTED}.
     * Lets an unsupported descriptor surface its error on load rather than at construction.
     */
    public static RemoteConfigFetcher unsupported() {
        return provider -> {
            throw new ConfigException(ConfigErrorType.REMOTE_PROVIDER_UNSUPPORTED,
                    "unsupported remote provider type '" + provider.type()
                            + "', expected one of " + SUPPORTED_TYPES);
        };
    }

    public static boolean isSupported(String type) {
        return SUPPORTED_TYPES.contains(type);
    }
}
