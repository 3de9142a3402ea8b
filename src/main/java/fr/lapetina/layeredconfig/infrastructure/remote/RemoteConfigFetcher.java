package fr.lapetina.layeredconfig.infrastructure.remote;

import fr.lapetina.layeredconfig.domain.model.RemoteProvider;

import java.io.IOException;

/**
 * Fetches the current configuration payload from a remote backend.
 *
 * The payload is a JSON document. Implementations must be thread-safe;
 * the provider and the polling watcher call them concurrently.
 */
@FunctionalInterface
public interface RemoteConfigFetcher {

    /**
     * Fetches the raw payload described by the provider.
     *
     * @param provider backend, endpoint and path to fetch from
     * @return the payload bytes, UTF-8 encoded JSON
     * @throws IOException if the backend is unreachable or answers with an error
     */
    byte[] fetch(RemoteProvider provider) throws IOException;
}
