package fr.lapetina.layeredconfig.infrastructure.provider;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import fr.lapetina.layeredconfig.domain.model.RemoteProvider;
import fr.lapetina.layeredconfig.infrastructure.format.ConfigFormat;
import fr.lapetina.layeredconfig.infrastructure.remote.RemoteConfigFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads configuration from a remote key/value backend.
 *
 * The fetch runs on a dedicated daemon thread and is bounded by a timeout.
 * On timeout the call returns immediately with {@link ConfigErrorType#TIMED_OUT};
 * the abandoned fetch finishes in the background and its result is discarded.
 * The remote payload is JSON.
 */
public final class RemoteConfigProvider extends AbstractConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(RemoteConfigProvider.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final RemoteProvider descriptor;
    private final RemoteConfigFetcher fetcher;
    private final Duration timeout;
    private final ExecutorService fetchExecutor;

    public RemoteConfigProvider(ProviderContext context, RemoteProvider descriptor,
                                RemoteConfigFetcher fetcher, Duration timeout) {
        super(context);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.descriptor = descriptor;
        this.fetcher = fetcher;
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.fetchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "remote-config-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RemoteConfigProvider(ProviderContext context, RemoteProvider descriptor, RemoteConfigFetcher fetcher) {
        this(context, descriptor, fetcher, DEFAULT_TIMEOUT);
    }

    @Override
    protected Optional<Map<String, Object>> readSource() {
        byte[] payload = fetch();
        log.debug("Remote configuration fetched: source={}, bytes={}", descriptor, payload.length);
        return Optional.of(ConfigFormat.JSON.decode(payload));
    }

    /**
     * Fetches the raw payload, bounded by the configured timeout.
     * Also used by the polling watcher.
     */
    public byte[] fetch() {
        CompletableFuture<byte[]> pending;
        try {
            pending = CompletableFuture.supplyAsync(this::fetchUnchecked, fetchExecutor);
        } catch (RejectedExecutionException e) {
            throw new ConfigException(ConfigErrorType.MANAGER_CLOSED,
                    "remote provider is closed: " + descriptor, e);
        }

        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ConfigException(ConfigErrorType.TIMED_OUT,
                    "remote config fetch timed out after " + timeout + ": " + descriptor, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigException(ConfigErrorType.REMOTE_FETCH_FAILED,
                    "interrupted while fetching remote config: " + descriptor, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConfigException configException) {
                throw configException;
            }
            if (cause instanceof UncheckedIOException io) {
                cause = io.getCause();
            }
            throw new ConfigException(ConfigErrorType.REMOTE_FETCH_FAILED,
                    "remote config fetch failed for " + descriptor + ": " + cause.getMessage(), cause);
        }
    }

    private byte[] fetchUnchecked() {
        try {
            byte[] payload = fetcher.fetch(descriptor);
            return payload != null ? payload : new byte[0];
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String describe() {
        return descriptor.toString();
    }

    /**
     * Stops accepting new fetches. An in-flight fetch is left to finish on its daemon thread.
     */
    @Override
    public void close() {
        fetchExecutor.shutdown();
    }
}
