package fr.lapetina.layeredconfig;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.CancellationSignal;
import fr.lapetina.layeredconfig.domain.model.ReloadFailurePolicy;
import fr.lapetina.layeredconfig.domain.model.ReloadOutcome;
import fr.lapetina.layeredconfig.domain.model.RemoteProvider;
import fr.lapetina.layeredconfig.infrastructure.metrics.ConfigMetrics;
import fr.lapetina.layeredconfig.infrastructure.provider.ConfigProvider;
import fr.lapetina.layeredconfig.infrastructure.provider.LocalConfigProvider;
import fr.lapetina.layeredconfig.infrastructure.provider.ProviderContext;
import fr.lapetina.layeredconfig.infrastructure.provider.RemoteConfigProvider;
import fr.lapetina.layeredconfig.infrastructure.remote.RemoteConfigFetcher;
import fr.lapetina.layeredconfig.infrastructure.remote.RemoteFetchers;
import fr.lapetina.layeredconfig.infrastructure.schema.SchemaBinder;
import fr.lapetina.layeredconfig.infrastructure.store.SettingsStore;
import fr.lapetina.layeredconfig.infrastructure.watch.ConfigWatcher;
import fr.lapetina.layeredconfig.infrastructure.watch.LocalConfigWatcher;
import fr.lapetina.layeredconfig.infrastructure.watch.RemoteConfigWatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Layered configuration manager.
 *
 * Settings are resolved from, highest precedence first: environment
 * variables, the remote backend or the local file, then defaults. Keys are
 * case-insensitive dotted paths such as {@code server.port}.
 *
 * Typical use:
 * <pre>{@code
 * try (ConfigManager config = ConfigManager.builder(Path.of("config.yaml"))
 *         .envPrefix("APP")
 *         .defaults(Map.of("server.port", 8080))
 *         .watchEnabled(true)
 *         .build()) {
 *     config.load();
 *     int port = config.getInt("server.port");
 * }
 * }</pre>
 *
 * Thread-safe. Getters may run concurrently with loads and watch callbacks;
 * a reader never observes a partially reloaded store.
 */
public final class ConfigManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigManager.class);

    private final SettingsStore store;
    private final ReadWriteLock lock;
    private final SchemaBinder binder;
    private final ConfigMetrics metrics;
    private final ConfigProvider provider;
    private final ConfigWatcher watcher;
    private final Object schema;
    private final boolean watchEnabled;
    private final ReloadFailurePolicy reloadFailurePolicy;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CancellationSignal done = CancellationSignal.create();

    private ConfigManager(Builder builder) {
        this.store = new SettingsStore(builder.environment);
        this.lock = new ReentrantReadWriteLock();
        this.binder = new SchemaBinder();
        this.metrics = new ConfigMetrics(builder.meterRegistry, ConfigMetrics.DEFAULT_PREFIX);
        this.schema = builder.schema;
        this.watchEnabled = builder.watchEnabled;
        this.reloadFailurePolicy = builder.reloadFailurePolicy;

        ProviderContext context = new ProviderContext(
                store, lock, builder.defaults, builder.envPrefix, binder, schema, metrics);

        if (builder.remoteProvider != null) {
            RemoteProvider descriptor = builder.remoteProvider;
            RemoteConfigFetcher fetcher = builder.remoteFetcher != null
                    ? builder.remoteFetcher
                    : RemoteFetchers.forDescriptor(descriptor, builder.remoteTimeout)
                            .orElseGet(RemoteFetchers::unsupported);
            RemoteConfigProvider remote = new RemoteConfigProvider(
                    context, descriptor, fetcher, builder.remoteTimeout);
            this.provider = remote;
            this.watcher = new RemoteConfigWatcher(remote, done, builder.pollInterval, metrics);
        } else {
            this.provider = new LocalConfigProvider(context, builder.configFile);
            this.watcher = new LocalConfigWatcher(builder.configFile, done);
        }

        log.debug("Config manager created: source={}, envPrefix={}, schema={}, watchEnabled={}",
                provider.describe(), context.envPrefix(),
                schema != null ? schema.getClass().getSimpleName() : "none", watchEnabled);
    }

    /**
     * Starts building a manager reading the given file.
     *
     * @param configFile local configuration file; may be null when a remote provider is configured
     */
    public static Builder builder(Path configFile) {
        return new Builder(configFile);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Loads, or reloads, the configuration from its source.
     *
     * A reload replaces all previously loaded values. On failure the
     * previous settings and schema are left untouched.
     *
     * @throws ConfigException if the manager is closed or the source cannot be loaded
     */
    public void load() {
        if (closed.get()) {
            throw ConfigException.closed();
        }
        provider.load();
    }

    /**
     * Watches the source for changes.
     *
     * On each change the configuration is reloaded, then the listener is
     * notified. Returns immediately; the watch runs until the signal fires
     * or the manager is closed. A local file is always watchable; remote
     * polling only runs when watching is enabled on the builder.
     *
     * @throws ConfigException with {@code MANAGER_CLOSED} after close, or
     *                         {@code WATCH_SETUP_FAILED} if the watch cannot start
     */
    public void watch(CancellationSignal signal, ConfigChangeListener listener) {
        if (closed.get()) {
            throw ConfigException.closed();
        }
        if (!watchEnabled && watcher instanceof RemoteConfigWatcher) {
            log.warn("Watch requested but remote polling is disabled: source={}", provider.describe());
            return;
        }
        Objects.requireNonNull(listener, "listener is required");
        watcher.watch(signal, () -> reloadAndNotify(listener));
    }

    private void reloadAndNotify(ConfigChangeListener listener) {
        if (closed.get()) {
            return;
        }

        ReloadOutcome outcome;
        try {
            provider.load();
            metrics.recordReload(true);
            outcome = ReloadOutcome.success();
        } catch (ConfigException e) {
            metrics.recordReload(false);
            log.error("Failed to reload configuration, keeping current: source={}, type={}",
                    provider.describe(), e.getType(), e);
            if (reloadFailurePolicy == ReloadFailurePolicy.SKIP_NOTIFICATION) {
                return;
            }
            outcome = ReloadOutcome.failed(e);
        }

        metrics.recordNotification();
        try {
            listener.onConfigChanged(outcome);
        } catch (RuntimeException e) {
            log.error("Error notifying config change listener", e);
        }
    }

    /**
     * Stops every running watch and releases background resources.
     * Idempotent. Getters keep serving the last loaded settings.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            done.cancel();
            provider.close();
            binder.close();
            log.info("Config manager closed: source={}", provider.describe());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ---------------------------------------------------------------------
    // Typed getters, zero value when the key is absent or not convertible
    // ---------------------------------------------------------------------

    public Object get(String key) {
        return read(() -> store.get(key));
    }

    public String getString(String key) {
        return read(() -> store.getString(key));
    }

    public int getInt(String key) {
        return read(() -> store.getInt(key));
    }

    public long getLong(String key) {
        return read(() -> store.getLong(key));
    }

    public double getDouble(String key) {
        return read(() -> store.getDouble(key));
    }

    public boolean getBoolean(String key) {
        return read(() -> store.getBoolean(key));
    }

    public List<String> getStringList(String key) {
        return read(() -> store.getStringList(key));
    }

    public Map<String, Object> getStringMap(String key) {
        return read(() -> store.getStringMap(key));
    }

    public Duration getDuration(String key) {
        return read(() -> store.getDuration(key));
    }

    public Instant getTime(String key) {
        return read(() -> store.getTime(key));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Strict accessor: empty when the key is absent or cannot be converted.
     */
    public <T> Optional<T> find(String key, Class<T> type) {
        return read(() -> store.find(key, type));
    }

    public boolean isSet(String key) {
        return read(() -> store.isSet(key));
    }

    /**
     * Returns the schema object bound on each load, or null when none was configured.
     */
    public Object getSchema() {
        return read(() -> schema);
    }

    public List<String> allKeys() {
        return read(store::allKeys);
    }

    public Map<String, Object> allSettings() {
        return read(store::allSettings);
    }

    private <T> T read(Supplier<T> query) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return query.get();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Builder for {@link ConfigManager}.
     */
    public static final class Builder {

        private final Path configFile;
        private Object schema;
        private String envPrefix;
        private Map<String, Object> defaults = Map.of();
        private RemoteProvider remoteProvider;
        private boolean watchEnabled;
        private Duration pollInterval = RemoteConfigWatcher.DEFAULT_POLL_INTERVAL;
        private Duration remoteTimeout = RemoteConfigProvider.DEFAULT_TIMEOUT;
        private RemoteConfigFetcher remoteFetcher;
        private Function<String, String> environment = System::getenv;
        private ReloadFailurePolicy reloadFailurePolicy = ReloadFailurePolicy.NOTIFY_ANYWAY;
        private MeterRegistry meterRegistry;

        private Builder(Path configFile) {
            this.configFile = configFile;
        }

        /**
         * Mutable object populated and validated on every load.
         * Constraints use Jakarta Bean Validation annotations.
         */
        public Builder schema(Object schema) {
            this.schema = schema;
            return this;
        }

        /**
         * Enables the environment overlay: key {@code server.port} is read
         * from {@code <PREFIX>_SERVER_PORT}.
         */
        public Builder envPrefix(String envPrefix) {
            this.envPrefix = envPrefix;
            return this;
        }

        public Builder defaults(Map<String, ?> defaults) {
            this.defaults = defaults != null ? new LinkedHashMap<>(defaults) : Map.of();
            return this;
        }

        /**
         * Reads from a remote backend instead of the local file.
         */
        public Builder remoteProvider(RemoteProvider remoteProvider) {
            this.remoteProvider = remoteProvider;
            return this;
        }

        /**
         * Enables polling of the remote provider. Local files are watched regardless.
         */
        public Builder watchEnabled(boolean watchEnabled) {
            this.watchEnabled = watchEnabled;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval is required");
            return this;
        }

        public Builder remoteTimeout(Duration remoteTimeout) {
            this.remoteTimeout = Objects.requireNonNull(remoteTimeout, "remoteTimeout is required");
            return this;
        }

        /**
         * Overrides the built-in fetcher chosen from the remote provider type.
         */
        public Builder remoteFetcher(RemoteConfigFetcher remoteFetcher) {
            this.remoteFetcher = remoteFetcher;
            return this;
        }

        /**
         * Environment lookup used by the overlay. Defaults to {@link System#getenv(String)}.
         */
        public Builder environment(Function<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment is required");
            return this;
        }

        public Builder reloadFailurePolicy(ReloadFailurePolicy reloadFailurePolicy) {
            this.reloadFailurePolicy = Objects.requireNonNull(reloadFailurePolicy, "reloadFailurePolicy is required");
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public ConfigManager build() {
            if (remoteProvider == null && configFile == null) {
                throw new IllegalArgumentException("either a config file or a remote provider is required");
            }
            if (meterRegistry == null) {
                meterRegistry = new SimpleMeterRegistry();
            }
            return new ConfigManager(this);
        }
    }
}
