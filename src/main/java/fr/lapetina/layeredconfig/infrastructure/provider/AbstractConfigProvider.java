package fr.lapetina.layeredconfig.infrastructure.provider;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.infrastructure.store.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Reload algorithm shared by every provider.
 *
 * The source is read and decoded before the write lock is taken, so slow
 * I/O never blocks readers. Reset, merge and schema binding then run as one
 * exclusive section: a reader sees either the previous settings or the new
 * ones, never a store that was reset but not yet re-populated. Any failure
 * inside that section restores the previous content before rethrowing.
 */
public abstract class AbstractConfigProvider implements ConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractConfigProvider.class);

    protected final ProviderContext context;

    protected AbstractConfigProvider(ProviderContext context) {
        this.context = context;
    }

    /**
     * Reads and decodes the source.
     *
     * @return the decoded tree, or empty when the load should proceed on defaults alone
     * @throws ConfigException if the source cannot be read or decoded
     */
    protected abstract Optional<Map<String, Object>> readSource();

    @Override
    public final void load() {
        long start = System.nanoTime();
        try {
            Optional<Map<String, Object>> source = readSource();
            int keyCount = apply(source);
            context.metrics().recordLoadSuccess(elapsedSince(start));
            log.info("Configuration loaded: source={}, keys={}, fromDefaultsOnly={}",
                    describe(), keyCount, source.isEmpty());
        } catch (ConfigException e) {
            context.metrics().recordLoadFailure(e.getType(), elapsedSince(start));
            log.warn("Configuration load failed: source={}, type={}, reason={}",
                    describe(), e.getType(), e.getMessage());
            throw e;
        }
    }

    private int apply(Optional<Map<String, Object>> source) {
        SettingsStore store = context.store();
        Lock writeLock = context.lock().writeLock();
        writeLock.lock();
        try {
            SettingsStore.Snapshot previous = store.snapshot();
            try {
                store.reset();
                context.defaults().forEach((key, value) -> {
                    store.setDefault(key, value);
                    log.debug("Setting default value: key={}, value={}", key, value);
                });
                if (context.envPrefix() != null) {
                    store.enableEnvironmentOverlay(context.envPrefix());
                } else {
                    store.disableEnvironmentOverlay();
                }
                source.ifPresent(store::merge);
                if (context.schema() != null) {
                    context.binder().bind(store, context.schema());
                }
                return store.allKeys().size();
            } catch (RuntimeException e) {
                store.restore(previous);
                throw e;
            }
        } finally {
            writeLock.unlock();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
