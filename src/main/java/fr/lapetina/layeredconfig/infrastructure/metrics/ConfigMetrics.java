package fr.lapetina.layeredconfig.infrastructure.metrics;

import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for one config manager.
 *
 * Provides:
 * - Load counters by outcome (success or error type)
 * - Load latency timer
 * - Watch-triggered reload counters by outcome
 * - Change notification and remote poll failure counters
 */
public final class ConfigMetrics {

    private static final Logger log = LoggerFactory.getLogger(ConfigMetrics.class);

    public static final String DEFAULT_PREFIX = "layeredconfig";

    private static final String SUCCESS = "success";

    private final MeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> loadCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> reloadCounters = new ConcurrentHashMap<>();
    private final Timer loadLatency;
    private final Counter notifications;
    private final Counter pollFailures;

    public ConfigMetrics(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;

        this.loadLatency = Timer.builder(prefix + "_load_latency")
                .description("Time spent loading configuration, source read included")
                .register(registry);
        this.notifications = Counter.builder(prefix + "_watch_notifications_total")
                .description("Change notifications delivered to watch listeners")
                .register(registry);
        this.pollFailures = Counter.builder(prefix + "_remote_poll_failures_total")
                .description("Failed remote watch polls")
                .register(registry);

        log.debug("ConfigMetrics initialized with prefix: {}", prefix);
    }

    public ConfigMetrics() {
        this(new SimpleMeterRegistry(), DEFAULT_PREFIX);
    }

    public void recordLoadSuccess(Duration latency) {
        loadLatency.record(latency);
        loadCounter(SUCCESS).increment();
    }

    public void recordLoadFailure(ConfigErrorType type, Duration latency) {
        loadLatency.record(latency);
        loadCounter(type.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordReload(boolean success) {
        String outcome = success ? SUCCESS : "failure";
        reloadCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_reloads_total")
                        .description("Reloads triggered by a watched change")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordNotification() {
        notifications.increment();
    }

    public void recordPollFailure() {
        pollFailures.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private Counter loadCounter(String outcome) {
        return loadCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_loads_total")
                        .description("Configuration loads")
                        .tag("outcome", outcome)
                        .register(registry)
        );
    }
}
