package fr.lapetina.layeredconfig.infrastructure.watch;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.CancellationSignal;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import fr.lapetina.layeredconfig.infrastructure.metrics.ConfigMetrics;
import fr.lapetina.layeredconfig.infrastructure.provider.RemoteConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the remote backend at a fixed delay.
 *
 * Every successful fetch is reported as a change; the backend has no
 * revision to compare against. A failed poll is logged and counted, and
 * polling continues with the next tick.
 */
public final class RemoteConfigWatcher implements ConfigWatcher {

    private static final Logger log = LoggerFactory.getLogger(RemoteConfigWatcher.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final RemoteConfigProvider provider;
    private final CancellationSignal done;
    private final Duration pollInterval;
    private final ConfigMetrics metrics;

    public RemoteConfigWatcher(RemoteConfigProvider provider, CancellationSignal done,
                               Duration pollInterval, ConfigMetrics metrics) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.provider = provider;
        this.done = done;
        this.pollInterval = pollInterval;
        this.metrics = metrics;
    }

    @Override
    public void watch(CancellationSignal signal, Runnable onChange) {
        if (signal == null) {
            throw new ConfigException(ConfigErrorType.WATCH_SETUP_FAILED, "cancellation signal is required");
        }

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "remote-config-poller-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        CancellationSignal stop = CancellationSignal.anyOf(signal, done);
        scheduler.scheduleWithFixedDelay(
                () -> poll(stop, scheduler, onChange),
                pollInterval.toMillis(),
                pollInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        stop.onCancel(scheduler::shutdown);

        log.info("Remote configuration polling started: source={}, interval={}",
                provider.describe(), pollInterval);
    }

    private void poll(CancellationSignal stop, ScheduledExecutorService scheduler, Runnable onChange) {
        if (stop.isCancelled()) {
            scheduler.shutdown();
            return;
        }
        try {
            provider.fetch();
        } catch (ConfigException e) {
            metrics.recordPollFailure();
            log.warn("Remote configuration poll failed, will retry: source={}, type={}, reason={}",
                    provider.describe(), e.getType(), e.getMessage());
            return;
        }
        if (stop.isCancelled()) {
            return;
        }
        try {
            onChange.run();
        } catch (RuntimeException e) {
            log.error("Error in remote configuration change callback: source={}", provider.describe(), e);
        }
    }
}
