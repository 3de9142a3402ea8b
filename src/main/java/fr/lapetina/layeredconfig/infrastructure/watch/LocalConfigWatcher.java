package fr.lapetina.layeredconfig.infrastructure.watch;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.CancellationSignal;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Watches the configuration file through the platform {@link WatchService}.
 *
 * The parent directory is watched rather than the file itself, so editors
 * that replace the file by renaming a temporary one are still detected.
 * Each call to {@link #watch} owns one watch service and one daemon thread.
 */
public final class LocalConfigWatcher implements ConfigWatcher {

    private static final Logger log = LoggerFactory.getLogger(LocalConfigWatcher.class);

    public static final Duration DEFAULT_POLL_SLICE = Duration.ofMillis(200);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Path path;
    private final CancellationSignal done;
    private final Duration pollSlice;

    public LocalConfigWatcher(Path path, CancellationSignal done, Duration pollSlice) {
        this.path = path.toAbsolutePath().normalize();
        this.done = done;
        this.pollSlice = pollSlice;
    }

    public LocalConfigWatcher(Path path, CancellationSignal done) {
        this(path, done, DEFAULT_POLL_SLICE);
    }

    @Override
    public void watch(CancellationSignal signal, Runnable onChange) {
        if (signal == null) {
            throw new ConfigException(ConfigErrorType.WATCH_SETUP_FAILED, "cancellation signal is required");
        }
        Path directory = path.getParent() != null ? path.getParent() : Path.of(".");

        WatchService watchService;
        try {
            watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new ConfigException(ConfigErrorType.WATCH_SETUP_FAILED,
                    "unable to create watch service for " + path, e);
        }
        try {
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException | RuntimeException e) {
            closeQuietly(watchService);
            throw new ConfigException(ConfigErrorType.WATCH_SETUP_FAILED,
                    "unable to watch directory " + directory, e);
        }

        CancellationSignal stop = CancellationSignal.anyOf(signal, done);
        Thread thread = new Thread(() -> runLoop(watchService, stop, onChange),
                "config-watcher-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        thread.start();

        log.info("Configuration file watch started: path={}", path);
    }

    private void runLoop(WatchService watchService, CancellationSignal stop, Runnable onChange) {
        Path fileName = path.getFileName();
        try {
            while (!stop.isCancelled()) {
                WatchKey key = watchService.poll(pollSlice.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }

                boolean touched = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        touched = true;
                        continue;
                    }
                    if (fileName.equals(event.context())) {
                        touched = true;
                    }
                }
                key.reset();

                if (touched && !stop.isCancelled()) {
                    log.debug("Configuration file changed: path={}", path);
                    notifyChange(onChange);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Configuration file watch interrupted: path={}", path);
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed: path={}", path);
        } finally {
            closeQuietly(watchService);
            log.info("Configuration file watch stopped: path={}", path);
        }
    }

    private void notifyChange(Runnable onChange) {
        try {
            onChange.run();
        } catch (RuntimeException e) {
            log.error("Error in configuration change callback: path={}", path, e);
        }
    }

    private void closeQuietly(WatchService watchService) {
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service: path={}", path, e);
        }
    }
}
