package fr.lapetina.layeredconfig.infrastructure.watch;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.CancellationSignal;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalConfigWatcherTest {

    @TempDir
    Path tempDir;

    private Path file;
    private CancellationSignal done;
    private LocalConfigWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        file = Files.writeString(tempDir.resolve("config.yaml"), "a: 1\n");
        done = CancellationSignal.create();
        watcher = new LocalConfigWatcher(file, done, Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        done.cancel();
    }

    @Test
    @DisplayName("should notify when the watched file changes")
    void shouldNotifyOnChange() throws Exception {
        CountDownLatch changed = new CountDownLatch(1);
        watcher.watch(CancellationSignal.create(), changed::countDown);

        Files.writeString(file, "a: 2\n");

        assertThat(changed.await(10, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should ignore changes to other files in the directory")
    void shouldIgnoreOtherFiles() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(CancellationSignal.create(), calls::incrementAndGet);

        Files.writeString(tempDir.resolve("other.yaml"), "b: 1\n");
        Thread.sleep(500);

        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("should stop notifying once the caller signal fires")
    void shouldStopOnCallerSignal() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CancellationSignal signal = CancellationSignal.create();
        watcher.watch(signal, calls::incrementAndGet);

        signal.cancel();
        Thread.sleep(300);
        Files.writeString(file, "a: 3\n");
        Thread.sleep(500);

        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("should stop notifying once the manager is done")
    void shouldStopOnDone() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        watcher.watch(CancellationSignal.create(), calls::incrementAndGet);

        done.cancel();
        Thread.sleep(300);
        Files.writeString(file, "a: 4\n");
        Thread.sleep(500);

        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("should fail with WATCH_SETUP_FAILED on null signal or missing directory")
    void shouldFailSetup() {
        assertThatThrownBy(() -> watcher.watch(null, () -> { }))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.WATCH_SETUP_FAILED));

        LocalConfigWatcher orphan = new LocalConfigWatcher(tempDir.resolve("nope/config.yaml"), done);
        assertThatThrownBy(() -> orphan.watch(CancellationSignal.create(), () -> { }))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getType()).isEqualTo(ConfigErrorType.WATCH_SETUP_FAILED));
    }
}
