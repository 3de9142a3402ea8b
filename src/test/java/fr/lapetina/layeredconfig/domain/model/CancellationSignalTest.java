package fr.lapetina.layeredconfig.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationSignalTest {

    @Test
    @DisplayName("should fire only once")
    void shouldFireOnce() {
        CancellationSignal signal = CancellationSignal.create();

        assertThat(signal.isCancelled()).isFalse();
        assertThat(signal.cancel()).isTrue();
        assertThat(signal.cancel()).isFalse();
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should run callbacks on cancel, or immediately when already cancelled")
    void shouldRunCallbacks() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);
        assertThat(calls.get()).isZero();

        signal.cancel();
        assertThat(calls.get()).isEqualTo(1);

        signal.onCancel(calls::incrementAndGet);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("should fire combined signal when either source fires")
    void shouldCombineSignals() {
        CancellationSignal first = CancellationSignal.create();
        CancellationSignal second = CancellationSignal.create();
        CancellationSignal combined = CancellationSignal.anyOf(first, second);

        assertThat(combined.isCancelled()).isFalse();

        second.cancel();

        assertThat(combined.isCancelled()).isTrue();
        assertThat(first.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("should fire by itself after the timeout")
    void shouldFireAfterTimeout() throws InterruptedException {
        CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofMillis(50));

        assertThat(signal.isCancelled()).isFalse();

        long deadline = System.currentTimeMillis() + 2000;
        while (!signal.isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(signal.isCancelled()).isTrue();
    }
}
