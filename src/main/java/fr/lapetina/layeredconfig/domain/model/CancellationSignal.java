package fr.lapetina.layeredconfig.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation token for background watch loops.
 *
 * Loops poll {@link #isCancelled()} once per tick or event; nothing is ever
 * interrupted. A signal fires at most once and stays fired.
 *
 * Thread-safe.
 */
public final class CancellationSignal {

    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    private CancellationSignal() {
    }

    /**
     * Creates a signal that only fires on {@link #cancel()}.
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Creates a signal that fires by itself once the timeout has elapsed.
     */
    public static CancellationSignal withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout is required");
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .execute(signal::cancel);
        return signal;
    }

    /**
     * Creates a signal that fires as soon as any of the given signals fires.
     */
    public static CancellationSignal anyOf(CancellationSignal first, CancellationSignal second) {
        CancellationSignal combined = new CancellationSignal();
        first.onCancel(combined::cancel);
        second.onCancel(combined::cancel);
        return combined;
    }

    /**
     * Fires the signal. Subsequent calls are no-ops.
     *
     * @return true if this call fired the signal
     */
    public boolean cancel() {
        return fired.complete(null);
    }

    public boolean isCancelled() {
        return fired.isDone();
    }

    /**
     * Registers an action to run when the signal fires.
     * Runs immediately on the calling thread if the signal already fired.
     */
    public void onCancel(Runnable action) {
        fired.thenRun(action);
    }
}
