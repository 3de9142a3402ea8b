package fr.lapetina.layeredconfig.infrastructure.watch;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.CancellationSignal;

/**
 * Subscribes to changes of a configuration source.
 */
public interface ConfigWatcher {

    /**
     * Starts watching in the background and returns immediately.
     *
     * The subscription ends when the given signal fires or when the owning
     * manager is closed, whichever comes first.
     *
     * @param signal   caller-owned cancellation signal
     * @param onChange invoked from the watch thread after each detected change
     * @throws ConfigException with {@code WATCH_SETUP_FAILED} if the subscription cannot be set up
     */
    void watch(CancellationSignal signal, Runnable onChange);
}
