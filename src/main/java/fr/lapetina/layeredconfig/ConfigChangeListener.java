package fr.lapetina.layeredconfig;

import fr.lapetina.layeredconfig.domain.model.ReloadOutcome;

/**
 * Listener for configuration changes detected by a watch.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a change was detected and a reload was attempted.
     *
     * @param outcome whether the reload succeeded; on failure the manager
     *                still serves the last successfully loaded settings
     */
    void onConfigChanged(ReloadOutcome outcome);
}
