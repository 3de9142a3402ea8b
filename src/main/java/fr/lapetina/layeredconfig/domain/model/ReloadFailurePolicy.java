package fr.lapetina.layeredconfig.domain.model;

/**
 * What a watch subscription does when the reload triggered by a change fails.
 * The failure itself is always logged and never stops the subscription.
 */
public enum ReloadFailurePolicy {
    /** Notify the listener anyway; it keeps reading the last-known-good data. */
    NOTIFY_ANYWAY,

    /** Swallow the change; the listener is only called after successful reloads. */
    SKIP_NOTIFICATION
}
