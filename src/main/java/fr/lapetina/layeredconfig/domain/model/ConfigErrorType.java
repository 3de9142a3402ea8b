package fr.lapetina.layeredconfig.domain.model;

/**
 * Error taxonomy for configuration loading and watching.
 * Callers can pick a retry policy per kind.
 */
public enum ConfigErrorType {
    /** No configuration file at the configured path and no defaults to fall back on */
    SOURCE_NOT_FOUND,

    /** The source exists but could not be read (I/O failure, permissions) */
    SOURCE_UNREADABLE,

    /** The source content is malformed or its format is not supported */
    SOURCE_UNPARSABLE,

    /** The merged settings could not be decoded into the schema's field types */
    DECODE_FAILED,

    /** The decoded schema violated a declared constraint */
    VALIDATION_FAILED,

    /** The remote fetch exceeded its internal deadline */
    TIMED_OUT,

    /** The remote source could not be reached or answered with an error */
    REMOTE_FETCH_FAILED,

    /** The remote descriptor names a backend no fetcher exists for */
    REMOTE_PROVIDER_UNSUPPORTED,

    /** The operation was attempted after the manager was closed */
    MANAGER_CLOSED,

    /** The watch subscription could not be set up */
    WATCH_SETUP_FAILED
}
