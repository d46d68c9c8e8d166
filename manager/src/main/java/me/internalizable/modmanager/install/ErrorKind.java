package me.internalizable.modmanager.install;

/**
 * Why an install request failed.
 */
public enum ErrorKind {
    /** The registry could not be queried for the requested project. */
    REGISTRY_ERROR,
    /** No version of the requested project matches the server. */
    NO_COMPATIBLE_VERSION,
    /** A file could not be downloaded or placed into the mods directory. */
    DOWNLOAD_FAILURE,
    /** The ledger could not be written. */
    LEDGER_ERROR,
    /** The mod manager has not been initialized. */
    NOT_INITIALIZED
}
