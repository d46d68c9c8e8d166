package me.internalizable.modmanager.install;

/**
 * Result of updating a single installed mod.
 */
public enum UpdateOutcome {
    UPDATED,
    UP_TO_DATE,
    NO_COMPATIBLE_VERSION,
    NOT_INSTALLED,
    FAILED
}
