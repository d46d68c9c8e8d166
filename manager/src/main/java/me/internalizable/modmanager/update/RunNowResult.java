package me.internalizable.modmanager.update;

/**
 * Answer to a manual reconciliation request.
 */
public enum RunNowResult {
    /** A pass was started in the background. */
    STARTED,
    /** A pass is already running; nothing was started. */
    BUSY
}
