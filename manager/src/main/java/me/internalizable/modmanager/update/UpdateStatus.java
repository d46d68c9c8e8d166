package me.internalizable.modmanager.update;

import javax.annotation.Nonnull;

/**
 * Result of one mod in a reconciliation pass.
 */
public enum UpdateStatus {
    SUCCESS("success"),
    SKIPPED("skipped"),
    FAILED("failed");

    private final String id;

    UpdateStatus(String id) {
        this.id = id;
    }

    @Nonnull
    public String getId() {
        return id;
    }
}
