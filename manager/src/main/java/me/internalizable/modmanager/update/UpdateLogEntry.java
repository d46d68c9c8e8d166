package me.internalizable.modmanager.update;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * Audit record of one mod checked by the auto-updater.
 *
 * @param timestamp when the check finished
 * @param slug the mod slug
 * @param oldVersion version before the check
 * @param newVersion version after the check
 * @param status outcome
 * @param message human-readable detail
 */
public record UpdateLogEntry(
        @Nonnull Instant timestamp,
        @Nonnull String slug,
        @Nullable String oldVersion,
        @Nullable String newVersion,
        @Nonnull UpdateStatus status,
        @Nonnull String message
) {

    public UpdateLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }
}
