package me.internalizable.modmanager.update;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Snapshot of the auto-updater state.
 *
 * @param enabled whether auto-update is enabled in the configuration
 * @param running whether the periodic job is scheduled
 * @param intervalHours hours between passes
 * @param lastCheck start of the most recent pass
 * @param nextCheck when the next scheduled pass starts
 * @param inProgress whether a pass is running right now
 */
public record UpdaterStatus(
        boolean enabled,
        boolean running,
        int intervalHours,
        @Nullable Instant lastCheck,
        @Nullable Instant nextCheck,
        boolean inProgress
) {
}
