package me.internalizable.modmanager.install;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of an install request.
 *
 * <p>The slug lists hold what was done before the request finished, so a
 * failed result still reports the mods installed ahead of the failure.</p>
 *
 * @param success whether every step of the plan completed
 * @param errorKind failure category, null on success
 * @param message failure description, null on success
 * @param installed slugs newly installed
 * @param updated slugs whose previous file was replaced
 * @param skipped slugs already installed at the chosen version
 */
public record InstallResult(
        boolean success,
        @Nullable ErrorKind errorKind,
        @Nullable String message,
        @Nonnull List<String> installed,
        @Nonnull List<String> updated,
        @Nonnull List<String> skipped
) {

    public InstallResult {
        installed = List.copyOf(installed);
        updated = List.copyOf(updated);
        skipped = List.copyOf(skipped);
    }

    @Nonnull
    public static InstallResult success(
            @Nonnull List<String> installed,
            @Nonnull List<String> updated,
            @Nonnull List<String> skipped) {
        return new InstallResult(true, null, null, installed, updated, skipped);
    }

    @Nonnull
    public static InstallResult failure(
            @Nonnull ErrorKind errorKind,
            @Nonnull String message,
            @Nonnull List<String> installed,
            @Nonnull List<String> updated,
            @Nonnull List<String> skipped) {
        return new InstallResult(false, Objects.requireNonNull(errorKind, "errorKind"),
                Objects.requireNonNull(message, "message"), installed, updated, skipped);
    }

    @Nonnull
    public static InstallResult failure(@Nonnull ErrorKind errorKind, @Nonnull String message) {
        return failure(errorKind, message, List.of(), List.of(), List.of());
    }
}
