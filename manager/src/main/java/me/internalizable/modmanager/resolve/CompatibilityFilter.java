package me.internalizable.modmanager.resolve;

import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionType;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Selects and orders the versions usable in a target environment.
 *
 * <p>The head of the returned list is the best available version: the most
 * stable tier first, newest publish date within a tier. Ties keep input
 * order.</p>
 */
public final class CompatibilityFilter {

    private static final Comparator<Version> PREFERENCE = Comparator
            .comparingInt((Version v) -> v.versionType().rank())
            .thenComparing(Version::datePublished, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()).reversed());

    private CompatibilityFilter() {
    }

    /**
     * Filter and order versions.
     *
     * @param versions candidate versions
     * @param gameVersion required game version
     * @param loader required loader
     * @param preferStable narrow to release versions when any is compatible
     * @return compatible versions, best first; empty if none
     */
    @Nonnull
    public static List<Version> filter(
            @Nonnull List<Version> versions,
            @Nonnull String gameVersion,
            @Nonnull ModLoader loader,
            boolean preferStable) {
        Objects.requireNonNull(versions, "versions");
        Objects.requireNonNull(gameVersion, "gameVersion");
        Objects.requireNonNull(loader, "loader");

        List<Version> compatible = versions.stream()
                .filter(v -> v.supportsGameVersion(gameVersion))
                .filter(v -> v.supportsLoader(loader.getId()))
                .collect(Collectors.toCollection(ArrayList::new));

        if (compatible.isEmpty()) {
            return List.of();
        }

        if (preferStable && compatible.stream().anyMatch(v -> v.versionType() == VersionType.RELEASE)) {
            compatible.removeIf(v -> v.versionType() != VersionType.RELEASE);
        }

        compatible.sort(PREFERENCE);
        return compatible;
    }
}
