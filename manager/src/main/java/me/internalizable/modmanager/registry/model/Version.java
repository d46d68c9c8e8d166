package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A specific release of a project.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Version(
        @Nonnull String id,
        @JsonProperty("project_id") @Nullable String projectId,
        @Nullable String name,
        @JsonProperty("version_number") @Nonnull String versionNumber,
        @JsonProperty("game_versions") @Nonnull List<String> gameVersions,
        @Nonnull List<String> loaders,
        @JsonProperty("version_type") @Nonnull VersionType versionType,
        @JsonProperty("date_published") @Nullable Instant datePublished,
        @Nonnull List<Dependency> dependencies,
        @Nonnull List<VersionFile> files
) {

    public Version {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(versionNumber, "versionNumber");
        gameVersions = gameVersions == null ? List.of() : List.copyOf(gameVersions);
        loaders = loaders == null ? List.of() : List.copyOf(loaders);
        versionType = versionType == null ? VersionType.OTHER : versionType;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean supportsGameVersion(@Nonnull String gameVersion) {
        return gameVersions.contains(gameVersion);
    }

    public boolean supportsLoader(@Nonnull String loaderId) {
        return loaders.contains(loaderId);
    }
}
