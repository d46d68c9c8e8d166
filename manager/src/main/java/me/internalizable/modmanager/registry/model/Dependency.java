package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A dependency declared by a version. Either id may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Dependency(
        @JsonProperty("project_id") @Nullable String projectId,
        @JsonProperty("version_id") @Nullable String versionId,
        @JsonProperty("dependency_type") @Nonnull DependencyType type
) {

    public Dependency {
        if (type == null) {
            type = DependencyType.UNKNOWN;
        }
    }
}
