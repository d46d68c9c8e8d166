package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * One result of a registry search.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchHit(
        @JsonProperty("project_id") @Nonnull String projectId,
        @Nonnull String slug,
        @Nullable String title,
        @Nullable String description,
        long downloads,
        @Nonnull List<String> versions
) {

    public SearchHit {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }
}
