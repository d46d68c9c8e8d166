package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A project published on the registry.
 *
 * @param id stable project id
 * @param slug url-friendly name, used as the ledger key
 * @param title display name
 * @param description short summary
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Project(
        @Nonnull String id,
        @Nonnull String slug,
        @Nullable String title,
        @Nullable String description
) {

    public Project {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(slug, "slug");
    }

    /**
     * Get the title, falling back to the slug.
     *
     * @return display name
     */
    @Nonnull
    public String displayName() {
        return title != null && !title.isBlank() ? title : slug;
    }
}
