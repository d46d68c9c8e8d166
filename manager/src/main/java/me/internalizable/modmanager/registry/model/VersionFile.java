package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A downloadable file attached to a version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionFile(
        @Nonnull String url,
        @Nonnull String filename,
        long size,
        boolean primary
) {

    public VersionFile {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(filename, "filename");
    }
}
