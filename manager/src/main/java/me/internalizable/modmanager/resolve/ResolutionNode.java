package me.internalizable.modmanager.resolve;

import me.internalizable.modmanager.registry.model.Project;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionFile;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One entry of a resolution plan: a project, its chosen version and the file to install.
 *
 * @param project the project
 * @param version selected version
 * @param file installable file, or null if the version ships none
 */
public record ResolutionNode(@Nonnull Project project, @Nonnull Version version, @Nullable VersionFile file) {

    public ResolutionNode {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(version, "version");
    }

    @Nonnull
    public String slug() {
        return project.slug();
    }
}
