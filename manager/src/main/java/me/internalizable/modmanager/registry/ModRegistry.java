package me.internalizable.modmanager.registry;

import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.registry.model.Project;
import me.internalizable.modmanager.registry.model.SearchHit;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionFile;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;

/**
 * Read access to a remote mod registry plus file downloads.
 */
public interface ModRegistry {

    /**
     * Fetch a project.
     *
     * @param slugOrUrl project slug, id, or project page URL
     * @return the project
     * @throws RegistryException if the project is unknown or the registry fails
     */
    @Nonnull
    Project getProject(@Nonnull String slugOrUrl) throws RegistryException;

    /**
     * Fetch the versions of a project, optionally pre-filtered by the registry.
     *
     * @param slug project slug or id
     * @param gameVersion game version filter, or null
     * @param loader loader filter, or null
     * @return versions as returned by the registry
     * @throws RegistryException if the registry fails
     */
    @Nonnull
    List<Version> getVersions(@Nonnull String slug, @Nullable String gameVersion, @Nullable ModLoader loader)
            throws RegistryException;

    /**
     * Fetch a single version by id.
     *
     * @param versionId version id
     * @return the version
     * @throws RegistryException if the version is unknown or the registry fails
     */
    @Nonnull
    Version getVersion(@Nonnull String versionId) throws RegistryException;

    /**
     * Search projects.
     *
     * @param query free text query
     * @param gameVersion game version facet, or null
     * @param limit maximum number of hits
     * @return matching projects
     * @throws RegistryException if the registry fails
     */
    @Nonnull
    List<SearchHit> searchProjects(@Nonnull String query, @Nullable String gameVersion, int limit)
            throws RegistryException;

    /**
     * Download a file.
     *
     * @param file file to download
     * @param destination target path
     * @return true if the file was written completely, false otherwise
     */
    boolean download(@Nonnull VersionFile file, @Nonnull Path destination);

    /**
     * Check whether the registry answers at all.
     *
     * @return true if reachable
     */
    boolean isReachable();
}
