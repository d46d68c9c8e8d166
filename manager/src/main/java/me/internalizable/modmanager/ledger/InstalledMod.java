package me.internalizable.modmanager.ledger;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import me.internalizable.modmanager.environment.ModLoader;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A mod recorded in the ledger.
 *
 * <p>Instances handed out by {@link StateLedger} are copies; changing them
 * has no effect until they are passed back through {@link StateLedger#add}
 * or {@link StateLedger#update}.</p>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
        "slug", "name", "version", "file_name", "installed_at", "auto_update", "dependencies",
        "minecraft_versions", "mod_loader", "project_id", "version_id", "file_size"
})
public class InstalledMod {

    private String slug;
    private String name;
    private String version;
    private String fileName;
    private Instant installedAt;
    private boolean autoUpdate = true;
    private List<String> dependencies = new ArrayList<>();
    private List<String> minecraftVersions = new ArrayList<>();
    private ModLoader modLoader;
    private String projectId;
    private String versionId;
    private long fileSize;

    /**
     * Create a deep copy of this entry.
     */
    @Nonnull
    public InstalledMod copy() {
        InstalledMod copy = new InstalledMod();
        copy.slug = slug;
        copy.name = name;
        copy.version = version;
        copy.fileName = fileName;
        copy.installedAt = installedAt;
        copy.autoUpdate = autoUpdate;
        copy.dependencies = new ArrayList<>(dependencies);
        copy.minecraftVersions = new ArrayList<>(minecraftVersions);
        copy.modLoader = modLoader;
        copy.projectId = projectId;
        copy.versionId = versionId;
        copy.fileSize = fileSize;
        return copy;
    }

    // Getters and Setters

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Installed version number as published by the registry.
     */
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public Instant getInstalledAt() {
        return installedAt;
    }

    public void setInstalledAt(Instant installedAt) {
        this.installedAt = installedAt;
    }

    public boolean isAutoUpdate() {
        return autoUpdate;
    }

    public void setAutoUpdate(boolean autoUpdate) {
        this.autoUpdate = autoUpdate;
    }

    /**
     * Slugs of the other mods installed in the same request.
     */
    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
    }

    public List<String> getMinecraftVersions() {
        return minecraftVersions;
    }

    public void setMinecraftVersions(List<String> minecraftVersions) {
        this.minecraftVersions = minecraftVersions != null ? new ArrayList<>(minecraftVersions) : new ArrayList<>();
    }

    public ModLoader getModLoader() {
        return modLoader;
    }

    public void setModLoader(ModLoader modLoader) {
        this.modLoader = modLoader;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getVersionId() {
        return versionId;
    }

    public void setVersionId(String versionId) {
        this.versionId = versionId;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InstalledMod)) {
            return false;
        }
        InstalledMod that = (InstalledMod) o;
        return autoUpdate == that.autoUpdate
                && fileSize == that.fileSize
                && Objects.equals(slug, that.slug)
                && Objects.equals(name, that.name)
                && Objects.equals(version, that.version)
                && Objects.equals(fileName, that.fileName)
                && Objects.equals(installedAt, that.installedAt)
                && Objects.equals(dependencies, that.dependencies)
                && Objects.equals(minecraftVersions, that.minecraftVersions)
                && modLoader == that.modLoader
                && Objects.equals(projectId, that.projectId)
                && Objects.equals(versionId, that.versionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, name, version, fileName, installedAt, autoUpdate, dependencies,
                minecraftVersions, modLoader, projectId, versionId, fileSize);
    }

    @Override
    public String toString() {
        return slug + " " + version + " (" + fileName + ")";
    }
}
