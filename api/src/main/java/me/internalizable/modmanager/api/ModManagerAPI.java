package me.internalizable.modmanager.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * API for managing the mods of a Minecraft server.
 *
 * <p>Installs mods from the registry together with their dependencies,
 * keeps them up to date on a schedule, and reports what is installed.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ModManagerAPI api = new ModManagerAPIImpl(manager);
 *
 * // Install a mod without auto-updates
 * api.install("lithium", InstallOptions.builder()
 *     .autoUpdate(false)
 *     .build())
 *     .thenAccept(outcome -> {
 *         System.out.println("Installed: " + outcome.getInstalled());
 *     });
 *
 * // Check for updates right away
 * api.runUpdateNow();
 * }</pre>
 */
public interface ModManagerAPI {

    // Mods

    /**
     * Install a mod and its dependencies.
     *
     * @param slug mod slug or registry URL
     * @param options install options
     * @return future completing with the outcome
     */
    @Nonnull
    CompletableFuture<InstallOutcome> install(@Nonnull String slug, @Nonnull InstallOptions options);

    /**
     * Install a mod with default options.
     *
     * @param slug mod slug or registry URL
     * @return future completing with the outcome
     */
    @Nonnull
    default CompletableFuture<InstallOutcome> install(@Nonnull String slug) {
        return install(slug, InstallOptions.defaults());
    }

    /**
     * Update an installed mod to its latest compatible version.
     *
     * @param slug mod slug
     * @return future completing with true if a newer version was installed
     */
    @Nonnull
    CompletableFuture<Boolean> update(@Nonnull String slug);

    /**
     * Remove an installed mod.
     *
     * @param slug mod slug
     * @return true if the mod was removed
     */
    boolean remove(@Nonnull String slug);

    /**
     * Enable or disable auto-updates for an installed mod.
     *
     * @param slug mod slug
     * @param enabled new value
     * @return false if the mod is not installed
     */
    boolean setAutoUpdate(@Nonnull String slug, boolean enabled);

    /**
     * Get all installed mods, ordered by slug.
     *
     * @return list of installed mods
     */
    @Nonnull
    List<ModInfo> listInstalled();

    /**
     * Search the registry for mods available for the server's game version.
     *
     * @param query search text
     * @param limit maximum number of results
     * @return future completing with the results
     */
    @Nonnull
    CompletableFuture<List<SearchResult>> search(@Nonnull String query, int limit);

    /**
     * Get a summary of the managed server.
     *
     * @return summary
     */
    @Nonnull
    ServerSummary getSummary();

    // Auto-updates

    /**
     * Schedule periodic auto-updates. Does nothing if disabled in the configuration.
     */
    void startAutoUpdates();

    /**
     * Cancel periodic auto-updates.
     */
    void stopAutoUpdates();

    /**
     * Start an update pass in the background.
     *
     * @return true if started, false if a pass is already running
     */
    boolean runUpdateNow();

    /**
     * Get the auto-updater state.
     *
     * @return status
     */
    @Nonnull
    AutoUpdateStatus getAutoUpdateStatus();

    /**
     * Get recent auto-update results, newest first.
     *
     * @param limit maximum number of entries
     * @return list of entries
     */
    @Nonnull
    List<UpdateLogRecord> getUpdateLogs(int limit);

    /**
     * Clear the auto-update log.
     */
    void clearUpdateLogs();

    /**
     * An installed mod.
     */
    interface ModInfo {
        @Nonnull
        String getSlug();

        @Nonnull
        String getName();

        /**
         * Get the installed version number.
         */
        @Nonnull
        String getVersion();

        @Nonnull
        String getFileName();

        @Nullable
        Instant getInstalledAt();

        boolean isAutoUpdate();

        /**
         * Get the slugs of the mods installed alongside this one.
         */
        @Nonnull
        List<String> getDependencies();

        @Nonnull
        List<String> getMinecraftVersions();

        @Nullable
        String getModLoader();

        @Nullable
        String getProjectId();

        @Nullable
        String getVersionId();

        long getFileSize();
    }

    /**
     * Result of an install request.
     */
    interface InstallOutcome {
        boolean isSuccess();

        /**
         * Get the failure category, or null on success.
         */
        @Nullable
        String getErrorKind();

        @Nullable
        String getMessage();

        @Nonnull
        List<String> getInstalled();

        @Nonnull
        List<String> getUpdated();

        @Nonnull
        List<String> getSkipped();
    }

    /**
     * A registry search result.
     */
    interface SearchResult {
        @Nonnull
        String getProjectId();

        @Nonnull
        String getSlug();

        @Nullable
        String getTitle();

        @Nullable
        String getDescription();

        long getDownloads();
    }

    /**
     * Summary of the managed server.
     */
    interface ServerSummary {
        @Nonnull
        String getMinecraftVersion();

        @Nonnull
        String getModLoader();

        @Nonnull
        String getServerPath();

        int getModCount();

        boolean isAutoUpdateEnabled();

        @Nullable
        Instant getLastUpdateCheck();
    }

    /**
     * Auto-updater state.
     */
    interface AutoUpdateStatus {
        boolean isEnabled();

        boolean isRunning();

        int getIntervalHours();

        @Nullable
        Instant getLastCheck();

        @Nullable
        Instant getNextCheck();

        boolean isUpdateInProgress();
    }

    /**
     * One auto-update result.
     */
    interface UpdateLogRecord {
        @Nonnull
        Instant getTimestamp();

        @Nonnull
        String getSlug();

        @Nullable
        String getOldVersion();

        @Nullable
        String getNewVersion();

        /**
         * Get the status: success, skipped or failed.
         */
        @Nonnull
        String getStatus();

        @Nonnull
        String getMessage();
    }

    /**
     * Options for installing a mod.
     */
    interface InstallOptions {
        /**
         * Reinstall mods that are already at the chosen version.
         */
        boolean isForceUpdate();

        /**
         * Enable auto-updates for the installed mods.
         */
        boolean isAutoUpdate();

        /**
         * Create default install options.
         */
        @Nonnull
        static InstallOptions defaults() {
            return builder().build();
        }

        /**
         * Create a builder for install options.
         */
        @Nonnull
        static Builder builder() {
            return new InstallOptionsBuilder();
        }

        /**
         * Builder for install options.
         */
        interface Builder {
            Builder forceUpdate(boolean forceUpdate);
            Builder autoUpdate(boolean autoUpdate);
            InstallOptions build();
        }
    }
}
