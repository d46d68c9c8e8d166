package me.internalizable.modmanager.impl;

import me.internalizable.modmanager.ModManager;
import me.internalizable.modmanager.api.ModManagerAPI;
import me.internalizable.modmanager.install.ErrorKind;
import me.internalizable.modmanager.install.InstallResult;
import me.internalizable.modmanager.ledger.InstalledMod;
import me.internalizable.modmanager.registry.RegistryException;
import me.internalizable.modmanager.registry.model.SearchHit;
import me.internalizable.modmanager.update.RunNowResult;
import me.internalizable.modmanager.update.UpdateLogEntry;
import me.internalizable.modmanager.update.UpdaterStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Implementation of the ModManagerAPI backed by a {@link ModManager}.
 *
 * <p>Installs, updates and searches run on a background executor.</p>
 */
public class ModManagerAPIImpl implements ModManagerAPI {

    private final ModManager modManager;
    private final Executor executor;

    /**
     * Create the API on the manager's own async executor, which stops when
     * the manager shuts down.
     *
     * @param modManager the backing manager
     */
    public ModManagerAPIImpl(@Nonnull ModManager modManager) {
        this(modManager, modManager.getAsyncExecutor());
    }

    public ModManagerAPIImpl(@Nonnull ModManager modManager, @Nonnull Executor executor) {
        this.modManager = Objects.requireNonNull(modManager, "modManager");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    @Nonnull
    public CompletableFuture<InstallOutcome> install(@Nonnull String slug, @Nonnull InstallOptions options) {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(options, "options");

        if (!modManager.isInitialized()) {
            return CompletableFuture.completedFuture(toInstallOutcome(
                    InstallResult.failure(ErrorKind.NOT_INITIALIZED, "Mod manager not initialized")));
        }

        return CompletableFuture.supplyAsync(
                () -> modManager.install(slug, options.isForceUpdate(), options.isAutoUpdate()), executor)
                .thenApply(this::toInstallOutcome);
    }

    @Override
    @Nonnull
    public CompletableFuture<Boolean> update(@Nonnull String slug) {
        Objects.requireNonNull(slug, "slug");
        return CompletableFuture.supplyAsync(() -> modManager.update(slug), executor);
    }

    @Override
    public boolean remove(@Nonnull String slug) {
        Objects.requireNonNull(slug, "slug");
        return modManager.remove(slug);
    }

    @Override
    public boolean setAutoUpdate(@Nonnull String slug, boolean enabled) {
        Objects.requireNonNull(slug, "slug");
        return modManager.setAutoUpdate(slug, enabled);
    }

    @Override
    @Nonnull
    public List<ModInfo> listInstalled() {
        return modManager.listInstalled().stream()
                .map(this::toModInfo)
                .collect(Collectors.toList());
    }

    @Override
    @Nonnull
    public CompletableFuture<List<SearchResult>> search(@Nonnull String query, int limit) {
        Objects.requireNonNull(query, "query");
        return CompletableFuture.supplyAsync(() -> {
            try {
                return modManager.search(query, limit).stream()
                        .map(this::toSearchResult)
                        .collect(Collectors.toList());
            } catch (RegistryException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @Override
    @Nonnull
    public ServerSummary getSummary() {
        ModManager.Summary summary = modManager.getSummary();
        return new ServerSummaryImpl(
                summary.gameVersion(),
                summary.loader().getId(),
                summary.serverPath().toString(),
                summary.modCount(),
                summary.autoUpdateEnabled(),
                summary.lastUpdateCheck()
        );
    }

    @Override
    public void startAutoUpdates() {
        modManager.getAutoUpdater().start();
    }

    @Override
    public void stopAutoUpdates() {
        modManager.getAutoUpdater().stop();
    }

    @Override
    public boolean runUpdateNow() {
        return modManager.getAutoUpdater().runNow() == RunNowResult.STARTED;
    }

    @Override
    @Nonnull
    public AutoUpdateStatus getAutoUpdateStatus() {
        UpdaterStatus status = modManager.getAutoUpdater().status();
        return new AutoUpdateStatusImpl(
                status.enabled(),
                status.running(),
                status.intervalHours(),
                status.lastCheck(),
                status.nextCheck(),
                status.inProgress()
        );
    }

    @Override
    @Nonnull
    public List<UpdateLogRecord> getUpdateLogs(int limit) {
        return modManager.getAutoUpdater().getLogs(limit).stream()
                .map(this::toUpdateLogRecord)
                .collect(Collectors.toList());
    }

    @Override
    public void clearUpdateLogs() {
        modManager.getAutoUpdater().clearLogs();
    }

    private InstallOutcome toInstallOutcome(InstallResult result) {
        return new InstallOutcomeImpl(
                result.success(),
                result.errorKind() != null ? result.errorKind().name() : null,
                result.message(),
                result.installed(),
                result.updated(),
                result.skipped()
        );
    }

    private ModInfo toModInfo(InstalledMod mod) {
        return new ModInfoImpl(
                mod.getSlug(),
                mod.getName() != null ? mod.getName() : mod.getSlug(),
                mod.getVersion() != null ? mod.getVersion() : "",
                mod.getFileName() != null ? mod.getFileName() : "",
                mod.getInstalledAt(),
                mod.isAutoUpdate(),
                List.copyOf(mod.getDependencies()),
                List.copyOf(mod.getMinecraftVersions()),
                mod.getModLoader() != null ? mod.getModLoader().getId() : null,
                mod.getProjectId(),
                mod.getVersionId(),
                mod.getFileSize()
        );
    }

    private SearchResult toSearchResult(SearchHit hit) {
        return new SearchResultImpl(hit.projectId(), hit.slug(), hit.title(), hit.description(), hit.downloads());
    }

    private UpdateLogRecord toUpdateLogRecord(UpdateLogEntry entry) {
        return new UpdateLogRecordImpl(
                entry.timestamp(),
                entry.slug(),
                entry.oldVersion(),
                entry.newVersion(),
                entry.status().getId(),
                entry.message()
        );
    }

    private record ModInfoImpl(
            String slug,
            String name,
            String version,
            String fileName,
            Instant installedAt,
            boolean autoUpdate,
            List<String> dependencies,
            List<String> minecraftVersions,
            String modLoader,
            String projectId,
            String versionId,
            long fileSize
    ) implements ModInfo {

        @Override
        @Nonnull
        public String getSlug() {
            return slug;
        }

        @Override
        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        @Nonnull
        public String getVersion() {
            return version;
        }

        @Override
        @Nonnull
        public String getFileName() {
            return fileName;
        }

        @Override
        @Nullable
        public Instant getInstalledAt() {
            return installedAt;
        }

        @Override
        public boolean isAutoUpdate() {
            return autoUpdate;
        }

        @Override
        @Nonnull
        public List<String> getDependencies() {
            return dependencies;
        }

        @Override
        @Nonnull
        public List<String> getMinecraftVersions() {
            return minecraftVersions;
        }

        @Override
        @Nullable
        public String getModLoader() {
            return modLoader;
        }

        @Override
        @Nullable
        public String getProjectId() {
            return projectId;
        }

        @Override
        @Nullable
        public String getVersionId() {
            return versionId;
        }

        @Override
        public long getFileSize() {
            return fileSize;
        }
    }

    private record InstallOutcomeImpl(
            boolean success,
            String errorKind,
            String message,
            List<String> installed,
            List<String> updated,
            List<String> skipped
    ) implements InstallOutcome {

        @Override
        public boolean isSuccess() {
            return success;
        }

        @Override
        @Nullable
        public String getErrorKind() {
            return errorKind;
        }

        @Override
        @Nullable
        public String getMessage() {
            return message;
        }

        @Override
        @Nonnull
        public List<String> getInstalled() {
            return installed;
        }

        @Override
        @Nonnull
        public List<String> getUpdated() {
            return updated;
        }

        @Override
        @Nonnull
        public List<String> getSkipped() {
            return skipped;
        }
    }

    private record SearchResultImpl(
            String projectId,
            String slug,
            String title,
            String description,
            long downloads
    ) implements SearchResult {

        @Override
        @Nonnull
        public String getProjectId() {
            return projectId;
        }

        @Override
        @Nonnull
        public String getSlug() {
            return slug;
        }

        @Override
        @Nullable
        public String getTitle() {
            return title;
        }

        @Override
        @Nullable
        public String getDescription() {
            return description;
        }

        @Override
        public long getDownloads() {
            return downloads;
        }
    }

    private record ServerSummaryImpl(
            String minecraftVersion,
            String modLoader,
            String serverPath,
            int modCount,
            boolean autoUpdateEnabled,
            Instant lastUpdateCheck
    ) implements ServerSummary {

        @Override
        @Nonnull
        public String getMinecraftVersion() {
            return minecraftVersion;
        }

        @Override
        @Nonnull
        public String getModLoader() {
            return modLoader;
        }

        @Override
        @Nonnull
        public String getServerPath() {
            return serverPath;
        }

        @Override
        public int getModCount() {
            return modCount;
        }

        @Override
        public boolean isAutoUpdateEnabled() {
            return autoUpdateEnabled;
        }

        @Override
        @Nullable
        public Instant getLastUpdateCheck() {
            return lastUpdateCheck;
        }
    }

    private record AutoUpdateStatusImpl(
            boolean enabled,
            boolean running,
            int intervalHours,
            Instant lastCheck,
            Instant nextCheck,
            boolean updateInProgress
    ) implements AutoUpdateStatus {

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getIntervalHours() {
            return intervalHours;
        }

        @Override
        @Nullable
        public Instant getLastCheck() {
            return lastCheck;
        }

        @Override
        @Nullable
        public Instant getNextCheck() {
            return nextCheck;
        }

        @Override
        public boolean isUpdateInProgress() {
            return updateInProgress;
        }
    }

    private record UpdateLogRecordImpl(
            Instant timestamp,
            String slug,
            String oldVersion,
            String newVersion,
            String status,
            String message
    ) implements UpdateLogRecord {

        @Override
        @Nonnull
        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        @Nonnull
        public String getSlug() {
            return slug;
        }

        @Override
        @Nullable
        public String getOldVersion() {
            return oldVersion;
        }

        @Override
        @Nullable
        public String getNewVersion() {
            return newVersion;
        }

        @Override
        @Nonnull
        public String getStatus() {
            return status;
        }

        @Override
        @Nonnull
        public String getMessage() {
            return message;
        }
    }
}
