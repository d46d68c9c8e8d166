package me.internalizable.modmanager.install;

import me.internalizable.modmanager.environment.ServerEnvironment;
import me.internalizable.modmanager.ledger.InstalledMod;
import me.internalizable.modmanager.ledger.LedgerException;
import me.internalizable.modmanager.ledger.StateLedger;
import me.internalizable.modmanager.registry.ModRegistry;
import me.internalizable.modmanager.registry.RegistryException;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionFile;
import me.internalizable.modmanager.resolve.CompatibilityFilter;
import me.internalizable.modmanager.resolve.DependencyResolver;
import me.internalizable.modmanager.resolve.ResolutionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Installs, updates and removes mods in the server's mods directory.
 *
 * <p>All operations run under one lock shared by manual requests and the
 * auto-updater, so the mods directory and the ledger only change one
 * request at a time.</p>
 *
 * <p>An install is not transactional: if a step fails, the mods installed
 * earlier in the same request stay installed.</p>
 */
public class ModInstaller {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModInstaller.class);

    private final ModRegistry registry;
    private final DependencyResolver resolver;
    private final StateLedger ledger;
    private final ServerEnvironment environment;
    private final Path modsDirectory;
    private final Clock clock;
    private final boolean preferStable;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Create an installer.
     *
     * @param registry registry to download from
     * @param resolver resolver producing install plans
     * @param ledger ledger recording installed mods
     * @param environment the server's game version and loader
     * @param modsDirectory directory the server loads mods from
     * @param clock clock for install timestamps
     * @param preferStable prefer release versions when checking for updates
     */
    public ModInstaller(
            @Nonnull ModRegistry registry,
            @Nonnull DependencyResolver resolver,
            @Nonnull StateLedger ledger,
            @Nonnull ServerEnvironment environment,
            @Nonnull Path modsDirectory,
            @Nonnull Clock clock,
            boolean preferStable) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.modsDirectory = Objects.requireNonNull(modsDirectory, "modsDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.preferStable = preferStable;
    }

    // ==================== Install ====================

    /**
     * Install a mod and its dependencies.
     *
     * @param slug slug or URL of the mod
     * @param forceUpdate reinstall mods that are already at the chosen version
     * @param autoUpdate auto-update flag recorded for every mod written
     * @return the result
     */
    @Nonnull
    public InstallResult install(@Nonnull String slug, boolean forceUpdate, boolean autoUpdate) {
        Objects.requireNonNull(slug, "slug");
        lock.lock();
        try {
            return doInstall(slug, forceUpdate, autoUpdate);
        } finally {
            lock.unlock();
        }
    }

    private InstallResult doInstall(String slug, boolean forceUpdate, boolean autoUpdate) {
        List<String> installed = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        List<ResolutionNode> plan;
        try {
            plan = resolver.resolve(slug, environment);
        } catch (RegistryException e) {
            LOGGER.error("Failed to resolve {}: {}", slug, e.getMessage());
            return InstallResult.failure(ErrorKind.REGISTRY_ERROR, e.getMessage());
        }

        if (plan.isEmpty()) {
            return InstallResult.failure(ErrorKind.NO_COMPATIBLE_VERSION,
                    "no compatible version for " + slug + " on " + environment);
        }

        List<String> planSlugs = plan.stream().map(ResolutionNode::slug).collect(Collectors.toList());

        try {
            Files.createDirectories(modsDirectory);
        } catch (IOException e) {
            LOGGER.error("Failed to create mods directory {}: {}", modsDirectory, e.getMessage());
            return InstallResult.failure(ErrorKind.DOWNLOAD_FAILURE,
                    "Cannot create mods directory " + modsDirectory);
        }

        for (ResolutionNode node : plan) {
            String nodeSlug = node.slug();
            VersionFile file = node.file();
            if (file == null) {
                LOGGER.warn("No downloadable file for {} {}", nodeSlug, node.version().versionNumber());
                continue;
            }

            InstalledMod existing = ledger.get(nodeSlug);
            boolean present = existing != null && isOnDisk(existing);
            String newVersion = node.version().versionNumber();

            if (present && !forceUpdate && newVersion.equals(existing.getVersion())) {
                LOGGER.info("{} {} is already installed", nodeSlug, newVersion);
                skipped.add(nodeSlug);
                continue;
            }

            Path target = resolveInModsDirectory(file.filename());
            if (target == null) {
                return InstallResult.failure(ErrorKind.DOWNLOAD_FAILURE,
                        "Refusing to write " + file.filename() + " outside the mods directory",
                        installed, updated, skipped);
            }

            if (present) {
                try {
                    Files.deleteIfExists(modsDirectory.resolve(existing.getFileName()));
                    LOGGER.info("Removed previous file {} of {}", existing.getFileName(), nodeSlug);
                } catch (IOException e) {
                    LOGGER.error("Failed to remove {}: {}", existing.getFileName(), e.getMessage());
                    return InstallResult.failure(ErrorKind.DOWNLOAD_FAILURE,
                            "Cannot remove previous file " + existing.getFileName(),
                            installed, updated, skipped);
                }
            }

            if (!registry.download(file, target)) {
                return InstallResult.failure(ErrorKind.DOWNLOAD_FAILURE,
                        "Failed to download " + file.filename(), installed, updated, skipped);
            }

            try {
                ledger.add(toInstalledMod(node, file, planSlugs, autoUpdate));
            } catch (LedgerException e) {
                return InstallResult.failure(ErrorKind.LEDGER_ERROR, e.getMessage(), installed, updated, skipped);
            }

            if (present) {
                updated.add(nodeSlug);
                LOGGER.info("Updated {} from {} to {}", nodeSlug, existing.getVersion(), newVersion);
            } else {
                installed.add(nodeSlug);
                LOGGER.info("Installed {} {}", nodeSlug, newVersion);
            }
        }

        return InstallResult.success(installed, updated, skipped);
    }

    private InstalledMod toInstalledMod(ResolutionNode node, VersionFile file, List<String> planSlugs, boolean autoUpdate) {
        Version version = node.version();

        InstalledMod mod = new InstalledMod();
        mod.setSlug(node.slug());
        mod.setName(node.project().displayName());
        mod.setVersion(version.versionNumber());
        mod.setFileName(file.filename());
        mod.setInstalledAt(clock.instant());
        mod.setAutoUpdate(autoUpdate);
        mod.setDependencies(planSlugs.stream()
                .filter(other -> !other.equals(node.slug()))
                .collect(Collectors.toList()));
        mod.setMinecraftVersions(version.gameVersions());
        mod.setModLoader(environment.loader());
        mod.setProjectId(node.project().id());
        mod.setVersionId(version.id());
        mod.setFileSize(file.size());
        return mod;
    }

    // ==================== Update ====================

    /**
     * Bring an installed mod to its best compatible version.
     *
     * @param slug the mod slug
     * @return true if a newer version was installed
     */
    public boolean update(@Nonnull String slug) {
        return updateMod(slug) == UpdateOutcome.UPDATED;
    }

    /**
     * Bring an installed mod to its best compatible version.
     *
     * <p>Dependencies are re-resolved and reinstalled along with the mod.</p>
     *
     * @param slug the mod slug
     * @return what happened
     */
    @Nonnull
    public UpdateOutcome updateMod(@Nonnull String slug) {
        Objects.requireNonNull(slug, "slug");
        lock.lock();
        try {
            InstalledMod existing = ledger.get(slug);
            if (existing == null) {
                LOGGER.warn("Cannot update {}: not installed", slug);
                return UpdateOutcome.NOT_INSTALLED;
            }

            List<Version> compatible;
            try {
                compatible = CompatibilityFilter.filter(
                        registry.getVersions(slug, environment.gameVersion(), environment.loader()),
                        environment.gameVersion(), environment.loader(), preferStable);
            } catch (RegistryException e) {
                LOGGER.error("Failed to check {} for updates: {}", slug, e.getMessage());
                return UpdateOutcome.FAILED;
            }

            if (compatible.isEmpty()) {
                LOGGER.warn("No compatible version of {} for {}", slug, environment);
                return UpdateOutcome.NO_COMPATIBLE_VERSION;
            }

            String latest = compatible.get(0).versionNumber();
            if (latest.equals(existing.getVersion())) {
                LOGGER.debug("{} is up to date ({})", slug, latest);
                return UpdateOutcome.UP_TO_DATE;
            }

            InstallResult result = doInstall(slug, true, existing.isAutoUpdate());
            if (!result.success()) {
                LOGGER.error("Failed to update {}: {}", slug, result.message());
                return UpdateOutcome.FAILED;
            }
            return UpdateOutcome.UPDATED;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Remove ====================

    /**
     * Remove an installed mod and its file.
     *
     * <p>Dependencies installed alongside it are left in place.</p>
     *
     * @param slug the mod slug
     * @return true if the mod was removed
     * @throws LedgerException if the ledger cannot be written
     */
    public boolean remove(@Nonnull String slug) {
        Objects.requireNonNull(slug, "slug");
        lock.lock();
        try {
            InstalledMod existing = ledger.get(slug);
            if (existing == null) {
                LOGGER.warn("Cannot remove {}: not installed", slug);
                return false;
            }

            Path file = modsDirectory.resolve(existing.getFileName());
            try {
                if (Files.deleteIfExists(file)) {
                    LOGGER.info("Deleted {}", file);
                }
            } catch (IOException e) {
                LOGGER.error("Failed to delete {}: {}", file, e.getMessage());
                return false;
            }

            ledger.remove(slug);
            LOGGER.info("Removed {}", slug);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Change the auto-update flag of an installed mod.
     *
     * @param slug the mod slug
     * @param enabled new flag value
     * @return false if the mod is not installed
     * @throws LedgerException if the ledger cannot be written
     */
    public boolean setAutoUpdate(@Nonnull String slug, boolean enabled) {
        Objects.requireNonNull(slug, "slug");
        lock.lock();
        try {
            boolean changed = ledger.update(slug, mod -> mod.setAutoUpdate(enabled));
            if (changed) {
                LOGGER.info("Auto-update for {} {}", slug, enabled ? "enabled" : "disabled");
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    /**
     * Check whether a mod is recorded and its file is present.
     *
     * @param slug the mod slug
     * @return true if installed
     */
    public boolean isInstalled(@Nonnull String slug) {
        InstalledMod mod = ledger.get(slug);
        return mod != null && isOnDisk(mod);
    }

    @Nonnull
    public Path getModsDirectory() {
        return modsDirectory;
    }

    private boolean isOnDisk(InstalledMod mod) {
        return mod.getFileName() != null && Files.isRegularFile(modsDirectory.resolve(mod.getFileName()));
    }

    @Nullable
    private Path resolveInModsDirectory(String filename) {
        Path base = modsDirectory.toAbsolutePath().normalize();
        Path target = base.resolve(filename).normalize();
        if (!target.getParent().equals(base)) {
            return null;
        }
        return target;
    }
}
