package me.internalizable.modmanager;

import me.internalizable.modmanager.config.ModManagerConfig;
import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.environment.ServerEnvironment;
import me.internalizable.modmanager.environment.ServerEnvironmentDetector;
import me.internalizable.modmanager.install.InstallResult;
import me.internalizable.modmanager.install.ModInstaller;
import me.internalizable.modmanager.install.UpdateOutcome;
import me.internalizable.modmanager.ledger.InstalledMod;
import me.internalizable.modmanager.ledger.StateLedger;
import me.internalizable.modmanager.registry.ModRegistry;
import me.internalizable.modmanager.registry.ModrinthClient;
import me.internalizable.modmanager.registry.RegistryException;
import me.internalizable.modmanager.registry.model.SearchHit;
import me.internalizable.modmanager.resolve.DependencyResolver;
import me.internalizable.modmanager.update.AutoUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the mod manager.
 *
 * <p>Owns the configuration, the detected server environment and every
 * component: registry client, resolver, ledger, installer and auto-updater.</p>
 *
 * <h2>Server layout</h2>
 * <pre>
 * &lt;minecraftRootPath&gt;/
 * ├── server.properties        # game version source
 * ├── logs/latest.log          # fallback game version source
 * ├── mods/                    # installed mod files
 * ├── mod_manager_state.json   # ledger
 * └── mod_manager_state.json.backup
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ModManager manager = new ModManager(Paths.get("modmanager.yml"));
 * manager.initialize();
 *
 * InstallResult result = manager.install("sodium", false, true);
 *
 * manager.shutdown();
 * }</pre>
 */
public class ModManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModManager.class);

    public static final Path DEFAULT_CONFIG_PATH = Paths.get("modmanager.yml");

    @Nullable
    private final Path configPath;
    private final Clock clock;

    private ModManagerConfig config;
    private ModRegistry registry;
    private ServerEnvironment environment;
    private StateLedger ledger;
    private ModInstaller installer;
    private AutoUpdater autoUpdater;
    private Instant startedAt;

    private final ExecutorService asyncExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ModManager-Async");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a mod manager that loads its configuration from a YAML file.
     *
     * @param configPath configuration file, created with defaults if absent
     */
    public ModManager(@Nonnull Path configPath) {
        this.configPath = Objects.requireNonNull(configPath, "configPath");
        this.clock = Clock.systemUTC();
    }

    /**
     * Create a mod manager with a given configuration and registry.
     *
     * @param config configuration
     * @param registry registry to use
     * @param clock clock for timestamps
     */
    public ModManager(@Nonnull ModManagerConfig config, @Nonnull ModRegistry registry, @Nonnull Clock clock) {
        this.configPath = null;
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== Initialization ====================

    /**
     * Initialize the mod manager.
     *
     * @throws IOException if the configuration or server directories cannot be prepared
     * @throws IllegalStateException if the server's game version cannot be determined
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("Mod manager already initialized");
        }

        LOGGER.info("Initializing mod manager...");

        if (config == null) {
            config = ModManagerConfig.load(configPath);
            LOGGER.info("Loaded configuration from {}", configPath);
        }
        if (registry == null) {
            registry = new ModrinthClient(config.getRegistry(), clock);
        }

        environment = new ServerEnvironmentDetector(config).detect();
        Files.createDirectories(config.modsDirectory());

        ledger = StateLedger.open(config.stateFile(), config.isBackupState(), clock);

        ModManagerConfig.ResolutionConfig resolution = config.getResolution();
        DependencyResolver resolver = new DependencyResolver(
                registry, resolution.isPreferStable(), resolution.isIncludeOptionalDependencies());

        installer = new ModInstaller(
                registry,
                resolver,
                ledger,
                environment,
                config.modsDirectory(),
                clock,
                resolution.isPreferStable()
        );

        autoUpdater = new AutoUpdater(installer, ledger, config.getAutoUpdate(), clock);
        autoUpdater.start();

        startedAt = clock.instant();
        initialized = true;

        LOGGER.info("Mod manager initialized");
        LOGGER.info("  Server: {} at {}", environment, config.rootDirectory());
        LOGGER.info("  Installed mods: {}", ledger.size());
    }

    // ==================== Mod Management ====================

    /**
     * Install a mod and its dependencies.
     *
     * @param slug slug or registry URL
     * @param forceUpdate reinstall mods already at the chosen version
     * @param autoUpdate enable auto-update for the installed mods
     * @return the result
     */
    @Nonnull
    public InstallResult install(@Nonnull String slug, boolean forceUpdate, boolean autoUpdate) {
        checkInitialized();
        return installer.install(slug, forceUpdate, autoUpdate);
    }

    /**
     * Update an installed mod.
     *
     * @param slug the mod slug
     * @return true if a newer version was installed
     */
    public boolean update(@Nonnull String slug) {
        checkInitialized();
        return installer.update(slug);
    }

    /**
     * Update an installed mod, reporting what happened.
     *
     * @param slug the mod slug
     * @return the outcome
     */
    @Nonnull
    public UpdateOutcome updateMod(@Nonnull String slug) {
        checkInitialized();
        return installer.updateMod(slug);
    }

    /**
     * Remove an installed mod.
     *
     * @param slug the mod slug
     * @return true if removed
     */
    public boolean remove(@Nonnull String slug) {
        checkInitialized();
        return installer.remove(slug);
    }

    /**
     * Change the auto-update flag of an installed mod.
     *
     * @param slug the mod slug
     * @param enabled new value
     * @return false if the mod is not installed
     */
    public boolean setAutoUpdate(@Nonnull String slug, boolean enabled) {
        checkInitialized();
        return installer.setAutoUpdate(slug, enabled);
    }

    /**
     * Get all installed mods, ordered by slug.
     */
    @Nonnull
    public List<InstalledMod> listInstalled() {
        checkInitialized();
        return ledger.list();
    }

    /**
     * Search the registry for mods available for this server's game version.
     *
     * @param query search text
     * @param limit maximum number of hits
     * @return matching projects
     * @throws RegistryException if the registry cannot be queried
     */
    @Nonnull
    public List<SearchHit> search(@Nonnull String query, int limit) throws RegistryException {
        checkInitialized();
        return registry.searchProjects(query, environment.gameVersion(), limit);
    }

    // ==================== Status ====================

    /**
     * Get a summary of the managed server.
     */
    @Nonnull
    public Summary getSummary() {
        checkInitialized();
        return new Summary(
                environment.gameVersion(),
                environment.loader(),
                config.rootDirectory(),
                ledger.size(),
                config.getAutoUpdate().isEnabled(),
                ledger.metadata().getLastUpdateCheck()
        );
    }

    /**
     * Probe the registry and the server directory.
     */
    @Nonnull
    public HealthReport checkHealth() {
        checkInitialized();
        boolean reachable = registry.isReachable();
        Path root = config.rootDirectory();
        boolean writable = Files.isDirectory(root) && Files.isWritable(root);
        return new HealthReport(reachable, writable, Duration.between(startedAt, clock.instant()));
    }

    // ==================== Accessors ====================

    @Nonnull
    public ModManagerConfig getConfig() {
        checkInitialized();
        return config;
    }

    @Nonnull
    public ServerEnvironment getEnvironment() {
        checkInitialized();
        return environment;
    }

    @Nonnull
    public StateLedger getLedger() {
        checkInitialized();
        return ledger;
    }

    @Nonnull
    public ModInstaller getInstaller() {
        checkInitialized();
        return installer;
    }

    @Nonnull
    public AutoUpdater getAutoUpdater() {
        checkInitialized();
        return autoUpdater;
    }

    @Nonnull
    public ModRegistry getRegistry() {
        checkInitialized();
        return registry;
    }

    /**
     * Get the executor for asynchronous API calls. It is shut down together
     * with the manager.
     *
     * @return the async executor
     */
    @Nonnull
    public ExecutorService getAsyncExecutor() {
        return asyncExecutor;
    }

    // ==================== Lifecycle ====================

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Mod manager not initialized");
        }
    }

    /**
     * Shut down the mod manager, waiting for a running update pass.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        shutdownAsyncExecutor();
        if (!initialized) {
            return;
        }

        LOGGER.info("Shutting down mod manager...");

        if (autoUpdater != null) {
            autoUpdater.shutdown();
        }
        if (registry instanceof ModrinthClient) {
            ((ModrinthClient) registry).clearCache();
        }

        LOGGER.info("Mod manager shut down");
    }

    private void shutdownAsyncExecutor() {
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Summary of the managed server.
     *
     * @param gameVersion detected game version
     * @param loader detected loader
     * @param serverPath server root directory
     * @param modCount number of installed mods
     * @param autoUpdateEnabled whether auto-update is enabled in the configuration
     * @param lastUpdateCheck when the last update pass ran
     */
    public record Summary(
            String gameVersion,
            ModLoader loader,
            Path serverPath,
            int modCount,
            boolean autoUpdateEnabled,
            @Nullable Instant lastUpdateCheck
    ) {}

    /**
     * Result of a health probe.
     *
     * @param registryReachable whether the registry answered
     * @param serverDirectoryWritable whether the server root can be written
     * @param uptime time since initialization
     */
    public record HealthReport(
            boolean registryReachable,
            boolean serverDirectoryWritable,
            Duration uptime
    ) {
        public boolean healthy() {
            return registryReachable && serverDirectoryWritable;
        }
    }
}
