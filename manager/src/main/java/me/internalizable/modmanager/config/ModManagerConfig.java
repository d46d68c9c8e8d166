package me.internalizable.modmanager.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the mod manager.
 *
 * <p>Loaded from {@code modmanager.yml} and defines the server location,
 * registry access, resolution policy and auto-update scheduling.</p>
 */
public class ModManagerConfig {

    private String minecraftRootPath = "/home/mc/server";
    private String minecraftVersion;
    private String modLoader = "fabric";
    private String serverPropertiesPath;
    private String stateFileName = "mod_manager_state.json";
    private boolean backupState = true;
    private RegistryConfig registry = new RegistryConfig();
    private AutoUpdateConfig autoUpdate = new AutoUpdateConfig();
    private ResolutionConfig resolution = new ResolutionConfig();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static ModManagerConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            ModManagerConfig config = new ModManagerConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(ModManagerConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            ModManagerConfig config = yaml.load(is);
            return config != null ? config : new ModManagerConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Representer representer = new Representer(dumperOptions);
        representer.addClassTag(ModManagerConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, dumperOptions);
        try (Writer writer = Files.newBufferedWriter(path)) {
            yaml.dump(this, writer);
        }
    }

    // Derived paths

    @Nonnull
    public Path rootDirectory() {
        return Paths.get(minecraftRootPath);
    }

    @Nonnull
    public Path modsDirectory() {
        return rootDirectory().resolve("mods");
    }

    @Nonnull
    public Path stateFile() {
        return rootDirectory().resolve(stateFileName);
    }

    @Nonnull
    public Path serverPropertiesFile() {
        if (serverPropertiesPath != null && !serverPropertiesPath.isBlank()) {
            return Paths.get(serverPropertiesPath);
        }
        return rootDirectory().resolve("server.properties");
    }

    @Nonnull
    public Path latestLogFile() {
        return rootDirectory().resolve("logs").resolve("latest.log");
    }

    // Getters and Setters

    public String getMinecraftRootPath() {
        return minecraftRootPath;
    }

    public void setMinecraftRootPath(String minecraftRootPath) {
        this.minecraftRootPath = minecraftRootPath;
    }

    /**
     * Explicit game version; when unset the version is detected from the server files.
     */
    @Nullable
    public String getMinecraftVersion() {
        return minecraftVersion;
    }

    public void setMinecraftVersion(String minecraftVersion) {
        this.minecraftVersion = minecraftVersion;
    }

    public String getModLoader() {
        return modLoader;
    }

    public void setModLoader(String modLoader) {
        this.modLoader = modLoader;
    }

    @Nullable
    public String getServerPropertiesPath() {
        return serverPropertiesPath;
    }

    public void setServerPropertiesPath(String serverPropertiesPath) {
        this.serverPropertiesPath = serverPropertiesPath;
    }

    public String getStateFileName() {
        return stateFileName;
    }

    public void setStateFileName(String stateFileName) {
        this.stateFileName = stateFileName;
    }

    public boolean isBackupState() {
        return backupState;
    }

    public void setBackupState(boolean backupState) {
        this.backupState = backupState;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryConfig registry) {
        this.registry = registry;
    }

    public AutoUpdateConfig getAutoUpdate() {
        return autoUpdate;
    }

    public void setAutoUpdate(AutoUpdateConfig autoUpdate) {
        this.autoUpdate = autoUpdate;
    }

    public ResolutionConfig getResolution() {
        return resolution;
    }

    public void setResolution(ResolutionConfig resolution) {
        this.resolution = resolution;
    }

    /**
     * Remote registry access settings.
     */
    public static class RegistryConfig {
        private String baseUrl = "https://api.modrinth.com/v2";
        private String expectedHost = "modrinth.com";
        private String userAgent = "ModManager/1.0.0 (me.internalizable.modmanager)";
        private int cacheTtlSeconds = 300;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;
        private int downloadTimeoutSeconds = 120;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getExpectedHost() {
            return expectedHost;
        }

        public void setExpectedHost(String expectedHost) {
            this.expectedHost = expectedHost;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getCacheTtlSeconds() {
            return cacheTtlSeconds;
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
        }

        public int getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getDownloadTimeoutSeconds() {
            return downloadTimeoutSeconds;
        }

        public void setDownloadTimeoutSeconds(int downloadTimeoutSeconds) {
            this.downloadTimeoutSeconds = downloadTimeoutSeconds;
        }
    }

    /**
     * Scheduled reconciliation settings.
     */
    public static class AutoUpdateConfig {
        private boolean enabled = true;
        private int intervalHours = 2;
        private long pauseBetweenModsMillis = 1000L;
        private int logCapacity = 1000;
        private int logRetention = 500;
        private int logTrimIntervalHours = 168;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalHours() {
            return intervalHours;
        }

        public void setIntervalHours(int intervalHours) {
            this.intervalHours = intervalHours;
        }

        public long getPauseBetweenModsMillis() {
            return pauseBetweenModsMillis;
        }

        public void setPauseBetweenModsMillis(long pauseBetweenModsMillis) {
            this.pauseBetweenModsMillis = pauseBetweenModsMillis;
        }

        public int getLogCapacity() {
            return logCapacity;
        }

        public void setLogCapacity(int logCapacity) {
            this.logCapacity = logCapacity;
        }

        /**
         * Number of audit entries kept by the periodic trim; never above the capacity.
         */
        public int getLogRetention() {
            return logRetention;
        }

        public void setLogRetention(int logRetention) {
            this.logRetention = logRetention;
        }

        public int getLogTrimIntervalHours() {
            return logTrimIntervalHours;
        }

        public void setLogTrimIntervalHours(int logTrimIntervalHours) {
            this.logTrimIntervalHours = logTrimIntervalHours;
        }
    }

    /**
     * Dependency resolution policy.
     */
    public static class ResolutionConfig {
        private boolean preferStable = true;
        private boolean includeOptionalDependencies = true;

        public boolean isPreferStable() {
            return preferStable;
        }

        public void setPreferStable(boolean preferStable) {
            this.preferStable = preferStable;
        }

        public boolean isIncludeOptionalDependencies() {
            return includeOptionalDependencies;
        }

        public void setIncludeOptionalDependencies(boolean includeOptionalDependencies) {
            this.includeOptionalDependencies = includeOptionalDependencies;
        }
    }
}
