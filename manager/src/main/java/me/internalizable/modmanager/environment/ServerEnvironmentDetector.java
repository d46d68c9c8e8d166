package me.internalizable.modmanager.environment;

import me.internalizable.modmanager.config.ModManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines the game version and loader of the managed server from its files.
 *
 * <p>The game version comes from the configuration override, then
 * {@code server.properties}, then the tail of {@code logs/latest.log}.
 * The loader is detected from launcher artifacts in the server root and
 * falls back to the configured loader.</p>
 */
public class ServerEnvironmentDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerEnvironmentDetector.class);

    private static final int LOG_TAIL_LINES = 100;

    private static final List<Pattern> LOG_VERSION_PATTERNS = List.of(
            Pattern.compile("Starting minecraft server version (\\d+\\.\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Loading Minecraft (\\d+\\.\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("minecraft.*?(\\d+\\.\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> FABRIC_MARKERS = List.of(
            "fabric-server-mc.*.jar", "fabric-loader-*.jar", ".fabric");
    private static final List<String> FORGE_MARKERS = List.of(
            "forge-*.jar", "minecraft_server.*.jar");

    private final ModManagerConfig config;

    public ServerEnvironmentDetector(@Nonnull ModManagerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Detect the full environment.
     *
     * @return the detected environment
     * @throws IllegalStateException if the game version cannot be determined
     */
    @Nonnull
    public ServerEnvironment detect() {
        String version = detectGameVersion();
        if (version == null) {
            throw new IllegalStateException("Could not determine the Minecraft server version");
        }
        return new ServerEnvironment(version, detectLoader());
    }

    /**
     * Detect the game version.
     *
     * @return the version, or null if no source yields one
     */
    @Nullable
    public String detectGameVersion() {
        String configured = config.getMinecraftVersion();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }

        String version = readVersionFromProperties(config.serverPropertiesFile());
        if (version != null) {
            return version;
        }

        version = readVersionFromLog(config.latestLogFile());
        if (version != null) {
            return version;
        }

        LOGGER.warn("Could not determine the Minecraft server version");
        return null;
    }

    @Nullable
    private String readVersionFromProperties(Path propertiesFile) {
        if (!Files.isRegularFile(propertiesFile)) {
            LOGGER.debug("server.properties not found: {}", propertiesFile);
            return null;
        }

        try (BufferedReader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.startsWith("version=") || line.startsWith("minecraft-version=")) {
                    String version = line.substring(line.indexOf('=') + 1).trim();
                    if (!version.isEmpty()) {
                        LOGGER.info("Minecraft version from server.properties: {}", version);
                        return version;
                    }
                }
            }
        } catch (IOException e) {
            LOGGER.error("Failed to read {}: {}", propertiesFile, e.getMessage());
        }
        return null;
    }

    @Nullable
    private String readVersionFromLog(Path logFile) {
        if (!Files.isRegularFile(logFile)) {
            LOGGER.debug("Server log not found: {}", logFile);
            return null;
        }

        try {
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - LOG_TAIL_LINES);
            for (int i = lines.size() - 1; i >= from; i--) {
                String line = lines.get(i);
                for (Pattern pattern : LOG_VERSION_PATTERNS) {
                    Matcher matcher = pattern.matcher(line);
                    if (matcher.find()) {
                        String version = matcher.group(1);
                        LOGGER.info("Minecraft version from server log: {}", version);
                        return version;
                    }
                }
            }
        } catch (IOException e) {
            LOGGER.error("Failed to read {}: {}", logFile, e.getMessage());
        }
        return null;
    }

    /**
     * Detect the loader from files in the server root.
     *
     * @return the detected loader, or the configured one
     */
    @Nonnull
    public ModLoader detectLoader() {
        Path root = config.rootDirectory();

        if (anyMatches(root, FABRIC_MARKERS)) {
            LOGGER.info("Detected Fabric loader");
            return ModLoader.FABRIC;
        }
        if (anyMatches(root, FORGE_MARKERS)
                || Files.isDirectory(root.resolve("libraries/net/minecraftforge"))) {
            LOGGER.info("Detected Forge loader");
            return ModLoader.FORGE;
        }

        ModLoader configured = ModLoader.fromId(config.getModLoader());
        LOGGER.info("Loader not detected, using configured loader: {}", configured);
        return configured;
    }

    private boolean anyMatches(Path root, List<String> globs) {
        if (!Files.isDirectory(root)) {
            return false;
        }
        for (String glob : globs) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, glob)) {
                if (stream.iterator().hasNext()) {
                    return true;
                }
            } catch (IOException e) {
                LOGGER.warn("Failed to scan {} for '{}': {}", root, glob, e.getMessage());
            }
        }
        return false;
    }
}
