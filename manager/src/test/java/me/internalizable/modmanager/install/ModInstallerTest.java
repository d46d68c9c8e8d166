package me.internalizable.modmanager.install;

import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.environment.ServerEnvironment;
import me.internalizable.modmanager.ledger.InstalledMod;
import me.internalizable.modmanager.ledger.StateLedger;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionType;
import me.internalizable.modmanager.resolve.DependencyResolver;
import me.internalizable.modmanager.testing.InMemoryRegistry;
import me.internalizable.modmanager.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static me.internalizable.modmanager.testing.InMemoryRegistry.GAME_VERSION;
import static me.internalizable.modmanager.testing.InMemoryRegistry.jar;
import static me.internalizable.modmanager.testing.InMemoryRegistry.required;
import static org.assertj.core.api.Assertions.assertThat;

class ModInstallerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private InMemoryRegistry registry;
    private StateLedger ledger;
    private Path mods;
    private ModInstaller installer;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRegistry();
        registry.addProject("PA", "alpha");
        registry.addProject("PB", "bravo");

        MutableClock clock = new MutableClock(NOW);
        ledger = StateLedger.open(tempDir.resolve("state.json"), false, clock);
        mods = tempDir.resolve("mods");
        installer = new ModInstaller(
                registry,
                new DependencyResolver(registry, true, true),
                ledger,
                new ServerEnvironment(GAME_VERSION, ModLoader.FABRIC),
                mods,
                clock,
                true
        );
    }

    private Version publishNewer(String projectId, String slug, String versionNumber) {
        return registry.addVersion(InMemoryRegistry.version(projectId, slug + "-" + versionNumber, versionNumber,
                VersionType.RELEASE, List.of(GAME_VERSION), Instant.parse("2024-03-01T00:00:00Z"), List.of(),
                List.of(jar(slug + "-" + versionNumber + ".jar", true))));
    }

    @Test
    void installsModWithDependencies() {
        registry.release("PA", "1.0", required("PB"));
        registry.release("PB", "1.0");

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.success()).isTrue();
        assertThat(result.errorKind()).isNull();
        assertThat(result.installed()).containsExactly("alpha", "bravo");
        assertThat(result.updated()).isEmpty();
        assertThat(result.skipped()).isEmpty();
        assertThat(mods.resolve("alpha-1.0.jar")).hasContent("alpha-1.0.jar");
        assertThat(mods.resolve("bravo-1.0.jar")).exists();

        InstalledMod alpha = ledger.get("alpha");
        assertThat(alpha.getName()).isEqualTo("Alpha");
        assertThat(alpha.getVersion()).isEqualTo("1.0");
        assertThat(alpha.getFileName()).isEqualTo("alpha-1.0.jar");
        assertThat(alpha.getInstalledAt()).isEqualTo(NOW);
        assertThat(alpha.isAutoUpdate()).isTrue();
        assertThat(alpha.getDependencies()).containsExactly("bravo");
        assertThat(alpha.getMinecraftVersions()).containsExactly(GAME_VERSION);
        assertThat(alpha.getModLoader()).isEqualTo(ModLoader.FABRIC);
        assertThat(alpha.getProjectId()).isEqualTo("PA");
        assertThat(alpha.getVersionId()).isEqualTo("alpha-1.0");
        assertThat(alpha.getFileSize()).isEqualTo("alpha-1.0.jar".length());
        assertThat(ledger.get("bravo").getDependencies()).containsExactly("alpha");
        assertThat(installer.isInstalled("alpha")).isTrue();
    }

    @Test
    void skipsModsAlreadyAtChosenVersion() {
        registry.release("PA", "1.0", required("PB"));
        registry.release("PB", "1.0");
        installer.install("alpha", false, true);

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.success()).isTrue();
        assertThat(result.installed()).isEmpty();
        assertThat(result.skipped()).containsExactly("alpha", "bravo");
        assertThat(registry.getDownloads()).hasSize(2);
    }

    @Test
    void forceReinstallsEverything() {
        registry.release("PA", "1.0", required("PB"));
        registry.release("PB", "1.0");
        installer.install("alpha", false, true);

        InstallResult result = installer.install("alpha", true, true);

        assertThat(result.updated()).containsExactly("alpha", "bravo");
        assertThat(result.skipped()).isEmpty();
        assertThat(registry.getDownloads()).hasSize(4);
        assertThat(mods.resolve("alpha-1.0.jar")).exists();
    }

    @Test
    void newerVersionReplacesPreviousFile() {
        registry.release("PA", "1.0", required("PB"));
        registry.release("PB", "1.0");
        installer.install("alpha", false, true);
        publishNewer("PA", "alpha", "1.1");

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.updated()).containsExactly("alpha");
        assertThat(result.skipped()).containsExactly("bravo");
        assertThat(mods.resolve("alpha-1.0.jar")).doesNotExist();
        assertThat(mods.resolve("alpha-1.1.jar")).exists();
        assertThat(ledger.get("alpha").getVersion()).isEqualTo("1.1");
    }

    @Test
    void recordedModWithMissingFileIsReinstalled() throws Exception {
        registry.release("PA", "1.0");
        installer.install("alpha", false, true);
        Files.delete(mods.resolve("alpha-1.0.jar"));

        assertThat(installer.isInstalled("alpha")).isFalse();

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.installed()).containsExactly("alpha");
        assertThat(mods.resolve("alpha-1.0.jar")).exists();
    }

    @Test
    void downloadFailureKeepsEarlierMods() {
        registry.release("PA", "1.0", required("PB"));
        registry.release("PB", "1.0");
        registry.failDownload("bravo-1.0.jar");

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.DOWNLOAD_FAILURE);
        assertThat(result.message()).isEqualTo("Failed to download bravo-1.0.jar");
        assertThat(result.installed()).containsExactly("alpha");
        assertThat(ledger.contains("alpha")).isTrue();
        assertThat(ledger.contains("bravo")).isFalse();
    }

    @Test
    void reportsMissingCompatibleVersion() {
        registry.addVersion(InMemoryRegistry.version("PA", "alpha-old", "0.1", VersionType.RELEASE,
                List.of("1.16.5"), NOW, List.of(), List.of(jar("alpha-0.1.jar", true))));

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.NO_COMPATIBLE_VERSION);
        assertThat(result.message()).startsWith("no compatible version for alpha");
        assertThat(ledger.size()).isZero();
    }

    @Test
    void reportsRegistryErrors() {
        InstallResult result = installer.install("unknown", false, true);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.REGISTRY_ERROR);
        assertThat(registry.getDownloads()).isEmpty();
    }

    @Test
    void skipsPlanEntriesWithoutFile() {
        registry.release("PA", "1.0", required("PB"));
        registry.addVersion(InMemoryRegistry.version("PB", "bravo-1.0", "1.0", VersionType.RELEASE,
                List.of(GAME_VERSION), NOW, List.of(), List.of()));

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.success()).isTrue();
        assertThat(result.installed()).containsExactly("alpha");
        assertThat(ledger.contains("bravo")).isFalse();
    }

    @Test
    void refusesFilenamesOutsideModsDirectory() {
        registry.addVersion(InMemoryRegistry.version("PA", "alpha-evil", "1.0", VersionType.RELEASE,
                List.of(GAME_VERSION), NOW, List.of(), List.of(jar("../evil.jar", true))));

        InstallResult result = installer.install("alpha", false, true);

        assertThat(result.errorKind()).isEqualTo(ErrorKind.DOWNLOAD_FAILURE);
        assertThat(tempDir.resolve("evil.jar")).doesNotExist();
        assertThat(registry.getDownloads()).isEmpty();
    }

    @Test
    void updateModReportsEachOutcome() {
        registry.release("PA", "1.0");

        assertThat(installer.updateMod("alpha")).isEqualTo(UpdateOutcome.NOT_INSTALLED);

        installer.install("alpha", false, false);
        assertThat(installer.updateMod("alpha")).isEqualTo(UpdateOutcome.UP_TO_DATE);

        publishNewer("PA", "alpha", "1.1");
        assertThat(installer.updateMod("alpha")).isEqualTo(UpdateOutcome.UPDATED);
        assertThat(ledger.get("alpha").getVersion()).isEqualTo("1.1");
        assertThat(ledger.get("alpha").isAutoUpdate()).isFalse();
        assertThat(mods.resolve("alpha-1.0.jar")).doesNotExist();

        registry.failVersionList("alpha");
        assertThat(installer.updateMod("alpha")).isEqualTo(UpdateOutcome.FAILED);
    }

    @Test
    void updateModWithoutCompatibleVersion() {
        registry.release("PA", "1.0");
        installer.install("alpha", false, true);
        registry.clearVersions("PA");

        assertThat(installer.updateMod("alpha")).isEqualTo(UpdateOutcome.NO_COMPATIBLE_VERSION);
        assertThat(installer.update("alpha")).isFalse();
        assertThat(ledger.get("alpha").getVersion()).isEqualTo("1.0");
    }

    @Test
    void updateReturnsTrueOnlyWhenNewerVersionInstalled() {
        registry.release("PA", "1.0");
        installer.install("alpha", false, true);

        assertThat(installer.update("alpha")).isFalse();

        publishNewer("PA", "alpha", "2.0");
        assertThat(installer.update("alpha")).isTrue();
    }

    @Test
    void removeDeletesFileAndEntryButKeepsDependencies() {
        registry.release("PA", "1.0", required("PB"));
        registry.release("PB", "1.0");
        installer.install("alpha", false, true);

        assertThat(installer.remove("alpha")).isTrue();

        assertThat(mods.resolve("alpha-1.0.jar")).doesNotExist();
        assertThat(ledger.contains("alpha")).isFalse();
        assertThat(ledger.contains("bravo")).isTrue();
        assertThat(installer.remove("alpha")).isFalse();
    }

    @Test
    void removeSucceedsWhenFileAlreadyGone() throws Exception {
        registry.release("PA", "1.0");
        installer.install("alpha", false, true);
        Files.delete(mods.resolve("alpha-1.0.jar"));

        assertThat(installer.remove("alpha")).isTrue();
        assertThat(ledger.contains("alpha")).isFalse();
    }

    @Test
    void setAutoUpdateChangesFlag() {
        registry.release("PA", "1.0");
        installer.install("alpha", false, true);

        assertThat(installer.setAutoUpdate("alpha", false)).isTrue();
        assertThat(ledger.get("alpha").isAutoUpdate()).isFalse();
        assertThat(installer.setAutoUpdate("missing", true)).isFalse();
    }
}
