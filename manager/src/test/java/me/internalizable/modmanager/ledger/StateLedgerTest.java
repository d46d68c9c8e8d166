package me.internalizable.modmanager.ledger;

import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateLedgerTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private Path file;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("mod_manager_state.json");
        clock = new MutableClock(START);
    }

    private static InstalledMod mod(String slug, String version) {
        InstalledMod mod = new InstalledMod();
        mod.setSlug(slug);
        mod.setName(slug.toUpperCase());
        mod.setVersion(version);
        mod.setFileName(slug + "-" + version + ".jar");
        mod.setInstalledAt(START);
        mod.setDependencies(List.of("fabric-api"));
        mod.setMinecraftVersions(List.of("1.20.1"));
        mod.setModLoader(ModLoader.FABRIC);
        mod.setProjectId("P" + slug);
        mod.setVersionId(slug + "-" + version);
        mod.setFileSize(1234L);
        return mod;
    }

    private String content() throws Exception {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Test
    void openCreatesEmptyLedgerFile() throws Exception {
        StateLedger ledger = StateLedger.open(file, true, clock);

        assertThat(file).exists();
        assertThat(ledger.size()).isZero();
        assertThat(content()).contains("\"schema_version\" : 1").contains("\"mods\" : { }");
        assertThat(ledger.metadata().getCreatedAt()).isEqualTo(START);
        assertThat(ledger.metadata().getLastUpdateCheck()).isNull();
        assertThat(file.resolveSibling("mod_manager_state.json.backup")).doesNotExist();
    }

    @Test
    void openCreatesMissingParentDirectories() {
        Path nested = tempDir.resolve("a/b/state.json");

        StateLedger.open(nested, false, clock);

        assertThat(nested).exists();
    }

    @Test
    void addedEntriesAreListedBySlug() {
        StateLedger ledger = StateLedger.open(file, false, clock);

        ledger.add(mod("sodium", "0.5.0"));
        ledger.add(mod("lithium", "0.11.2"));

        assertThat(ledger.contains("sodium")).isTrue();
        assertThat(ledger.get("sodium").getVersion()).isEqualTo("0.5.0");
        assertThat(ledger.get("missing")).isNull();
        assertThat(ledger.list()).extracting(InstalledMod::getSlug).containsExactly("lithium", "sodium");
    }

    @Test
    void addReplacesExistingEntry() {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));

        ledger.add(mod("sodium", "0.5.1"));

        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.get("sodium").getVersion()).isEqualTo("0.5.1");
    }

    @Test
    void reopenRestoresEveryField() {
        StateLedger ledger = StateLedger.open(file, false, clock);
        InstalledMod original = mod("sodium", "0.5.0");
        original.setAutoUpdate(false);
        ledger.add(original);

        StateLedger reopened = StateLedger.open(file, false, clock);

        assertThat(reopened.get("sodium")).isEqualTo(original);
        assertThat(reopened.metadata().getCreatedAt()).isEqualTo(START);
    }

    @Test
    void writesSnakeCaseFields() throws Exception {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));

        assertThat(content())
                .contains("\"file_name\" : \"sodium-0.5.0.jar\"")
                .contains("\"installed_at\" : \"2024-05-01T12:00:00Z\"")
                .contains("\"auto_update\" : true")
                .contains("\"minecraft_versions\" : [ \"1.20.1\" ]")
                .contains("\"mod_loader\" : \"fabric\"")
                .contains("\"file_size\" : 1234");
    }

    @Test
    void encodingDecodedFileIsByteIdentical() throws Exception {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));
        ledger.add(mod("iris", "1.6.4"));
        byte[] bytes = Files.readAllBytes(file);

        LedgerCodec codec = new LedgerCodec();

        assertThat(codec.encode(codec.decode(bytes))).isEqualTo(bytes);
    }

    @Test
    void unreadableFileIsQuarantined() throws Exception {
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        StateLedger ledger = StateLedger.open(file, false, clock);

        Path quarantine = tempDir.resolve("mod_manager_state.json.corrupt-20240501T120000Z");
        assertThat(quarantine).exists();
        assertThat(Files.readString(quarantine, StandardCharsets.UTF_8)).isEqualTo("{ not json");
        assertThat(ledger.size()).isZero();
        assertThat(content()).contains("\"schema_version\" : 1");
    }

    @Test
    void quarantineInSameSecondKeepsEarlierCopy() throws Exception {
        Files.writeString(file, "first", StandardCharsets.UTF_8);
        StateLedger.open(file, false, clock);
        Files.writeString(file, "second", StandardCharsets.UTF_8);
        StateLedger.open(file, false, clock);

        assertThat(tempDir.resolve("mod_manager_state.json.corrupt-20240501T120000Z")).hasContent("first");
        assertThat(tempDir.resolve("mod_manager_state.json.corrupt-20240501T120000Z-1")).hasContent("second");
    }

    @Test
    void unknownLoaderDoesNotDiscardOtherEntries() throws Exception {
        Files.writeString(file, "{\"schema_version\": 1, \"mods\": {"
                        + "\"sodium\": {\"version\": \"0.5.0\", \"file_name\": \"sodium.jar\", \"mod_loader\": \"rift\"},"
                        + "\"iris\": {\"version\": \"1.6.4\", \"file_name\": \"iris.jar\", \"mod_loader\": \"quilt\"}}}",
                StandardCharsets.UTF_8);

        StateLedger ledger = StateLedger.open(file, false, clock);

        assertThat(tempDir.resolve("mod_manager_state.json.corrupt-20240501T120000Z")).doesNotExist();
        assertThat(ledger.size()).isEqualTo(2);
        assertThat(ledger.get("sodium").getModLoader()).isNull();
        assertThat(ledger.get("sodium").getVersion()).isEqualTo("0.5.0");
        assertThat(ledger.get("iris").getModLoader()).isEqualTo(ModLoader.QUILT);
    }

    @Test
    void unsupportedSchemaVersionIsQuarantined() throws Exception {
        Files.writeString(file, "{\"schema_version\": 99, \"mods\": {}}", StandardCharsets.UTF_8);

        StateLedger ledger = StateLedger.open(file, false, clock);

        assertThat(tempDir.resolve("mod_manager_state.json.corrupt-20240501T120000Z")).exists();
        assertThat(ledger.size()).isZero();
    }

    @Test
    void missingSchemaVersionIsReadAsCurrent() throws Exception {
        Files.writeString(file,
                "{\"mods\": {\"sodium\": {\"version\": \"0.5.0\", \"file_name\": \"sodium.jar\", \"unknown\": 1}}}",
                StandardCharsets.UTF_8);

        StateLedger ledger = StateLedger.open(file, false, clock);

        InstalledMod sodium = ledger.get("sodium");
        assertThat(sodium).isNotNull();
        assertThat(sodium.getSlug()).isEqualTo("sodium");
        assertThat(sodium.getFileName()).isEqualTo("sodium.jar");
        assertThat(sodium.isAutoUpdate()).isTrue();
        assertThat(sodium.getDependencies()).isEmpty();
    }

    @Test
    void removingUnknownSlugDoesNotRewriteFile() throws Exception {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));
        byte[] before = Files.readAllBytes(file);
        clock.advance(Duration.ofMinutes(5));

        assertThat(ledger.remove("nope")).isFalse();

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    void removeDeletesEntryDurably() {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));

        assertThat(ledger.remove("sodium")).isTrue();

        assertThat(StateLedger.open(file, false, clock).contains("sodium")).isFalse();
    }

    @Test
    void backupHoldsPreviousContent() throws Exception {
        StateLedger ledger = StateLedger.open(file, true, clock);
        ledger.add(mod("sodium", "0.5.0"));
        ledger.add(mod("lithium", "0.11.2"));

        String backup = Files.readString(file.resolveSibling("mod_manager_state.json.backup"), StandardCharsets.UTF_8);

        assertThat(backup).contains("sodium").doesNotContain("lithium");
        assertThat(content()).contains("sodium").contains("lithium");
    }

    @Test
    void updateChangesExistingEntryOnly() {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));

        assertThat(ledger.update("sodium", m -> {
            m.setAutoUpdate(false);
            m.setSlug("renamed");
        })).isTrue();
        assertThat(ledger.update("missing", m -> m.setAutoUpdate(false))).isFalse();

        assertThat(ledger.get("sodium").isAutoUpdate()).isFalse();
        assertThat(ledger.contains("renamed")).isFalse();
        assertThat(StateLedger.open(file, false, clock).get("sodium").isAutoUpdate()).isFalse();
    }

    @Test
    void lastUpdateCheckSurvivesReopen() {
        StateLedger ledger = StateLedger.open(file, false, clock);
        Instant check = START.plus(Duration.ofHours(3));
        clock.advance(Duration.ofHours(3));

        ledger.recordUpdateCheck(check);

        StateLedger reopened = StateLedger.open(file, false, clock);
        assertThat(reopened.metadata().getLastUpdateCheck()).isEqualTo(check);
        assertThat(reopened.metadata().getUpdatedAt()).isEqualTo(check);
    }

    @Test
    void returnedEntriesAreCopies() {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));

        ledger.get("sodium").setVersion("tampered");
        ledger.list().get(0).getDependencies().clear();

        assertThat(ledger.get("sodium").getVersion()).isEqualTo("0.5.0");
        assertThat(ledger.get("sodium").getDependencies()).containsExactly("fabric-api");
    }

    @Test
    void failedSaveRollsBack() throws Exception {
        StateLedger ledger = StateLedger.open(file, false, clock);
        ledger.add(mod("sodium", "0.5.0"));
        byte[] before = Files.readAllBytes(file);

        Path blocker = file.resolveSibling("mod_manager_state.json.tmp");
        Files.createDirectories(blocker);
        Files.writeString(blocker.resolve("keep"), "x", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ledger.add(mod("lithium", "0.11.2")))
                .isInstanceOf(LedgerException.class);

        assertThat(ledger.contains("lithium")).isFalse();
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }
}
