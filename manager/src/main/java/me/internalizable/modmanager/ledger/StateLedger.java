package me.internalizable.modmanager.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Durable record of installed mods, kept in a JSON file.
 *
 * <p>Every mutation is written through immediately. The file is replaced
 * atomically, and the previous copy is kept as {@code <file>.backup} when
 * backups are enabled. If a write fails the in-memory state is rolled back
 * and a {@link LedgerException} is thrown.</p>
 *
 * <p>A file that cannot be decoded is moved to
 * {@code <file>.corrupt-<timestamp>} (with a counter suffix if that name is taken)
 * and replaced with an empty ledger.</p>
 *
 * <p>All methods are mutually exclusive.</p>
 */
public class StateLedger {

    private static final Logger LOGGER = LoggerFactory.getLogger(StateLedger.class);

    private static final DateTimeFormatter QUARANTINE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final Path file;
    private final boolean backup;
    private final Clock clock;
    private final LedgerCodec codec = new LedgerCodec();

    private LedgerDocument document;

    private StateLedger(Path file, boolean backup, Clock clock) {
        this.file = file;
        this.backup = backup;
        this.clock = clock;
    }

    /**
     * Open the ledger stored at the given path, creating it if absent.
     *
     * @param file ledger file
     * @param backup keep a copy of the previous file before each write
     * @param clock clock for metadata timestamps
     * @return the opened ledger
     * @throws LedgerException if the file cannot be read or created
     */
    @Nonnull
    public static StateLedger open(@Nonnull Path file, boolean backup, @Nonnull Clock clock) {
        StateLedger ledger = new StateLedger(
                Objects.requireNonNull(file, "file"), backup, Objects.requireNonNull(clock, "clock"));
        ledger.load();
        return ledger;
    }

    private void load() {
        if (!Files.exists(file)) {
            LOGGER.info("No ledger at {}, creating an empty one", file);
            initializeEmpty();
            return;
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new LedgerException("Failed to read ledger " + file, e);
        }

        try {
            document = codec.decode(bytes);
            LOGGER.info("Loaded ledger {} with {} mod(s)", file, document.getMods().size());
        } catch (IOException e) {
            Path quarantine = quarantinePath();
            try {
                Files.move(file, quarantine);
            } catch (IOException moveFailure) {
                throw new LedgerException("Failed to move unreadable ledger " + file + " aside", moveFailure);
            }
            LOGGER.error("Ledger {} is unreadable ({}); moved to {} and starting empty",
                    file, e.getMessage(), quarantine);
            initializeEmpty();
        }
    }

    private Path quarantinePath() {
        String base = file.getFileName() + ".corrupt-" + QUARANTINE_STAMP.format(clock.instant());
        Path candidate = file.resolveSibling(base);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = file.resolveSibling(base + "-" + n);
        }
        return candidate;
    }

    private void initializeEmpty() {
        document = LedgerCodec.empty();
        document.getMetadata().setCreatedAt(clock.instant());
        persist();
    }

    // ==================== Queries ====================

    /**
     * Get a copy of the entry for a slug.
     *
     * @param slug the mod slug
     * @return the entry, or null if not recorded
     */
    @Nullable
    public synchronized InstalledMod get(@Nonnull String slug) {
        InstalledMod mod = document.getMods().get(slug);
        return mod != null ? mod.copy() : null;
    }

    /**
     * Get copies of all entries, ordered by slug.
     */
    @Nonnull
    public synchronized List<InstalledMod> list() {
        List<InstalledMod> mods = new ArrayList<>(document.getMods().size());
        document.getMods().values().forEach(mod -> mods.add(mod.copy()));
        return mods;
    }

    public synchronized boolean contains(@Nonnull String slug) {
        return document.getMods().containsKey(slug);
    }

    public synchronized int size() {
        return document.getMods().size();
    }

    /**
     * Get a copy of the ledger metadata.
     */
    @Nonnull
    public synchronized LedgerMetadata metadata() {
        return document.getMetadata().copy();
    }

    @Nonnull
    public Path getFile() {
        return file;
    }

    // ==================== Mutations ====================

    /**
     * Insert or replace the entry for {@code mod.getSlug()}.
     *
     * @param mod the entry to record
     * @throws LedgerException if the ledger cannot be written
     */
    public synchronized void add(@Nonnull InstalledMod mod) {
        Objects.requireNonNull(mod, "mod");
        Objects.requireNonNull(mod.getSlug(), "mod.slug");
        InstalledMod stored = mod.copy();
        commit(() -> document.getMods().put(stored.getSlug(), stored));
    }

    /**
     * Remove an entry.
     *
     * @param slug the mod slug
     * @return true if an entry was removed; false leaves the file untouched
     * @throws LedgerException if the ledger cannot be written
     */
    public synchronized boolean remove(@Nonnull String slug) {
        if (!document.getMods().containsKey(slug)) {
            return false;
        }
        commit(() -> document.getMods().remove(slug));
        return true;
    }

    /**
     * Apply a change to an existing entry.
     *
     * @param slug the mod slug
     * @param mutator change to apply; the slug cannot be changed
     * @return true if the entry existed
     * @throws LedgerException if the ledger cannot be written
     */
    public synchronized boolean update(@Nonnull String slug, @Nonnull Consumer<InstalledMod> mutator) {
        InstalledMod existing = document.getMods().get(slug);
        if (existing == null) {
            return false;
        }
        InstalledMod changed = existing.copy();
        mutator.accept(changed);
        changed.setSlug(slug);
        commit(() -> document.getMods().put(slug, changed));
        return true;
    }

    /**
     * Record when the auto-updater last checked for updates.
     *
     * @param timestamp time of the check
     * @throws LedgerException if the ledger cannot be written
     */
    public synchronized void recordUpdateCheck(@Nonnull Instant timestamp) {
        commit(() -> document.getMetadata().setLastUpdateCheck(timestamp));
    }

    private void commit(Runnable mutation) {
        LedgerDocument before = document.copy();
        mutation.run();
        try {
            persist();
        } catch (LedgerException e) {
            document = before;
            throw e;
        }
    }

    private void persist() {
        Instant previousUpdate = document.getMetadata().getUpdatedAt();
        document.getMetadata().setUpdatedAt(clock.instant());

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (backup && Files.exists(file)) {
                Files.copy(file, file.resolveSibling(file.getFileName() + ".backup"),
                        StandardCopyOption.REPLACE_EXISTING);
            }
            Files.write(temp, codec.encode(document));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.debug("Saved ledger {}", file);
        } catch (IOException e) {
            document.getMetadata().setUpdatedAt(previousUpdate);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            LOGGER.error("Failed to save ledger {}: {}", file, e.getMessage());
            throw new LedgerException("Failed to save ledger " + file, e);
        }
    }
}
