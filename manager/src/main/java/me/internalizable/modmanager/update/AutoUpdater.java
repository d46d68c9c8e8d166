package me.internalizable.modmanager.update;

import me.internalizable.modmanager.config.ModManagerConfig;
import me.internalizable.modmanager.install.ModInstaller;
import me.internalizable.modmanager.install.UpdateOutcome;
import me.internalizable.modmanager.ledger.InstalledMod;
import me.internalizable.modmanager.ledger.LedgerException;
import me.internalizable.modmanager.ledger.StateLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Periodically brings auto-update mods to their latest compatible version.
 *
 * <p>Only one reconciliation pass runs at a time. A scheduled or manual
 * trigger that arrives while a pass is running is dropped, never queued.
 * Mods are checked one after another with a short pause between them, and
 * every result is recorded in the {@link UpdateLog}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AutoUpdater updater = new AutoUpdater(installer, ledger, config.getAutoUpdate(), clock);
 * updater.start();
 *
 * // Trigger a pass without waiting for the schedule
 * if (updater.runNow() == RunNowResult.BUSY) {
 *     // a pass is already running
 * }
 *
 * updater.shutdown();
 * }</pre>
 */
public class AutoUpdater {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutoUpdater.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(5);

    private final ModInstaller installer;
    private final StateLedger ledger;
    private final ModManagerConfig.AutoUpdateConfig config;
    private final Clock clock;
    private final UpdateLog log;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService manualExecutor;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();

    private volatile ScheduledFuture<?> updateTask;
    private volatile ScheduledFuture<?> trimTask;
    private volatile Instant lastCheck;
    private volatile boolean shutdown = false;

    /**
     * Create an auto-updater. Nothing is scheduled until {@link #start()}.
     *
     * @param installer installer performing the updates
     * @param ledger ledger listing installed mods
     * @param config scheduling settings
     * @param clock clock for audit timestamps
     */
    public AutoUpdater(
            @Nonnull ModInstaller installer,
            @Nonnull StateLedger ledger,
            @Nonnull ModManagerConfig.AutoUpdateConfig config,
            @Nonnull Clock clock) {
        this.installer = Objects.requireNonNull(installer, "installer");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");

        if (config.getIntervalHours() < 1) {
            throw new IllegalArgumentException("intervalHours must be at least 1: " + config.getIntervalHours());
        }

        this.log = new UpdateLog(config.getLogCapacity());
        this.lastCheck = ledger.metadata().getLastUpdateCheck();

        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "AutoUpdater-Scheduler");
            t.setDaemon(true);
            return t;
        });

        this.manualExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "AutoUpdater-Manual");
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Scheduling ====================

    /**
     * Schedule the periodic update and log-trim jobs.
     *
     * <p>Does nothing if auto-update is disabled or the jobs are already scheduled.</p>
     */
    public synchronized void start() {
        if (!config.isEnabled()) {
            LOGGER.info("Auto-update is disabled in the configuration");
            return;
        }
        if (updateTask != null) {
            LOGGER.warn("Auto-updater already running");
            return;
        }
        if (shutdown) {
            throw new IllegalStateException("Auto-updater has been shut down");
        }

        long interval = config.getIntervalHours();
        updateTask = scheduler.scheduleAtFixedRate(this::runScheduled, interval, interval, TimeUnit.HOURS);

        long trimInterval = Math.max(1, config.getLogTrimIntervalHours());
        trimTask = scheduler.scheduleAtFixedRate(this::trimLogs, trimInterval, trimInterval, TimeUnit.HOURS);

        LOGGER.info("Auto-updater started (interval: {} h)", interval);
    }

    /**
     * Cancel the periodic jobs. A pass that is already running finishes.
     */
    public synchronized void stop() {
        if (updateTask == null) {
            return;
        }
        updateTask.cancel(false);
        updateTask = null;
        if (trimTask != null) {
            trimTask.cancel(false);
            trimTask = null;
        }
        LOGGER.info("Auto-updater stopped");
    }

    public boolean isRunning() {
        return updateTask != null;
    }

    /**
     * Start a pass in the background without waiting for the schedule.
     *
     * @return {@link RunNowResult#BUSY} if a pass is already running
     * @throws IllegalStateException if the updater has been shut down
     */
    @Nonnull
    public RunNowResult runNow() {
        if (!inProgress.compareAndSet(false, true)) {
            LOGGER.info("Update pass already in progress");
            return RunNowResult.BUSY;
        }

        try {
            manualExecutor.execute(() -> {
                try {
                    runBatch();
                } finally {
                    finishBatch();
                }
            });
        } catch (RejectedExecutionException e) {
            finishBatch();
            throw new IllegalStateException("Auto-updater has been shut down", e);
        }

        LOGGER.info("Manual update pass started");
        return RunNowResult.STARTED;
    }

    /**
     * Wait until no pass is running.
     *
     * @param timeout maximum time to wait
     * @return true if idle, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(@Nonnull Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inProgress.get()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    // ==================== Reconciliation ====================

    private void runScheduled() {
        if (!inProgress.compareAndSet(false, true)) {
            LOGGER.warn("Update pass already in progress, skipping scheduled run");
            return;
        }
        try {
            runBatch();
        } finally {
            finishBatch();
        }
    }

    private void finishBatch() {
        inProgress.set(false);
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
    }

    private void runBatch() {
        Instant started = clock.instant();
        lastCheck = started;

        try {
            List<InstalledMod> targets = ledger.list().stream()
                    .filter(InstalledMod::isAutoUpdate)
                    .collect(Collectors.toList());
            LOGGER.info("Checking {} mod(s) for updates", targets.size());

            int updated = 0;
            int failed = 0;
            for (int i = 0; i < targets.size(); i++) {
                if (i > 0 && !pause()) {
                    LOGGER.warn("Update pass interrupted after {} mod(s)", i);
                    break;
                }
                UpdateLogEntry entry = check(targets.get(i));
                log.add(entry);
                if (entry.status() == UpdateStatus.SUCCESS) {
                    updated++;
                } else if (entry.status() == UpdateStatus.FAILED) {
                    failed++;
                }
            }

            ledger.recordUpdateCheck(started);
            LOGGER.info("Update pass finished: {} updated, {} failed", updated, failed);
        } catch (LedgerException e) {
            LOGGER.error("Failed to record update check: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Update pass failed", e);
        }
    }

    private UpdateLogEntry check(InstalledMod mod) {
        String slug = mod.getSlug();
        String oldVersion = mod.getVersion();
        try {
            UpdateOutcome outcome = installer.updateMod(slug);
            return switch (outcome) {
                case UPDATED -> {
                    InstalledMod current = ledger.get(slug);
                    String newVersion = current != null ? current.getVersion() : null;
                    LOGGER.info("Auto-updated {} {} -> {}", slug, oldVersion, newVersion);
                    yield entry(slug, oldVersion, newVersion, UpdateStatus.SUCCESS, "Updated");
                }
                case UP_TO_DATE -> entry(slug, oldVersion, oldVersion, UpdateStatus.SKIPPED, "Already up to date");
                case NO_COMPATIBLE_VERSION -> entry(slug, oldVersion, oldVersion, UpdateStatus.SKIPPED,
                        "No compatible version available");
                case NOT_INSTALLED -> entry(slug, oldVersion, null, UpdateStatus.SKIPPED, "No longer installed");
                case FAILED -> entry(slug, oldVersion, oldVersion, UpdateStatus.FAILED, "Update failed");
            };
        } catch (RuntimeException e) {
            LOGGER.error("Error while updating {}: {}", slug, e.getMessage());
            return entry(slug, oldVersion, oldVersion, UpdateStatus.FAILED, "Error: " + e.getMessage());
        }
    }

    private UpdateLogEntry entry(String slug, @Nullable String oldVersion, @Nullable String newVersion,
                                 UpdateStatus status, String message) {
        return new UpdateLogEntry(clock.instant(), slug, oldVersion, newVersion, status, message);
    }

    private boolean pause() {
        long millis = config.getPauseBetweenModsMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void trimLogs() {
        int retain = Math.min(config.getLogRetention(), log.getCapacity());
        int dropped = log.trim(retain);
        if (dropped > 0) {
            LOGGER.info("Trimmed {} old update log entries, {} kept", dropped, log.size());
        }
    }

    // ==================== Queries ====================

    /**
     * Get a snapshot of the updater state.
     */
    @Nonnull
    public UpdaterStatus status() {
        ScheduledFuture<?> task = updateTask;
        Instant nextCheck = task != null
                ? clock.instant().plusMillis(Math.max(0, task.getDelay(TimeUnit.MILLISECONDS)))
                : null;
        return new UpdaterStatus(
                config.isEnabled(),
                task != null,
                config.getIntervalHours(),
                lastCheck,
                nextCheck,
                inProgress.get()
        );
    }

    public boolean isInProgress() {
        return inProgress.get();
    }

    @Nonnull
    public List<UpdateLogEntry> getLogs(int limit) {
        return log.getLogs(limit);
    }

    public void clearLogs() {
        log.clear();
        LOGGER.info("Update log cleared");
    }

    @Nonnull
    public UpdateLog getLog() {
        return log;
    }

    // ==================== Lifecycle ====================

    /**
     * Stop scheduling, wait for a running pass, then release the threads.
     */
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        stop();

        try {
            if (!awaitIdle(SHUTDOWN_GRACE)) {
                LOGGER.warn("Update pass still running after {}, abandoning it", SHUTDOWN_GRACE);
            }
            scheduler.shutdown();
            manualExecutor.shutdown();
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!manualExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                manualExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            manualExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Auto-updater shut down");
    }
}
