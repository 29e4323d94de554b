package io.netnotes.canvas.project;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import org.apache.commons.io.FileUtils;

import io.netnotes.canvas.config.CanvasConfig;
import io.netnotes.canvas.scene.DeferredExecutor;
import io.netnotes.canvas.scene.SceneController;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * AutoSaveManager - Saves the scene to a fixed project file on a timer
 *
 * The timer thread never reads the scene. Each tick posts
 * {@link #performAutoSave()} onto the host's {@link DeferredExecutor}, so the
 * save itself runs on the scene thread between input events.
 *
 * Enabled flag and interval are kept in the {@link CanvasConfig}; when a
 * settings file is given, every change is written back to it.
 */
public class AutoSaveManager {
    private static final String LOG_SCOPE = "[AutoSaveManager]";

    public interface Listener {
        default void autoSavePerformed(File file) {
        }

        default void autoSaveStatusChanged(boolean enabled) {
        }
    }

    private final SceneController controller;
    private final DeferredExecutor deferredExecutor;
    private final CanvasConfig config;
    private final File settingsFile;
    private final TimeUnit intervalUnit;
    private final ProjectSerializer serializer = new ProjectSerializer();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
        public Thread newThread(Runnable r) {
            Thread t = Executors.defaultThreadFactory().newThread(r);
            t.setName("canvas-autosave");
            t.setDaemon(true);
            return t;
        }
    });

    private ScheduledFuture<?> scheduledTick = null;
    private Supplier<CanvasProperties> canvasProperties = CanvasProperties::new;

    public AutoSaveManager(SceneController controller, DeferredExecutor deferredExecutor, CanvasConfig config) {
        this(controller, deferredExecutor, config, null);
    }

    public AutoSaveManager(SceneController controller, DeferredExecutor deferredExecutor, CanvasConfig config,
            File settingsFile) {
        this(controller, deferredExecutor, config, settingsFile, TimeUnit.MINUTES);
    }

    AutoSaveManager(SceneController controller, DeferredExecutor deferredExecutor, CanvasConfig config,
            File settingsFile, TimeUnit intervalUnit) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.deferredExecutor = Objects.requireNonNull(deferredExecutor, "deferredExecutor");
        this.config = config != null ? config : new CanvasConfig();
        this.settingsFile = settingsFile;
        this.intervalUnit = intervalUnit;

        if (this.config.isAutoSaveEnabled()) {
            startTimer();
        }
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /**
     * Source of the canvas properties written with each autosave.
     */
    public void setCanvasProperties(Supplier<CanvasProperties> canvasProperties) {
        this.canvasProperties = canvasProperties != null ? canvasProperties : CanvasProperties::new;
    }

    public boolean isEnabled() {
        return config.isAutoSaveEnabled();
    }

    public int getIntervalMinutes() {
        return config.getAutoSaveIntervalMinutes();
    }

    public File autoSavePath() {
        return config.getAutoSaveFile();
    }

    public synchronized boolean isTimerRunning() {
        return scheduledTick != null && !scheduledTick.isDone();
    }

    public void setEnabled(boolean enabled) {
        if (config.isAutoSaveEnabled() == enabled) {
            return;
        }
        config.withAutoSaveEnabled(enabled);
        if (enabled) {
            startTimer();
        } else {
            stopTimer();
        }
        saveSettings();

        for (Listener listener : listeners) {
            try {
                listener.autoSaveStatusChanged(enabled);
            } catch (RuntimeException e) {
                Log.logError(LOG_SCOPE, "listener failed", e);
            }
        }
    }

    /**
     * Clamped to [{@value CanvasConfig#MIN_AUTO_SAVE_MINUTES},
     * {@value CanvasConfig#MAX_AUTO_SAVE_MINUTES}]. A running timer restarts
     * with the new interval.
     */
    public void setIntervalMinutes(int minutes) {
        int clamped = CanvasConfig.clampInterval(minutes);
        if (clamped == config.getAutoSaveIntervalMinutes()) {
            return;
        }
        config.withAutoSaveIntervalMinutes(clamped);
        if (config.isAutoSaveEnabled()) {
            startTimer();
        }
        saveSettings();
    }

    /**
     * Save the scene to the autosave file now. Call on the scene thread.
     *
     * @return false if the save failed
     */
    public boolean performAutoSave() {
        File file = autoSavePath();
        if (file == null) {
            return false;
        }
        if (!serializer.saveProject(file, controller, canvasProperties.get())) {
            Log.log(LOG_SCOPE, "autosave failed: " + file, LogLevel.ERROR);
            return false;
        }

        Log.log(LOG_SCOPE, "autosaved to " + file.getName(), LogLevel.GENERAL);
        for (Listener listener : listeners) {
            try {
                listener.autoSavePerformed(file);
            } catch (RuntimeException e) {
                Log.logError(LOG_SCOPE, "listener failed", e);
            }
        }
        return true;
    }

    public boolean hasAutoSave() {
        File file = autoSavePath();
        return file != null && file.isFile();
    }

    public void clearAutoSave() {
        if (hasAutoSave()) {
            FileUtils.deleteQuietly(autoSavePath());
        }
    }

    /**
     * Offer the autosave to the user. Accepted, it replaces the current scene;
     * declined, it is deleted.
     *
     * @param confirm asked only when an autosave exists
     * @return the restored project's canvas properties, or null if nothing was restored
     */
    public CanvasProperties restoreAutoSave(BooleanSupplier confirm) {
        if (!hasAutoSave()) {
            return null;
        }
        if (confirm != null && confirm.getAsBoolean()) {
            return serializer.loadProject(autoSavePath(), controller);
        }
        clearAutoSave();
        return null;
    }

    public void shutdown() {
        timer.shutdownNow();
    }

    // ===== TIMER =====

    private synchronized void startTimer() {
        if (scheduledTick != null) {
            scheduledTick.cancel(false);
        }
        long interval = config.getAutoSaveIntervalMinutes();
        scheduledTick = timer.scheduleAtFixedRate(this::tick, interval, interval, intervalUnit);
    }

    private synchronized void stopTimer() {
        if (scheduledTick != null) {
            scheduledTick.cancel(false);
            scheduledTick = null;
        }
    }

    private void tick() {
        deferredExecutor.post(() -> {
            if (config.isAutoSaveEnabled()) {
                performAutoSave();
            }
        });
    }

    private void saveSettings() {
        if (settingsFile == null) {
            return;
        }
        try {
            config.save(settingsFile);
        } catch (IOException e) {
            Log.logError(LOG_SCOPE, "could not save settings to " + settingsFile, e);
        }
    }
}
