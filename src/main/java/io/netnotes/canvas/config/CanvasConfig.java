package io.netnotes.canvas.config;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import io.netnotes.canvas.utils.JsonHelpers;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * CanvasConfig - Settings for the canvas core
 *
 * Builder style: every {@code withX} returns this. Missing keys in a JSON
 * source keep their defaults, so a partial file is always valid.
 */
public class CanvasConfig {
    public static final String DEFAULT_RESOURCE = "/netnotes-canvas.json";

    public static final String Z_ORDER_STRIDE = "zOrderStride";
    public static final String UNDO_LIMIT = "undoLimit";
    public static final String DEFAULT_LAYER_NAME = "defaultLayerName";
    public static final String FLATTENED_LAYER_NAME = "flattenedLayerName";
    public static final String AUTO_SAVE_ENABLED = "autoSaveEnabled";
    public static final String AUTO_SAVE_INTERVAL_MINUTES = "autoSaveIntervalMinutes";
    public static final String AUTO_SAVE_FILE = "autoSaveFile";
    public static final String LOG_LEVEL = "logLevel";
    public static final String LOG_DIRECTORY = "logDirectory";

    public static final int MIN_AUTO_SAVE_MINUTES = 1;
    public static final int MAX_AUTO_SAVE_MINUTES = 60;

    private double zOrderStride = 1000.0;
    private int undoLimit = 0;
    private String defaultLayerName = "Background";
    private String flattenedLayerName = "Flattened";
    private boolean autoSaveEnabled = true;
    private int autoSaveIntervalMinutes = 5;
    private File autoSaveFile = new File("autosave.ncanvas");
    private LogLevel logLevel = LogLevel.ALL;
    private File logDirectory = new File("logs");

    public CanvasConfig() {
    }

    public CanvasConfig(JsonObject json) {
        if (json == null) {
            return;
        }
        zOrderStride = JsonHelpers.getDouble(json, Z_ORDER_STRIDE, zOrderStride);
        undoLimit = JsonHelpers.getInt(json, UNDO_LIMIT, undoLimit);
        defaultLayerName = JsonHelpers.getString(json, DEFAULT_LAYER_NAME, defaultLayerName);
        flattenedLayerName = JsonHelpers.getString(json, FLATTENED_LAYER_NAME, flattenedLayerName);
        autoSaveEnabled = JsonHelpers.getBoolean(json, AUTO_SAVE_ENABLED, autoSaveEnabled);
        withAutoSaveIntervalMinutes(JsonHelpers.getInt(json, AUTO_SAVE_INTERVAL_MINUTES, autoSaveIntervalMinutes));

        String autoSavePath = JsonHelpers.getString(json, AUTO_SAVE_FILE, null);
        if (autoSavePath != null && !autoSavePath.isBlank()) autoSaveFile = new File(autoSavePath);

        logLevel = LogLevel.fromName(JsonHelpers.getString(json, LOG_LEVEL, null), logLevel);

        String logDir = JsonHelpers.getString(json, LOG_DIRECTORY, null);
        if (logDir != null && !logDir.isBlank()) logDirectory = new File(logDir);

        if (zOrderStride < 1) zOrderStride = 1;
        if (undoLimit < 0) undoLimit = 0;
    }

    // ===== LOADING =====

    public static CanvasConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new CanvasConfig();
        }
        try {
            JsonElement element = JsonParser.parseString(json);
            return new CanvasConfig(element.isJsonObject() ? element.getAsJsonObject() : null);
        } catch (JsonParseException e) {
            Log.logError("[CanvasConfig]", "invalid config json, using defaults", e);
            return new CanvasConfig();
        }
    }

    /**
     * Reads a config file. A missing file yields the defaults.
     *
     * @throws IOException if the file exists but cannot be read
     */
    public static CanvasConfig load(File file) throws IOException {
        if (file == null || !file.isFile()) {
            return new CanvasConfig();
        }
        return fromJson(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    }

    /**
     * Reads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if it is absent.
     */
    public static CanvasConfig loadDefault() {
        try (InputStream in = CanvasConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return new CanvasConfig();
            }
            return fromJson(IOUtils.toString(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            Log.logError("[CanvasConfig]", "could not read " + DEFAULT_RESOURCE, e);
            return new CanvasConfig();
        }
    }

    public void save(File file) throws IOException {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        FileUtils.writeStringToFile(file, gson.toJson(toJson()), StandardCharsets.UTF_8);
    }

    /**
     * Points the shared log at this config's level and directory.
     */
    public void applyLogging() {
        Log.setLogLevel(logLevel);
        Log.setLogDirectory(logDirectory);
    }

    // ===== BUILDER STYLE =====

    public CanvasConfig withZOrderStride(double stride) {
        this.zOrderStride = Math.max(1, stride);
        return this;
    }

    public CanvasConfig withUndoLimit(int undoLimit) {
        this.undoLimit = Math.max(0, undoLimit);
        return this;
    }

    public CanvasConfig withDefaultLayerName(String name) {
        this.defaultLayerName = name;
        return this;
    }

    public CanvasConfig withFlattenedLayerName(String name) {
        this.flattenedLayerName = name;
        return this;
    }

    public CanvasConfig withAutoSaveEnabled(boolean enabled) {
        this.autoSaveEnabled = enabled;
        return this;
    }

    public CanvasConfig withAutoSaveIntervalMinutes(int minutes) {
        this.autoSaveIntervalMinutes = clampInterval(minutes);
        return this;
    }

    public CanvasConfig withAutoSaveFile(File file) {
        this.autoSaveFile = file;
        return this;
    }

    public CanvasConfig withLogLevel(LogLevel level) {
        this.logLevel = level;
        return this;
    }

    public CanvasConfig withLogDirectory(File dir) {
        this.logDirectory = dir;
        return this;
    }

    public static int clampInterval(int minutes) {
        return Math.max(MIN_AUTO_SAVE_MINUTES, Math.min(MAX_AUTO_SAVE_MINUTES, minutes));
    }

    // ===== GETTERS =====

    public double getZOrderStride() { return zOrderStride; }
    public int getUndoLimit() { return undoLimit; }
    public String getDefaultLayerName() { return defaultLayerName; }
    public String getFlattenedLayerName() { return flattenedLayerName; }
    public boolean isAutoSaveEnabled() { return autoSaveEnabled; }
    public int getAutoSaveIntervalMinutes() { return autoSaveIntervalMinutes; }
    public File getAutoSaveFile() { return autoSaveFile; }
    public LogLevel getLogLevel() { return logLevel; }
    public File getLogDirectory() { return logDirectory; }

    // ===== SERIALIZATION =====

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty(Z_ORDER_STRIDE, zOrderStride);
        json.addProperty(UNDO_LIMIT, undoLimit);
        json.addProperty(DEFAULT_LAYER_NAME, defaultLayerName);
        json.addProperty(FLATTENED_LAYER_NAME, flattenedLayerName);
        json.addProperty(AUTO_SAVE_ENABLED, autoSaveEnabled);
        json.addProperty(AUTO_SAVE_INTERVAL_MINUTES, autoSaveIntervalMinutes);
        if (autoSaveFile != null) json.addProperty(AUTO_SAVE_FILE, autoSaveFile.getPath());
        json.addProperty(LOG_LEVEL, logLevel.name());
        if (logDirectory != null) json.addProperty(LOG_DIRECTORY, logDirectory.getPath());
        return json;
    }
}
