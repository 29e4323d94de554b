package io.netnotes.canvas.config;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

import static org.junit.Assert.*;

public class CanvasConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void defaults() {
        CanvasConfig config = new CanvasConfig();
        assertEquals(1000, config.getZOrderStride(), 1e-9);
        assertEquals(0, config.getUndoLimit());
        assertEquals("Background", config.getDefaultLayerName());
        assertEquals("Flattened", config.getFlattenedLayerName());
        assertTrue(config.isAutoSaveEnabled());
        assertEquals(5, config.getAutoSaveIntervalMinutes());
        assertEquals(LogLevel.ALL, config.getLogLevel());
    }

    @Test
    public void fromJson_partialKeepsDefaults() {
        CanvasConfig config = CanvasConfig.fromJson("{ \"undoLimit\": 25, \"logLevel\": \"error\" }");
        assertEquals(25, config.getUndoLimit());
        assertEquals(LogLevel.ERROR, config.getLogLevel());
        assertEquals("Background", config.getDefaultLayerName());
    }

    @Test
    public void fromJson_invalidFallsBackToDefaults() {
        CanvasConfig config = CanvasConfig.fromJson("{ not json");
        assertEquals(0, config.getUndoLimit());
        assertEquals(5, CanvasConfig.fromJson("[1, 2]").getAutoSaveIntervalMinutes());
    }

    @Test
    public void fromJson_clampsOutOfRangeValues() {
        CanvasConfig config = CanvasConfig.fromJson(
            "{ \"autoSaveIntervalMinutes\": 999, \"zOrderStride\": 0, \"undoLimit\": -4 }");
        assertEquals(60, config.getAutoSaveIntervalMinutes());
        assertEquals(1, config.getZOrderStride(), 1e-9);
        assertEquals(0, config.getUndoLimit());
    }

    @Test
    public void saveThenLoad_roundTrips() throws IOException {
        File file = new File(folder.getRoot(), "canvas.json");
        new CanvasConfig()
            .withUndoLimit(10)
            .withDefaultLayerName("Paper")
            .withAutoSaveEnabled(false)
            .withAutoSaveIntervalMinutes(15)
            .withLogLevel(LogLevel.HIGH_PRIORITY)
            .save(file);

        CanvasConfig loaded = CanvasConfig.load(file);
        assertEquals(10, loaded.getUndoLimit());
        assertEquals("Paper", loaded.getDefaultLayerName());
        assertFalse(loaded.isAutoSaveEnabled());
        assertEquals(15, loaded.getAutoSaveIntervalMinutes());
        assertEquals(LogLevel.HIGH_PRIORITY, loaded.getLogLevel());
    }

    @Test
    public void load_missingFileGivesDefaults() throws IOException {
        CanvasConfig config = CanvasConfig.load(new File(folder.getRoot(), "absent.json"));
        assertEquals("Background", config.getDefaultLayerName());
    }

    @Test
    public void loadDefault_readsBundledResource() {
        CanvasConfig config = CanvasConfig.loadDefault();
        assertEquals("Background", config.getDefaultLayerName());
        assertEquals("autosave.ncanvas", config.getAutoSaveFile().getName());
    }

    @Test
    public void applyLogging_setsSharedLogLevel() {
        int previous = Log.getLogLevel();
        try {
            new CanvasConfig()
                .withLogLevel(LogLevel.ERROR)
                .withLogDirectory(folder.getRoot())
                .applyLogging();
            assertTrue(Log.drain(2, TimeUnit.SECONDS));
            assertEquals(LogLevel.ERROR.getValue(), Log.getLogLevel());
        } finally {
            Log.setLogLevel(previous);
            Log.setLogDirectory(new File("logs"));
            Log.drain(2, TimeUnit.SECONDS);
        }
    }
}
