package io.netnotes.canvas.project;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.layers.BlendMode;
import io.netnotes.canvas.layers.Layer;
import io.netnotes.canvas.layers.LayerManager;
import io.netnotes.canvas.layers.LayerType;
import io.netnotes.canvas.scene.SceneController;
import io.netnotes.canvas.utils.JsonHelpers;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * ProjectSerializer - Reads and writes {@value #FILE_EXTENSION} project files
 *
 * FORMAT (JSON):
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "application": "NetnotesCanvas",
 *   "canvas": { "x", "y", "width", "height", "backgroundColor": "#aarrggbb" },
 *   "layers": [ { "name", "type", "visible", "locked", "opacity", "blendMode",
 *                 "items": [ ...ItemCodec... ] } ],   bottom to top
 *   "activeLayer": 0
 * }
 * </pre>
 *
 * Ids are not persisted. Layer order, layer properties and item state are.
 *
 * Saving goes to a temp file that then replaces the target, so a failed save
 * leaves the previous file intact. Loading validates the whole document
 * before the current scene is touched.
 */
public class ProjectSerializer {
    private static final String LOG_SCOPE = "[ProjectSerializer]";

    public static final String FILE_EXTENSION = ".ncanvas";
    public static final int FORMAT_VERSION = 1;
    public static final String APPLICATION = "NetnotesCanvas";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Adds {@value #FILE_EXTENSION} to a file that has no extension.
     */
    public static File withExtension(File file) {
        if (FilenameUtils.getExtension(file.getName()).isEmpty()) {
            return new File(file.getPath() + FILE_EXTENSION);
        }
        return file;
    }

    public static boolean isProjectFile(File file) {
        return file != null && FilenameUtils.isExtension(file.getName(), FILE_EXTENSION.substring(1));
    }

    // ===== SAVE =====

    public JsonObject toJson(SceneController controller, CanvasProperties properties) {
        LayerManager layerManager = controller.layerManager();
        CanvasProperties canvas = properties != null ? properties : new CanvasProperties();

        JsonObject root = new JsonObject();
        root.addProperty("formatVersion", FORMAT_VERSION);
        root.addProperty("application", APPLICATION);
        root.add("canvas", canvas.toJson());

        JsonArray layersArray = new JsonArray();
        for (Layer layer : layerManager.getLayers()) {
            JsonObject layerJson = new JsonObject();
            layerJson.addProperty("name", layer.getName());
            layerJson.addProperty("type", layer.getType().ordinal());
            layerJson.addProperty("visible", layer.isVisible());
            layerJson.addProperty("locked", layer.isLocked());
            layerJson.addProperty("opacity", layer.getOpacity());
            layerJson.addProperty("blendMode", layer.getBlendMode().name());

            JsonArray itemsArray = new JsonArray();
            for (ItemId id : layer.itemIds()) {
                CanvasItem item = controller.item(id);
                if (item != null) {
                    itemsArray.add(ItemCodec.toJson(item));
                }
            }
            layerJson.add("items", itemsArray);
            layersArray.add(layerJson);
        }
        root.add("layers", layersArray);
        root.addProperty("activeLayer", layerManager.activeLayerIndex());
        return root;
    }

    /**
     * @return false if the file could not be written; the previous file, if
     *         any, is left untouched in that case
     */
    public boolean saveProject(File file, SceneController controller, CanvasProperties properties) {
        if (file == null || controller == null) {
            return false;
        }

        File target = file.getAbsoluteFile();
        File tmpFile = new File(target.getParentFile(), target.getName() + ".tmp");

        try {
            JsonObject root = toJson(controller, properties);
            FileUtils.writeStringToFile(tmpFile, gson.toJson(root), StandardCharsets.UTF_8);
            moveIntoPlace(tmpFile, target);
            Log.logJson(LOG_SCOPE, saveSummary(target, root), LogLevel.GENERAL);
            return true;
        } catch (IOException | RuntimeException e) {
            Log.logError(LOG_SCOPE, "failed to save " + target, e);
            FileUtils.deleteQuietly(tmpFile);
            return false;
        }
    }

    private static JsonObject saveSummary(File target, JsonObject root) {
        JsonArray layers = root.getAsJsonArray("layers");
        int items = 0;
        for (JsonElement layer : layers) {
            items += layer.getAsJsonObject().getAsJsonArray("items").size();
        }

        JsonObject summary = new JsonObject();
        summary.addProperty("saved", target.getName());
        summary.addProperty("layers", layers.size());
        summary.addProperty("items", items);
        summary.addProperty("activeLayer", root.get("activeLayer").getAsInt());
        return summary;
    }

    private static void moveIntoPlace(File tmpFile, File target) throws IOException {
        try {
            Files.move(tmpFile.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmpFile.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ===== LOAD =====

    /**
     * Replace the controller's scene with the project in {@code file}.
     *
     * @return the project's canvas properties, or null if the file is missing,
     *         unreadable, malformed or from an unsupported format version; the
     *         current scene is untouched in every such case
     */
    public CanvasProperties loadProject(File file, SceneController controller) {
        if (file == null || controller == null || !file.isFile()) {
            return null;
        }

        JsonObject root;
        try {
            root = parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            Log.logError(LOG_SCOPE, "failed to read " + file, e);
            return null;
        }
        if (root == null) {
            Log.log(LOG_SCOPE, "not a project file: " + file.getName(), LogLevel.HIGH_PRIORITY);
            return null;
        }

        int version = JsonHelpers.getInt(root, "formatVersion", 0);
        if (version < 1 || version > FORMAT_VERSION) {
            Log.log(LOG_SCOPE, "unsupported format version " + version + " in " + file.getName(), LogLevel.HIGH_PRIORITY);
            return null;
        }

        CanvasProperties properties = CanvasProperties.fromJson(JsonHelpers.getObject(root, "canvas"));
        LayerManager layerManager = controller.layerManager();

        controller.clearAll();
        layerManager.clear();

        int loadedItems = 0;
        int layerIndex = 0;
        for (JsonElement element : JsonHelpers.getArray(root, "layers")) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject layerJson = element.getAsJsonObject();
            String name = JsonHelpers.getString(layerJson, "name", "Layer " + (layerIndex + 1));
            LayerType type = LayerType.fromOrdinal(JsonHelpers.getInt(layerJson, "type", 0));

            Layer layer;
            if (layerIndex == 0) {
                layer = layerManager.layer(0);
                layer.setName(name);
                layer.setType(type);
            } else {
                layer = layerManager.createLayer(name, type);
            }

            layer.setVisible(JsonHelpers.getBoolean(layerJson, "visible", true));
            layer.setLocked(JsonHelpers.getBoolean(layerJson, "locked", false));
            layer.setOpacity(JsonHelpers.getDouble(layerJson, "opacity", 1.0));
            layer.setBlendMode(BlendMode.fromName(JsonHelpers.getString(layerJson, "blendMode", null)));

            loadedItems += loadItems(JsonHelpers.getArray(layerJson, "items"), layer, controller);
            layerIndex++;
        }

        int active = JsonHelpers.getInt(root, "activeLayer", 0);
        layerManager.setActiveLayer(Math.max(0, Math.min(active, layerManager.layerCount() - 1)));

        Log.log(LOG_SCOPE, "loaded " + file.getName() + ": " + layerManager.layerCount() + " layer(s), "
            + loadedItems + " item(s)", LogLevel.GENERAL);
        return properties;
    }

    private static int loadItems(JsonArray items, Layer layer, SceneController controller) {
        int count = 0;
        for (JsonElement element : items) {
            if (!element.isJsonObject()) {
                continue;
            }
            CanvasItem item = ItemCodec.fromJson(element.getAsJsonObject());
            if (item != null && controller.addItem(item, layer).isValid()) {
                count++;
            }
        }
        return count;
    }

    private static JsonObject parse(String text) {
        try {
            JsonElement element = JsonParser.parseString(text);
            return element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            Log.logError(LOG_SCOPE, "malformed project json", e);
            return null;
        }
    }
}
