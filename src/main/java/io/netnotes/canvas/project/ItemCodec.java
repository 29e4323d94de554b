package io.netnotes.canvas.project;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import io.netnotes.canvas.geometry.Affine2D;
import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemKind;
import io.netnotes.canvas.paint.PaintState;
import io.netnotes.canvas.utils.JsonHelpers;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * JSON form of a single item, children included. Ids are not written; a
 * loaded item gets a fresh one when it is added to the scene.
 */
public class ItemCodec {

    public static JsonObject toJson(CanvasItem item) {
        JsonObject json = new JsonObject();
        json.addProperty("type", item.getKind().getTypeName());
        json.addProperty("x", item.getPosition().getX());
        json.addProperty("y", item.getPosition().getY());
        json.addProperty("z", item.getZValue());
        json.addProperty("visible", item.isVisible());
        json.addProperty("opacity", item.getOpacity());
        if (!item.isSelectable()) json.addProperty("selectable", false);
        if (!item.isMovable()) json.addProperty("movable", false);
        if (!item.getTransform().isIdentity()) json.add("transform", item.getTransform().toJson());
        json.add("paint", item.getPaint().toJson());
        json.add("shape", item.getShape());

        if (item.hasChildren()) {
            JsonArray children = new JsonArray();
            for (CanvasItem child : item.getChildren()) {
                children.add(toJson(child));
            }
            json.add("children", children);
        }
        return json;
    }

    /**
     * @return the item, or null if the type is missing or unknown
     */
    public static CanvasItem fromJson(JsonObject json) {
        if (json == null) {
            return null;
        }

        ItemKind kind = ItemKind.fromTypeName(JsonHelpers.getString(json, "type", null));
        if (kind == null) {
            Log.log("[ItemCodec]", "skipping item of unknown type: " + json.get("type"), LogLevel.HIGH_PRIORITY);
            return null;
        }

        CanvasItem item = new CanvasItem(kind, JsonHelpers.getObject(json, "shape"));
        item.setPosition(new Point2D(JsonHelpers.getDouble(json, "x", 0), JsonHelpers.getDouble(json, "y", 0)));
        item.setZValue(JsonHelpers.getDouble(json, "z", 0));
        item.setVisible(JsonHelpers.getBoolean(json, "visible", true));
        item.setOpacity(JsonHelpers.getDouble(json, "opacity", 1.0));
        item.setSelectable(JsonHelpers.getBoolean(json, "selectable", true));
        item.setMovable(JsonHelpers.getBoolean(json, "movable", true));

        JsonObject transform = JsonHelpers.getObject(json, "transform");
        if (transform != null) item.setTransform(Affine2D.fromJson(transform));

        JsonObject paint = JsonHelpers.getObject(json, "paint");
        if (paint != null) item.setPaint(PaintState.fromJson(paint));

        for (JsonElement element : JsonHelpers.getArray(json, "children")) {
            if (element.isJsonObject()) {
                CanvasItem child = fromJson(element.getAsJsonObject());
                if (child != null) {
                    item.addChild(child);
                }
            }
        }
        return item;
    }
}
