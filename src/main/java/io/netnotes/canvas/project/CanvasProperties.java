package io.netnotes.canvas.project;

import com.google.gson.JsonObject;

import io.netnotes.canvas.paint.ColorHelpers;
import io.netnotes.canvas.utils.JsonHelpers;

/**
 * Scene rectangle and background color stored with a project.
 */
public class CanvasProperties {
    public static final double DEFAULT_WIDTH = 1920;
    public static final double DEFAULT_HEIGHT = 1080;

    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final int backgroundColor;

    public CanvasProperties() {
        this(0, 0, DEFAULT_WIDTH, DEFAULT_HEIGHT, ColorHelpers.WHITE);
    }

    public CanvasProperties(double x, double y, double width, double height, int backgroundColor) {
        this.x = x;
        this.y = y;
        this.width = width > 0 ? width : DEFAULT_WIDTH;
        this.height = height > 0 ? height : DEFAULT_HEIGHT;
        this.backgroundColor = backgroundColor;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public int getBackgroundColor() { return backgroundColor; }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("x", x);
        json.addProperty("y", y);
        json.addProperty("width", width);
        json.addProperty("height", height);
        json.addProperty("backgroundColor", ColorHelpers.toHexArgb(backgroundColor));
        return json;
    }

    public static CanvasProperties fromJson(JsonObject json) {
        if (json == null) {
            return new CanvasProperties();
        }
        return new CanvasProperties(
            JsonHelpers.getDouble(json, "x", 0),
            JsonHelpers.getDouble(json, "y", 0),
            JsonHelpers.getDouble(json, "width", DEFAULT_WIDTH),
            JsonHelpers.getDouble(json, "height", DEFAULT_HEIGHT),
            ColorHelpers.parseHexArgb(JsonHelpers.getString(json, "backgroundColor", null), ColorHelpers.WHITE)
        );
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CanvasProperties other)) return false;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
            && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0
            && backgroundColor == other.backgroundColor;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return 31 * result + backgroundColor;
    }
}
