package io.netnotes.canvas.paint;

import java.util.Objects;

import com.google.gson.JsonObject;

import io.netnotes.canvas.utils.JsonHelpers;

/**
 * Immutable set of paint attributes carried by every canvas item.
 * Kinds that have no use for a channel simply ignore it when painting.
 */
public class PaintState {
    public static final PaintState DEFAULT = new PaintState(ColorHelpers.BLACK, 1.0, null, TintState.NONE, null);

    private final int strokeColor;
    private final double strokeWidth;
    private final Integer fillColor;
    private final TintState tint;
    private final String themeName;

    public PaintState(int strokeColor, double strokeWidth, Integer fillColor, TintState tint, String themeName){
        this.strokeColor = strokeColor;
        this.strokeWidth = strokeWidth;
        this.fillColor = fillColor;
        this.tint = tint != null ? tint : TintState.NONE;
        this.themeName = themeName;
    }

    public int getStrokeColor() { return strokeColor; }
    public double getStrokeWidth() { return strokeWidth; }
    /** null when the item is unfilled */
    public Integer getFillColor() { return fillColor; }
    public TintState getTint() { return tint; }
    public String getThemeName() { return themeName; }

    public PaintState withStroke(int color, double width){
        return new PaintState(color, width, fillColor, tint, themeName);
    }

    public PaintState withFill(Integer color){
        return new PaintState(strokeColor, strokeWidth, color, tint, themeName);
    }

    public PaintState withTint(TintState tint){
        return new PaintState(strokeColor, strokeWidth, fillColor, tint, themeName);
    }

    public PaintState withTheme(String themeName){
        return new PaintState(strokeColor, strokeWidth, fillColor, tint, themeName);
    }

    public JsonObject toJson(){
        JsonObject json = new JsonObject();
        JsonObject stroke = new JsonObject();
        stroke.addProperty("color", ColorHelpers.toHexArgb(strokeColor));
        stroke.addProperty("width", strokeWidth);
        json.add("pen", stroke);
        if(fillColor != null){
            JsonObject fill = new JsonObject();
            fill.addProperty("color", ColorHelpers.toHexArgb(fillColor));
            json.add("brush", fill);
        }
        if(tint.isEnabled()){
            json.add("tint", tint.toJson());
        }
        if(themeName != null){
            json.addProperty("theme", themeName);
        }
        return json;
    }

    public static PaintState fromJson(JsonObject json){
        if(json == null){
            return DEFAULT;
        }
        JsonObject stroke = JsonHelpers.getObject(json, "pen");
        JsonObject fill = JsonHelpers.getObject(json, "brush");
        JsonObject tint = JsonHelpers.getObject(json, "tint");

        int strokeColor = ColorHelpers.parseHexArgb(JsonHelpers.getString(stroke, "color", null), ColorHelpers.BLACK);
        double strokeWidth = JsonHelpers.getDouble(stroke, "width", 1.0);
        Integer fillColor = fill != null ? ColorHelpers.parseHexArgb(JsonHelpers.getString(fill, "color", null), ColorHelpers.TRANSPARENT) : null;

        return new PaintState(strokeColor, strokeWidth, fillColor, TintState.fromJson(tint), JsonHelpers.getString(json, "theme", null));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PaintState other)) return false;
        return strokeColor == other.strokeColor
            && Double.compare(strokeWidth, other.strokeWidth) == 0
            && Objects.equals(fillColor, other.fillColor)
            && tint.equals(other.tint)
            && Objects.equals(themeName, other.themeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strokeColor, strokeWidth, fillColor, tint, themeName);
    }

    @Override
    public String toString() {
        return "PaintState[stroke=" + ColorHelpers.toHexArgb(strokeColor) + "/" + strokeWidth
            + ", fill=" + (fillColor != null ? ColorHelpers.toHexArgb(fillColor) : "none")
            + ", tint=" + tint + ", theme=" + themeName + "]";
    }
}
