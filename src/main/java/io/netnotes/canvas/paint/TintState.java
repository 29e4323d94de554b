package io.netnotes.canvas.paint;

import com.google.gson.JsonObject;

import io.netnotes.canvas.utils.JsonHelpers;

/**
 * Colorize effect applied over raster items. Strength is clamped to [0,1].
 */
public class TintState {
    public static final TintState NONE = new TintState(false, ColorHelpers.TRANSPARENT, 0);

    private final boolean enabled;
    private final int color;
    private final double strength;

    public TintState(boolean enabled, int color, double strength){
        this.enabled = enabled;
        this.color = color;
        this.strength = Math.max(0.0, Math.min(1.0, strength));
    }

    public static TintState of(int color, double strength){
        return new TintState(true, color, strength);
    }

    public boolean isEnabled() { return enabled; }
    public int getColor() { return color; }
    public double getStrength() { return strength; }

    public JsonObject toJson(){
        JsonObject json = new JsonObject();
        json.addProperty("enabled", enabled);
        json.addProperty("color", ColorHelpers.toHexArgb(color));
        json.addProperty("strength", strength);
        return json;
    }

    public static TintState fromJson(JsonObject json){
        if(json == null || !JsonHelpers.getBoolean(json, "enabled", false)){
            return NONE;
        }
        return new TintState(true,
            ColorHelpers.parseHexArgb(JsonHelpers.getString(json, "color", null), ColorHelpers.TRANSPARENT),
            JsonHelpers.getDouble(json, "strength", 1.0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TintState other)) return false;
        if (!enabled && !other.enabled) return true;
        return enabled == other.enabled && color == other.color && Math.abs(strength - other.strength) < 1e-9;
    }

    @Override
    public int hashCode() {
        return enabled ? 31 * color + Double.hashCode(strength) : 0;
    }

    @Override
    public String toString() {
        return enabled ? ColorHelpers.toHexArgb(color) + "@" + strength : "none";
    }
}
