package io.netnotes.canvas.layers;

/**
 * How a layer composites onto the layers beneath it. Stored and persisted by
 * the core, applied by the renderer.
 */
public enum BlendMode {
    NORMAL,
    MULTIPLY,
    SCREEN,
    OVERLAY,
    DARKEN,
    LIGHTEN,
    COLOR_DODGE,
    COLOR_BURN,
    HARD_LIGHT,
    SOFT_LIGHT,
    DIFFERENCE,
    EXCLUSION;

    public static BlendMode fromName(String name) {
        if (name != null) {
            for (BlendMode mode : values()) {
                if (mode.name().equalsIgnoreCase(name)) {
                    return mode;
                }
            }
        }
        return NORMAL;
    }
}
