package io.netnotes.canvas.layers;

/**
 * Informational tag; the core treats every layer type the same way.
 */
public enum LayerType {
    VECTOR,
    RASTER,
    MIXED;

    public static LayerType fromOrdinal(int ordinal) {
        LayerType[] types = values();
        return ordinal >= 0 && ordinal < types.length ? types[ordinal] : VECTOR;
    }
}
