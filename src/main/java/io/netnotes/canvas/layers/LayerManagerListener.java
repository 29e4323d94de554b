package io.netnotes.canvas.layers;

public interface LayerManagerListener {

    default void layerAdded(Layer layer) {
    }

    default void layerRemoved(Layer layer) {
    }

    default void activeLayerChanged(Layer layer) {
    }

    /** name, visibility, lock, opacity or blend mode changed */
    default void layerChanged(Layer layer) {
    }

    default void layerOrderChanged() {
    }

    default void itemOrderChanged() {
    }
}
