package io.netnotes.canvas.scene;

import io.netnotes.canvas.items.ItemId;

public interface SceneListener {

    default void itemAdded(ItemId id) {
    }

    /** the id no longer resolves when this is called */
    default void itemRemoved(ItemId id) {
    }

    default void itemModified(ItemId id) {
    }

    default void itemRestored(ItemId id) {
    }
}
