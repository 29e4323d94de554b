package io.netnotes.canvas.actions;

import java.util.Objects;

import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.scene.SceneController;

/**
 * Records that an item was added. Undo takes it off the canvas into the
 * snapshot set; redo brings it back under the same id.
 */
public class CreateAction implements Action {
    private final SceneController controller;
    private final ItemId id;

    // true while the snapshot belongs to this action rather than the live scene
    private boolean ownsSnapshot = false;

    public CreateAction(SceneController controller, ItemId id) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.id = id != null ? id : ItemId.NULL;
    }

    public ItemId getItemId() {
        return id;
    }

    public boolean ownsSnapshot() {
        return ownsSnapshot;
    }

    @Override
    public void undo() {
        if (!ownsSnapshot && controller.removeItem(id, true)) {
            ownsSnapshot = true;
        }
    }

    @Override
    public void redo() {
        if (ownsSnapshot && controller.restoreItem(id)) {
            ownsSnapshot = false;
        }
    }

    @Override
    public void discard() {
        if (ownsSnapshot) {
            controller.itemStore().discardSnapshot(id);
            controller.scheduleDeletionFlush();
            ownsSnapshot = false;
        }
    }

    @Override
    public String description() {
        return "Create";
    }
}
