package io.netnotes.canvas.actions;

import java.util.Objects;

import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.scene.SceneController;

/**
 * Records that an item was removed with its snapshot kept. The action owns
 * the snapshot until an undo hands the item back to the scene.
 *
 * <pre>
 * controller.removeItem(id, true);
 * undoStack.push(new DeleteAction(controller, id));
 * </pre>
 */
public class DeleteAction implements Action {
    private final SceneController controller;
    private final ItemId id;

    private boolean ownsSnapshot = true;

    public DeleteAction(SceneController controller, ItemId id) {
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
        if (ownsSnapshot && controller.restoreItem(id)) {
            ownsSnapshot = false;
        }
    }

    @Override
    public void redo() {
        if (!ownsSnapshot && controller.removeItem(id, true)) {
            ownsSnapshot = true;
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
        return "Delete";
    }
}
