package io.netnotes.canvas.actions;

import java.util.Objects;

import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.scene.SceneController;

public class MoveAction implements Action {
    private final SceneController controller;
    private final ItemId id;
    private final Point2D oldPosition;
    private final Point2D newPosition;

    public MoveAction(SceneController controller, ItemId id, Point2D oldPosition, Point2D newPosition) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.id = id != null ? id : ItemId.NULL;
        this.oldPosition = oldPosition != null ? oldPosition : Point2D.ORIGIN;
        this.newPosition = newPosition != null ? newPosition : Point2D.ORIGIN;
    }

    public ItemId getItemId() {
        return id;
    }

    @Override
    public void undo() {
        controller.moveItem(id, oldPosition);
    }

    @Override
    public void redo() {
        controller.moveItem(id, newPosition);
    }

    @Override
    public String description() {
        return "Move";
    }
}
