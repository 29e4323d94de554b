package io.netnotes.canvas.actions;

import java.util.Objects;

import io.netnotes.canvas.geometry.Affine2D;
import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.scene.SceneController;

/**
 * Scale, rotate or skew of one item. Position is recorded alongside the
 * transform since transforming about a center moves the item as well.
 */
public class TransformAction implements Action {
    private final SceneController controller;
    private final ItemId id;
    private final Affine2D oldTransform;
    private final Affine2D newTransform;
    private final Point2D oldPosition;
    private final Point2D newPosition;

    public TransformAction(SceneController controller, ItemId id, Affine2D oldTransform, Affine2D newTransform,
            Point2D oldPosition, Point2D newPosition) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.id = id != null ? id : ItemId.NULL;
        this.oldTransform = oldTransform != null ? oldTransform : Affine2D.IDENTITY;
        this.newTransform = newTransform != null ? newTransform : Affine2D.IDENTITY;
        this.oldPosition = oldPosition;
        this.newPosition = newPosition;
    }

    public TransformAction(SceneController controller, ItemId id, Affine2D oldTransform, Affine2D newTransform) {
        this(controller, id, oldTransform, newTransform, null, null);
    }

    public ItemId getItemId() {
        return id;
    }

    @Override
    public void undo() {
        apply(oldTransform, oldPosition);
    }

    @Override
    public void redo() {
        apply(newTransform, newPosition);
    }

    private void apply(Affine2D transform, Point2D position) {
        if (controller.transformItem(id, transform) && position != null) {
            controller.moveItem(id, position);
        }
    }

    @Override
    public String description() {
        return "Transform";
    }
}
