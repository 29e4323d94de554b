package io.netnotes.canvas.actions;

import java.util.Objects;

import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.paint.PaintAttribute;
import io.netnotes.canvas.scene.SceneController;

/**
 * Recolor of one paint channel. Before and after are values of the same
 * {@link PaintAttribute.Channel}, so undo needs no knowledge of the item kind.
 */
public class FillAction implements Action {
    private final SceneController controller;
    private final ItemId id;
    private final PaintAttribute before;
    private final PaintAttribute after;

    public FillAction(SceneController controller, ItemId id, PaintAttribute before, PaintAttribute after) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.id = id != null ? id : ItemId.NULL;
        this.before = Objects.requireNonNull(before, "before");
        this.after = Objects.requireNonNull(after, "after");
        if (before.getChannel() != after.getChannel()) {
            throw new IllegalArgumentException("paint channels differ: " + before.getChannel() + " / " + after.getChannel());
        }
    }

    /**
     * Apply {@code after} to the item and return the action that reverses it,
     * or null if the id does not resolve.
     */
    public static FillAction apply(SceneController controller, ItemId id, PaintAttribute after) {
        CanvasItem item = controller.item(id);
        if (item == null) {
            return null;
        }
        PaintAttribute before = after.captureFrom(item.getPaint());
        controller.applyPaint(id, after);
        return new FillAction(controller, id, before, after);
    }

    public ItemId getItemId() {
        return id;
    }

    public PaintAttribute getBefore() {
        return before;
    }

    public PaintAttribute getAfter() {
        return after;
    }

    @Override
    public void undo() {
        controller.applyPaint(id, before);
    }

    @Override
    public void redo() {
        controller.applyPaint(id, after);
    }

    @Override
    public String description() {
        return "Change " + after.getChannel().name().toLowerCase();
    }
}
