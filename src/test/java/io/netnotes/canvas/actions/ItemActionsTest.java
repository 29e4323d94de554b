package io.netnotes.canvas.actions;

import org.junit.Before;
import org.junit.Test;

import io.netnotes.canvas.geometry.Affine2D;
import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.items.ItemKind;
import io.netnotes.canvas.items.SceneSurface;
import io.netnotes.canvas.layers.Layer;
import io.netnotes.canvas.layers.LayerType;
import io.netnotes.canvas.paint.ColorHelpers;
import io.netnotes.canvas.paint.PaintAttribute;
import io.netnotes.canvas.paint.PaintState;
import io.netnotes.canvas.scene.PendingTaskQueue;
import io.netnotes.canvas.scene.SceneController;

import static org.junit.Assert.*;

public class ItemActionsTest {

    private PendingTaskQueue pending;
    private SceneController controller;
    private UndoStack stack;

    @Before
    public void setUp() {
        pending = new PendingTaskQueue();
        controller = new SceneController(SceneSurface.NONE, pending);
        stack = controller.undoStack();
    }

    @Test
    public void moveActions_undoAndRedoInOrder() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);

        controller.moveItem(id, new Point2D(10, 10));
        stack.push(new MoveAction(controller, id, new Point2D(0, 0), new Point2D(10, 10)));
        controller.moveItem(id, new Point2D(20, 20));
        stack.push(new MoveAction(controller, id, new Point2D(10, 10), new Point2D(20, 20)));

        stack.undo();
        stack.undo();
        assertEquals(new Point2D(0, 0), item.getPosition());

        stack.redo();
        stack.redo();
        assertEquals(new Point2D(20, 20), item.getPosition());
    }

    @Test
    public void createAction_undoSnapshotsAndRedoRestoresSameId() {
        CanvasItem item = new CanvasItem(ItemKind.PATH);
        ItemId id = controller.addItem(item);
        CreateAction create = new CreateAction(controller, id);
        stack.push(create);

        stack.undo();
        assertNull(controller.item(id));
        assertTrue(create.ownsSnapshot());
        assertTrue(controller.itemStore().hasSnapshot(id));
        pending.runPending();
        assertFalse(item.isDisposed());

        stack.redo();
        assertSame(item, controller.item(id));
        assertFalse(create.ownsSnapshot());
        assertTrue(controller.layerManager().activeLayer().containsItem(id));
    }

    @Test
    public void createAction_droppedFromRedoStackDestroysItem() {
        CanvasItem item = new CanvasItem(ItemKind.PATH);
        ItemId id = controller.addItem(item);
        stack.push(new CreateAction(controller, id));
        stack.undo();

        ItemId other = controller.addItem(new CanvasItem(ItemKind.RECT));
        stack.push(new CreateAction(controller, other));
        pending.runPending();

        assertTrue(item.isDisposed());
        assertFalse(controller.itemStore().hasSnapshot(id));
        assertFalse(controller.restoreItem(id));
    }

    @Test
    public void deleteAction_restoresIntoOriginalLayer() {
        Layer upper = controller.layerManager().createLayer("Upper", LayerType.VECTOR);
        CanvasItem item = new CanvasItem(ItemKind.ELLIPSE);
        ItemId id = controller.addItem(item, upper);

        controller.removeItem(id, true);
        DeleteAction delete = new DeleteAction(controller, id);
        stack.push(delete);
        pending.runPending();
        assertNull(controller.item(id));

        stack.undo();
        assertSame(item, controller.item(id));
        assertTrue(upper.containsItem(id));
        assertFalse(delete.ownsSnapshot());

        stack.redo();
        assertNull(controller.item(id));
        assertTrue(delete.ownsSnapshot());
        assertFalse(upper.containsItem(id));
    }

    @Test
    public void transformAction_restoresTransformAndPosition() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);
        Affine2D scaled = Affine2D.scaling(2, 2);

        controller.transformItem(id, scaled);
        controller.moveItem(id, new Point2D(-5, -5));
        stack.push(new TransformAction(controller, id, Affine2D.IDENTITY, scaled, Point2D.ORIGIN, new Point2D(-5, -5)));

        stack.undo();
        assertTrue(item.getTransform().isIdentity());
        assertEquals(Point2D.ORIGIN, item.getPosition());

        stack.redo();
        assertEquals(scaled, item.getTransform());
        assertEquals(new Point2D(-5, -5), item.getPosition());
    }

    @Test
    public void fillAction_swapsOnlyItsChannel() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);
        controller.applyPaint(id, PaintAttribute.stroke(ColorHelpers.WHITE, 3));
        PaintState before = item.getPaint();

        FillAction fill = FillAction.apply(controller, id, PaintAttribute.fill(0xFFFF0000));
        stack.push(fill);
        assertEquals(Integer.valueOf(0xFFFF0000), item.getPaint().getFillColor());

        stack.undo();
        assertEquals(before, item.getPaint());

        stack.redo();
        assertEquals(Integer.valueOf(0xFFFF0000), item.getPaint().getFillColor());
        assertEquals(ColorHelpers.WHITE, item.getPaint().getStrokeColor());
    }

    @Test
    public void fillAction_unresolvedIdYieldsNoAction() {
        assertNull(FillAction.apply(controller, ItemId.generate(), PaintAttribute.noFill()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fillAction_rejectsMismatchedChannels() {
        new FillAction(controller, ItemId.generate(), PaintAttribute.noFill(), PaintAttribute.theme("dark"));
    }

    @Test
    public void compositeOfCreateAndFill_undoesCleanly() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);
        CompositeAction composite = new CompositeAction("Stamp")
            .addAction(new CreateAction(controller, id))
            .addAction(FillAction.apply(controller, id, PaintAttribute.fill(ColorHelpers.BLACK)));
        stack.push(composite);

        stack.undo();
        assertNull(controller.item(id));
        assertNull(item.getPaint().getFillColor());

        stack.redo();
        assertSame(item, controller.item(id));
        assertEquals(Integer.valueOf(ColorHelpers.BLACK), item.getPaint().getFillColor());
    }

    @Test
    public void actions_onFlushedItemAreHarmless() {
        ItemId id = controller.addItem(new CanvasItem(ItemKind.RECT));
        MoveAction move = new MoveAction(controller, id, Point2D.ORIGIN, new Point2D(1, 1));
        controller.removeItem(id, false);
        pending.runPending();

        move.undo();
        move.redo();
        assertNull(controller.item(id));
    }
}
