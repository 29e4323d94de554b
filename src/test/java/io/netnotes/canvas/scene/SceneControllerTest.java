package io.netnotes.canvas.scene;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import io.netnotes.canvas.geometry.Affine2D;
import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.items.ItemKind;
import io.netnotes.canvas.items.ItemRef;
import io.netnotes.canvas.items.RecordingSurface;
import io.netnotes.canvas.layers.Layer;
import io.netnotes.canvas.layers.LayerType;
import io.netnotes.canvas.paint.PaintAttribute;
import io.netnotes.canvas.paint.TintState;

import static org.junit.Assert.*;

public class SceneControllerTest {

    private RecordingSurface surface;
    private PendingTaskQueue pending;
    private SceneController controller;
    private List<String> events;

    @Before
    public void setUp() {
        surface = new RecordingSurface();
        pending = new PendingTaskQueue();
        controller = new SceneController(surface, pending);
        events = new ArrayList<>();
        controller.addListener(new SceneListener() {
            @Override
            public void itemAdded(ItemId id) {
                events.add("added");
            }

            @Override
            public void itemRemoved(ItemId id) {
                events.add("removed");
            }

            @Override
            public void itemModified(ItemId id) {
                events.add("modified");
            }

            @Override
            public void itemRestored(ItemId id) {
                events.add("restored");
            }
        });
    }

    @Test
    public void addItem_registersAndJoinsActiveLayer() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);

        assertTrue(id.isValid());
        assertSame(item, controller.item(id));
        assertEquals(id, controller.idForItem(item));
        assertTrue(controller.layerManager().activeLayer().containsItem(id));
        assertTrue(surface.contains(item));
        assertEquals(Arrays.asList("added"), events);
    }

    @Test
    public void addItem_intoNamedLayer() {
        Layer top = controller.layerManager().createLayer("Top", LayerType.VECTOR);
        ItemId id = controller.addItem(new CanvasItem(ItemKind.PATH), top);

        assertTrue(top.containsItem(id));
        assertFalse(controller.layerManager().layer(0).containsItem(id));
    }

    @Test
    public void removeItem_defersDestructionToPostedFlush() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);

        assertTrue(controller.removeItem(id, false));

        assertNull(controller.item(id));
        assertFalse(controller.layerManager().activeLayer().containsItem(id));
        assertFalse(item.isDisposed());
        assertTrue(controller.isFlushScheduled());

        pending.runPending();
        assertTrue(item.isDisposed());
        assertFalse(controller.isFlushScheduled());
    }

    @Test
    public void removeItem_coalescesFlushesWithinOneDispatch() {
        ItemId a = controller.addItem(new CanvasItem(ItemKind.RECT));
        ItemId b = controller.addItem(new CanvasItem(ItemKind.RECT));
        ItemId c = controller.addItem(new CanvasItem(ItemKind.RECT));

        controller.removeItem(a, false);
        controller.removeItem(b, false);
        controller.removeItem(c, true);

        assertEquals(1, pending.pendingCount());
        pending.runPending();
        assertEquals(0, controller.itemStore().pendingDeletionCount());
        assertTrue(controller.itemStore().hasSnapshot(c));
    }

    @Test
    public void removeItem_unknownOrRemovedIdFails() {
        ItemId id = controller.addItem(new CanvasItem(ItemKind.RECT));
        assertTrue(controller.removeItem(id));
        assertFalse(controller.removeItem(id));
        assertFalse(controller.removeItem(ItemId.generate()));
        assertFalse(controller.removeItem(null, true));
    }

    @Test
    public void restoreItem_returnsToOriginalLayer() {
        Layer top = controller.layerManager().createLayer("Top", LayerType.VECTOR);
        ItemId id = controller.addItem(new CanvasItem(ItemKind.PATH), top);

        controller.removeItem(id, true);
        assertTrue(controller.restoreItem(id));

        assertTrue(top.containsItem(id));
        assertEquals(Arrays.asList("added", "removed", "restored"), events);
    }

    @Test
    public void restoreItem_fallsBackToActiveLayerWhenOriginalIsGone() {
        Layer top = controller.layerManager().createLayer("Top", LayerType.VECTOR);
        ItemId id = controller.addItem(new CanvasItem(ItemKind.PATH), top);
        controller.removeItem(id, true);
        controller.layerManager().deleteLayer(top.getId());

        assertTrue(controller.restoreItem(id));
        assertTrue(controller.layerManager().activeLayer().containsItem(id));
    }

    @Test
    public void addItem_ofSnapshottedItemForgetsOldLayer() {
        Layer bottom = controller.layerManager().layer(0);
        Layer top = controller.layerManager().createLayer("Top", LayerType.VECTOR);
        CanvasItem item = new CanvasItem(ItemKind.PATH);
        ItemId id = controller.addItem(item, bottom);
        controller.removeItem(id, true);

        assertEquals(id, controller.addItem(item, top));
        assertTrue(top.containsItem(id));
        assertFalse(bottom.containsItem(id));

        controller.layerManager().setActiveLayer(top.getId());
        controller.itemStore().scheduleDelete(id, true);
        assertTrue(controller.restoreItem(id));

        assertTrue(top.containsItem(id));
        assertFalse(bottom.containsItem(id));
    }

    @Test
    public void restoreItem_afterFlushFails() {
        ItemId id = controller.addItem(new CanvasItem(ItemKind.PATH));
        controller.removeItem(id, false);
        controller.flushDeletions();

        assertFalse(controller.restoreItem(id));
        assertNull(controller.item(id));
    }

    @Test
    public void ref_tracksLiveness() {
        ItemId id = controller.addItem(new CanvasItem(ItemKind.PATH));
        ItemRef ref = controller.ref(id);
        assertTrue(ref.isValid());

        controller.removeItem(id, true);
        assertFalse(ref.isValid());
    }

    @Test
    public void modify_updatesItemAndNotifies() {
        CanvasItem item = new CanvasItem(ItemKind.RECT);
        ItemId id = controller.addItem(item);
        events.clear();

        assertTrue(controller.moveItem(id, new Point2D(3, 4)));
        assertTrue(controller.transformItem(id, Affine2D.rotation(90)));
        assertTrue(controller.applyPaint(id, PaintAttribute.tint(TintState.of(0xFF00FF00, 0.5))));

        assertEquals(new Point2D(3, 4), item.getPosition());
        assertEquals(Affine2D.rotation(90), item.getTransform());
        assertTrue(item.getPaint().getTint().isEnabled());
        assertEquals(Arrays.asList("modified", "modified", "modified"), events);

        assertFalse(controller.moveItem(ItemId.generate(), Point2D.ORIGIN));
        assertFalse(controller.transformItem(id, null));
    }

    @Test
    public void scaleLayer_scalesAboutCentroid() {
        Layer layer = controller.layerManager().activeLayer();
        CanvasItem left = new CanvasItem(ItemKind.RECT);
        CanvasItem right = new CanvasItem(ItemKind.RECT);
        left.setPosition(new Point2D(0, 0));
        right.setPosition(new Point2D(10, 0));
        controller.addItem(left);
        controller.addItem(right);

        assertEquals(2, controller.scaleLayer(layer, 2, 2));

        assertEquals(new Point2D(-5, 0), left.getPosition());
        assertEquals(new Point2D(15, 0), right.getPosition());
        assertEquals(Affine2D.scaling(2, 2), left.getTransform());
    }

    @Test
    public void scaleLayer_emptyOrUnknownLayerScalesNothing() {
        assertEquals(0, controller.scaleLayer(controller.layerManager().activeLayer(), 2, 2));
        assertEquals(0, controller.scaleLayer(null, 2, 2));
    }

    @Test
    public void deleteLayer_removesMembersThroughController() {
        Layer top = controller.layerManager().createLayer("Top", LayerType.VECTOR);
        CanvasItem item = new CanvasItem(ItemKind.PATH);
        ItemId id = controller.addItem(item, top);

        controller.layerManager().deleteLayer(top.getId());

        assertNull(controller.item(id));
        assertTrue(controller.itemStore().isPendingDeletion(id));
        pending.runPending();
        assertTrue(item.isDisposed());
    }

    @Test
    public void clearAll_flushesImmediately() {
        CanvasItem live = new CanvasItem(ItemKind.RECT);
        CanvasItem snapshotted = new CanvasItem(ItemKind.RECT);
        controller.addItem(live);
        ItemId snapId = controller.addItem(snapshotted);
        controller.removeItem(snapId, true);

        controller.clearAll();

        assertTrue(live.isDisposed());
        assertTrue(snapshotted.isDisposed());
        assertEquals(0, controller.allItemIds().size());
        assertEquals(0, controller.itemStore().snapshotCount());
        assertEquals(0, controller.itemStore().pendingDeletionCount());
        assertEquals(0, controller.layerManager().activeLayer().itemCount());
        assertTrue(surface.onSurface.isEmpty());
    }
}
