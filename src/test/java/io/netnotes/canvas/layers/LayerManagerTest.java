package io.netnotes.canvas.layers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import io.netnotes.canvas.config.CanvasConfig;
import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.items.ItemKind;
import io.netnotes.canvas.items.ItemStore;

import static org.junit.Assert.*;

public class LayerManagerTest {

    private ItemStore store;
    private LayerManager manager;

    @Before
    public void setUp() {
        store = new ItemStore();
        manager = new LayerManager(store);
    }

    private ItemId addTo(Layer layer) {
        ItemId id = store.register(new CanvasItem(ItemKind.PATH));
        assertTrue(manager.addItemToLayer(id, layer));
        return id;
    }

    private void assertZOrderMonotonic() {
        double previousMax = Double.NEGATIVE_INFINITY;
        for (Layer layer : manager.getLayers()) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (CanvasItem item : layer.items()) {
                min = Math.min(min, item.getZValue());
                max = Math.max(max, item.getZValue());
            }
            if (layer.itemCount() > 0) {
                assertTrue("layer " + layer.getName() + " overlaps the one below", min > previousMax);
                previousMax = max;
            }
        }
    }

    @Test
    public void constructor_startsWithActiveBackgroundLayer() {
        assertEquals(1, manager.layerCount());
        assertEquals("Background", manager.layer(0).getName());
        assertEquals(0, manager.activeLayerIndex());
        assertSame(manager.layer(0), manager.activeLayer());
    }

    @Test
    public void createLayer_doesNotChangeActiveLayer() {
        Layer second = manager.createLayer("Sketch", LayerType.RASTER);

        assertEquals(2, manager.layerCount());
        assertSame(second, manager.layer(1));
        assertEquals(0, manager.activeLayerIndex());
        assertSame(second, manager.layer(second.getId()));
    }

    @Test
    public void deleteLayer_refusesLastLayer() {
        assertFalse(manager.deleteLayer(0));
        assertEquals(1, manager.layerCount());
        assertFalse(manager.deleteLayer(5));
        assertFalse(manager.deleteLayer(-1));
    }

    @Test
    public void deleteLayer_removesItsItemsFromTheStore() {
        Layer doomed = manager.createLayer("Doomed", LayerType.VECTOR);
        ItemId a = addTo(doomed);
        ItemId b = addTo(doomed);
        ItemId kept = addTo(manager.layer(0));

        assertTrue(manager.deleteLayer(doomed.getId()));

        assertEquals(1, manager.layerCount());
        assertNull(store.resolve(a));
        assertNull(store.resolve(b));
        assertEquals(0, store.pendingDeletionCount());
        assertNotNull(store.resolve(kept));
    }

    @Test
    public void deleteLayer_keepsActiveLayerPointedAtSameLayer() {
        manager.createLayer("One", LayerType.VECTOR);
        Layer two = manager.createLayer("Two", LayerType.VECTOR);
        manager.setActiveLayer(2);

        assertTrue(manager.deleteLayer(0));
        assertSame(two, manager.activeLayer());
        assertEquals(1, manager.activeLayerIndex());

        assertTrue(manager.deleteLayer(1));
        assertEquals(0, manager.activeLayerIndex());
        assertEquals("One", manager.activeLayer().getName());
    }

    @Test
    public void moveLayerUp_swapsWithLayerBelowAndFollowsActive() {
        LayerManager scenario = new LayerManager(new ItemStore(), new CanvasConfig().withDefaultLayerName("L1"));
        Layer l1 = scenario.layer(0);
        Layer l2 = scenario.createLayer("L2", LayerType.VECTOR);
        assertEquals(0, scenario.activeLayerIndex());

        assertTrue(scenario.moveLayerUp(1));

        assertSame(l2, scenario.layer(0));
        assertSame(l1, scenario.layer(1));
        assertEquals(1, scenario.activeLayerIndex());
        assertSame(l1, scenario.activeLayer());
    }

    @Test
    public void moveLayer_refusesOutOfRange() {
        manager.createLayer("Top", LayerType.VECTOR);
        assertFalse(manager.moveLayerUp(0));
        assertFalse(manager.moveLayerDown(1));
        assertFalse(manager.moveLayerUp(7));
        assertTrue(manager.moveLayerDown(0));
        assertEquals("Top", manager.layer(0).getName());
        assertEquals(1, manager.activeLayerIndex());
    }

    @Test
    public void zOrder_layersNeverInterleave() {
        Layer bottom = manager.layer(0);
        Layer top = manager.createLayer("Top", LayerType.VECTOR);
        ItemId b1 = addTo(bottom);
        addTo(bottom);
        ItemId t1 = addTo(top);
        assertZOrderMonotonic();
        assertEquals(0, store.resolve(b1).getZValue(), 1e-9);
        assertEquals(1000, store.resolve(t1).getZValue(), 1e-9);

        manager.moveLayerDown(0);
        assertZOrderMonotonic();
        assertEquals(0, store.resolve(t1).getZValue(), 1e-9);

        manager.moveItemToTop(b1);
        assertZOrderMonotonic();
    }

    @Test
    public void zOrder_strideGrowsWithLargeLayers() {
        ItemStore small = new ItemStore();
        LayerManager tight = new LayerManager(small, new CanvasConfig().withZOrderStride(2));
        Layer top = tight.createLayer("Top", LayerType.VECTOR);
        for (int i = 0; i < 5; i++) {
            ItemId id = small.register(new CanvasItem(ItemKind.PATH));
            tight.addItemToLayer(id, tight.layer(0));
        }
        ItemId above = small.register(new CanvasItem(ItemKind.PATH));
        tight.addItemToLayer(above, top);

        assertEquals(5, tight.zStride(), 1e-9);
        for (CanvasItem item : tight.layer(0).items()) {
            assertTrue(item.getZValue() < small.resolve(above).getZValue());
        }
    }

    @Test
    public void addItemToLayer_movesIdOutOfPreviousLayer() {
        Layer other = manager.createLayer("Other", LayerType.VECTOR);
        ItemId id = addTo(manager.layer(0));

        assertTrue(manager.addItemToLayer(id, other));

        assertFalse(manager.layer(0).containsItem(id));
        assertTrue(other.containsItem(id));
        assertSame(other, manager.findLayerForItem(id));
        assertFalse(manager.addItemToLayer(id, new Layer("Stray", LayerType.VECTOR, store)));
    }

    @Test
    public void storeDeletion_dropsIdFromLayers() {
        ItemId id = addTo(manager.layer(0));
        store.scheduleDelete(id, true);

        assertFalse(manager.layer(0).containsItem(id));
        assertNull(manager.findLayerForItem(id));
    }

    @Test
    public void mergeDown_movesItemsAndDeletesSource() {
        Layer bottom = manager.layer(0);
        Layer top = manager.createLayer("Top", LayerType.VECTOR);
        ItemId a = addTo(bottom);
        ItemId b = addTo(top);

        assertFalse(manager.mergeDown(0));
        assertTrue(manager.mergeDown(1));

        assertEquals(1, manager.layerCount());
        assertEquals(Arrays.asList(a, b), bottom.itemIds());
        assertNotNull(store.resolve(b));
        assertZOrderMonotonic();
    }

    @Test
    public void mergeDown_activeSourceHandsActiveToTarget() {
        Layer bottom = manager.layer(0);
        Layer middle = manager.createLayer("Middle", LayerType.VECTOR);
        manager.createLayer("Top", LayerType.VECTOR);
        manager.setActiveLayer(1);

        assertTrue(manager.mergeDown(1));

        assertEquals(2, manager.layerCount());
        assertEquals(0, manager.activeLayerIndex());
        assertSame(bottom, manager.activeLayer());
        assertEquals(-1, manager.indexOf(middle));
    }

    @Test
    public void mergeDown_activeLayerAboveSourceStaysActive() {
        manager.createLayer("Middle", LayerType.VECTOR);
        Layer top = manager.createLayer("Top", LayerType.VECTOR);
        manager.setActiveLayer(2);

        assertTrue(manager.mergeDown(1));

        assertSame(top, manager.activeLayer());
        assertEquals(1, manager.activeLayerIndex());
    }

    @Test
    public void flattenAll_collectsEverythingIntoBottomLayer() {
        Layer bottom = manager.layer(0);
        Layer mid = manager.createLayer("Mid", LayerType.VECTOR);
        Layer top = manager.createLayer("Top", LayerType.VECTOR);
        ItemId a = addTo(bottom);
        ItemId b = addTo(mid);
        ItemId c = addTo(top);
        manager.setActiveLayer(2);

        Layer result = manager.flattenAll();

        assertSame(bottom, result);
        assertEquals(1, manager.layerCount());
        assertEquals("Flattened", result.getName());
        assertEquals(Arrays.asList(a, b, c), result.itemIds());
        assertEquals(0, manager.activeLayerIndex());
        assertEquals(3, store.itemCount());
    }

    @Test
    public void duplicateLayer_copiesPropertiesButNotItems() {
        Layer source = manager.layer(0);
        addTo(source);
        source.setOpacity(0.4);
        source.setLocked(true);
        source.setVisible(false);
        source.setBlendMode(BlendMode.MULTIPLY);

        Layer copy = manager.duplicateLayer(0);

        assertEquals("Background (Copy)", copy.getName());
        assertSame(copy, manager.layer(1));
        assertEquals(0.4, copy.getOpacity(), 1e-9);
        assertTrue(copy.isLocked());
        assertFalse(copy.isVisible());
        assertEquals(BlendMode.MULTIPLY, copy.getBlendMode());
        assertEquals(0, copy.itemCount());
        assertNull(manager.duplicateLayer(9));
    }

    @Test
    public void mergeItems_groupsMembersUnderNewId() {
        Layer layer = manager.layer(0);
        ItemId first = addTo(layer);
        ItemId a = addTo(layer);
        ItemId b = addTo(layer);
        CanvasItem itemA = store.resolve(a);

        ItemId group = manager.mergeItems(Arrays.asList(a, b));

        assertTrue(group.isValid());
        assertEquals(Arrays.asList(first, group), layer.itemIds());
        assertNull(store.resolve(a));
        assertNull(store.resolve(b));
        CanvasItem groupItem = store.resolve(group);
        assertEquals(ItemKind.GROUP, groupItem.getKind());
        assertSame(groupItem, itemA.getParent());
        assertEquals(2, groupItem.getChildren().size());
    }

    @Test
    public void mergeItems_refusesAcrossLayersOrTooFew() {
        Layer other = manager.createLayer("Other", LayerType.VECTOR);
        ItemId a = addTo(manager.layer(0));
        ItemId b = addTo(other);

        assertSame(ItemId.NULL, manager.mergeItems(Arrays.asList(a)));
        assertSame(ItemId.NULL, manager.mergeItems(Arrays.asList(a, b)));
        assertSame(ItemId.NULL, manager.mergeItems(Arrays.asList(a, ItemId.generate())));
        assertNotNull(store.resolve(a));
    }

    @Test
    public void clear_leavesSingleDefaultLayer() {
        manager.createLayer("A", LayerType.VECTOR);
        manager.createLayer("B", LayerType.VECTOR);

        manager.clear();

        assertEquals(1, manager.layerCount());
        assertEquals("Background", manager.layer(0).getName());
        assertEquals(0, manager.activeLayerIndex());
    }

    @Test
    public void listeners_seeStructuralChanges() {
        List<String> events = new ArrayList<>();
        manager.addListener(new LayerManagerListener() {
            @Override
            public void layerAdded(Layer layer) {
                events.add("added:" + layer.getName());
            }

            @Override
            public void layerRemoved(Layer layer) {
                events.add("removed:" + layer.getName());
            }

            @Override
            public void layerChanged(Layer layer) {
                events.add("changed:" + layer.getName());
            }

            @Override
            public void layerOrderChanged() {
                events.add("order");
            }
        });

        Layer top = manager.createLayer("Top", LayerType.VECTOR);
        top.setLocked(true);
        manager.moveLayerUp(1);
        manager.deleteLayer(0);

        assertEquals(Arrays.asList("added:Top", "changed:Top", "order", "removed:Top"), events);
    }

    @Test
    public void setActiveLayer_rejectsOutOfRange() {
        assertFalse(manager.setActiveLayer(3));
        assertTrue(manager.setActiveLayer(manager.layer(0).getId()));
        assertEquals(0, manager.activeLayerIndex());
    }
}
