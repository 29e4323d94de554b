package io.netnotes.canvas.layers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import io.netnotes.canvas.config.CanvasConfig;
import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.items.ItemStore;
import io.netnotes.canvas.items.ItemStoreListener;
import io.netnotes.canvas.scene.SceneController;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * LayerManager - Ordered stack of layers over one {@link ItemStore}
 *
 * ORDER:
 * - index 0 is the bottom layer, the last index the top
 * - every member of layer i gets z = i * stride + (position in layer), so all
 *   of layer i paints below all of layer i+1
 * - z is recomputed after every structural change
 *
 * INVARIANTS:
 * - there is always at least one layer; the last one cannot be deleted
 * - the active index always points at an existing layer, and follows the same
 *   layer across moves and deletions of other layers
 * - an id belongs to at most one layer
 */
public class LayerManager {
    private static final String LOG_SCOPE = "[LayerManager]";

    private final ItemStore itemStore;
    private final CanvasConfig config;
    private final List<Layer> layers = new ArrayList<>();
    private final List<LayerManagerListener> listeners = new CopyOnWriteArrayList<>();

    private SceneController sceneController = null;
    private int activeLayerIndex = -1;
    private boolean notificationsBlocked = false;

    public LayerManager(ItemStore itemStore) {
        this(itemStore, new CanvasConfig());
    }

    public LayerManager(ItemStore itemStore, CanvasConfig config) {
        this.itemStore = Objects.requireNonNull(itemStore, "itemStore");
        this.config = config != null ? config : new CanvasConfig();

        // Drop ids from every layer as soon as the store announces their removal
        this.itemStore.addListener(new ItemStoreListener() {
            @Override
            public void itemAboutToBeDeleted(ItemId id) {
                for (Layer layer : layers) {
                    layer.removeItem(id);
                }
            }
        });

        createLayer(this.config.getDefaultLayerName(), LayerType.VECTOR);
    }

    /**
     * Members of deleted layers are removed through the controller when one is set,
     * otherwise straight through the store with an immediate flush.
     */
    public void setSceneController(SceneController sceneController) {
        this.sceneController = sceneController;
    }

    public ItemStore getItemStore() {
        return itemStore;
    }

    public void addListener(LayerManagerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LayerManagerListener listener) {
        listeners.remove(listener);
    }

    // ===== LAYER LIFECYCLE =====

    /**
     * Append a layer on top. It becomes active only if there was no active layer.
     */
    public Layer createLayer(String name, LayerType type) {
        Layer layer = new Layer(name, type, itemStore);
        layer.setOwner(this);
        layers.add(layer);

        if (activeLayerIndex < 0) {
            activeLayerIndex = 0;
        }

        updateLayerZOrder();
        notifyListeners(l -> l.layerAdded(layer));
        return layer;
    }

    public Layer createLayer(String name) {
        return createLayer(name, LayerType.VECTOR);
    }

    /**
     * Remove a layer and every item in it.
     *
     * @return false if the index is out of range or it is the last layer
     */
    public boolean deleteLayer(int index) {
        if (index < 0 || index >= layers.size()) {
            return false;
        }

        if (layers.size() <= 1) {
            Log.log(LOG_SCOPE, "refusing to delete the last layer", LogLevel.GENERAL);
            return false;
        }

        Layer layer = layers.get(index);
        notifyListeners(l -> l.layerRemoved(layer));

        List<ItemId> ids = layer.itemIds();
        if (sceneController != null) {
            for (ItemId id : ids) {
                sceneController.removeItem(id, false);
            }
        } else {
            for (ItemId id : ids) {
                itemStore.scheduleDelete(id, false);
            }
            itemStore.flushDeletions();
        }

        layers.remove(index);
        layer.setOwner(null);

        if (index < activeLayerIndex) {
            activeLayerIndex--;
        } else if (activeLayerIndex >= layers.size()) {
            activeLayerIndex = layers.size() - 1;
        }

        updateLayerZOrder();
        notifyListeners(l -> l.activeLayerChanged(activeLayer()));
        return true;
    }

    public boolean deleteLayer(UUID id) {
        return deleteLayer(indexOf(id));
    }

    // ===== LOOKUP =====

    public Layer layer(int index) {
        if (index < 0 || index >= layers.size()) {
            return null;
        }
        return layers.get(index);
    }

    public Layer layer(UUID id) {
        return layer(indexOf(id));
    }

    public int indexOf(UUID id) {
        if (id != null) {
            for (int i = 0; i < layers.size(); i++) {
                if (layers.get(i).getId().equals(id)) {
                    return i;
                }
            }
        }
        return -1;
    }

    public int indexOf(Layer layer) {
        return layers.indexOf(layer);
    }

    public int layerCount() {
        return layers.size();
    }

    /**
     * @return the layers bottom to top
     */
    public List<Layer> getLayers() {
        return Collections.unmodifiableList(new ArrayList<>(layers));
    }

    public Layer activeLayer() {
        return layer(activeLayerIndex);
    }

    public int activeLayerIndex() {
        return activeLayerIndex;
    }

    public boolean setActiveLayer(int index) {
        if (index < 0 || index >= layers.size()) {
            return false;
        }
        activeLayerIndex = index;
        notifyListeners(l -> l.activeLayerChanged(activeLayer()));
        return true;
    }

    public boolean setActiveLayer(UUID id) {
        return setActiveLayer(indexOf(id));
    }

    public Layer findLayerForItem(ItemId id) {
        if (id != null && id.isValid()) {
            for (Layer layer : layers) {
                if (layer.containsItem(id)) {
                    return layer;
                }
            }
        }
        return null;
    }

    public Layer findLayerForItem(CanvasItem item) {
        return findLayerForItem(itemStore.reverseResolve(item));
    }

    // ===== LAYER ORDER =====

    /**
     * Swap the layer at {@code index} with the one below it (index - 1).
     */
    public boolean moveLayerUp(int index) {
        if (index <= 0 || index >= layers.size()) {
            return false;
        }

        Collections.swap(layers, index, index - 1);

        if (activeLayerIndex == index) {
            activeLayerIndex = index - 1;
        } else if (activeLayerIndex == index - 1) {
            activeLayerIndex = index;
        }

        updateLayerZOrder();
        notifyListeners(LayerManagerListener::layerOrderChanged);
        return true;
    }

    /**
     * Swap the layer at {@code index} with the one above it (index + 1).
     */
    public boolean moveLayerDown(int index) {
        if (index < 0 || index >= layers.size() - 1) {
            return false;
        }

        Collections.swap(layers, index, index + 1);

        if (activeLayerIndex == index) {
            activeLayerIndex = index + 1;
        } else if (activeLayerIndex == index + 1) {
            activeLayerIndex = index;
        }

        updateLayerZOrder();
        notifyListeners(LayerManagerListener::layerOrderChanged);
        return true;
    }

    // ===== ITEM ORDER =====

    public boolean moveItemUp(ItemId id) {
        Layer layer = findLayerForItem(id);
        return layer != null && itemOrderChanged(layer.moveItemUp(id));
    }

    public boolean moveItemDown(ItemId id) {
        Layer layer = findLayerForItem(id);
        return layer != null && itemOrderChanged(layer.moveItemDown(id));
    }

    public boolean moveItemToTop(ItemId id) {
        Layer layer = findLayerForItem(id);
        return layer != null && itemOrderChanged(layer.moveItemToTop(id));
    }

    public boolean moveItemToBottom(ItemId id) {
        Layer layer = findLayerForItem(id);
        return layer != null && itemOrderChanged(layer.moveItemToBottom(id));
    }

    public boolean reorderItem(ItemId id, int newIndex) {
        Layer layer = findLayerForItem(id);
        if (layer == null) {
            return false;
        }
        int oldIndex = layer.indexOfItem(id);
        return oldIndex >= 0 && itemOrderChanged(layer.moveItem(oldIndex, newIndex));
    }

    private boolean itemOrderChanged(boolean moved) {
        if (moved) {
            updateLayerZOrder();
            notifyListeners(LayerManagerListener::itemOrderChanged);
        }
        return moved;
    }

    // ===== MEMBERSHIP =====

    public boolean addItemToActiveLayer(ItemId id) {
        return addItemToLayer(id, activeLayer());
    }

    /**
     * Put an id into the given layer, taking it out of whichever layer held it.
     *
     * @return false if the layer is not managed here or the id is null
     */
    public boolean addItemToLayer(ItemId id, Layer layer) {
        if (layer == null || !layers.contains(layer) || id == null || !id.isValid()) {
            return false;
        }
        if (layer.containsItem(id)) {
            return true;
        }
        layer.addItem(id);
        updateLayerZOrder();
        return true;
    }

    void detachFromOtherLayers(ItemId id, Layer keep) {
        for (Layer layer : layers) {
            if (layer != keep) {
                layer.removeItem(id);
            }
        }
    }

    void onLayerChanged(Layer layer) {
        notifyListeners(l -> l.layerChanged(layer));
    }

    // ===== STRUCTURAL OPERATIONS =====

    /**
     * Move every member of {@code index} into the layer below, then delete {@code index}.
     * If the merged layer was active, the layer below becomes active.
     */
    public boolean mergeDown(int index) {
        if (index <= 0 || index >= layers.size()) {
            return false;
        }

        Layer source = layers.get(index);
        Layer target = layers.get(index - 1);

        for (ItemId id : source.itemIds()) {
            target.addItem(id);
        }
        source.clear();

        // the merged content lives on in the target
        if (activeLayerIndex == index) {
            activeLayerIndex = index - 1;
        }
        return deleteLayer(index);
    }

    /**
     * Move every item into the bottom layer, drop the rest and rename the result.
     */
    public Layer flattenAll() {
        if (layers.isEmpty()) {
            return null;
        }

        Layer bottom = layers.get(0);
        for (int i = 1; i < layers.size(); i++) {
            Layer layer = layers.get(i);
            for (ItemId id : layer.itemIds()) {
                bottom.addItem(id);
            }
            layer.clear();
        }

        while (layers.size() > 1) {
            Layer removed = layers.remove(layers.size() - 1);
            removed.setOwner(null);
            notifyListeners(l -> l.layerRemoved(removed));
        }

        activeLayerIndex = 0;
        bottom.setName(config.getFlattenedLayerName());

        updateLayerZOrder();
        notifyListeners(LayerManagerListener::layerOrderChanged);
        notifyListeners(l -> l.activeLayerChanged(activeLayer()));
        return bottom;
    }

    /**
     * Create a new top layer with the same name (suffixed), visibility, lock,
     * opacity and blend mode. Members are not copied.
     */
    public Layer duplicateLayer(int index) {
        Layer source = layer(index);
        if (source == null) {
            return null;
        }

        Layer copy = createLayer(source.getName() + " (Copy)", source.getType());
        copy.setVisible(source.isVisible());
        copy.setLocked(source.isLocked());
        copy.setOpacity(source.getOpacity());
        copy.setBlendMode(source.getBlendMode());
        return copy;
    }

    /**
     * Group two or more items of the same layer into one GROUP item.
     *
     * The members stop being tracked individually; the group gets a new id and
     * takes the first member's place in the layer.
     *
     * @return the group's id, or {@link ItemId#NULL} if the ids are fewer than
     *         two, span layers, or do not all resolve
     */
    public ItemId mergeItems(List<ItemId> ids) {
        if (ids == null || ids.size() < 2) {
            return ItemId.NULL;
        }

        Layer layer = findLayerForItem(ids.get(0));
        if (layer == null) {
            return ItemId.NULL;
        }

        List<CanvasItem> members = new ArrayList<>();
        for (ItemId id : ids) {
            CanvasItem item = itemStore.resolve(id);
            if (item == null || findLayerForItem(id) != layer || members.contains(item)) {
                return ItemId.NULL;
            }
            members.add(item);
        }

        int insertAt = layer.indexOfItem(ids.get(0));
        for (int i = 0; i < ids.size(); i++) {
            insertAt = Math.min(insertAt, layer.indexOfItem(ids.get(i)));
        }

        CanvasItem group = CanvasItem.group(members);

        // the group paints its members from here on
        for (int i = 0; i < ids.size(); i++) {
            layer.removeItem(ids.get(i));
            itemStore.unregister(ids.get(i));
            itemStore.getSurface().removeFromSurface(members.get(i));
        }

        ItemId groupId = itemStore.register(group);
        layer.addItem(groupId);
        layer.moveItem(layer.indexOfItem(groupId), insertAt);

        updateLayerZOrder();
        notifyListeners(LayerManagerListener::itemOrderChanged);
        return groupId;
    }

    /**
     * Forget every layer and start over with a single default layer. Items are
     * left alone; callers clear the store themselves.
     */
    public void clear() {
        notificationsBlocked = true;
        try {
            for (Layer layer : layers) {
                layer.setOwner(null);
            }
            layers.clear();
            activeLayerIndex = -1;
        } finally {
            notificationsBlocked = false;
        }

        createLayer(config.getDefaultLayerName(), LayerType.VECTOR);
        notifyListeners(l -> l.activeLayerChanged(activeLayer()));
    }

    // ===== Z ORDER =====

    /**
     * Stride between layers. Grows past the configured value when a layer
     * holds more items than the stride, so layers never interleave.
     */
    public double zStride() {
        double stride = config.getZOrderStride();
        for (Layer layer : layers) {
            stride = Math.max(stride, layer.itemCount());
        }
        return stride;
    }

    public void updateLayerZOrder() {
        double stride = zStride();
        for (int i = 0; i < layers.size(); i++) {
            double layerZ = i * stride;
            List<ItemId> ids = layers.get(i).itemIds();
            for (int j = 0; j < ids.size(); j++) {
                CanvasItem item = itemStore.resolve(ids.get(j));
                if (item != null) {
                    item.setZValue(layerZ + j);
                }
            }
        }
    }

    private void notifyListeners(Consumer<LayerManagerListener> notification) {
        if (notificationsBlocked) {
            return;
        }
        for (LayerManagerListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                Log.logError(LOG_SCOPE, "listener failed", e);
            }
        }
    }
}
