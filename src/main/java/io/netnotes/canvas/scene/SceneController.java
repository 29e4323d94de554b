package io.netnotes.canvas.scene;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import io.netnotes.canvas.actions.UndoStack;
import io.netnotes.canvas.config.CanvasConfig;
import io.netnotes.canvas.geometry.Affine2D;
import io.netnotes.canvas.geometry.Point2D;
import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.items.ItemRef;
import io.netnotes.canvas.items.ItemStore;
import io.netnotes.canvas.items.SceneSurface;
import io.netnotes.canvas.layers.Layer;
import io.netnotes.canvas.layers.LayerManager;
import io.netnotes.canvas.paint.PaintAttribute;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * SceneController - The one place scene state is changed from
 *
 * Tools, actions and the project serializer add, remove and modify items
 * only through here. Each call keeps the {@link ItemStore} and the
 * {@link LayerManager} consistent with each other before it returns.
 *
 * REMOVAL:
 * - {@link #removeItem} takes the item out of its layer and the live set at
 *   once, but destruction is left to a flush posted on the
 *   {@link DeferredExecutor}
 * - any number of removals inside one dispatch share a single flush
 * - {@link #clearAll()} is the exception: it flushes immediately
 *
 * Single threaded. Call it only from the thread that drains the executor.
 */
public class SceneController {
    private static final String LOG_SCOPE = "[SceneController]";

    private final ItemStore itemStore;
    private final LayerManager layerManager;
    private final DeferredExecutor deferredExecutor;
    private final UndoStack undoStack;
    private final List<SceneListener> listeners = new CopyOnWriteArrayList<>();

    // Layer each snapshotted item was removed from, so undo puts it back there
    private final Map<ItemId, UUID> removedFrom = new HashMap<>();

    private boolean flushScheduled = false;

    public SceneController(SceneSurface surface, DeferredExecutor deferredExecutor) {
        this(surface, deferredExecutor, new CanvasConfig());
    }

    public SceneController(SceneSurface surface, DeferredExecutor deferredExecutor, CanvasConfig config) {
        CanvasConfig cfg = config != null ? config : new CanvasConfig();
        this.deferredExecutor = Objects.requireNonNull(deferredExecutor, "deferredExecutor");
        this.itemStore = new ItemStore(surface);
        this.layerManager = new LayerManager(itemStore, cfg);
        this.layerManager.setSceneController(this);
        this.undoStack = new UndoStack(cfg.getUndoLimit());
    }

    public ItemStore itemStore() {
        return itemStore;
    }

    public LayerManager layerManager() {
        return layerManager;
    }

    public UndoStack undoStack() {
        return undoStack;
    }

    public void addListener(SceneListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SceneListener listener) {
        listeners.remove(listener);
    }

    // ===== ADD / REMOVE =====

    public ItemId addItem(CanvasItem item) {
        return addItem(item, null);
    }

    /**
     * Register an item and put it into {@code layer}, or the active layer when
     * {@code layer} is null or not managed here.
     *
     * @return the item's id, or {@link ItemId#NULL} if the store refused it
     */
    public ItemId addItem(CanvasItem item, Layer layer) {
        ItemId id = itemStore.register(item);
        if (id.isNull()) {
            return id;
        }
        // re-adding a snapshotted item places it here, not where it was removed from
        removedFrom.remove(id);

        if (layer == null || !layerManager.addItemToLayer(id, layer)) {
            layerManager.addItemToActiveLayer(id);
        }

        notifyListeners(l -> l.itemAdded(id));
        return id;
    }

    public boolean removeItem(ItemId id) {
        return removeItem(id, true);
    }

    /**
     * Take an item off the canvas.
     *
     * With {@code keepForUndo} the item is snapshotted and {@link #restoreItem}
     * can bring it back until the snapshot is discarded. Without it the item
     * is destroyed on the next deferred flush.
     *
     * @return false if the id is not live
     */
    public boolean removeItem(ItemId id, boolean keepForUndo) {
        if (!itemStore.contains(id)) {
            return false;
        }

        Layer layer = layerManager.findLayerForItem(id);
        if (layer != null) {
            layer.removeItem(id);
        }

        if (!itemStore.scheduleDelete(id, keepForUndo)) {
            return false;
        }

        if (keepForUndo && layer != null) {
            removedFrom.put(id, layer.getId());
        } else {
            removedFrom.remove(id);
        }

        notifyListeners(l -> l.itemRemoved(id));
        scheduleDeletionFlush();
        return true;
    }

    /**
     * Bring a snapshotted item back, into the layer it was removed from or the
     * active layer if that layer has been deleted since.
     *
     * @return false if the item has no snapshot, including once it was flushed
     */
    public boolean restoreItem(ItemId id) {
        if (!itemStore.restore(id)) {
            return false;
        }

        Layer layer = layerManager.layer(removedFrom.remove(id));
        if (layer == null || !layerManager.addItemToLayer(id, layer)) {
            layerManager.addItemToActiveLayer(id);
        }

        notifyListeners(l -> l.itemRestored(id));
        return true;
    }

    // ===== LOOKUP =====

    public CanvasItem item(ItemId id) {
        return itemStore.resolve(id);
    }

    public ItemRef ref(ItemId id) {
        return new ItemRef(itemStore, id);
    }

    public ItemId idForItem(CanvasItem item) {
        return itemStore.reverseResolve(item);
    }

    public List<ItemId> allItemIds() {
        return itemStore.allItemIds();
    }

    // ===== MODIFY =====

    public boolean moveItem(ItemId id, Point2D position) {
        CanvasItem item = itemStore.resolve(id);
        if (item == null || position == null) {
            return false;
        }
        item.setPosition(position);
        notifyListeners(l -> l.itemModified(id));
        return true;
    }

    public boolean transformItem(ItemId id, Affine2D transform) {
        CanvasItem item = itemStore.resolve(id);
        if (item == null || transform == null) {
            return false;
        }
        item.setTransform(transform);
        notifyListeners(l -> l.itemModified(id));
        return true;
    }

    public boolean applyPaint(ItemId id, PaintAttribute attribute) {
        CanvasItem item = itemStore.resolve(id);
        if (item == null || attribute == null) {
            return false;
        }
        item.setPaint(attribute.applyTo(item.getPaint()));
        notifyListeners(l -> l.itemModified(id));
        return true;
    }

    /**
     * Scale every live member of a layer about the centroid of their positions.
     * Each member's transform is scaled as well as its distance from the centroid.
     *
     * @return the number of items scaled
     */
    public int scaleLayer(Layer layer, double sx, double sy) {
        if (layer == null || layerManager.indexOf(layer) < 0) {
            return 0;
        }

        List<ItemId> ids = layer.itemIds();
        Map<ItemId, CanvasItem> members = new HashMap<>();
        double cx = 0;
        double cy = 0;
        for (ItemId id : ids) {
            CanvasItem item = itemStore.resolve(id);
            if (item != null) {
                members.put(id, item);
                cx += item.getPosition().getX();
                cy += item.getPosition().getY();
            }
        }
        if (members.isEmpty()) {
            return 0;
        }

        Point2D center = new Point2D(cx / members.size(), cy / members.size());
        Affine2D scale = Affine2D.scaling(sx, sy);

        for (ItemId id : ids) {
            CanvasItem item = members.get(id);
            if (item == null) {
                continue;
            }
            item.setPosition(center.add(item.getPosition().subtract(center).scale(sx, sy)));
            item.setTransform(item.getTransform().then(scale));
            notifyListeners(l -> l.itemModified(id));
        }
        return members.size();
    }

    // ===== DEFERRED DELETION =====

    /**
     * Post a flush for the next turn of the host's loop, unless one is already posted.
     */
    public void scheduleDeletionFlush() {
        if (flushScheduled) {
            return;
        }
        flushScheduled = true;
        deferredExecutor.post(this::runScheduledFlush);
    }

    private void runScheduledFlush() {
        flushScheduled = false;
        flushDeletions();
    }

    public boolean isFlushScheduled() {
        return flushScheduled;
    }

    /**
     * Destroy everything pending deletion now. Only safe when no caller up the
     * stack still holds one of those items.
     */
    public int flushDeletions() {
        int flushed = itemStore.flushDeletions();
        removedFrom.keySet().removeIf(id -> !itemStore.hasSnapshot(id));
        return flushed;
    }

    /**
     * Drop every item, snapshot and undo step and flush at once. Layers are kept.
     */
    public void clearAll() {
        undoStack.clear();
        itemStore.clear();
        removedFrom.clear();
        int flushed = itemStore.flushDeletions();
        Log.log(LOG_SCOPE, "cleared scene, " + flushed + " item(s) destroyed", LogLevel.GENERAL);
    }

    private void notifyListeners(Consumer<SceneListener> notification) {
        for (SceneListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                Log.logError(LOG_SCOPE, "listener failed", e);
            }
        }
    }
}
