package io.netnotes.canvas.items;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * ItemStore - Single owner of every canvas item
 *
 * Each item the store knows about lives in exactly one of three partitions:
 * <ul>
 *   <li><b>live</b> - resolvable by id, present on the surface</li>
 *   <li><b>snapshot</b> - removed, but kept so an undo can restore it</li>
 *   <li><b>pending deletion</b> - removed for good, destroyed on the next flush</li>
 * </ul>
 *
 * DEFERRED DELETION:
 * - {@link #scheduleDelete} never destroys anything; it only moves the item
 *   out of the live index so later lookups report it gone
 * - {@link #flushDeletions} is the only place items are disposed, and must be
 *   called from a point where nothing up the call stack still holds one
 *
 * Invalid, unknown or already-removed ids are never an error: the methods
 * return null, false or {@link ItemId#NULL}.
 *
 * Not thread safe. All calls are expected on the thread that owns the scene.
 */
public class ItemStore {
    private static final String LOG_SCOPE = "[ItemStore]";

    private final SceneSurface surface;

    // Primary storage: ItemId -> item
    private final Map<ItemId, CanvasItem> items = new HashMap<>();

    // Reverse lookup for live items, keyed by identity
    private final Map<CanvasItem, ItemId> reverseMap = new IdentityHashMap<>();

    // Items removed from the surface but kept for potential undo
    private final Map<ItemId, CanvasItem> snapshotItems = new LinkedHashMap<>();

    // Items scheduled for permanent deletion
    private final Map<ItemId, CanvasItem> deletionQueue = new LinkedHashMap<>();

    // Reverse lookup for snapshot and pending items, so re-registering one never mints a second id
    private final Map<CanvasItem, ItemId> retainedMap = new IdentityHashMap<>();

    // Group each removed child was taken out of, so a restore can put it back
    private final Map<ItemId, CanvasItem> detachedFrom = new HashMap<>();

    // Ids whose pre-removal notification is currently being delivered
    private final Set<ItemId> removing = new HashSet<>();

    private final List<ItemStoreListener> listeners = new CopyOnWriteArrayList<>();

    public ItemStore() {
        this(SceneSurface.NONE);
    }

    public ItemStore(SceneSurface surface) {
        this.surface = surface != null ? surface : SceneSurface.NONE;
    }

    public SceneSurface getSurface() {
        return surface;
    }

    public void addListener(ItemStoreListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ItemStoreListener listener) {
        listeners.remove(listener);
    }

    // ===== REGISTRATION =====

    /**
     * Register an item with the store and put it on the surface.
     *
     * Registering an item that is already known returns its existing id. An
     * item sitting in the snapshot set is restored; one waiting in the deletion
     * queue is taken back out of it.
     *
     * @return the item's id, or {@link ItemId#NULL} for null or already-destroyed items
     */
    public ItemId register(CanvasItem item) {
        if (item == null) {
            return ItemId.NULL;
        }

        if (item.isDisposed()) {
            Log.log(LOG_SCOPE, "refusing to register a destroyed item: " + item, LogLevel.HIGH_PRIORITY);
            return ItemId.NULL;
        }

        ItemId existing = reverseMap.get(item);
        if (existing != null) {
            return existing;
        }

        ItemId retained = retainedMap.get(item);
        if (retained != null) {
            if (snapshotItems.containsKey(retained)) {
                restore(retained);
                return retained;
            }
            deletionQueue.remove(retained);
            retainedMap.remove(item);
            makeLive(retained, item);
            notifyListeners(l -> l.itemRestored(retained));
            return retained;
        }

        ItemId id = ItemId.generate();
        makeLive(id, item);

        notifyListeners(l -> l.itemRegistered(id));
        return id;
    }

    /**
     * Stop tracking an item without deleting it or taking it off the surface.
     *
     * @return the item, or null if the id is not live
     */
    public CanvasItem unregister(ItemId id) {
        if (id == null || !id.isValid()) {
            return null;
        }

        CanvasItem item = items.remove(id);
        if (item == null) {
            return null;
        }
        reverseMap.remove(item);
        return item;
    }

    private void makeLive(ItemId id, CanvasItem item) {
        items.put(id, item);
        reverseMap.put(item, id);
        surface.addToSurface(item);
    }

    // ===== LOOKUP =====

    /**
     * @return the live item for the id, or null if the id is null, unknown,
     *         snapshotted, pending deletion or destroyed
     */
    public CanvasItem resolve(ItemId id) {
        if (id == null || !id.isValid()) {
            return null;
        }
        return items.get(id);
    }

    /**
     * @return the id of a live item, or {@link ItemId#NULL}
     */
    public ItemId reverseResolve(CanvasItem item) {
        if (item == null) {
            return ItemId.NULL;
        }
        ItemId id = reverseMap.get(item);
        return id != null ? id : ItemId.NULL;
    }

    public boolean contains(ItemId id) {
        return resolve(id) != null;
    }

    // ===== DELETION =====

    /**
     * Take an item out of the live set.
     *
     * The item leaves the surface, listeners get {@code itemAboutToBeDeleted}
     * while it still resolves, then it moves to the snapshot set (undoable) or
     * the deletion queue. Registered descendants follow it into the same set.
     * An item removed on its own is taken out of its parent group, so the
     * group no longer paints or saves it.
     *
     * @return false if the id was not live
     */
    public boolean scheduleDelete(ItemId id, boolean keepSnapshot) {
        if (id == null || !id.isValid() || removing.contains(id)) {
            return false;
        }

        CanvasItem item = items.get(id);
        if (item == null) {
            return false;
        }

        // Remove from the surface first, before any listener can trigger a paint
        surface.removeFromSurface(item);
        announceRemoval(id);

        for (CanvasItem child : item.getDescendants()) {
            ItemId childId = reverseMap.get(child);
            if (childId == null) {
                continue;
            }
            surface.removeFromSurface(child);
            announceRemoval(childId);
            retire(childId, child, keepSnapshot);
        }

        // a listener may have unregistered it while being notified
        if (items.get(id) == item) {
            retire(id, item, keepSnapshot);
            detachFromParent(id, item, keepSnapshot);
        }
        return true;
    }

    public boolean scheduleDelete(ItemId id) {
        return scheduleDelete(id, false);
    }

    private void announceRemoval(ItemId id) {
        removing.add(id);
        try {
            notifyListeners(l -> l.itemAboutToBeDeleted(id));
        } finally {
            removing.remove(id);
        }
    }

    private void retire(ItemId id, CanvasItem item, boolean keepSnapshot) {
        items.remove(id);
        reverseMap.remove(item);
        retainedMap.put(item, id);
        if (keepSnapshot) {
            snapshotItems.put(id, item);
        } else {
            deletionQueue.put(id, item);
        }
    }

    private void detachFromParent(ItemId id, CanvasItem item, boolean keepSnapshot) {
        CanvasItem parent = item.getParent();
        if (parent == null) {
            return;
        }
        parent.removeChild(item);
        if (keepSnapshot) {
            detachedFrom.put(id, parent);
        }
    }

    /**
     * Destroy every item waiting in the deletion queue.
     *
     * Items whose ancestor is queued as well are released through that
     * ancestor, so nothing is disposed twice.
     *
     * @return the number of ids retired by this flush
     */
    public int flushDeletions() {
        if (deletionQueue.isEmpty()) {
            return 0;
        }

        List<ItemId> ids = new ArrayList<>(deletionQueue.keySet());
        List<CanvasItem> queued = new ArrayList<>(deletionQueue.values());
        int count = queued.size();
        deletionQueue.clear();

        Set<CanvasItem> queuedSet = Collections.newSetFromMap(new IdentityHashMap<>());
        queuedSet.addAll(queued);

        for (CanvasItem item : queued) {
            retainedMap.remove(item);
            if (item.hasAncestorIn(queuedSet)) {
                continue;
            }
            releaseHeldDescendants(item, queuedSet);
            item.dispose();
        }
        for (ItemId id : ids) {
            detachedFrom.remove(id);
        }

        Log.log(LOG_SCOPE, "flushed " + count + " item(s)", LogLevel.GENERAL);
        return count;
    }

    /**
     * Disposing a group reaches every child. A descendant the store still
     * holds live is taken out of the group first; a snapshotted one is
     * dropped with it and can no longer be restored.
     */
    private void releaseHeldDescendants(CanvasItem item, Set<CanvasItem> queuedSet) {
        Set<CanvasItem> kept = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CanvasItem child : item.getDescendants()) {
            if (queuedSet.contains(child) || child.hasAncestorIn(kept)) {
                continue;
            }
            if (reverseMap.containsKey(child)) {
                kept.add(child);
                child.getParent().removeChild(child);
                continue;
            }
            ItemId childId = retainedMap.remove(child);
            if (childId != null) {
                snapshotItems.remove(childId);
                detachedFrom.remove(childId);
            }
        }
    }

    /**
     * Bring a snapshotted item back into the live set under its original id.
     *
     * @return false if the id is not in the snapshot set, including after the
     *         snapshot was discarded and flushed
     */
    public boolean restore(ItemId id) {
        if (id == null || !id.isValid()) {
            return false;
        }

        CanvasItem item = snapshotItems.remove(id);
        if (item == null) {
            return false;
        }
        retainedMap.remove(item);
        CanvasItem parent = detachedFrom.remove(id);
        if (item.isDisposed()) {
            Log.log(LOG_SCOPE, "snapshot was destroyed, cannot restore: " + id, LogLevel.HIGH_PRIORITY);
            return false;
        }
        if (parent != null && !parent.isDisposed()) {
            parent.addChild(item);
        }
        makeLive(id, item);

        // Re-register any descendants that were stored as snapshots
        for (CanvasItem child : item.getDescendants()) {
            ItemId childId = retainedMap.get(child);
            if (childId == null || snapshotItems.remove(childId) == null) {
                continue;
            }
            retainedMap.remove(child);
            makeLive(childId, child);
            notifyListeners(l -> l.itemRestored(childId));
        }

        notifyListeners(l -> l.itemRestored(id));
        return true;
    }

    /**
     * Hand a snapshot over to the deletion queue once nothing can restore it.
     *
     * @return false if the id is not in the snapshot set
     */
    public boolean discardSnapshot(ItemId id) {
        if (id == null || !id.isValid()) {
            return false;
        }
        CanvasItem item = snapshotItems.remove(id);
        if (item == null) {
            return false;
        }
        deletionQueue.put(id, item);
        detachedFrom.remove(id);
        if (item.getParent() != null) {
            item.getParent().removeChild(item);
        }

        for (CanvasItem child : item.getDescendants()) {
            ItemId childId = retainedMap.get(child);
            if (childId != null && snapshotItems.remove(childId) != null) {
                deletionQueue.put(childId, child);
            }
        }
        return true;
    }

    /**
     * Schedule every live item for deletion and fold all snapshots into the
     * deletion queue. Used when a new project replaces the current one.
     */
    public void clear() {
        List<ItemId> ids = new ArrayList<>(items.keySet());
        for (ItemId id : ids) {
            scheduleDelete(id, false);
        }

        deletionQueue.putAll(snapshotItems);
        snapshotItems.clear();
        detachedFrom.clear();
    }

    // ===== STATE QUERIES =====

    public boolean isPendingDeletion(ItemId id) {
        return id != null && deletionQueue.containsKey(id);
    }

    public boolean hasSnapshot(ItemId id) {
        return id != null && snapshotItems.containsKey(id);
    }

    public int itemCount() {
        return items.size();
    }

    public int snapshotCount() {
        return snapshotItems.size();
    }

    public int pendingDeletionCount() {
        return deletionQueue.size();
    }

    public List<ItemId> allItemIds() {
        return new ArrayList<>(items.keySet());
    }

    public List<ItemId> snapshotIds() {
        return new ArrayList<>(snapshotItems.keySet());
    }

    public List<ItemId> pendingDeletionIds() {
        return new ArrayList<>(deletionQueue.keySet());
    }

    private void notifyListeners(Consumer<ItemStoreListener> notification) {
        for (ItemStoreListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                Log.logError(LOG_SCOPE, "listener failed", e);
            }
        }
    }
}
