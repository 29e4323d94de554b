package io.netnotes.canvas.layers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import io.netnotes.canvas.items.CanvasItem;
import io.netnotes.canvas.items.ItemId;
import io.netnotes.canvas.items.ItemStore;
import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * Layer - Ordered group of item ids painted together
 *
 * A layer holds ids only, never items. Visibility and opacity cascade to the
 * members' items as soon as they change; ids whose item no longer resolves are
 * dropped during that pass rather than when the item goes away.
 *
 * Member order is paint order inside the layer: index 0 is painted first.
 */
public class Layer {
    private final UUID id;
    private LayerType type;
    private final ItemStore itemStore;
    private final List<ItemId> itemIds = new ArrayList<>();

    private String name;
    private boolean visible = true;
    private boolean locked = false;
    private double opacity = 1.0;
    private BlendMode blendMode = BlendMode.NORMAL;

    private LayerManager owner = null;

    public Layer(String name, LayerType type, ItemStore itemStore) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.type = type != null ? type : LayerType.VECTOR;
        this.itemStore = itemStore;
    }

    void setOwner(LayerManager owner) {
        this.owner = owner;
    }

    public UUID getId() {
        return id;
    }

    public LayerType getType() {
        return type;
    }

    public void setType(LayerType type) {
        this.type = type != null ? type : LayerType.VECTOR;
        changed();
    }

    // ===== PROPERTIES =====

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        changed();
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        if (this.visible != visible) {
            this.visible = visible;
            cascade();
            changed();
        }
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        if (this.locked != locked) {
            this.locked = locked;
            changed();
        }
    }

    public double getOpacity() {
        return opacity;
    }

    /**
     * Clamped to [0, 1]. Always re-applied to the members.
     */
    public void setOpacity(double opacity) {
        this.opacity = Double.isNaN(opacity) ? 1.0 : Math.max(0.0, Math.min(1.0, opacity));
        cascade();
        changed();
    }

    public BlendMode getBlendMode() {
        return blendMode;
    }

    public void setBlendMode(BlendMode blendMode) {
        this.blendMode = blendMode != null ? blendMode : BlendMode.NORMAL;
        changed();
    }

    private void changed() {
        if (owner != null) {
            owner.onLayerChanged(this);
        }
    }

    // ===== MEMBERSHIP =====

    /**
     * Append an id and push the layer's visibility and opacity onto its item.
     * When the layer belongs to a manager the id is taken out of any other
     * layer first.
     *
     * @return false for a null id or one already in this layer
     */
    public boolean addItem(ItemId id) {
        if (id == null || !id.isValid() || itemIds.contains(id)) {
            return false;
        }

        if (owner != null) {
            owner.detachFromOtherLayers(id, this);
        }
        itemIds.add(id);

        CanvasItem item = itemStore != null ? itemStore.resolve(id) : null;
        if (item != null) {
            item.setVisible(visible);
            item.setOpacity(opacity);
        }
        return true;
    }

    public boolean removeItem(ItemId id) {
        return id != null && itemIds.remove(id);
    }

    public boolean containsItem(ItemId id) {
        return id != null && itemIds.contains(id);
    }

    public void clear() {
        itemIds.clear();
    }

    public int itemCount() {
        return itemIds.size();
    }

    public int indexOfItem(ItemId id) {
        return itemIds.indexOf(id);
    }

    public List<ItemId> itemIds() {
        return Collections.unmodifiableList(new ArrayList<>(itemIds));
    }

    /**
     * @return the members' live items in paint order, skipping ids that no longer resolve
     */
    public List<CanvasItem> items() {
        List<CanvasItem> result = new ArrayList<>();
        if (itemStore == null) {
            return result;
        }
        for (ItemId itemId : itemIds) {
            CanvasItem item = itemStore.resolve(itemId);
            if (item != null) {
                result.add(item);
            }
        }
        return result;
    }

    // ===== ORDERING =====

    public boolean moveItemUp(ItemId id) {
        int idx = itemIds.indexOf(id);
        if (idx < 0 || idx >= itemIds.size() - 1) {
            return false;
        }
        Collections.swap(itemIds, idx, idx + 1);
        return true;
    }

    public boolean moveItemDown(ItemId id) {
        int idx = itemIds.indexOf(id);
        if (idx <= 0) {
            return false;
        }
        Collections.swap(itemIds, idx, idx - 1);
        return true;
    }

    public boolean moveItemToTop(ItemId id) {
        int idx = itemIds.indexOf(id);
        if (idx < 0 || idx == itemIds.size() - 1) {
            return false;
        }
        itemIds.remove(idx);
        itemIds.add(id);
        return true;
    }

    public boolean moveItemToBottom(ItemId id) {
        int idx = itemIds.indexOf(id);
        if (idx <= 0) {
            return false;
        }
        itemIds.remove(idx);
        itemIds.add(0, id);
        return true;
    }

    public boolean moveItem(int fromIndex, int toIndex) {
        if (fromIndex < 0 || fromIndex >= itemIds.size() || toIndex < 0
                || toIndex >= itemIds.size() || fromIndex == toIndex) {
            return false;
        }
        ItemId moved = itemIds.remove(fromIndex);
        itemIds.add(toIndex, moved);
        return true;
    }

    // ===== CASCADE =====

    private void cascade() {
        if (itemStore == null) {
            return;
        }

        int dropped = 0;
        for (int i = itemIds.size() - 1; i >= 0; --i) {
            CanvasItem item = itemStore.resolve(itemIds.get(i));
            if (item == null) {
                itemIds.remove(i);
                dropped++;
                continue;
            }
            item.setVisible(visible);
            item.setOpacity(opacity);
        }

        if (dropped > 0) {
            Log.log("[Layer:" + name + "]", "dropped " + dropped + " stale id(s)", LogLevel.GENERAL);
        }
    }

    @Override
    public String toString() {
        return "Layer[" + name + ", items=" + itemIds.size() + (visible ? "" : ", hidden") + "]";
    }
}
