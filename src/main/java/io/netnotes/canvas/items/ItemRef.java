package io.netnotes.canvas.items;

/**
 * Non-owning view of an item, resolved through its store on every access.
 *
 * Holding an ItemRef never keeps an item alive: once the item is removed from
 * the live set {@link #get()} returns null. Layers, actions and tools that
 * outlive a single call keep one of these, never the item itself.
 *
 * <pre>
 * ItemRef ref = controller.ref(id);
 * CanvasItem item = ref.get();
 * if (item != null) {
 *     // use it within this call only
 * }
 * </pre>
 */
public final class ItemRef {
    public static final ItemRef NULL = new ItemRef(null, ItemId.NULL);

    private final ItemStore store;
    private final ItemId id;

    public ItemRef(ItemStore store, ItemId id) {
        this.store = store;
        this.id = id != null ? id : ItemId.NULL;
    }

    /**
     * @return the live item, or null if it has been removed or was never valid
     */
    public CanvasItem get() {
        return store != null && id.isValid() ? store.resolve(id) : null;
    }

    public boolean isValid() {
        return get() != null;
    }

    public boolean isNull() {
        return !id.isValid();
    }

    public ItemId id() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ItemRef other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ItemRef[" + id + "]";
    }
}
