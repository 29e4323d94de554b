package io.netnotes.canvas.items;

import java.util.UUID;

/**
 * Stable, location-independent name of a canvas item.
 *
 * An ItemId carries no lifetime semantics of its own: it stays comparable and
 * hashable after the item it named has been destroyed. {@link #NULL} is never
 * valid and is what every failed lookup or registration returns.
 */
public final class ItemId implements Comparable<ItemId> {
    public static final ItemId NULL = new ItemId(null);

    private final UUID uuid;

    private ItemId(UUID uuid) {
        this.uuid = uuid;
    }

    public static ItemId generate() {
        return new ItemId(UUID.randomUUID());
    }

    public static ItemId of(UUID uuid) {
        return uuid == null ? NULL : new ItemId(uuid);
    }

    /**
     * @return the parsed id, or {@link #NULL} when the text is not a UUID
     */
    public static ItemId fromString(String text) {
        if (text == null || text.isBlank()) {
            return NULL;
        }
        try {
            return new ItemId(UUID.fromString(text.trim()));
        } catch (IllegalArgumentException e) {
            return NULL;
        }
    }

    public boolean isValid() {
        return uuid != null;
    }

    public boolean isNull() {
        return uuid == null;
    }

    public UUID uuid() {
        return uuid;
    }

    @Override
    public int compareTo(ItemId other) {
        if (uuid == null) {
            return other.uuid == null ? 0 : -1;
        }
        if (other.uuid == null) {
            return 1;
        }
        // unsigned comparison so the order matches the textual form
        int high = Long.compareUnsigned(uuid.getMostSignificantBits(), other.uuid.getMostSignificantBits());
        return high != 0 ? high : Long.compareUnsigned(uuid.getLeastSignificantBits(), other.uuid.getLeastSignificantBits());
    }

    @Override
    public String toString() {
        return uuid != null ? uuid.toString() : "null";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ItemId other)) return false;
        return uuid == null ? other.uuid == null : uuid.equals(other.uuid);
    }

    @Override
    public int hashCode() {
        return uuid != null ? uuid.hashCode() : 0;
    }
}
