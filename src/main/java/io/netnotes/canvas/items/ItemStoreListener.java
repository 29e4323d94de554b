package io.netnotes.canvas.items;

/**
 * Lifecycle notifications from an {@link ItemStore}.
 *
 * {@link #itemAboutToBeDeleted} is delivered while the id still resolves, so a
 * listener may read the item one last time; it is gone from the live index as
 * soon as every listener has returned.
 */
public interface ItemStoreListener {

    default void itemRegistered(ItemId id) {
    }

    default void itemAboutToBeDeleted(ItemId id) {
    }

    default void itemRestored(ItemId id) {
    }
}
