package io.netnotes.canvas.actions;

/**
 * A reversible edit.
 *
 * The forward effect has already happened when an action is pushed; the
 * action only knows how to reverse it and apply it again. Actions refer to
 * items by {@link io.netnotes.canvas.items.ItemId} and go through the
 * {@link io.netnotes.canvas.scene.SceneController} for every change.
 */
public interface Action {

    void undo();

    void redo();

    String description();

    /**
     * Called once the action can no longer be undone or redone, when it is
     * trimmed from the history or dropped with the redo stack.
     */
    default void discard() {
    }
}
