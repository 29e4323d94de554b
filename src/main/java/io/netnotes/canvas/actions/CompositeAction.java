package io.netnotes.canvas.actions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Several actions undone and redone as one step.
 *
 * Undo runs the members last to first, redo first to last, so a member may
 * depend on the effect of the ones added before it.
 */
public class CompositeAction implements Action {
    private final String description;
    private final List<Action> actions = new ArrayList<>();

    public CompositeAction(String description) {
        this.description = description != null ? description : "Multiple changes";
    }

    public CompositeAction addAction(Action action) {
        actions.add(Objects.requireNonNull(action, "action"));
        return this;
    }

    public List<Action> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public int size() {
        return actions.size();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    @Override
    public void undo() {
        for (int i = actions.size() - 1; i >= 0; i--) {
            actions.get(i).undo();
        }
    }

    @Override
    public void redo() {
        for (Action action : actions) {
            action.redo();
        }
    }

    @Override
    public void discard() {
        for (Action action : actions) {
            action.discard();
        }
    }

    @Override
    public String description() {
        return description;
    }
}
