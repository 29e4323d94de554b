package io.netnotes.canvas.actions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import io.netnotes.canvas.utils.LoggingHelpers.Log;
import io.netnotes.canvas.utils.LoggingHelpers.LogLevel;

/**
 * UndoStack - Two LIFO stacks of {@link Action}s
 *
 * - push clears the redo stack; every dropped action is discarded
 * - undo pops the undo stack, reverses the action and keeps it for redo
 * - redo pops the redo stack, reapplies the action and keeps it for undo
 * - with a limit above zero the oldest actions fall off (and are discarded)
 *   once the undo stack grows past it
 */
public class UndoStack {
    private static final String LOG_SCOPE = "[UndoStack]";

    public interface Listener {
        void stackChanged(UndoStack stack);
    }

    private final Deque<Action> undoStack = new ArrayDeque<>();
    private final Deque<Action> redoStack = new ArrayDeque<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private int limit;

    public UndoStack() {
        this(0);
    }

    public UndoStack(int limit) {
        this.limit = Math.max(0, limit);
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = Math.max(0, limit);
        trim();
        changed();
    }

    /**
     * Record an action whose forward effect has already been applied.
     */
    public void push(Action action) {
        Objects.requireNonNull(action, "action");

        discardAll(redoStack);
        undoStack.push(action);
        trim();
        changed();
    }

    /**
     * @return false if there was nothing to undo
     */
    public boolean undo() {
        Action action = undoStack.poll();
        if (action == null) {
            return false;
        }
        action.undo();
        redoStack.push(action);
        changed();
        return true;
    }

    /**
     * @return false if there was nothing to redo
     */
    public boolean redo() {
        Action action = redoStack.poll();
        if (action == null) {
            return false;
        }
        action.redo();
        undoStack.push(action);
        changed();
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoCount() {
        return undoStack.size();
    }

    public int redoCount() {
        return redoStack.size();
    }

    public String undoDescription() {
        Action action = undoStack.peek();
        return action != null ? action.description() : null;
    }

    public String redoDescription() {
        Action action = redoStack.peek();
        return action != null ? action.description() : null;
    }

    public void clear() {
        discardAll(undoStack);
        discardAll(redoStack);
        changed();
    }

    private void trim() {
        if (limit <= 0) {
            return;
        }
        int trimmed = 0;
        while (undoStack.size() > limit) {
            undoStack.pollLast().discard();
            trimmed++;
        }
        if (trimmed > 0) {
            Log.log(LOG_SCOPE, "trimmed " + trimmed + " action(s) past limit " + limit, LogLevel.GENERAL);
        }
    }

    private static void discardAll(Deque<Action> stack) {
        Iterator<Action> it = stack.iterator();
        while (it.hasNext()) {
            it.next().discard();
            it.remove();
        }
    }

    private void changed() {
        for (Listener listener : listeners) {
            try {
                listener.stackChanged(this);
            } catch (RuntimeException e) {
                Log.logError(LOG_SCOPE, "listener failed", e);
            }
        }
    }
}
