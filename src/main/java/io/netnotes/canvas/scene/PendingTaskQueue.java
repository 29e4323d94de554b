package io.netnotes.canvas.scene;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

import io.netnotes.canvas.utils.LoggingHelpers.Log;

/**
 * PendingTaskQueue - {@link DeferredExecutor} drained explicitly by the host
 *
 * Any thread may post. The host calls {@link #runPending()} on the scene
 * thread at its safe point, typically right after an input event has been
 * dispatched. Tasks posted while draining wait for the next call.
 */
public class PendingTaskQueue implements DeferredExecutor {
    private final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();

    @Override
    public void post(Runnable task) {
        tasks.add(Objects.requireNonNull(task, "task"));
    }

    /**
     * Run every task that was queued when the call began.
     *
     * @return the number of tasks run
     */
    public int runPending() {
        int count = tasks.size();
        int ran = 0;
        for (int i = 0; i < count; i++) {
            Runnable task = tasks.poll();
            if (task == null) {
                break;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                Log.logError("[PendingTaskQueue]", "deferred task failed", e);
            }
            ran++;
        }
        return ran;
    }

    public int pendingCount() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }
}
