package io.netnotes.canvas.scene;

/**
 * The host's "next iteration of the event loop".
 *
 * Work posted here must not run inside the call that posts it; it runs once
 * the current dispatch has fully returned, on the thread that owns the scene.
 */
public interface DeferredExecutor {

    void post(Runnable task);
}
