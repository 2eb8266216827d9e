package io.advantageous.elekt.kv.store;

/**
 * Handle of an open watch. Must be cancelled to release server side state.
 */
public interface Watcher {

    /**
     * Cancel the watch. Idempotent.
     */
    void cancel();

    boolean isCancelled();
}
