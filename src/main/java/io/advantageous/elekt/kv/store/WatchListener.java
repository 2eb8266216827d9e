package io.advantageous.elekt.kv.store;

/**
 * Receives events of a watch. Called from a store thread, events in revision order.
 */
public interface WatchListener {

    void onEvent(WatchEvent event);

    /**
     * The watch stream failed. No more events follow.
     */
    void onError(Throwable error);
}
