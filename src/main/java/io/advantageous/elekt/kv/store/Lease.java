package io.advantageous.elekt.kv.store;

/**
 * A granted lease. Keys put with the lease id are deleted by the store when the lease
 * expires or is revoked. Keep-alive is the store's business.
 */
public interface Lease {

    long getId();

    long getTtlSeconds();

    /**
     * Register for the lease being lost (expired or revoked by someone else).
     * Listeners fire at most once.
     */
    void onLost(Runnable listener);

    /**
     * Drop every lost listener.
     */
    void removeLostListeners();

    /**
     * Revoke now, deleting the keys it backs. Does not fire lost listeners.
     */
    void revoke();
}
