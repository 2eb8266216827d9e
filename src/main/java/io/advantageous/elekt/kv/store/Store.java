package io.advantageous.elekt.kv.store;

/**
 * Linearizable key-value store with global revisions, conditional transactions,
 * leases and watches. This is all an election needs from a store.
 * <p>
 * Every call may block on the network. Failures surface as {@link StoreException}.
 */
public interface Store {

    /**
     * Commit a conditional transaction atomically.
     *
     * @param txn transaction
     * @return outcome with the revision after commit
     */
    TxnResponse commit(Txn txn);

    /**
     * Point read.
     *
     * @param key key
     * @return response with zero or one key
     */
    RangeResponse get(String key);

    /**
     * Prefix read.
     *
     * @param request range request
     * @return matching keys in the requested order
     */
    RangeResponse range(RangeRequest request);

    /**
     * Put, bound to {@code lease} when not 0.
     *
     * @return revision of the write
     */
    long put(String key, String value, long lease);

    /**
     * Delete one key.
     *
     * @return number of keys deleted
     */
    long delete(String key);

    /**
     * Grant a lease.
     *
     * @param ttlSeconds time to live in seconds
     * @return the granted lease
     */
    Lease grantLease(long ttlSeconds);

    /**
     * Revoke a lease by id, deleting the keys it backs.
     */
    void revokeLease(long leaseId);

    /**
     * Watch a single key.
     *
     * @param key           key
     * @param startRevision first revision of interest, 0 for events from now on
     * @param listener      listener
     * @return watch handle
     */
    Watcher watchKey(String key, long startRevision, WatchListener listener);

    /**
     * Watch every key under a prefix.
     *
     * @param prefix        prefix
     * @param startRevision first revision of interest, 0 for events from now on
     * @param listener      listener
     * @return watch handle
     */
    Watcher watchPrefix(String prefix, long startRevision, WatchListener listener);
}
