package io.advantageous.elekt.kv;

import io.advantageous.elekt.kv.store.Lease;
import io.advantageous.elekt.kv.store.RangeRequest;
import io.advantageous.elekt.kv.store.RangeResponse;
import io.advantageous.elekt.kv.store.Store;
import io.advantageous.elekt.kv.store.StoreException;
import io.advantageous.elekt.kv.store.Txn;
import io.advantageous.elekt.kv.store.TxnResponse;
import io.advantageous.elekt.kv.store.WatchListener;
import io.advantageous.elekt.kv.store.Watcher;

/**
 * Store that fails selected calls on demand.
 */
class FaultyStore implements Store {

    private final Store delegate;

    volatile boolean failRange;
    volatile boolean failGrant;

    FaultyStore(final Store delegate) {
        this.delegate = delegate;
    }

    @Override
    public TxnResponse commit(final Txn txn) {
        return delegate.commit(txn);
    }

    @Override
    public RangeResponse get(final String key) {
        return delegate.get(key);
    }

    @Override
    public RangeResponse range(final RangeRequest request) {
        if (failRange) {
            throw new StoreException("range unavailable");
        }
        return delegate.range(request);
    }

    @Override
    public long put(final String key, final String value, final long lease) {
        return delegate.put(key, value, lease);
    }

    @Override
    public long delete(final String key) {
        return delegate.delete(key);
    }

    @Override
    public Lease grantLease(final long ttlSeconds) {
        if (failGrant) {
            throw new StoreException("lease grant unavailable");
        }
        return delegate.grantLease(ttlSeconds);
    }

    @Override
    public void revokeLease(final long leaseId) {
        delegate.revokeLease(leaseId);
    }

    @Override
    public Watcher watchKey(final String key, final long startRevision, final WatchListener listener) {
        return delegate.watchKey(key, startRevision, listener);
    }

    @Override
    public Watcher watchPrefix(final String prefix, final long startRevision, final WatchListener listener) {
        return delegate.watchPrefix(prefix, startRevision, listener);
    }
}
