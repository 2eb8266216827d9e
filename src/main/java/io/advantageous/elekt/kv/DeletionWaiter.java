package io.advantageous.elekt.kv;

import io.advantageous.elekt.kv.store.RangeResponse;
import io.advantageous.elekt.kv.store.Store;
import io.advantageous.elekt.kv.store.StoreException;
import io.advantageous.elekt.kv.store.WatchEvent;
import io.advantageous.elekt.kv.store.WatchListener;
import io.advantageous.elekt.kv.store.Watcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Blocks until keys are deleted. Every watch opened here is cancelled before returning,
 * whether the wait ended with the delete, a watch error or an interrupt.
 */
public class DeletionWaiter {

    private final Logger logger = LoggerFactory.getLogger(DeletionWaiter.class);

    private final Store store;

    public DeletionWaiter(final Store store) {
        this.store = store;
    }

    /**
     * Wait for the next delete of {@code key}.
     *
     * @param key key
     */
    public void waitForDelete(final String key) {
        waitForDelete(key, 0);
    }

    /**
     * Wait for a delete of {@code key} at or after {@code startRevision}.
     *
     * @param key           key
     * @param startRevision first revision to consider, 0 for deletes from now on
     */
    public void waitForDelete(final String key, final long startRevision) {
        final CompletableFuture<WatchEvent> deleted = new CompletableFuture<>();
        final Watcher watcher = store.watchKey(key, startRevision, new WatchListener() {
            @Override
            public void onEvent(final WatchEvent event) {
                if (event.getType() == WatchEvent.Type.DELETE) {
                    deleted.complete(event);
                }
            }

            @Override
            public void onError(final Throwable error) {
                deleted.completeExceptionally(error);
            }
        });

        try {
            logger.debug("waiting for delete of {}", key);
            final WatchEvent event = await(deleted, key);
            logger.debug("{} deleted at revision {}", key, event.getRevision());
        } finally {
            watcher.cancel();
        }
    }

    /**
     * Wait for every key in order. A key that is already gone when its turn comes is skipped.
     *
     * @param keys keys, waited on in list order
     */
    public void waitForDeletes(final List<String> keys) {
        waitForDeletes(keys, 0);
    }

    /**
     * @param keys          keys, waited on in list order
     * @param startRevision revision right after the read that listed {@code keys}, 0 if unknown
     */
    public void waitForDeletes(final List<String> keys, final long startRevision) {
        if (keys.isEmpty()) {
            return;
        }

        if (keys.size() == 1) {
            waitForDelete(keys.get(0), startRevision);
            return;
        }

        for (String key : keys) {
            final RangeResponse current = store.get(key);
            if (current.isEmpty()) {
                continue;
            }
            waitForDelete(key, current.getRevision() + 1);
        }
    }

    /**
     * Block on a watch outcome.
     *
     * @param future completed by a watch listener
     * @param what   key or prefix watched, for messages
     */
    static <T> T await(final CompletableFuture<T> future, final String what) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreException("interrupted while watching " + what, ex);
        } catch (ExecutionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof StoreException) {
                throw (StoreException) cause;
            }
            throw new StoreException("watch on " + what + " failed", cause);
        }
    }
}
