package io.advantageous.elekt.kv;

import io.advantageous.elekt.kv.store.RangeRequest;
import io.advantageous.elekt.kv.store.RangeResponse;
import io.advantageous.elekt.kv.store.Store;
import io.advantageous.elekt.kv.store.WatchEvent;
import io.advantageous.elekt.kv.store.WatchListener;
import io.advantageous.elekt.kv.store.Watcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reports every leader of an election to its listeners.
 * <p>
 * The loop runs only while somebody listens. Each cycle finds the leader (or waits for the
 * first candidate), reports it, then waits for the leader key to be deleted. Errors are
 * reported and the cycle starts over after a backoff; the loop ends only when a cycle
 * finishes with no listener left. At most one loop runs per observer.
 */
public class LeaderObserver {

    /**
     * Logger
     */
    private final Logger logger = LoggerFactory.getLogger(LeaderObserver.class);

    /**
     * Store holding the candidates.
     */
    private final Store store;
    /**
     * Election prefix.
     */
    private final String prefix;
    /**
     * Waits for the leader key to go away.
     */
    private final DeletionWaiter deletionWaiter;
    /**
     * Runs the observation loop.
     */
    private final ExecutorService longPollExecutorService;
    /**
     * Notifies listeners without blocking the loop.
     */
    private final ExecutorService outExecutorService;
    /**
     * Pause before restarting after an error.
     */
    private final long retryBackoffMillis;
    /**
     * Registered listeners.
     */
    private final CopyOnWriteArrayList<LeadershipListener> listeners = new CopyOnWriteArrayList<>();
    /**
     * True while the loop runs.
     */
    private final AtomicBoolean observing = new AtomicBoolean();

    /**
     * @param store                   store
     * @param prefix                  election prefix, {@code <keyPrefix><name>/}
     * @param longPollExecutorService runs the loop, should be single threaded
     * @param outExecutorService      delivers notifications, should be single threaded to keep order
     * @param retryBackoffMillis      pause before restarting after an error
     */
    public LeaderObserver(final Store store,
                          final String prefix,
                          final ExecutorService longPollExecutorService,
                          final ExecutorService outExecutorService,
                          final long retryBackoffMillis) {
        this.store = store;
        this.prefix = prefix;
        this.deletionWaiter = new DeletionWaiter(store);
        this.longPollExecutorService = longPollExecutorService;
        this.outExecutorService = outExecutorService;
        this.retryBackoffMillis = retryBackoffMillis;
    }

    /**
     * Register a listener, starting the loop if it is not running.
     *
     * @param listener listener
     * @return handle to unregister
     */
    public Subscription subscribe(final LeadershipListener listener) {
        listeners.add(listener);
        start();
        return () -> unsubscribe(listener);
    }

    /**
     * Unregister a listener. The loop stops at the end of its cycle once none is left.
     *
     * @param listener listener
     */
    public void unsubscribe(final LeadershipListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public boolean isObserving() {
        return observing.get();
    }

    /**
     * Report an error to every listener.
     *
     * @param error error
     */
    public void notifyError(final Throwable error) {
        submit(() -> listeners.forEach(listener -> {
            try {
                listener.error(error);
            } catch (RuntimeException ex) {
                logger.error("leadership listener failed handling error", ex);
            }
        }));
    }

    private void notifyLeader(final String leaderKey) {
        logger.debug("leader of {} is {}", prefix, leaderKey);
        submit(() -> listeners.forEach(listener -> {
            try {
                listener.leader(leaderKey);
            } catch (RuntimeException ex) {
                logger.error("leadership listener failed handling " + leaderKey, ex);
            }
        }));
    }

    private void submit(final Runnable notification) {
        try {
            outExecutorService.submit(notification);
        } catch (RejectedExecutionException ex) {
            logger.debug("notification for {} dropped, observer stopped", prefix);
        }
    }

    private void start() {
        if (!observing.compareAndSet(false, true)) {
            return;
        }
        try {
            longPollExecutorService.submit(this::run);
        } catch (RejectedExecutionException ex) {
            observing.set(false);
            throw ex;
        }
    }

    private void run() {
        try {
            while (!listeners.isEmpty() && !Thread.currentThread().isInterrupted()) {
                try {
                    observe();
                } catch (RuntimeException ex) {
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    logger.error("observing " + prefix + " failed, restarting", ex);
                    notifyError(ex);
                    backoff();
                }
            }
        } finally {
            observing.set(false);
        }

        /* A listener may have arrived between the last check and dropping the flag. */
        if (!listeners.isEmpty() && !Thread.currentThread().isInterrupted()
                && !longPollExecutorService.isShutdown()) {
            start();
        }
    }

    /**
     * One cycle: find the leader, report it, wait until it is deleted.
     */
    private void observe() {
        final RangeResponse candidates = store.range(RangeRequest.prefix(prefix)
                .sortByCreateRevision(RangeRequest.SortOrder.ASCEND)
                .keysOnly());

        final String leaderKey;
        final long watchFrom;
        if (candidates.isEmpty()) {
            final WatchEvent created = waitForFirstCandidate(candidates.getRevision() + 1);
            leaderKey = created.getKey();
            watchFrom = created.getRevision() + 1;
        } else {
            leaderKey = candidates.getKvs().get(0).getKey();
            watchFrom = candidates.getRevision() + 1;
        }

        notifyLeader(leaderKey);
        deletionWaiter.waitForDelete(leaderKey, watchFrom);
    }

    private WatchEvent waitForFirstCandidate(final long startRevision) {
        final CompletableFuture<WatchEvent> created = new CompletableFuture<>();
        final Watcher watcher = store.watchPrefix(prefix, startRevision, new WatchListener() {
            @Override
            public void onEvent(final WatchEvent event) {
                if (event.getType() == WatchEvent.Type.PUT) {
                    created.complete(event);
                }
            }

            @Override
            public void onError(final Throwable error) {
                created.completeExceptionally(error);
            }
        });

        try {
            logger.debug("no candidate under {}, waiting for one", prefix);
            return DeletionWaiter.await(created, prefix);
        } finally {
            watcher.cancel();
        }
    }

    private void backoff() {
        if (retryBackoffMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(retryBackoffMillis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
