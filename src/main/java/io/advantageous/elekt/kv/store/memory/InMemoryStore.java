package io.advantageous.elekt.kv.store.memory;

import io.advantageous.elekt.kv.store.Compare;
import io.advantageous.elekt.kv.store.KeyValue;
import io.advantageous.elekt.kv.store.Lease;
import io.advantageous.elekt.kv.store.Op;
import io.advantageous.elekt.kv.store.OpResponse;
import io.advantageous.elekt.kv.store.RangeRequest;
import io.advantageous.elekt.kv.store.RangeResponse;
import io.advantageous.elekt.kv.store.Store;
import io.advantageous.elekt.kv.store.StoreException;
import io.advantageous.elekt.kv.store.Txn;
import io.advantageous.elekt.kv.store.TxnResponse;
import io.advantageous.elekt.kv.store.WatchEvent;
import io.advantageous.elekt.kv.store.WatchListener;
import io.advantageous.elekt.kv.store.Watcher;
import io.advantageous.reakt.reactor.Reactor;
import io.advantageous.reakt.reactor.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Single process store with the ordering guarantees of a consensus backed one.
 * <p>
 * Every operation runs under one lock, so the store is linearizable. Each write bumps the
 * global revision once (a transaction with several writes shares one revision). Watch events
 * and lease lost notifications are delivered in revision order on one dispatch thread.
 * <p>
 * Leases are kept alive automatically, the way a client keep-alive loop would, until
 * {@link #pauseKeepAlive(long)} is called. A repeating reactor task refreshes live leases and
 * expires the paused ones whose deadline has passed. Call {@link #process()} to drive it.
 * <p>
 * Only the events of the last {@code historyRevisions} revisions are kept for watch replay.
 * A watch asking for an older start revision fails with a {@link StoreException}.
 */
public class InMemoryStore implements Store {

    /**
     * Logger
     */
    private final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    /**
     * Guards every piece of state below.
     */
    private final Object lock = new Object();
    /**
     * Live keys.
     */
    private final TreeMap<String, KeyValue> data = new TreeMap<>();
    /**
     * Default number of revisions kept for watch replay.
     */
    public static final long DEFAULT_HISTORY_REVISIONS = 1000;

    /**
     * Recent events in revision order, used to replay watches started at an older revision.
     */
    private final Deque<WatchEvent> history = new ArrayDeque<>();
    /**
     * Revisions kept in history.
     */
    private final long historyRevisions;
    /**
     * Events at or below this revision are gone.
     */
    private long compactedRevision;
    /**
     * Granted leases by id.
     */
    private final Map<Long, MemoryLease> leases = new LinkedHashMap<>();
    /**
     * Open watches.
     */
    private final Map<Long, MemoryWatcher> watchers = new LinkedHashMap<>();
    /**
     * Current global revision.
     */
    private long revision = 1;
    /**
     * Lease id generator.
     */
    private final AtomicLong leaseIds = new AtomicLong(7587);
    /**
     * Watch id generator.
     */
    private final AtomicLong watchIds = new AtomicLong();
    /**
     * Delivers watch events and lost notifications outside the lock.
     */
    private final ExecutorService dispatchExecutorService = Executors.newSingleThreadExecutor();
    /**
     * Reactor for the lease check.
     */
    private final Reactor reactor;
    /**
     * Clock for lease deadlines.
     */
    private final TimeSource timeSource;

    public InMemoryStore() {
        this(System::currentTimeMillis);
    }

    public InMemoryStore(final TimeSource timeSource) {
        this(Reactor.reactor(Duration.ofSeconds(30), timeSource), timeSource);
    }

    /**
     * @param reactor    reactor that runs the lease check
     * @param timeSource clock used for lease deadlines, should be the reactor's clock
     */
    public InMemoryStore(final Reactor reactor, final TimeSource timeSource) {
        this(reactor, timeSource, DEFAULT_HISTORY_REVISIONS);
    }

    /**
     * @param reactor          reactor that runs the lease check
     * @param timeSource       clock used for lease deadlines, should be the reactor's clock
     * @param historyRevisions revisions kept for watch replay, at least one
     */
    public InMemoryStore(final Reactor reactor, final TimeSource timeSource, final long historyRevisions) {
        this.reactor = reactor;
        this.timeSource = timeSource;
        this.historyRevisions = Math.max(1, historyRevisions);
        this.reactor.addRepeatingTask(Duration.ofSeconds(1), this::checkLeases);
    }

    @Override
    public TxnResponse commit(final Txn txn) {
        synchronized (lock) {
            final boolean succeeded = txn.getCompares().stream()
                    .allMatch(compare -> compare.test(data.get(compare.getKey())));
            final List<Op> ops = succeeded ? txn.getSuccess() : txn.getFailure();

            for (Op op : ops) {
                if (op.getType() == Op.Type.PUT && op.getLease() != 0 && !leases.containsKey(op.getLease())) {
                    throw new StoreException("lease not found " + op.getLease());
                }
            }

            final long writeRevision = revision + 1;
            final List<WatchEvent> events = new ArrayList<>();
            final List<OpResponse> responses = new ArrayList<>(ops.size());
            for (Op op : ops) {
                responses.add(apply(op, writeRevision, events));
            }
            publish(events);
            return new TxnResponse(revision, succeeded, responses);
        }
    }

    @Override
    public RangeResponse get(final String key) {
        synchronized (lock) {
            final KeyValue keyValue = data.get(key);
            return new RangeResponse(revision,
                    keyValue == null ? Collections.emptyList() : Collections.singletonList(keyValue));
        }
    }

    @Override
    public RangeResponse range(final RangeRequest request) {
        synchronized (lock) {
            List<KeyValue> kvs = data.tailMap(request.getPrefix(), true).values().stream()
                    .filter(kv -> kv.getKey().startsWith(request.getPrefix()))
                    .filter(kv -> request.getMaxCreateRevision() == 0
                            || kv.getCreateRevision() <= request.getMaxCreateRevision())
                    .map(kv -> request.isKeysOnly() ? kv.keyOnly() : kv)
                    .collect(Collectors.toList());

            final Comparator<KeyValue> byCreate = Comparator.comparingLong(KeyValue::getCreateRevision);
            switch (request.getSortOrder()) {
                case ASCEND:
                    kvs.sort(byCreate);
                    break;
                case DESCEND:
                    kvs.sort(byCreate.reversed());
                    break;
                default:
                    break;
            }
            return new RangeResponse(revision, kvs);
        }
    }

    @Override
    public long put(final String key, final String value, final long lease) {
        return commit(Txn.txn().then(Op.put(key, value, lease)).build()).getRevision();
    }

    @Override
    public long delete(final String key) {
        return commit(Txn.txn().then(Op.delete(key)).build()).getResponses().get(0).getDeleted();
    }

    @Override
    public Lease grantLease(final long ttlSeconds) {
        final long ttl = Math.max(1, ttlSeconds);
        synchronized (lock) {
            final MemoryLease lease = new MemoryLease(leaseIds.incrementAndGet(), ttl);
            lease.deadline = timeSource.getTime() + ttl * 1000;
            leases.put(lease.id, lease);
            logger.debug("granted lease {} ttl {}s", lease.id, ttl);
            return lease;
        }
    }

    @Override
    public void revokeLease(final long leaseId) {
        synchronized (lock) {
            final MemoryLease lease = leases.get(leaseId);
            if (lease == null) {
                throw new StoreException("lease not found " + leaseId);
            }
            dropLease(lease);
            logger.debug("revoked lease {}", leaseId);
        }
    }

    @Override
    public Watcher watchKey(final String key, final long startRevision, final WatchListener listener) {
        return watch(key, false, startRevision, listener);
    }

    @Override
    public Watcher watchPrefix(final String prefix, final long startRevision, final WatchListener listener) {
        return watch(prefix, true, startRevision, listener);
    }

    /**
     * Run due reactor tasks, which includes the lease check.
     */
    public void process() {
        reactor.process();
    }

    /**
     * Expire a lease now, as if its keep-alive had stopped long ago. Its keys are deleted and
     * its lost listeners fire.
     *
     * @param leaseId lease id
     */
    public void expireLease(final long leaseId) {
        synchronized (lock) {
            final MemoryLease lease = leases.get(leaseId);
            if (lease == null) {
                throw new StoreException("lease not found " + leaseId);
            }
            expire(lease);
        }
    }

    /**
     * Stop refreshing a lease. It expires once its ttl elapses on the store clock.
     *
     * @param leaseId lease id
     */
    public void pauseKeepAlive(final long leaseId) {
        synchronized (lock) {
            final MemoryLease lease = leases.get(leaseId);
            if (lease != null) {
                lease.keepAlive = false;
            }
        }
    }

    /**
     * Break every open watch stream with {@code cause}. The watches stay open until cancelled.
     *
     * @param cause error handed to the watch listeners
     */
    public void failWatches(final Throwable cause) {
        synchronized (lock) {
            for (MemoryWatcher watcher : watchers.values()) {
                dispatchExecutorService.submit(() -> watcher.fail(cause));
            }
        }
    }

    public int activeWatchCount() {
        synchronized (lock) {
            return watchers.size();
        }
    }

    public boolean hasLease(final long leaseId) {
        synchronized (lock) {
            return leases.containsKey(leaseId);
        }
    }

    public long getRevision() {
        synchronized (lock) {
            return revision;
        }
    }

    /**
     * Drop the history at or below {@code compactRevision}.
     *
     * @param compactRevision revision to compact up to, at most the current revision
     */
    public void compact(final long compactRevision) {
        synchronized (lock) {
            if (compactRevision > revision) {
                throw new StoreException("compaction revision " + compactRevision
                        + " is ahead of current revision " + revision);
            }
            compactTo(compactRevision);
        }
    }

    public long getCompactedRevision() {
        synchronized (lock) {
            return compactedRevision;
        }
    }

    public int historySize() {
        synchronized (lock) {
            return history.size();
        }
    }

    /**
     * Stop the dispatch thread.
     */
    public void close() {
        dispatchExecutorService.shutdownNow();
    }

    private Watcher watch(final String key, final boolean prefix, final long startRevision,
                          final WatchListener listener) {
        synchronized (lock) {
            if (startRevision > 0 && startRevision <= compactedRevision) {
                throw new StoreException("required revision " + startRevision
                        + " has been compacted, compacted revision is " + compactedRevision);
            }
            final MemoryWatcher watcher = new MemoryWatcher(watchIds.incrementAndGet(), key, prefix, listener);
            watchers.put(watcher.id, watcher);
            if (startRevision > 0) {
                for (WatchEvent event : history) {
                    if (event.getRevision() >= startRevision && watcher.matches(event.getKey())) {
                        dispatchExecutorService.submit(() -> watcher.deliver(event));
                    }
                }
            }
            return watcher;
        }
    }

    private OpResponse apply(final Op op, final long writeRevision, final List<WatchEvent> events) {
        final KeyValue current = data.get(op.getKey());
        switch (op.getType()) {
            case PUT: {
                final KeyValue next = current == null
                        ? new KeyValue(op.getKey(), op.getValue(), writeRevision, writeRevision, 1, op.getLease())
                        : new KeyValue(op.getKey(), op.getValue(), current.getCreateRevision(), writeRevision,
                        current.getVersion() + 1, op.getLease());
                data.put(op.getKey(), next);
                events.add(new WatchEvent(WatchEvent.Type.PUT, next));
                return new OpResponse(Op.Type.PUT, Collections.emptyList(), 0);
            }
            case DELETE: {
                if (current == null) {
                    return new OpResponse(Op.Type.DELETE, Collections.emptyList(), 0);
                }
                data.remove(op.getKey());
                events.add(deleted(current, writeRevision));
                return new OpResponse(Op.Type.DELETE, Collections.emptyList(), 1);
            }
            default:
                return new OpResponse(Op.Type.GET,
                        current == null ? Collections.emptyList() : Collections.singletonList(current), 0);
        }
    }

    private WatchEvent deleted(final KeyValue keyValue, final long deleteRevision) {
        return new WatchEvent(WatchEvent.Type.DELETE, new KeyValue(keyValue.getKey(), keyValue.getValue(),
                keyValue.getCreateRevision(), deleteRevision, keyValue.getVersion(), keyValue.getLease()));
    }

    /**
     * Record events, bump the revision if anything changed, hand events to matching watches.
     * Caller holds the lock.
     */
    private void publish(final List<WatchEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        revision++;
        history.addAll(events);
        compactTo(revision - historyRevisions);
        for (WatchEvent event : events) {
            for (MemoryWatcher watcher : watchers.values()) {
                if (watcher.matches(event.getKey())) {
                    dispatchExecutorService.submit(() -> watcher.deliver(event));
                }
            }
        }
    }

    /**
     * Caller holds the lock.
     */
    private void compactTo(final long compactRevision) {
        if (compactRevision <= compactedRevision) {
            return;
        }
        while (!history.isEmpty() && history.peekFirst().getRevision() <= compactRevision) {
            history.pollFirst();
        }
        compactedRevision = compactRevision;
        logger.trace("history compacted to revision {}", compactRevision);
    }

    /**
     * Remove a lease and delete its keys in one revision. Caller holds the lock.
     */
    private void dropLease(final MemoryLease lease) {
        leases.remove(lease.id);
        final long deleteRevision = revision + 1;
        final List<KeyValue> owned = data.values().stream()
                .filter(kv -> kv.getLease() == lease.id)
                .collect(Collectors.toList());
        final List<WatchEvent> events = new ArrayList<>(owned.size());
        for (KeyValue kv : owned) {
            data.remove(kv.getKey());
            events.add(deleted(kv, deleteRevision));
        }
        publish(events);
    }

    /**
     * Caller holds the lock.
     */
    private void expire(final MemoryLease lease) {
        logger.info("lease {} expired", lease.id);
        dropLease(lease);
        final List<Runnable> listeners = new ArrayList<>(lease.lostListeners);
        lease.lostListeners.clear();
        for (Runnable listener : listeners) {
            dispatchExecutorService.submit(listener);
        }
    }

    private void checkLeases() {
        final long now = timeSource.getTime();
        synchronized (lock) {
            for (MemoryLease lease : new ArrayList<>(leases.values())) {
                if (lease.keepAlive) {
                    lease.deadline = now + lease.ttlSeconds * 1000;
                } else if (now >= lease.deadline) {
                    expire(lease);
                }
            }
        }
    }

    private class MemoryLease implements Lease {

        private final long id;
        private final long ttlSeconds;
        private final List<Runnable> lostListeners = new CopyOnWriteArrayList<>();
        private volatile boolean keepAlive = true;
        private long deadline;

        private MemoryLease(final long id, final long ttlSeconds) {
            this.id = id;
            this.ttlSeconds = ttlSeconds;
        }

        @Override
        public long getId() {
            return id;
        }

        @Override
        public long getTtlSeconds() {
            return ttlSeconds;
        }

        @Override
        public void onLost(final Runnable listener) {
            lostListeners.add(listener);
        }

        @Override
        public void removeLostListeners() {
            lostListeners.clear();
        }

        @Override
        public void revoke() {
            revokeLease(id);
        }
    }

    private class MemoryWatcher implements Watcher {

        private final long id;
        private final String key;
        private final boolean prefix;
        private final WatchListener listener;
        private volatile boolean cancelled;
        private volatile boolean failed;

        private MemoryWatcher(final long id, final String key, final boolean prefix, final WatchListener listener) {
            this.id = id;
            this.key = key;
            this.prefix = prefix;
            this.listener = listener;
        }

        private boolean matches(final String candidate) {
            return prefix ? candidate.startsWith(key) : candidate.equals(key);
        }

        private void deliver(final WatchEvent event) {
            if (cancelled || failed) {
                return;
            }
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                logger.error("watch listener failed on " + event, ex);
            }
        }

        private void fail(final Throwable cause) {
            if (cancelled || failed) {
                return;
            }
            failed = true;
            listener.onError(cause);
        }

        @Override
        public void cancel() {
            cancelled = true;
            synchronized (lock) {
                watchers.remove(id);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
