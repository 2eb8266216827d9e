package io.advantageous.elekt.kv;

import io.advantageous.elekt.kv.store.Compare;
import io.advantageous.elekt.kv.store.KeyValue;
import io.advantageous.elekt.kv.store.Lease;
import io.advantageous.elekt.kv.store.Op;
import io.advantageous.elekt.kv.store.RangeRequest;
import io.advantageous.elekt.kv.store.RangeResponse;
import io.advantageous.elekt.kv.store.Store;
import io.advantageous.elekt.kv.store.StoreException;
import io.advantageous.elekt.kv.store.Txn;
import io.advantageous.elekt.kv.store.TxnResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * One process's candidacy in a named election.
 * <p>
 * A candidate is the key {@code <prefix><name>/<leaseId>} bound to the session's lease. The
 * candidate with the lowest creation revision under the election prefix is the leader, so
 * leadership passes on in the order candidates arrived. Exclusivity comes from the store's
 * transactions alone.
 * <p>
 * Calls on one session must be serialized by the caller. {@link #campaign(String)} blocks until
 * every earlier candidate is gone.
 */
public class ElectionSession {

    /**
     * Default key namespace.
     */
    public static final String DEFAULT_KEY_PREFIX = "election/";

    /**
     * Logger
     */
    private final Logger logger = LoggerFactory.getLogger(ElectionSession.class);

    /**
     * Store holding the candidates.
     */
    private final Store store;
    /**
     * Election name.
     */
    private final String name;
    /**
     * Keys of this election live under this prefix.
     */
    private final String prefix;
    /**
     * Lease ttl in seconds.
     */
    private final long ttlSeconds;
    /**
     * Waits for earlier candidates to leave.
     */
    private final DeletionWaiter deletionWaiter;
    /**
     * Runs lease replacement after a lease is lost.
     */
    private final ExecutorService recoveryExecutorService;
    /**
     * True when the recovery executor was created here and must be shut down here.
     */
    private final boolean ownsRecoveryExecutor;
    /**
     * Receives lease replacement failures.
     */
    private final Consumer<Throwable> errorHandler;
    /**
     * Guards lease replacement.
     */
    private final Object leaseLock = new Object();
    /**
     * Held lease, null until initialized or after it was lost.
     */
    private final AtomicReference<Lease> lease = new AtomicReference<>();

    private volatile long leaseId;
    private volatile String leaderKey;
    private volatile long leaderRevision;
    private volatile boolean campaigning;
    private volatile boolean closed;

    /**
     * @param store    store
     * @param name     election name
     * @param timeUnit time unit of ttl
     * @param ttl      lease ttl
     */
    public ElectionSession(final Store store,
                           final String name,
                           final TimeUnit timeUnit,
                           final long ttl) {
        this(store, DEFAULT_KEY_PREFIX, name, timeUnit, ttl, null, null);
    }

    /**
     * @param store                   store
     * @param keyPrefix               key namespace, the election prefix is {@code keyPrefix + name + "/"}
     * @param name                    election name
     * @param timeUnit                time unit of ttl
     * @param ttl                     lease ttl, rounded down to seconds, at least one second
     * @param recoveryExecutorService runs lease replacement, null for a private thread
     * @param errorHandler            receives lease replacement failures, null to only log them
     */
    public ElectionSession(final Store store,
                           final String keyPrefix,
                           final String name,
                           final TimeUnit timeUnit,
                           final long ttl,
                           final ExecutorService recoveryExecutorService,
                           final Consumer<Throwable> errorHandler) {
        this.store = store;
        this.name = name;
        this.prefix = keyPrefix + name + "/";
        this.ttlSeconds = Math.max(1, timeUnit.toSeconds(ttl));
        this.deletionWaiter = new DeletionWaiter(store);
        this.ownsRecoveryExecutor = recoveryExecutorService == null;
        this.recoveryExecutorService = ownsRecoveryExecutor
                ? Executors.newSingleThreadExecutor() : recoveryExecutorService;
        this.errorHandler = errorHandler == null ? error -> { } : errorHandler;
    }

    /**
     * Grant a lease if none is held. Idempotent.
     *
     * @return id of the held lease
     */
    public long initialize() {
        synchronized (leaseLock) {
            final Lease current = lease.get();
            if (current != null) {
                return current.getId();
            }
            final Lease granted = store.grantLease(ttlSeconds);
            granted.onLost(() -> onLeaseLost(granted));
            lease.set(granted);
            leaseId = granted.getId();
            logger.info("election {} holds lease {}", name, leaseId);
            return leaseId;
        }
    }

    /**
     * Become a candidate with {@code value} and block until elected.
     * <p>
     * Campaigning again on the same lease keeps the existing place in line and proclaims
     * the new value if it differs. On any failure the candidacy is resigned before the error
     * is rethrown, so a failed campaign never leaves the session campaigning.
     *
     * @param value value to publish under the candidate key
     * @return the candidate key, now the leader
     */
    public String campaign(final String value) {
        final long id = initialize();
        final String key = candidateKey(id);

        try {
            final TxnResponse response = store.commit(Txn.txn()
                    .when(Compare.createRevisionEquals(key, 0))
                    .then(Op.put(key, value, id))
                    .otherwise(Op.get(key))
                    .build());

            leaderKey = key;
            leaderRevision = response.getRevision();
            campaigning = true;

            if (!response.isSucceeded()) {
                final List<KeyValue> existing = response.getResponses().get(0).getKvs();
                if (existing.isEmpty()) {
                    throw new NotLeaderException("candidate " + key + " vanished during campaign");
                }
                leaderRevision = existing.get(0).getCreateRevision();
                logger.debug("{} already a candidate since revision {}", key, leaderRevision);
                if (!value.equals(existing.get(0).getValue())) {
                    proclaim(value);
                }
            } else {
                logger.debug("{} became a candidate at revision {}", key, leaderRevision);
            }

            waitForElected(key);
        } catch (RuntimeException ex) {
            logger.debug("campaign of " + key + " failed, resigning", ex);
            try {
                resign();
            } catch (RuntimeException resignFailure) {
                ex.addSuppressed(resignFailure);
            }
            throw ex;
        }

        logger.info("{} elected leader of {}", key, name);
        return key;
    }

    /**
     * Replace the value of the held candidacy without losing its place in line.
     *
     * @param value new value
     * @throws NotLeaderException if not campaigning or the candidate key is gone
     */
    public void proclaim(final String value) {
        if (!campaigning) {
            throw new NotLeaderException("not campaigning in election " + name);
        }

        final long id = leaseId;
        final String key = candidateKey(id);
        final TxnResponse response = store.commit(Txn.txn()
                .when(Compare.createRevisionEquals(key, leaderRevision))
                .then(Op.put(key, value, id))
                .build());

        if (!response.isSucceeded()) {
            leaderKey = null;
            throw new NotLeaderException("candidate " + key + " of election " + name + " was superseded");
        }
        logger.debug("{} proclaimed at revision {}", key, response.getRevision());
    }

    /**
     * Give up the candidacy. No-op when not campaigning.
     * <p>
     * If the candidate key is no longer the one this session created, the lease is revoked
     * so nothing it backs lingers; the next {@link #initialize()} grants a fresh one.
     *
     * @return true if a candidacy was held
     */
    public boolean resign() {
        if (!campaigning) {
            return false;
        }

        try {
            final String key = candidateKey(leaseId);
            final TxnResponse response = store.commit(Txn.txn()
                    .when(Compare.createRevisionEquals(key, leaderRevision))
                    .then(Op.delete(key))
                    .build());

            if (response.isSucceeded()) {
                logger.info("{} resigned from {}", key, name);
            } else {
                logger.info("{} no longer held in {}, revoking lease", key, name);
                revokeLease();
            }
        } finally {
            leaderKey = null;
            leaderRevision = 0;
            campaigning = false;
        }
        return true;
    }

    /**
     * Key of the current leader. Needs no lease and no campaign.
     *
     * @return leader key
     * @throws NoLeaderException if there is no candidate
     */
    public String getLeader() {
        return getLeaderKeyValue().getKey();
    }

    /**
     * Current leader with its value and revisions.
     *
     * @return leader key value
     * @throws NoLeaderException if there is no candidate
     */
    public KeyValue getLeaderKeyValue() {
        final RangeResponse candidates = store.range(RangeRequest.prefix(prefix)
                .sortByCreateRevision(RangeRequest.SortOrder.ASCEND));
        return candidates.first().orElseThrow(() -> new NoLeaderException(name));
    }

    /**
     * Revoke the held lease and stop lease recovery.
     */
    public void close() {
        closed = true;
        synchronized (leaseLock) {
            final Lease current = lease.getAndSet(null);
            leaseId = 0;
            if (current != null) {
                current.removeLostListeners();
                try {
                    current.revoke();
                } catch (StoreException ex) {
                    logger.warn("unable to revoke lease " + current.getId() + " of election " + name, ex);
                }
            }
        }
        if (ownsRecoveryExecutor) {
            recoveryExecutorService.shutdownNow();
        }
    }

    /**
     * Wait until every candidate created before ours is deleted, then check ours survived.
     */
    private void waitForElected(final String key) {
        final long lastRevision = leaderRevision - 1;
        if (lastRevision > 0) {
            final RangeResponse earlier = store.range(RangeRequest.prefix(prefix)
                    .maxCreateRevision(lastRevision)
                    .sortByCreateRevision(RangeRequest.SortOrder.DESCEND)
                    .keysOnly());

            if (!earlier.isEmpty()) {
                final List<String> keys = earlier.getKvs().stream()
                        .map(KeyValue::getKey)
                        .collect(Collectors.toList());
                logger.debug("{} waiting for {} earlier candidates", key, keys.size());
                deletionWaiter.waitForDeletes(keys, earlier.getRevision() + 1);
            }
        }

        final boolean held = store.get(key).first()
                .map(kv -> kv.getCreateRevision() == leaderRevision)
                .orElse(false);
        if (!held) {
            throw new NotLeaderException("candidate " + key + " was deleted while waiting for election " + name);
        }
    }

    /**
     * Drop the lease reference before revoking, so a lost notification for it is ignored.
     */
    private void revokeLease() {
        synchronized (leaseLock) {
            final Lease current = lease.getAndSet(null);
            leaseId = 0;
            if (current != null) {
                current.removeLostListeners();
                try {
                    current.revoke();
                } catch (StoreException ex) {
                    logger.warn("unable to revoke lease " + current.getId() + " of election " + name, ex);
                }
            }
        }
    }

    private void onLeaseLost(final Lease lost) {
        synchronized (leaseLock) {
            if (lease.get() != lost) {
                return;
            }
            lost.removeLostListeners();
            lease.set(null);
            leaseId = 0;
        }
        logger.info("election {} lost lease {}", name, lost.getId());

        if (closed) {
            return;
        }
        try {
            recoveryExecutorService.submit(() -> {
                try {
                    initialize();
                } catch (RuntimeException ex) {
                    logger.error("unable to replace lost lease of election " + name, ex);
                    errorHandler.accept(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            logger.warn("lease recovery of election {} skipped, executor stopped", name);
        }
    }

    String candidateKey(final long id) {
        return prefix + id;
    }

    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /**
     * @return id of the held lease, 0 when none
     */
    public long getLeaseId() {
        return leaseId;
    }

    /**
     * @return candidate key while campaigning, null otherwise or after a failed proclaim
     */
    public String getLeaderKey() {
        return leaderKey;
    }

    /**
     * @return creation revision of the candidate key, 0 when not campaigning
     */
    public long getLeaderRevision() {
        return leaderRevision;
    }

    public boolean isReady() {
        return leaseId != 0;
    }

    public boolean isCampaigning() {
        return campaigning;
    }
}
