package io.advantageous.elekt.kv;

import io.advantageous.elekt.kv.store.Store;
import io.advantageous.reakt.Callback;
import io.advantageous.reakt.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;


/**
 * Fair leader election for a named role over a revisioned key-value store.
 * <p>
 * Candidates line up by the creation revision of their keys; the oldest live candidate leads.
 * Requests run in submission order on a request thread and answer through callbacks, reads run
 * on their own thread, and leadership changes are pushed to listeners from an observer loop.
 */
public class KvLeadershipElector {

    /**
     * Logger
     */
    protected final Logger logger = LoggerFactory.getLogger(KvLeadershipElector.class);

    /**
     * Election name.
     */
    private final String electionName;
    /**
     * Candidacy state machine.
     */
    private final ElectionSession session;
    /**
     * Pushes leadership changes to listeners.
     */
    private final LeaderObserver leaderObserver;
    /**
     * One request queue for the store so campaign, proclaim and resign happen orderly.
     */
    private final ExecutorService requestExecutorService = Executors.newSingleThreadExecutor();
    /**
     * Reads, so a leader lookup never waits behind a campaign.
     */
    private final ExecutorService readExecutorService = Executors.newSingleThreadExecutor();
    /**
     * Another thread to notify listeners w/o blocking request queue.
     */
    private final ExecutorService outExecutorService = Executors.newSingleThreadExecutor();
    /**
     * Another thread for the leadership observation loop.
     */
    private final ExecutorService longPollExecutorService = Executors.newSingleThreadExecutor();
    /**
     * Replaces a lost lease while a campaign may hold the request thread.
     */
    private final ExecutorService leaseExecutorService = Executors.newSingleThreadExecutor();

    /**
     * @param store        store
     * @param electionName election name
     * @param timeUnit     timeUnit
     * @param ttl          lease ttl
     */
    public KvLeadershipElector(final Store store,
                               final String electionName,
                               final TimeUnit timeUnit,
                               final long ttl) {
        this(store, ElectionSession.DEFAULT_KEY_PREFIX, electionName, timeUnit, ttl, Duration.ofSeconds(1));
    }

    /**
     * @param store               store
     * @param keyPrefix           key namespace, keys are {@code <keyPrefix><electionName>/<leaseId>}
     * @param electionName        election name
     * @param timeUnit            timeUnit
     * @param ttl                 lease ttl
     * @param observeRetryBackoff pause before the observer restarts after an error
     */
    public KvLeadershipElector(final Store store,
                               final String keyPrefix,
                               final String electionName,
                               final TimeUnit timeUnit,
                               final long ttl,
                               final Duration observeRetryBackoff) {
        this.electionName = electionName;
        this.leaderObserver = new LeaderObserver(store, keyPrefix + electionName + "/",
                longPollExecutorService, outExecutorService, observeRetryBackoff.toMillis());
        this.session = new ElectionSession(store, keyPrefix, electionName, timeUnit, ttl,
                leaseExecutorService, leaderObserver::notifyError);
    }

    /**
     * Acquire the lease now instead of on the first campaign.
     *
     * @param callback receives the lease id
     */
    public void initialize(final Callback<Long> callback) {
        requestExecutorService.submit(() -> {
            try {
                callback.resolve(session.initialize());
            } catch (Exception ex) {
                logger.error("Unable to initialize election " + electionName, ex);
                callback.reject("Unable to initialize election " + electionName, ex);
            }
        });
    }

    /**
     * Campaign for leadership. The callback fires once this node is leader, which can take as
     * long as the earlier candidates hold on.
     *
     * @param value    value to publish, typically this node's endpoint
     * @param callback receives the leader key once elected
     */
    public void campaign(final String value, final Callback<String> callback) {
        requestExecutorService.submit(() -> {
            try {
                callback.resolve(session.campaign(value));
            } catch (Exception ex) {
                logger.error("Unable to become leader of " + electionName, ex);
                callback.reject("Unable to become leader of " + electionName, ex);
            }
        });
    }

    /**
     * Change the published value while keeping leadership.
     *
     * @param value    new value
     * @param callback true once proclaimed, rejected with {@link NotLeaderException} if not leader
     */
    public void proclaim(final String value, final Callback<Boolean> callback) {
        requestExecutorService.submit(() -> {
            try {
                session.proclaim(value);
                callback.resolve(true);
            } catch (Exception ex) {
                logger.error("Unable to proclaim " + value + " in " + electionName, ex);
                callback.reject("Unable to proclaim in " + electionName, ex);
            }
        });
    }

    /**
     * Give up leadership or candidacy.
     *
     * @param callback true if a candidacy was held
     */
    public void resign(final Callback<Boolean> callback) {
        requestExecutorService.submit(() -> {
            try {
                callback.resolve(session.resign());
            } catch (Exception ex) {
                logger.error("Unable to resign from " + electionName, ex);
                callback.reject("Unable to resign from " + electionName, ex);
            }
        });
    }

    /**
     * Look up the current leader.
     *
     * @param callback leader key, rejected with {@link NoLeaderException} when there is none
     */
    public void getLeader(final Callback<String> callback) {
        readExecutorService.submit(() -> {
            try {
                final String leader = session.getLeader();
                logger.debug("getLeader Leader Found {} for {} ", leader, electionName);
                callback.resolve(leader);
            } catch (Exception ex) {
                logger.debug("getLeader failed for {}: {}", electionName, ex.getMessage());
                callback.reject("Unable to load leader of " + electionName, ex);
            }
        });
    }

    /**
     * Register for leadership changes.
     *
     * @param listener listener
     * @return handle to unregister
     */
    public Subscription observe(final LeadershipListener listener) {
        return leaderObserver.subscribe(listener);
    }

    /**
     * Register a stream for leader keys. Cancelling the stream unregisters it.
     *
     * @param leadershipStream leadershipStream
     */
    public void leadershipChangeNotice(final Stream<String> leadershipStream) {
        leaderObserver.subscribe(new StreamListener(leadershipStream));
    }

    /**
     * Stop observing, stop the worker threads and revoke the lease.
     */
    public void close() {
        longPollExecutorService.shutdownNow();
        requestExecutorService.shutdownNow();
        readExecutorService.shutdownNow();
        outExecutorService.shutdown();
        session.close();
        leaseExecutorService.shutdownNow();
    }

    public String getElectionName() {
        return electionName;
    }

    public String getLeaderKey() {
        return session.getLeaderKey();
    }

    public long getLeaderRevision() {
        return session.getLeaderRevision();
    }

    public long getLeaseId() {
        return session.getLeaseId();
    }

    public boolean isReady() {
        return session.isReady();
    }

    public boolean isCampaigning() {
        return session.isCampaigning();
    }

    public boolean isObserving() {
        return leaderObserver.isObserving();
    }

    /**
     * Adapts a reakt stream. Errors are not streamed, they are logged by the observer.
     */
    private class StreamListener implements LeadershipListener {

        private final Stream<String> stream;

        private StreamListener(final Stream<String> stream) {
            this.stream = stream;
        }

        @Override
        public void leader(final String leaderKey) {
            stream.reply(leaderKey, false, () -> leaderObserver.unsubscribe(this));
        }
    }
}
