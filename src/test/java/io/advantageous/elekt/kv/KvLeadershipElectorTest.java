package io.advantageous.elekt.kv;

import io.advantageous.elekt.kv.store.RangeRequest;
import io.advantageous.elekt.kv.store.Store;
import io.advantageous.elekt.kv.store.StoreException;
import io.advantageous.elekt.kv.store.memory.InMemoryStore;
import io.advantageous.reakt.promise.Promise;
import io.advantageous.reakt.promise.Promises;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class KvLeadershipElectorTest {

    private final String electionName = "svc";
    private final long ttl = 60;
    private InMemoryStore store;
    private final List<KvLeadershipElector> electors = new ArrayList<>();

    @Before
    public void setUp() {
        store = new InMemoryStore();
    }

    @After
    public void tearDown() {
        electors.forEach(KvLeadershipElector::close);
        store.close();
    }

    @Test
    public void testSelfElect() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);

        Promise<String> promise = Promises.<String>blockingPromise();
        leadershipElector.getLeader(promise);
        assertTrue("No leader yet", promise.failure());
        assertTrue(causedBy(promise.cause(), NoLeaderException.class));

        Promise<String> campaignPromise = Promises.<String>blockingPromise();
        leadershipElector.campaign("foo.com:9091", campaignPromise);
        final String leaderKey = campaignPromise.get();

        assertEquals("election/svc/" + leadershipElector.getLeaseId(), leaderKey);
        assertTrue(leadershipElector.isCampaigning());
        assertTrue(leadershipElector.isReady());
        assertEquals(leaderKey, leadershipElector.getLeaderKey());

        Promise<String> getLeaderPromise = Promises.<String>blockingPromise();
        leadershipElector.getLeader(getLeaderPromise);
        assertEquals(leaderKey, getLeaderPromise.get());

        Promise<Boolean> proclaimPromise = Promises.<Boolean>blockingPromise();
        leadershipElector.proclaim("foo2.com:9092", proclaimPromise);
        assertTrue(proclaimPromise.get());
        assertEquals("foo2.com:9092", store.get(leaderKey).first().get().getValue());

        Promise<Boolean> resignPromise = Promises.<Boolean>blockingPromise();
        leadershipElector.resign(resignPromise);
        assertTrue(resignPromise.get());
        assertFalse(leadershipElector.isCampaigning());

        Promise<Boolean> resignAgainPromise = Promises.<Boolean>blockingPromise();
        leadershipElector.resign(resignAgainPromise);
        assertFalse("Second resign is a no-op", resignAgainPromise.get());
    }

    @Test
    public void testInitialize() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);

        Promise<Long> promise = Promises.<Long>blockingPromise();
        leadershipElector.initialize(promise);

        assertEquals(Long.valueOf(leadershipElector.getLeaseId()), promise.get());
        assertTrue(store.hasLease(promise.get()));
    }

    @Test
    public void testProclaimWithoutCampaignIsRejected() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);

        Promise<Boolean> promise = Promises.<Boolean>blockingPromise();
        leadershipElector.proclaim("foo.com:9091", promise);

        assertTrue(promise.failure());
        assertTrue(causedBy(promise.cause(), NotLeaderException.class));
    }

    @Test
    public void testObserverFollowsHandOver() throws Exception {
        final KvLeadershipElector electorA = elector(store);
        final KvLeadershipElector electorB = elector(store);
        final KvLeadershipElector watcher = elector(store);

        final BlockingQueue<String> leaders = new LinkedBlockingQueue<>();
        watcher.observe(leaders::add);

        Promise<String> campaignA = Promises.<String>blockingPromise();
        electorA.campaign("A", campaignA);
        final String keyA = campaignA.get();
        assertEquals(keyA, leaders.poll(5, TimeUnit.SECONDS));
        assertTrue(watcher.isObserving());

        final CountDownLatch electedB = new CountDownLatch(1);
        Promise<String> campaignB = Promises.<String>promise();
        campaignB.then(key -> electedB.countDown());
        electorB.campaign("B", campaignB);
        assertFalse("B waits for A", electedB.await(300, TimeUnit.MILLISECONDS));
        assertNull(leaders.poll(200, TimeUnit.MILLISECONDS));

        Promise<Boolean> resignA = Promises.<Boolean>blockingPromise();
        electorA.resign(resignA);
        assertTrue(resignA.get());

        assertTrue(electedB.await(5, TimeUnit.SECONDS));
        assertEquals("election/svc/" + electorB.getLeaseId(), leaders.poll(5, TimeUnit.SECONDS));
        assertNull("No duplicate notice", leaders.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testObserverRegisteredBeforeAnyCandidate() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);
        final BlockingQueue<String> leaders = new LinkedBlockingQueue<>();
        leadershipElector.observe(leaders::add);

        assertNull(leaders.poll(200, TimeUnit.MILLISECONDS));

        Promise<String> campaign = Promises.<String>blockingPromise();
        leadershipElector.campaign("A", campaign);

        assertEquals(campaign.get(), leaders.poll(5, TimeUnit.SECONDS));
        assertNull(leaders.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testObserverRestartsAfterWatchError() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);
        final BlockingQueue<String> leaders = new LinkedBlockingQueue<>();
        final BlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();
        leadershipElector.observe(new LeadershipListener() {
            @Override
            public void leader(final String leaderKey) {
                leaders.add(leaderKey);
            }

            @Override
            public void error(final Throwable error) {
                errors.add(error);
            }
        });

        Promise<String> campaign = Promises.<String>blockingPromise();
        leadershipElector.campaign("A", campaign);
        final String leaderKey = campaign.get();
        assertEquals(leaderKey, leaders.poll(5, TimeUnit.SECONDS));
        awaitWatches(1);

        store.failWatches(new StoreException("watch stream broken"));

        assertEquals("watch stream broken", errors.poll(5, TimeUnit.SECONDS).getMessage());
        assertEquals("Leader is reported again after restart", leaderKey, leaders.poll(5, TimeUnit.SECONDS));
        awaitWatches(1);
    }

    @Test
    public void testObserverStopsWithoutListeners() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);
        final BlockingQueue<String> leaders = new LinkedBlockingQueue<>();
        final Subscription subscription = leadershipElector.observe(leaders::add);

        Promise<String> campaign = Promises.<String>blockingPromise();
        leadershipElector.campaign("A", campaign);
        assertEquals(campaign.get(), leaders.poll(5, TimeUnit.SECONDS));

        subscription.unsubscribe();
        assertTrue("Loop stays until the cycle ends", leadershipElector.isObserving());

        Promise<Boolean> resign = Promises.<Boolean>blockingPromise();
        leadershipElector.resign(resign);
        assertTrue(resign.get());

        final long deadline = System.currentTimeMillis() + 5000;
        while (leadershipElector.isObserving() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(leadershipElector.isObserving());
        assertEquals(0, store.activeWatchCount());
    }

    @Test
    public void testLeadershipChangeNoticeStream() throws Exception {
        final KvLeadershipElector leadershipElector = elector(store);
        final BlockingQueue<String> leaders = new LinkedBlockingQueue<>();

        leadershipElector.leadershipChangeNotice(result -> {
            result.then(leaders::add);
            result.cancel();
        });

        Promise<String> campaign = Promises.<String>blockingPromise();
        leadershipElector.campaign("A", campaign);
        final String leaderKey = campaign.get();
        assertEquals(leaderKey, leaders.poll(5, TimeUnit.SECONDS));

        Promise<Boolean> resign = Promises.<Boolean>blockingPromise();
        leadershipElector.resign(resign);
        resign.get();
        Promise<String> campaignAgain = Promises.<String>blockingPromise();
        leadershipElector.campaign("A", campaignAgain);
        campaignAgain.get();

        assertNull("Cancelled stream gets nothing more", leaders.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testLeaseRecoveryFailureIsReported() throws Exception {
        final FaultyStore faultyStore = new FaultyStore(store);
        final KvLeadershipElector leadershipElector = elector(faultyStore);
        final BlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();
        leadershipElector.observe(new LeadershipListener() {
            @Override
            public void leader(final String leaderKey) {
            }

            @Override
            public void error(final Throwable error) {
                errors.add(error);
            }
        });

        Promise<Long> initialize = Promises.<Long>blockingPromise();
        leadershipElector.initialize(initialize);
        final long leaseId = initialize.get();

        faultyStore.failGrant = true;
        store.expireLease(leaseId);

        assertEquals("lease grant unavailable", errors.poll(5, TimeUnit.SECONDS).getMessage());
        assertFalse(leadershipElector.isReady());

        faultyStore.failGrant = false;
        Promise<Long> retry = Promises.<Long>blockingPromise();
        leadershipElector.initialize(retry);
        assertNotEquals(Long.valueOf(leaseId), retry.get());
        assertTrue(leadershipElector.isReady());
    }

    @Test
    public void testLeaseIsReplacedWhileCampaignWaits() throws Exception {
        final KvLeadershipElector electorA = elector(store);
        final KvLeadershipElector electorB = elector(store);

        Promise<String> campaignA = Promises.<String>blockingPromise();
        electorA.campaign("A", campaignA);
        campaignA.get();

        Promise<String> campaignB = Promises.<String>blockingPromise();
        electorB.campaign("B", campaignB);
        final CompletableFuture<Boolean> campaignBFailed = CompletableFuture.supplyAsync(campaignB::failure);
        awaitCandidates(2);
        final long lostLease = electorB.getLeaseId();

        store.expireLease(lostLease);

        final long deadline = System.currentTimeMillis() + 5000;
        while ((electorB.getLeaseId() == 0 || electorB.getLeaseId() == lostLease)
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue("Lease replaced while campaign still waits", electorB.isReady());
        assertNotEquals(lostLease, electorB.getLeaseId());
        assertTrue(store.hasLease(electorB.getLeaseId()));
        assertFalse(campaignBFailed.isDone());

        Promise<Boolean> resignA = Promises.<Boolean>blockingPromise();
        electorA.resign(resignA);
        assertTrue(resignA.get());

        assertTrue(campaignBFailed.get(5, TimeUnit.SECONDS));
        assertTrue(causedBy(campaignB.cause(), NotLeaderException.class));
        assertFalse(electorB.isCampaigning());
    }

    private KvLeadershipElector elector(final Store backing) {
        final KvLeadershipElector leadershipElector = new KvLeadershipElector(backing,
                ElectionSession.DEFAULT_KEY_PREFIX, electionName, TimeUnit.SECONDS, ttl, Duration.ofMillis(10));
        electors.add(leadershipElector);
        return leadershipElector;
    }

    private void awaitCandidates(final int count) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + 5000;
        while (candidates() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(count, candidates());
    }

    private int candidates() {
        return store.range(RangeRequest.prefix("election/svc/")).getKvs().size();
    }

    private void awaitWatches(final int count) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + 5000;
        while (store.activeWatchCount() != count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(count, store.activeWatchCount());
    }

    private static boolean causedBy(final Throwable error, final Class<? extends Throwable> type) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }
}
