package io.advantageous.elekt.kv;

/**
 * Receives leadership changes from a {@link LeaderObserver}.
 * Delivery is at least once: the same leader key can be reported again after a watch failure.
 */
public interface LeadershipListener {

    /**
     * A leader was identified.
     *
     * @param leaderKey candidate key of the leader, {@code <prefix><name>/<leaseId>}
     */
    void leader(String leaderKey);

    /**
     * Observation failed and is being retried, or a lost lease could not be replaced.
     *
     * @param error cause
     */
    default void error(final Throwable error) {
    }
}
