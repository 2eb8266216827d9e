package io.advantageous.elekt.kv;

/**
 * Handle returned when registering a {@link LeadershipListener}.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Stop receiving notifications. Idempotent.
     */
    void unsubscribe();
}
