package io.advantageous.elekt.kv.store;

/**
 * Failure reported by a store: transport, transaction execution or watch stream errors.
 */
public class StoreException extends RuntimeException {

    public StoreException(final String message) {
        super(message);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
