package io.advantageous.elekt.kv;

/**
 * Base of the errors an election raises on its own account. Store failures are
 * {@link io.advantageous.elekt.kv.store.StoreException}s and pass through untouched.
 */
public class ElectionException extends RuntimeException {

    public ElectionException(final String message) {
        super(message);
    }

    public ElectionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
