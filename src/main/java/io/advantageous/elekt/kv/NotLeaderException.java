package io.advantageous.elekt.kv;

/**
 * This session does not hold the candidacy the operation needs: it never campaigned,
 * or its candidate key was deleted or superseded.
 */
public class NotLeaderException extends ElectionException {

    public NotLeaderException(final String message) {
        super(message);
    }
}
