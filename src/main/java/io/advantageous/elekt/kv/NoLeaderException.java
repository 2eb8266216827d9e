package io.advantageous.elekt.kv;

/**
 * No candidate is alive in the election.
 */
public class NoLeaderException extends ElectionException {

    public NoLeaderException(final String electionName) {
        super("election " + electionName + " has no leader");
    }
}
