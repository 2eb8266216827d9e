package io.advantageous.elekt.kv.store;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a committed {@link Txn}.
 */
public final class TxnResponse {

    /**
     * Store revision after the transaction.
     */
    private final long revision;
    /**
     * True if the compares held and the success branch ran.
     */
    private final boolean succeeded;
    /**
     * One response per op of the branch that ran.
     */
    private final List<OpResponse> responses;

    public TxnResponse(final long revision, final boolean succeeded, final List<OpResponse> responses) {
        this.revision = revision;
        this.succeeded = succeeded;
        this.responses = Collections.unmodifiableList(responses);
    }

    public long getRevision() {
        return revision;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public List<OpResponse> getResponses() {
        return responses;
    }
}
