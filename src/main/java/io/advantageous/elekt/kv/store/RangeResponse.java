package io.advantageous.elekt.kv.store;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Keys read plus the store revision the read was served at.
 */
public final class RangeResponse {

    private final long revision;
    private final List<KeyValue> kvs;

    public RangeResponse(final long revision, final List<KeyValue> kvs) {
        this.revision = revision;
        this.kvs = Collections.unmodifiableList(kvs);
    }

    public long getRevision() {
        return revision;
    }

    public List<KeyValue> getKvs() {
        return kvs;
    }

    public boolean isEmpty() {
        return kvs.isEmpty();
    }

    public Optional<KeyValue> first() {
        return kvs.isEmpty() ? Optional.empty() : Optional.of(kvs.get(0));
    }
}
