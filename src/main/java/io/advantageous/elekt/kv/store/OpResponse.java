package io.advantageous.elekt.kv.store;

import java.util.Collections;
import java.util.List;

/**
 * Result of one {@link Op}. Gets carry the keys read, deletes the number of keys removed.
 */
public final class OpResponse {

    private final Op.Type type;
    private final List<KeyValue> kvs;
    private final long deleted;

    public OpResponse(final Op.Type type, final List<KeyValue> kvs, final long deleted) {
        this.type = type;
        this.kvs = Collections.unmodifiableList(kvs);
        this.deleted = deleted;
    }

    public Op.Type getType() {
        return type;
    }

    public List<KeyValue> getKvs() {
        return kvs;
    }

    public long getDeleted() {
        return deleted;
    }
}
