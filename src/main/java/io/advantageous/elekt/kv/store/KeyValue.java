package io.advantageous.elekt.kv.store;

import java.util.Objects;

/**
 * A key as stored, with the revisions the store recorded for it.
 */
public final class KeyValue {

    /**
     * Full key.
     */
    private final String key;
    /**
     * Value, may be null when only keys were requested.
     */
    private final String value;
    /**
     * Revision at which this key was created.
     */
    private final long createRevision;
    /**
     * Revision of the last modification.
     */
    private final long modRevision;
    /**
     * Number of writes since creation.
     */
    private final long version;
    /**
     * Lease backing this key, 0 if none.
     */
    private final long lease;

    public KeyValue(final String key,
                    final String value,
                    final long createRevision,
                    final long modRevision,
                    final long version,
                    final long lease) {
        this.key = key;
        this.value = value;
        this.createRevision = createRevision;
        this.modRevision = modRevision;
        this.version = version;
        this.lease = lease;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public long getCreateRevision() {
        return createRevision;
    }

    public long getModRevision() {
        return modRevision;
    }

    public long getVersion() {
        return version;
    }

    public long getLease() {
        return lease;
    }

    /**
     * Copy without the value.
     *
     * @return key only copy
     */
    public KeyValue keyOnly() {
        return new KeyValue(key, null, createRevision, modRevision, version, lease);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final KeyValue keyValue = (KeyValue) o;
        return createRevision == keyValue.createRevision &&
                modRevision == keyValue.modRevision &&
                version == keyValue.version &&
                lease == keyValue.lease &&
                Objects.equals(key, keyValue.key) &&
                Objects.equals(value, keyValue.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, createRevision, modRevision, version, lease);
    }

    @Override
    public String toString() {
        return "KeyValue{" +
                "key='" + key + '\'' +
                ", value='" + value + '\'' +
                ", createRevision=" + createRevision +
                ", modRevision=" + modRevision +
                ", version=" + version +
                ", lease=" + lease +
                '}';
    }
}
