package io.advantageous.elekt.kv.store;

/**
 * A single key operation inside a transaction branch.
 */
public final class Op {

    public enum Type {
        PUT,
        GET,
        DELETE
    }

    private final Type type;
    private final String key;
    private final String value;
    private final long lease;

    private Op(final Type type, final String key, final String value, final long lease) {
        this.type = type;
        this.key = key;
        this.value = value;
        this.lease = lease;
    }

    /**
     * Put a value, bound to a lease when {@code lease} is not 0.
     */
    public static Op put(final String key, final String value, final long lease) {
        return new Op(Type.PUT, key, value, lease);
    }

    public static Op get(final String key) {
        return new Op(Type.GET, key, null, 0);
    }

    public static Op delete(final String key) {
        return new Op(Type.DELETE, key, null, 0);
    }

    public Type getType() {
        return type;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public long getLease() {
        return lease;
    }

    @Override
    public String toString() {
        return type + " " + key;
    }
}
