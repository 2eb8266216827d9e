package io.advantageous.elekt.kv.store;

/**
 * A mutation seen by a watch.
 */
public final class WatchEvent {

    public enum Type {
        PUT,
        DELETE
    }

    private final Type type;
    /**
     * Key after a put; for deletes the key as it was, with the delete revision as mod revision.
     */
    private final KeyValue keyValue;

    public WatchEvent(final Type type, final KeyValue keyValue) {
        this.type = type;
        this.keyValue = keyValue;
    }

    public Type getType() {
        return type;
    }

    public KeyValue getKeyValue() {
        return keyValue;
    }

    public String getKey() {
        return keyValue.getKey();
    }

    /**
     * Revision at which the event happened.
     */
    public long getRevision() {
        return keyValue.getModRevision();
    }

    @Override
    public String toString() {
        return type + " " + keyValue.getKey() + "@" + getRevision();
    }
}
