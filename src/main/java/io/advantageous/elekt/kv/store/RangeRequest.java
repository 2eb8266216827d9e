package io.advantageous.elekt.kv.store;

/**
 * Read of every key under a prefix.
 */
public final class RangeRequest {

    public enum SortOrder {
        NONE,
        ASCEND,
        DESCEND
    }

    private final String prefix;
    private final SortOrder sortOrder;
    private final long maxCreateRevision;
    private final boolean keysOnly;

    private RangeRequest(final String prefix, final SortOrder sortOrder, final long maxCreateRevision,
                         final boolean keysOnly) {
        this.prefix = prefix;
        this.sortOrder = sortOrder;
        this.maxCreateRevision = maxCreateRevision;
        this.keysOnly = keysOnly;
    }

    public static RangeRequest prefix(final String prefix) {
        return new RangeRequest(prefix, SortOrder.NONE, 0, false);
    }

    /**
     * Sort the result by creation revision.
     */
    public RangeRequest sortByCreateRevision(final SortOrder sortOrder) {
        return new RangeRequest(prefix, sortOrder, maxCreateRevision, keysOnly);
    }

    /**
     * Only keys created at or before {@code revision}. 0 disables the bound.
     */
    public RangeRequest maxCreateRevision(final long revision) {
        return new RangeRequest(prefix, sortOrder, revision, keysOnly);
    }

    public RangeRequest keysOnly() {
        return new RangeRequest(prefix, sortOrder, maxCreateRevision, true);
    }

    public String getPrefix() {
        return prefix;
    }

    public SortOrder getSortOrder() {
        return sortOrder;
    }

    public long getMaxCreateRevision() {
        return maxCreateRevision;
    }

    public boolean isKeysOnly() {
        return keysOnly;
    }

    @Override
    public String toString() {
        return "RangeRequest{" +
                "prefix='" + prefix + '\'' +
                ", sortOrder=" + sortOrder +
                ", maxCreateRevision=" + maxCreateRevision +
                ", keysOnly=" + keysOnly +
                '}';
    }
}
