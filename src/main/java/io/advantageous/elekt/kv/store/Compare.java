package io.advantageous.elekt.kv.store;

/**
 * One guard of a conditional transaction. A missing key has create revision, mod revision
 * and version all equal to 0.
 */
public final class Compare {

    public enum Target {
        CREATE_REVISION,
        MOD_REVISION,
        VERSION
    }

    public enum Operator {
        EQUAL,
        NOT_EQUAL,
        LESS,
        GREATER
    }

    private final String key;
    private final Target target;
    private final Operator operator;
    private final long value;

    private Compare(final String key, final Target target, final Operator operator, final long value) {
        this.key = key;
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public static Compare compare(final String key, final Target target, final Operator operator, final long value) {
        return new Compare(key, target, operator, value);
    }

    /**
     * Shorthand for the guard elections use: the key's creation revision equals {@code revision}.
     * A revision of 0 means the key must be absent.
     */
    public static Compare createRevisionEquals(final String key, final long revision) {
        return new Compare(key, Target.CREATE_REVISION, Operator.EQUAL, revision);
    }

    /**
     * Evaluate against the current state of the key.
     *
     * @param current current key or null when absent
     * @return true if the guard holds
     */
    public boolean test(final KeyValue current) {
        final long actual;
        switch (target) {
            case CREATE_REVISION:
                actual = current == null ? 0 : current.getCreateRevision();
                break;
            case MOD_REVISION:
                actual = current == null ? 0 : current.getModRevision();
                break;
            default:
                actual = current == null ? 0 : current.getVersion();
        }
        switch (operator) {
            case EQUAL:
                return actual == value;
            case NOT_EQUAL:
                return actual != value;
            case LESS:
                return actual < value;
            default:
                return actual > value;
        }
    }

    public String getKey() {
        return key;
    }

    public Target getTarget() {
        return target;
    }

    public Operator getOperator() {
        return operator;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String toString() {
        return key + " " + target + " " + operator + " " + value;
    }
}
