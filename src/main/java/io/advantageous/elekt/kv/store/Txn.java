package io.advantageous.elekt.kv.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Conditional transaction: if every compare holds, the success ops run, otherwise the failure ops.
 * Committed atomically with {@link Store#commit(Txn)}.
 */
public final class Txn {

    private final List<Compare> compares;
    private final List<Op> success;
    private final List<Op> failure;

    private Txn(final List<Compare> compares, final List<Op> success, final List<Op> failure) {
        this.compares = Collections.unmodifiableList(compares);
        this.success = Collections.unmodifiableList(success);
        this.failure = Collections.unmodifiableList(failure);
    }

    public static Builder txn() {
        return new Builder();
    }

    public List<Compare> getCompares() {
        return compares;
    }

    public List<Op> getSuccess() {
        return success;
    }

    public List<Op> getFailure() {
        return failure;
    }

    public static class Builder {

        private final List<Compare> compares = new ArrayList<>();
        private final List<Op> success = new ArrayList<>();
        private final List<Op> failure = new ArrayList<>();

        public Builder when(final Compare... compares) {
            this.compares.addAll(Arrays.asList(compares));
            return this;
        }

        public Builder then(final Op... ops) {
            success.addAll(Arrays.asList(ops));
            return this;
        }

        public Builder otherwise(final Op... ops) {
            failure.addAll(Arrays.asList(ops));
            return this;
        }

        public Txn build() {
            return new Txn(new ArrayList<>(compares), new ArrayList<>(success), new ArrayList<>(failure));
        }
    }
}
