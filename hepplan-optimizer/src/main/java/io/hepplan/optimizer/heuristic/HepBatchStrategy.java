package io.hepplan.optimizer.heuristic;

import com.google.common.base.Preconditions;

/**
 * An execution strategy for a batch: the maximum number of passes and the order nodes are visited in.
 * If the batch reaches fix point (i.e. converge) before maxIterations, it will stop.
 */
public class HepBatchStrategy {
    public final int maxIterations;
    public final HepMatchOrder matchOrder;

    public HepBatchStrategy(int maxIterations, HepMatchOrder matchOrder) {
        Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
        Preconditions.checkArgument(matchOrder != null, "Null match order");
        this.maxIterations = maxIterations;
        this.matchOrder = matchOrder;
    }

    /** A single top-down pass. */
    public static HepBatchStrategy once() {
        return new HepBatchStrategy(1, HepMatchOrder.TOP_DOWN);
    }

    public static HepBatchStrategy once(HepMatchOrder matchOrder) {
        return new HepBatchStrategy(1, matchOrder);
    }

    public static HepBatchStrategy fixPoint(int maxIterations, HepMatchOrder matchOrder) {
        return new HepBatchStrategy(maxIterations, matchOrder);
    }

    public boolean isOnce() {
        return maxIterations == 1;
    }

    @Override
    public String toString() {
        return String.format("%s(%d)", matchOrder, maxIterations);
    }
}
