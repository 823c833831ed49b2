package io.hepplan.optimizer.heuristic;

import com.google.common.base.Preconditions;

/**
 * Tracks the state of one batch run:
 * IDLE -> SCANNING -> (APPLYING -> SCANNING)* -> STABLE | CAP_EXCEEDED, or IDLE -> SKIPPED.
 */
class BatchExecution {
    private final HepBatch batch;
    private BatchState state = BatchState.IDLE;
    private int iterations;
    private int applications;

    BatchExecution(HepBatch batch) {
        this.batch = batch;
    }

    BatchState state() {
        return state;
    }

    int iterations() {
        return iterations;
    }

    /** Starts a new pass over the plan. */
    void startPass() {
        Preconditions.checkState(state == BatchState.IDLE || state == BatchState.SCANNING,
                "Batch %s cannot start a pass in state %s", batch.name, state);
        state = BatchState.SCANNING;
        iterations++;
    }

    void applying() {
        transit(BatchState.SCANNING, BatchState.APPLYING);
    }

    void applied(boolean changed) {
        transit(BatchState.APPLYING, BatchState.SCANNING);
        if (changed) {
            applications++;
        }
    }

    void stable() {
        transit(BatchState.SCANNING, BatchState.STABLE);
    }

    void capExceeded() {
        transit(BatchState.SCANNING, BatchState.CAP_EXCEEDED);
    }

    void skip() {
        transit(BatchState.IDLE, BatchState.SKIPPED);
    }

    boolean capReached() {
        return iterations >= batch.strategy.maxIterations;
    }

    BatchReport report() {
        Preconditions.checkState(state.isTerminal(), "Batch %s not finished: %s", batch.name, state);
        return new BatchReport(batch.name, state, iterations, applications);
    }

    private void transit(BatchState from, BatchState to) {
        Preconditions.checkState(state == from, "Batch %s: illegal transition %s -> %s", batch.name, state, to);
        state = to;
    }
}
