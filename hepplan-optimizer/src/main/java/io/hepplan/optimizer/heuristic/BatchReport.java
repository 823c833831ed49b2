package io.hepplan.optimizer.heuristic;

/**
 * Outcome of one batch run.
 */
public class BatchReport {
    public final String batchName;
    public final BatchState state;
    /** Number of passes over the plan. */
    public final int iterations;
    /** Number of rule applications which changed the plan. */
    public final int applications;

    public BatchReport(String batchName, BatchState state, int iterations, int applications) {
        this.batchName = batchName;
        this.state = state;
        this.iterations = iterations;
        this.applications = applications;
    }

    public boolean stable() {
        return state == BatchState.STABLE;
    }

    @Override
    public String toString() {
        return String.format("%s: %s after %d iterations, %d applications", batchName, state, iterations, applications);
    }
}
