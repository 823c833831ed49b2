package io.hepplan.optimizer.heuristic;

public enum BatchState {
    IDLE,
    SCANNING,
    APPLYING,
    /** A full pass changed nothing. */
    STABLE,
    /** The last allowed pass still changed the plan. */
    CAP_EXCEEDED,
    /** Not run, the optimization ran out of time before this batch. */
    SKIPPED;

    public boolean isTerminal() {
        return this == STABLE || this == CAP_EXCEEDED || this == SKIPPED;
    }
}
