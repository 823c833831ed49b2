package io.hepplan.optimizer.core;

/**
 * Raised when the plan graph or a rule breaks an invariant of the optimizer. Aborts the optimization.
 */
public class OptimizerException extends RuntimeException {
    public OptimizerException(String message) {
        super(message);
    }

    public OptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
