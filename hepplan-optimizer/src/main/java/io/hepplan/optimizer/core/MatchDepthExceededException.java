package io.hepplan.optimizer.core;

public class MatchDepthExceededException extends OptimizerException {
    public MatchDepthExceededException(int limit) {
        super(String.format("Pattern matching exceeded depth limit %d", limit));
    }
}
