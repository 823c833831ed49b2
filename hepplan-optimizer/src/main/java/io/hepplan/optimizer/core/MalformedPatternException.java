package io.hepplan.optimizer.core;

public class MalformedPatternException extends OptimizerException {
    public MalformedPatternException(String message) {
        super(message);
    }
}
