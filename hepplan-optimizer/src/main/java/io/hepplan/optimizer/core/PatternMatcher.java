package io.hepplan.optimizer.core;

public interface PatternMatcher {
    /**
     * Returns true if the pattern matches. A failed match is not an error.
     */
    boolean matchOptExpr();
}
