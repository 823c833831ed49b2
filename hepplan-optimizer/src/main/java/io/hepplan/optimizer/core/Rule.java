package io.hepplan.optimizer.core;

import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;

/**
 * A pattern paired with a rewrite. The optimizer calls {@link #apply} only on nodes matching {@link #pattern()}.
 */
public interface Rule {
    Pattern pattern();

    /**
     * Rewrites the graph at the matched node. A rule may decide not to change anything.
     */
    void apply(HepNodeId nodeId, HepGraph graph);

    /** Name for this rule, automatically inferred based on class name. */
    default String ruleName() {
        String className = this.getClass().getSimpleName();
        return className.isEmpty() ? this.getClass().getName() : className;
    }
}
