package io.hepplan.optimizer.heuristic;

import java.util.List;

import javax.annotation.Nullable;

import io.hepplan.plan.operator.Operator;

/**
 * Read-only access to a plan graph, all pattern matching needs.
 */
public interface HepGraphView {
    /**
     * @throws io.hepplan.optimizer.core.NodeNotFoundException if the id is unknown or removed.
     */
    Operator operator(HepNodeId id);

    /**
     * Direct children in positional order, empty for leaves.
     *
     * @throws io.hepplan.optimizer.core.NodeNotFoundException if the id is unknown or removed.
     */
    List<HepNodeId> childrenAt(HepNodeId id);

    /**
     * Ids of the subtree rooted at `start`, or of the whole graph if `start` is null, in the given order.
     * The result is a snapshot taken at call time, later mutations of the graph do not show up in it.
     */
    List<HepNodeId> nodesIter(HepMatchOrder order, @Nullable HepNodeId start);
}
