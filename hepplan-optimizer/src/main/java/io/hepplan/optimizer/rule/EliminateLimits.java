package io.hepplan.optimizer.rule;

import java.util.List;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.LimitOperator;
import io.hepplan.plan.operator.OperatorType;

/**
 * Combines two adjacent Limits into one.
 */
public class EliminateLimits implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.LIMIT, Pattern.of(OperatorType.LIMIT));

    @Override
    public Pattern pattern() {
        return PATTERN;
    }

    @Override
    public void apply(HepNodeId nodeId, HepGraph graph) {
        List<HepNodeId> children = graph.childrenAt(nodeId);
        if (children.size() != 1) {
            return;
        }
        HepNodeId childId = children.get(0);
        LimitOperator parent = (LimitOperator) graph.operator(nodeId);
        LimitOperator child = (LimitOperator) graph.operator(childId);
        graph.setOperator(nodeId, combine(parent, child));
        graph.removeNode(childId, false);
    }

    /**
     * The limit equal to applying `inner` first, then `outer`.
     */
    static LimitOperator combine(LimitOperator outer, LimitOperator inner) {
        Long offset = outer.offset == null && inner.offset == null
                ? null
                : outer.offsetOrZero() + inner.offsetOrZero();
        Long limit;
        if (inner.limit == null) {
            limit = outer.limit;
        } else {
            long remaining = Math.max(inner.limit - outer.offsetOrZero(), 0);
            limit = outer.limit == null ? remaining : Math.min(outer.limit, remaining);
        }
        return new LimitOperator(offset, limit);
    }
}
