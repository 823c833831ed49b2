package io.hepplan.optimizer.rule;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.JoinOperator;
import io.hepplan.plan.operator.LimitOperator;
import io.hepplan.plan.operator.Operator;
import io.hepplan.plan.operator.OperatorType;
import io.hepplan.plan.operator.ScanOperator;

/**
 * Adds a Limit on the preserved side of an outer join under a Limit. Every row of the preserved side
 * produces at least one output row, so it never needs to produce more rows than the outer Limit fetches.
 */
public class PushLimitThroughJoin implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.LIMIT, Pattern.of(OperatorType.JOIN));
    private static final Set<OperatorType> PASS_THROUGH = EnumSet.of(OperatorType.PROJECT, OperatorType.FILTER, OperatorType.SORT);

    @Override
    public Pattern pattern() {
        return PATTERN;
    }

    @Override
    public void apply(HepNodeId nodeId, HepGraph graph) {
        LimitOperator limit = (LimitOperator) graph.operator(nodeId);
        Long fetch = limit.fetch();
        if (fetch == null) {
            return;
        }
        List<HepNodeId> children = graph.childrenAt(nodeId);
        if (children.size() != 1) {
            return;
        }
        HepNodeId joinId = children.get(0);
        JoinOperator join = (JoinOperator) graph.operator(joinId);
        int side;
        switch (join.joinType) {
            case LEFT:
                side = 0;
                break;
            case RIGHT:
                side = 1;
                break;
            default:
                return;
        }
        List<HepNodeId> joinChildren = graph.childrenAt(joinId);
        if (joinChildren.size() != 2) {
            return;
        }
        HepNodeId sideId = joinChildren.get(side);
        if (!boundedBy(graph, sideId, fetch)) {
            graph.addNode(joinId, sideId, LimitOperator.of(fetch));
        }
    }

    /**
     * Whether the subtree at `id` produces at most `fetch` rows. Looks through Projects, Filters and Sorts,
     * none of them produces more rows than its input.
     */
    private static boolean boundedBy(HepGraph graph, HepNodeId id, long fetch) {
        HepNodeId cur = id;
        while (true) {
            Operator op = graph.operator(cur);
            if (op instanceof LimitOperator) {
                Long l = ((LimitOperator) op).limit;
                return l != null && l <= fetch;
            }
            if (op instanceof ScanOperator) {
                Long l = ((ScanOperator) op).limit;
                return l != null && l <= fetch;
            }
            List<HepNodeId> children = graph.childrenAt(cur);
            if (!PASS_THROUGH.contains(op.type()) || children.size() != 1) {
                return false;
            }
            cur = children.get(0);
        }
    }
}
