package io.hepplan.optimizer.rule;

import java.util.List;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.LimitOperator;
import io.hepplan.plan.operator.OperatorType;
import io.hepplan.plan.operator.ScanOperator;

/**
 * Lets an unbounded Scan apply the Limit above it, the Limit is removed.
 */
public class PushLimitIntoScan implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.LIMIT, Pattern.of(OperatorType.SCAN));

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
        HepNodeId scanId = children.get(0);
        LimitOperator limit = (LimitOperator) graph.operator(nodeId);
        ScanOperator scan = (ScanOperator) graph.operator(scanId);
        if (scan.bounded() || scan.offset != null || limit.limit == null) {
            return;
        }
        graph.setOperator(scanId, scan.withBounds(limit.offset, limit.limit));
        graph.removeNode(nodeId, false);
    }
}
