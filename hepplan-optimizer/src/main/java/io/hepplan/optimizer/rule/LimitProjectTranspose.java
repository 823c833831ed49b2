package io.hepplan.optimizer.rule;

import java.util.List;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.OperatorType;

/**
 * Moves a Limit below the Project under it, so that it can reach scans and joins.
 */
public class LimitProjectTranspose implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.LIMIT, Pattern.of(OperatorType.PROJECT));

    @Override
    public Pattern pattern() {
        return PATTERN;
    }

    @Override
    public void apply(HepNodeId nodeId, HepGraph graph) {
        List<HepNodeId> children = graph.childrenAt(nodeId);
        if (children.size() == 1) {
            graph.swapNode(nodeId, children.get(0));
        }
    }
}
