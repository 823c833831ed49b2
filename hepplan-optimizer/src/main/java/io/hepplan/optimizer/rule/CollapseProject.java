package io.hepplan.optimizer.rule;

import java.util.List;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.OperatorType;
import io.hepplan.plan.operator.ProjectOperator;

/**
 * Removes a Project whose parent Project only needs columns it passes through unchanged.
 */
public class CollapseProject implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.PROJECT, Pattern.of(OperatorType.PROJECT));

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
        ProjectOperator parent = (ProjectOperator) graph.operator(nodeId);
        ProjectOperator child = (ProjectOperator) graph.operator(childId);
        if (child.columns.containsAll(parent.columns)) {
            graph.removeNode(childId, false);
        }
    }
}
