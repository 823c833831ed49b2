package io.hepplan.optimizer.rule;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.FilterOperator;
import io.hepplan.plan.operator.OperatorType;

/**
 * Merges two adjacent Filters into one holding the conjuncts of both.
 */
public class CombineFilter implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.FILTER, Pattern.of(OperatorType.FILTER));

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
        FilterOperator parent = (FilterOperator) graph.operator(nodeId);
        FilterOperator child = (FilterOperator) graph.operator(childId);
        // HAVING and WHERE conditions stay apart.
        if (parent.having != child.having) {
            return;
        }
        Set<String> conjuncts = new LinkedHashSet<>(child.conjuncts);
        conjuncts.addAll(parent.conjuncts);
        graph.setOperator(nodeId, new FilterOperator(new ArrayList<>(conjuncts), parent.having));
        graph.removeNode(childId, false);
    }
}
