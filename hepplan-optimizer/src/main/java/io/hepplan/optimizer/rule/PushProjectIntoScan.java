package io.hepplan.optimizer.rule;

import java.util.List;

import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.optimizer.heuristic.HepGraph;
import io.hepplan.optimizer.heuristic.HepNodeId;
import io.hepplan.plan.operator.OperatorType;
import io.hepplan.plan.operator.ProjectOperator;
import io.hepplan.plan.operator.ScanOperator;

import static io.hepplan.util.Trick.forAll;

/**
 * Makes a Scan read only the columns the Project above it outputs. Only applies when the Project
 * is made of plain column references. An empty column list of a Scan means all columns.
 */
public class PushProjectIntoScan implements Rule {
    private static final Pattern PATTERN = Pattern.of(OperatorType.PROJECT, Pattern.of(OperatorType.SCAN));
    private static final java.util.regex.Pattern COLUMN_REF = java.util.regex.Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

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
        ProjectOperator project = (ProjectOperator) graph.operator(nodeId);
        ScanOperator scan = (ScanOperator) graph.operator(scanId);
        if (!forAll(project.columns, c -> COLUMN_REF.matcher(c).matches())) {
            return;
        }
        if (!scan.columns.isEmpty() && !scan.columns.containsAll(project.columns)) {
            return;
        }
        graph.setOperator(scanId, scan.withColumns(project.columns));
    }
}
