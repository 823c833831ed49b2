package io.hepplan.optimizer;

import com.google.common.collect.Lists;

import java.util.List;

import io.hepplan.optimizer.heuristic.HepBatch;
import io.hepplan.optimizer.heuristic.HepBatchStrategy;
import io.hepplan.optimizer.heuristic.HepMatchOrder;
import io.hepplan.optimizer.heuristic.HepOptimizer;
import io.hepplan.optimizer.rule.CollapseProject;
import io.hepplan.optimizer.rule.CombineFilter;
import io.hepplan.optimizer.rule.EliminateLimits;
import io.hepplan.optimizer.rule.LimitProjectTranspose;
import io.hepplan.optimizer.rule.PushLimitIntoScan;
import io.hepplan.optimizer.rule.PushLimitThroughJoin;
import io.hepplan.optimizer.rule.PushProjectIntoScan;

/**
 * The heuristic optimizer with the built-in rules.
 */
public class Optimizer extends HepOptimizer {

    public Optimizer(OptimizerConfig config) {
        super(defaultBatches(config.maxIterations), config);
    }

    public Optimizer() {
        this(OptimizerConfig.defaults());
    }

    public static List<HepBatch> defaultBatches(int maxIterations) {
        return Lists.newArrayList(
                new HepBatch("Column Pruning", HepBatchStrategy.fixPoint(maxIterations, HepMatchOrder.TOP_DOWN),
                        new CollapseProject(),
                        new PushProjectIntoScan()),
                new HepBatch("Combine Operators", HepBatchStrategy.fixPoint(maxIterations, HepMatchOrder.BOTTOM_UP),
                        new CombineFilter(),
                        new EliminateLimits()),
                new HepBatch("Limit Pushdown", HepBatchStrategy.fixPoint(maxIterations, HepMatchOrder.TOP_DOWN),
                        new LimitProjectTranspose(),
                        new EliminateLimits(),
                        new PushLimitThroughJoin(),
                        new PushLimitIntoScan())
        );
    }
}
