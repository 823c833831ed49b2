package io.hepplan.optimizer.heuristic;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import io.hepplan.optimizer.OptimizerConfig;
import io.hepplan.optimizer.core.OptimizerException;
import io.hepplan.optimizer.core.Rule;
import io.hepplan.plan.LogicalPlan;

/**
 * Applies batches of rules to a plan graph until each batch reaches a fix point or its iteration cap.
 *
 * Batches run serially in declared order. One pass of a batch visits a snapshot of the node ids, taken in
 * the batch's match order, and tries every rule of the batch at every node still in the graph. Nodes created
 * during a pass are visited by the next one. A pass which leaves the graph untouched ends the batch.
 *
 * The optimizer holds no per-plan state and can be shared by threads optimizing different plans.
 */
public class HepOptimizer {
    private static final Logger log = LoggerFactory.getLogger(HepOptimizer.class);

    private final List<HepBatch> batches;
    protected final OptimizerConfig config;

    public HepOptimizer(List<HepBatch> batches, OptimizerConfig config) {
        Preconditions.checkArgument(batches != null, "Null batches");
        Preconditions.checkArgument(config != null, "Null config");
        this.batches = ImmutableList.copyOf(batches);
        this.config = config;
    }

    public List<HepBatch> batches() {
        return batches;
    }

    /**
     * Optimizes the plan and returns the rewritten one.
     */
    public LogicalPlan execute(LogicalPlan plan) {
        HepGraph graph = new HepGraph(plan);
        optimize(graph);
        return graph.toPlan();
    }

    /**
     * Runs all batches against the graph, rewriting it in place.
     *
     * @return one report per batch, in batch order.
     */
    public List<BatchReport> optimize(HepGraph graph) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<BatchReport> reports = new ArrayList<>(batches.size());
        for (HepBatch batch : batches) {
            BatchExecution execution = new BatchExecution(batch);
            long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            if (config.timeoutMs > 0 && elapsed >= config.timeoutMs) {
                log.warn("Optimization took {} ms, exceeds {} ms, skip batch {}", elapsed, config.timeoutMs, batch.name);
                execution.skip();
            } else {
                runBatch(batch, graph, execution);
            }
            reports.add(execution.report());
        }
        if (log.isDebugEnabled()) {
            log.debug("Optimized in {} ms, plan:\n{}", stopwatch.elapsed(TimeUnit.MILLISECONDS), graph.treeString());
        }
        return reports;
    }

    private void runBatch(HepBatch batch, HepGraph graph, BatchExecution execution) {
        long batchStartVersion = graph.version();
        // Run until fix point or the max number of iterations as specified in the strategy.
        while (true) {
            execution.startPass();
            boolean changed = applyPass(batch, graph, execution);
            if (!changed) {
                execution.stable();
                log.trace("Fixed point reached for batch {} after {} iterations.", batch.name, execution.iterations());
                break;
            }
            if (execution.capReached()) {
                execution.capExceeded();
                // Only log if this is a batch that is supposed to run more than once.
                if (!batch.strategy.isOnce()) {
                    log.info("Max iterations ({}) reached for batch {}", execution.iterations(), batch.name);
                }
                break;
            }
        }
        if (graph.version() == batchStartVersion) {
            log.trace("Batch {} has no effect.", batch.name);
        }
    }

    private boolean applyPass(HepBatch batch, HepGraph graph, BatchExecution execution) {
        HepMatchOrder order = batch.strategy.matchOrder;
        long passStartVersion = graph.version();
        for (HepNodeId nodeId : graph.nodesIter(order, null)) {
            for (Rule rule : batch.rules) {
                // A rewrite earlier in this pass may have removed the node.
                if (!graph.contains(nodeId)) {
                    break;
                }
                HepMatcher matcher = new HepMatcher(rule.pattern(), nodeId, graph, order, config.matchDepthLimit);
                if (matcher.matchOptExpr()) {
                    execution.applying();
                    long before = graph.version();
                    apply(rule, nodeId, graph);
                    boolean changed = graph.version() != before;
                    execution.applied(changed);
                    if (changed) {
                        log.trace("Applying rule {} at {}", rule.ruleName(), nodeId);
                    }
                }
            }
        }
        return graph.version() != passStartVersion;
    }

    private static void apply(Rule rule, HepNodeId nodeId, HepGraph graph) {
        try {
            rule.apply(nodeId, graph);
        } catch (OptimizerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OptimizerException(String.format("Rule %s failed at %s", rule.ruleName(), nodeId), e);
        }
    }
}
