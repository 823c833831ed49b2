package io.hepplan.optimizer.heuristic;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import io.hepplan.optimizer.core.MalformedPatternException;
import io.hepplan.optimizer.core.MatchDepthExceededException;
import io.hepplan.optimizer.core.NodeNotFoundException;
import io.hepplan.optimizer.core.OperatorPredicate;
import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.PatternChildrenPredicate;
import io.hepplan.plan.LogicalPlan;
import io.hepplan.plan.TestPlans;
import io.hepplan.plan.operator.JoinType;
import io.hepplan.plan.operator.Operator;
import io.hepplan.plan.operator.OperatorType;
import io.hepplan.plan.operator.ScanOperator;

import static io.hepplan.plan.TestPlans.dummy;
import static io.hepplan.plan.TestPlans.filter;
import static io.hepplan.plan.TestPlans.join;
import static io.hepplan.plan.TestPlans.plan;
import static io.hepplan.plan.TestPlans.project;
import static io.hepplan.plan.TestPlans.scan;

public class HepMatcherTest {
    private static final HepNodeId ROOT = HepNodeId.of(0);

    private static boolean matches(Pattern pattern, HepNodeId id, HepGraphView graph) {
        return new HepMatcher(pattern, id, graph).matchOptExpr();
    }

    @Test
    public void testPredicate() {
        HepGraph graph = new HepGraph(TestPlans.load("project_scan"));
        Pattern projectIntoTableScan = Pattern.of(OperatorType.PROJECT, Pattern.of(OperatorType.SCAN));
        Assert.assertTrue(matches(projectIntoTableScan, ROOT, graph));

        HepGraph other = new HepGraph(plan(project("a"), plan(filter("a > 1"), plan(scan("t1", "a")))));
        Assert.assertFalse(matches(projectIntoTableScan, ROOT, other));
    }

    @Test
    public void testCombinedPredicate() {
        OperatorPredicate unboundedScan = OperatorPredicate.typeOf(OperatorType.SCAN)
                .and(op -> !((ScanOperator) op).bounded());
        Pattern pattern = Pattern.of(OperatorType.PROJECT, new Pattern(unboundedScan, PatternChildrenPredicate.none()));

        Assert.assertTrue(matches(pattern, ROOT, new HepGraph(TestPlans.load("project_scan"))));
        HepGraph bounded = new HepGraph(plan(project("a"), plan(scan("t1", "a").withBounds(null, 10L))));
        Assert.assertFalse(matches(pattern, ROOT, bounded));
        // The type check comes first, a project is never cast.
        Assert.assertFalse(matches(new Pattern(unboundedScan, PatternChildrenPredicate.none()), ROOT, bounded));
    }

    @Test
    public void testRecursive() {
        LogicalPlan allDummy = plan(dummy(),
                plan(dummy(), plan(dummy())),
                plan(dummy()));
        HepGraph graph = new HepGraph(allDummy);
        Pattern onlyDummy = Pattern.all(OperatorType.DUMMY);
        Assert.assertTrue(matches(onlyDummy, ROOT, graph));
        Assert.assertTrue(new HepMatcher(onlyDummy, ROOT, graph, HepMatchOrder.BOTTOM_UP, 8).matchOptExpr());

        // Any single dissenting node breaks the match.
        for (HepNodeId id : graph.nodesIter(HepMatchOrder.TOP_DOWN, null)) {
            HepGraph changed = new HepGraph(allDummy);
            changed.setOperator(id, project("x"));
            Assert.assertFalse(id.toString(), matches(onlyDummy, ROOT, changed));
        }

        // Only the subtree of the start node counts.
        HepGraph partly = new HepGraph(allDummy);
        partly.setOperator(HepNodeId.of(3), project("x"));
        Assert.assertTrue(matches(onlyDummy, HepNodeId.of(1), partly));
    }

    @Test
    public void testNoneChildren() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        Assert.assertTrue(matches(Pattern.of(OperatorType.JOIN), HepNodeId.of(1), graph));
        Assert.assertTrue(matches(Pattern.of(OperatorType.SCAN), HepNodeId.of(2), graph));
        Assert.assertFalse(matches(Pattern.of(OperatorType.SCAN), HepNodeId.of(3), graph));
    }

    @Test
    public void testShortCircuit() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        CountingGraphView view = new CountingGraphView(graph);

        Pattern recursiveFilter = new Pattern(OperatorPredicate.typeOf(OperatorType.FILTER), PatternChildrenPredicate.recursive());
        Pattern filterOverScan = Pattern.of(OperatorType.FILTER, Pattern.of(OperatorType.SCAN));
        Assert.assertFalse(matches(recursiveFilter, ROOT, view));
        Assert.assertFalse(matches(filterOverScan, ROOT, view));
        Assert.assertEquals(2, view.operatorCalls);
        Assert.assertEquals(0, view.childrenCalls);
        Assert.assertEquals(0, view.iterCalls);

        Assert.assertTrue(matches(filterOverScan, HepNodeId.of(3), view));
        Assert.assertEquals(1, view.childrenCalls);
        Assert.assertEquals(0, view.iterCalls);
    }

    @Test
    public void testChildrenAllPatterns() {
        // Join(Scan, Filter(Scan))
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        HepNodeId joinId = HepNodeId.of(1);

        // Every child must match every pattern of the list.
        Pattern anyChildren = Pattern.of(OperatorType.JOIN, new Pattern(OperatorPredicate.any(), PatternChildrenPredicate.none()));
        Assert.assertTrue(matches(anyChildren, joinId, graph));
        Assert.assertFalse(matches(Pattern.of(OperatorType.JOIN, Pattern.of(OperatorType.SCAN)), joinId, graph));
        Assert.assertFalse(matches(
                Pattern.of(OperatorType.JOIN, Pattern.of(OperatorType.SCAN), Pattern.of(OperatorType.FILTER)), joinId, graph));

        HepGraph twoScans = new HepGraph(plan(join(JoinType.INNER, "a = b"), plan(scan("t1", "a")), plan(scan("t2", "b"))));
        Assert.assertTrue(matches(Pattern.of(OperatorType.JOIN, Pattern.of(OperatorType.SCAN)), ROOT, twoScans));

        // An empty list puts no constraint, a leaf trivially satisfies any list.
        Assert.assertTrue(matches(Pattern.of(OperatorType.JOIN, new Pattern[0]), joinId, graph));
        Assert.assertTrue(matches(Pattern.of(OperatorType.SCAN, Pattern.of(OperatorType.PROJECT)), HepNodeId.of(2), graph));
    }

    @Test
    public void testPositional() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        HepNodeId joinId = HepNodeId.of(1);

        Pattern scanAndFilter = Pattern.positional(OperatorType.JOIN,
                Pattern.of(OperatorType.SCAN),
                Pattern.of(OperatorType.FILTER, Pattern.of(OperatorType.SCAN)));
        Assert.assertTrue(matches(scanAndFilter, joinId, graph));

        Pattern swapped = Pattern.positional(OperatorType.JOIN, Pattern.of(OperatorType.FILTER), Pattern.of(OperatorType.SCAN));
        Assert.assertFalse(matches(swapped, joinId, graph));
    }

    @Test(expected = MalformedPatternException.class)
    public void testPositionalArityMismatch() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        matches(Pattern.positional(OperatorType.JOIN, Pattern.of(OperatorType.SCAN)), HepNodeId.of(1), graph);
    }

    @Test
    public void testPositionalRootMismatchIsNoError() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        Assert.assertFalse(matches(Pattern.positional(OperatorType.JOIN, Pattern.of(OperatorType.SCAN)), ROOT, graph));
    }

    @Test
    public void testDepthLimit() {
        LogicalPlan deep = plan(dummy());
        for (int i = 0; i < 5; i++) {
            deep = plan(dummy(), deep);
        }
        HepGraph graph = new HepGraph(deep);
        Pattern nested = Pattern.of(OperatorType.DUMMY);
        for (int i = 0; i < 5; i++) {
            nested = Pattern.of(OperatorType.DUMMY, nested);
        }

        Assert.assertTrue(new HepMatcher(nested, ROOT, graph, HepMatchOrder.TOP_DOWN, 5).matchOptExpr());
        try {
            new HepMatcher(nested, ROOT, graph, HepMatchOrder.TOP_DOWN, 4).matchOptExpr();
            Assert.fail();
        } catch (MatchDepthExceededException e) {
            // expected
        }
    }

    @Test
    public void testStaleId() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        graph.replaceNode(HepNodeId.of(3), plan(dummy()));
        try {
            matches(Pattern.of(OperatorType.FILTER), HepNodeId.of(3), graph);
            Assert.fail();
        } catch (NodeNotFoundException e) {
            Assert.assertEquals(HepNodeId.of(3), e.nodeId());
        }
    }

    @Test
    public void testMatchDoesNotMutate() {
        HepGraph graph = new HepGraph(TestPlans.projectOverJoin());
        long version = graph.version();
        for (HepNodeId id : graph.nodesIter(HepMatchOrder.BOTTOM_UP, null)) {
            matches(Pattern.all(OperatorType.SCAN), id, graph);
            matches(Pattern.of(OperatorType.JOIN, Pattern.of(OperatorType.SCAN)), id, graph);
        }
        Assert.assertEquals(version, graph.version());
        Assert.assertEquals(TestPlans.projectOverJoin(), graph.toPlan());
    }

    private static class CountingGraphView implements HepGraphView {
        private final HepGraphView delegate;
        int operatorCalls;
        int childrenCalls;
        int iterCalls;

        CountingGraphView(HepGraphView delegate) {
            this.delegate = delegate;
        }

        @Override
        public Operator operator(HepNodeId id) {
            operatorCalls++;
            return delegate.operator(id);
        }

        @Override
        public List<HepNodeId> childrenAt(HepNodeId id) {
            childrenCalls++;
            return delegate.childrenAt(id);
        }

        @Override
        public List<HepNodeId> nodesIter(HepMatchOrder order, HepNodeId start) {
            iterCalls++;
            return delegate.nodesIter(order, start);
        }
    }
}
