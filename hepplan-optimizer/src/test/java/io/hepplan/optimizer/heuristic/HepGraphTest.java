package io.hepplan.optimizer.heuristic;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.hepplan.optimizer.core.NodeNotFoundException;
import io.hepplan.plan.LogicalPlan;
import io.hepplan.plan.TestPlans;
import io.hepplan.plan.operator.JoinType;
import io.hepplan.plan.operator.LimitOperator;
import io.hepplan.plan.operator.Operator;

import static io.hepplan.plan.TestPlans.dummy;
import static io.hepplan.plan.TestPlans.filter;
import static io.hepplan.plan.TestPlans.join;
import static io.hepplan.plan.TestPlans.plan;
import static io.hepplan.plan.TestPlans.project;
import static io.hepplan.plan.TestPlans.scan;

public class HepGraphTest {
    private LogicalPlan original;
    private HepGraph graph;

    private static List<HepNodeId> ids(int... indexes) {
        HepNodeId[] ids = new HepNodeId[indexes.length];
        for (int i = 0; i < indexes.length; i++) {
            ids[i] = HepNodeId.of(indexes[i]);
        }
        return Arrays.asList(ids);
    }

    private static HepNodeId id(int index) {
        return HepNodeId.of(index);
    }

    @Before
    public void setUp() {
        // #0 Project
        //   #1 Join
        //     #2 Scan t1
        //     #3 Filter
        //       #4 Scan t2
        original = TestPlans.projectOverJoin();
        graph = new HepGraph(original);
    }

    @Test
    public void testWrap() {
        Assert.assertEquals(id(0), graph.root());
        Assert.assertEquals(5, graph.size());
        Assert.assertEquals(project("a", "b"), graph.operator(id(0)));
        Assert.assertEquals(join(JoinType.LEFT, "t1.id = t2.id"), graph.operator(id(1)));
        Assert.assertEquals(scan("t1", "id", "a"), graph.operator(id(2)));
        Assert.assertEquals(filter("b > 1"), graph.operator(id(3)));
        Assert.assertEquals(scan("t2", "id", "b"), graph.operator(id(4)));

        Assert.assertEquals(ids(1), graph.childrenAt(id(0)));
        Assert.assertEquals(ids(2, 3), graph.childrenAt(id(1)));
        Assert.assertEquals(Collections.emptyList(), graph.childrenAt(id(4)));
        Assert.assertNull(graph.parentOf(id(0)));
        Assert.assertEquals(id(3), graph.parentOf(id(4)));
    }

    @Test
    public void testRoundTrip() {
        Assert.assertEquals(original, graph.toPlan());
        HepGraph again = new HepGraph(graph.toPlan());
        Assert.assertEquals(original, again.toPlan());
        for (HepNodeId id : graph.nodesIter(HepMatchOrder.TOP_DOWN, null)) {
            Assert.assertEquals(graph.operator(id), again.operator(id));
            Assert.assertEquals(graph.childrenAt(id), again.childrenAt(id));
        }
    }

    @Test
    public void testNodesIter() {
        Assert.assertEquals(ids(0, 1, 2, 3, 4), graph.nodesIter(HepMatchOrder.TOP_DOWN, null));
        Assert.assertEquals(ids(2, 4, 3, 1, 0), graph.nodesIter(HepMatchOrder.BOTTOM_UP, null));
        Assert.assertEquals(ids(3, 4), graph.nodesIter(HepMatchOrder.TOP_DOWN, id(3)));
        Assert.assertEquals(ids(4, 3), graph.nodesIter(HepMatchOrder.BOTTOM_UP, id(3)));
        Assert.assertEquals(ids(2), graph.nodesIter(HepMatchOrder.BOTTOM_UP, id(2)));
    }

    @Test
    public void testNodesIterIsSnapshot() {
        List<HepNodeId> ids = graph.nodesIter(HepMatchOrder.TOP_DOWN, null);
        graph.removeNode(id(3), true);
        Assert.assertEquals(ids(0, 1, 2, 3, 4), ids);
        Assert.assertEquals(ids(0, 1, 2), graph.nodesIter(HepMatchOrder.TOP_DOWN, null));
    }

    @Test
    public void testReplaceNode() {
        long version = graph.version();
        HepNodeId newId = graph.replaceNode(id(3), plan(limitOf(5), plan(scan("t3", "b"))));
        Assert.assertEquals(id(5), newId);
        Assert.assertEquals(ids(2, 5), graph.childrenAt(id(1)));
        Assert.assertEquals(id(1), graph.parentOf(newId));
        Assert.assertEquals(ids(6), graph.childrenAt(newId));
        Assert.assertFalse(graph.contains(id(3)));
        Assert.assertFalse(graph.contains(id(4)));
        Assert.assertEquals(5, graph.size());
        Assert.assertTrue(graph.version() > version);

        try {
            graph.operator(id(3));
            Assert.fail();
        } catch (NodeNotFoundException e) {
            Assert.assertEquals(id(3), e.nodeId());
        }
    }

    @Test
    public void testReplaceRoot() {
        HepNodeId newId = graph.replaceNode(id(0), plan(dummy()));
        Assert.assertEquals(newId, graph.root());
        Assert.assertEquals(1, graph.size());
        Assert.assertEquals(plan(dummy()), graph.toPlan());
    }

    @Test
    public void testSetOperator() {
        long version = graph.version();
        graph.setOperator(id(3), filter("b > 1"));
        Assert.assertEquals(version, graph.version());

        graph.setOperator(id(3), filter("b > 2"));
        Assert.assertEquals(version + 1, graph.version());
        Assert.assertEquals(filter("b > 2"), graph.operator(id(3)));
        Assert.assertEquals(ids(4), graph.childrenAt(id(3)));
    }

    @Test
    public void testAddNode() {
        HepNodeId limitId = graph.addNode(id(1), id(2), limitOf(10));
        Assert.assertEquals(id(5), limitId);
        Assert.assertEquals(ids(5, 3), graph.childrenAt(id(1)));
        Assert.assertEquals(ids(2), graph.childrenAt(limitId));
        Assert.assertEquals(limitId, graph.parentOf(id(2)));

        HepNodeId leafId = graph.addNode(id(3), null, dummy());
        Assert.assertEquals(ids(4, 6), graph.childrenAt(id(3)));
        Assert.assertEquals(Collections.emptyList(), graph.childrenAt(leafId));
        Assert.assertEquals(7, graph.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAddNodeNotAChild() {
        graph.addNode(id(0), id(2), dummy());
    }

    @Test
    public void testAddRoot() {
        HepNodeId newRoot = graph.addRoot(limitOf(1));
        Assert.assertEquals(newRoot, graph.root());
        Assert.assertEquals(ids(0), graph.childrenAt(newRoot));
        Assert.assertEquals(newRoot, graph.parentOf(id(0)));
        Assert.assertEquals(plan(limitOf(1), original), graph.toPlan());
    }

    @Test
    public void testSwapNode() {
        graph.swapNode(id(0), id(1));
        Assert.assertEquals(join(JoinType.LEFT, "t1.id = t2.id"), graph.operator(id(0)));
        Assert.assertEquals(project("a", "b"), graph.operator(id(1)));
        Assert.assertEquals(ids(2, 3), graph.childrenAt(id(1)));
    }

    @Test
    public void testRemoveNode() {
        Operator removed = graph.removeNode(id(3), false);
        Assert.assertEquals(filter("b > 1"), removed);
        Assert.assertEquals(ids(2, 4), graph.childrenAt(id(1)));
        Assert.assertEquals(id(1), graph.parentOf(id(4)));
        Assert.assertEquals(4, graph.size());

        graph.removeNode(id(1), true);
        Assert.assertEquals(Collections.emptyList(), graph.childrenAt(id(0)));
        Assert.assertEquals(1, graph.size());
        Assert.assertFalse(graph.contains(id(2)));
    }

    @Test
    public void testCapacity() {
        Assert.assertEquals(5, graph.capacity());
        for (int i = 0; i < 10; i++) {
            HepNodeId added = graph.addNode(id(3), id(4), dummy());
            graph.removeNode(added, false);
        }
        Assert.assertEquals(5, graph.size());
        Assert.assertEquals(15, graph.capacity());
        Assert.assertFalse(graph.contains(id(14)));
        Assert.assertEquals(original, graph.toPlan());
    }

    @Test
    public void testRemoveRoot() {
        graph.removeNode(id(0), false);
        Assert.assertEquals(id(1), graph.root());
        Assert.assertNull(graph.parentOf(id(1)));
        Assert.assertEquals(original.children.get(0), graph.toPlan());
    }

    @Test(expected = IllegalStateException.class)
    public void testRemoveWholePlan() {
        graph.removeNode(id(0), true);
    }

    @Test(expected = IllegalStateException.class)
    public void testRemoveRootWithTwoChildren() {
        graph.removeNode(id(0), false);
        graph.removeNode(id(1), false);
    }

    @Test
    public void testSetRoot() {
        graph.setRoot(id(3));
        Assert.assertEquals(id(3), graph.root());
        Assert.assertEquals(2, graph.size());
        Assert.assertFalse(graph.contains(id(0)));
        Assert.assertFalse(graph.contains(id(2)));
        Assert.assertEquals(plan(filter("b > 1"), plan(scan("t2", "id", "b"))), graph.toPlan());
    }

    @Test(expected = NodeNotFoundException.class)
    public void testUnknownId() {
        graph.childrenAt(id(42));
    }

    @Test
    public void testTreeString() {
        Assert.assertEquals(
                "#0 Project [a, b]\n" +
                        "  #1 Join LEFT, t1.id = t2.id\n" +
                        "    #2 Scan t1, [id, a]\n" +
                        "    #3 Filter [b > 1]\n" +
                        "      #4 Scan t2, [id, b]\n",
                graph.treeString());
    }

    private static LimitOperator limitOf(long limit) {
        return LimitOperator.of(limit);
    }
}
