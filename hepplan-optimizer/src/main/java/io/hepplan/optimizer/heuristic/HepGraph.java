package io.hepplan.optimizer.heuristic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import javax.annotation.Nullable;

import io.hepplan.optimizer.core.NodeNotFoundException;
import io.hepplan.plan.LogicalPlan;
import io.hepplan.plan.operator.Operator;

/**
 * Mutable plan representation rewritten by the heuristic optimizer.
 *
 * The graph is the only owner of its nodes. A node holds an operator and the ordered ids of its children,
 * and every node except the root has exactly one parent, so the graph is always a tree rooted at {@link #root()}.
 * Ids are slot indexes handed out in increasing order and never reused: an id of a removed node stays invalid
 * and every lookup through it fails with {@link NodeNotFoundException}.
 * Removed nodes leave an empty slot behind, so memory grows with the number of nodes ever created
 * ({@link #capacity()}), not with {@link #size()}. Rules which keep inserting nodes are bounded by the
 * iteration cap of their batch.
 *
 * Not thread safe, one graph belongs to one optimization.
 */
public class HepGraph implements HepGraphView {
    private static class HepNode {
        Operator operator;
        HepNodeId parent;
        final List<HepNodeId> children = new ArrayList<>(2);

        HepNode(Operator operator, HepNodeId parent) {
            this.operator = operator;
            this.parent = parent;
        }
    }

    private final List<HepNode> nodes = new ArrayList<>();
    private HepNodeId root;
    private int liveCount;
    private long version;

    /**
     * Wraps the plan, ids are assigned in pre-order starting from 0 at the root.
     */
    public HepGraph(LogicalPlan plan) {
        Preconditions.checkArgument(plan != null, "Null plan");
        this.root = insertPlan(plan, null);
    }

    public HepNodeId root() {
        return root;
    }

    /**
     * Makes `id` the new root. Every node not under `id` is removed.
     */
    public void setRoot(HepNodeId id) {
        HepNode node = node(id);
        if (id.equals(root)) {
            return;
        }
        HepNode parent = node(node.parent);
        parent.children.remove(id);
        node.parent = null;
        deleteSubtree(root);
        root = id;
        version++;
    }

    public boolean contains(HepNodeId id) {
        return id != null && id.index() < nodes.size() && nodes.get(id.index()) != null;
    }

    /** Number of live nodes. */
    public int size() {
        return liveCount;
    }

    /** Number of slots handed out so far, live or removed. */
    public int capacity() {
        return nodes.size();
    }

    /**
     * Increases on every change of the graph, a rule which leaves it untouched does not move it.
     */
    public long version() {
        return version;
    }

    @Override
    public Operator operator(HepNodeId id) {
        return node(id).operator;
    }

    @Override
    public List<HepNodeId> childrenAt(HepNodeId id) {
        return ImmutableList.copyOf(node(id).children);
    }

    /** The parent of `id`, null for the root. */
    public HepNodeId parentOf(HepNodeId id) {
        return node(id).parent;
    }

    @Override
    public List<HepNodeId> nodesIter(HepMatchOrder order, @Nullable HepNodeId start) {
        HepNodeId from = start == null ? root : start;
        node(from);

        List<HepNodeId> ids = new ArrayList<>();
        Deque<HepNodeId> stack = new ArrayDeque<>();
        stack.push(from);
        if (order == HepMatchOrder.TOP_DOWN) {
            while (!stack.isEmpty()) {
                HepNodeId id = stack.pop();
                ids.add(id);
                List<HepNodeId> children = node(id).children;
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            return ids;
        } else {
            // Root first with children right to left, reversed it is left to right post-order.
            while (!stack.isEmpty()) {
                HepNodeId id = stack.pop();
                ids.add(id);
                for (HepNodeId child : node(id).children) {
                    stack.push(child);
                }
            }
            return Lists.reverse(ids);
        }
    }

    /**
     * Replaces the subtree rooted at `id` by `plan`. The new subtree takes the position of the old one
     * under its parent, or becomes the root. Nodes of the old subtree are removed.
     *
     * @return the id of the new subtree root.
     */
    public HepNodeId replaceNode(HepNodeId id, LogicalPlan plan) {
        Preconditions.checkArgument(plan != null, "Null plan");
        HepNode node = node(id);
        HepNodeId parentId = node.parent;
        HepNodeId newId = insertPlan(plan, parentId);
        if (parentId == null) {
            root = newId;
        } else {
            List<HepNodeId> siblings = node(parentId).children;
            siblings.set(siblings.indexOf(id), newId);
        }
        deleteSubtree(id);
        version++;
        return newId;
    }

    /**
     * Installs a new operator at `id`, children are kept.
     */
    public void setOperator(HepNodeId id, Operator operator) {
        Preconditions.checkArgument(operator != null, "Null operator");
        HepNode node = node(id);
        if (!node.operator.equals(operator)) {
            node.operator = operator;
            version++;
        }
    }

    /**
     * Adds a node under `parentId`. If `childId` is given, the new node takes its position and adopts it
     * as only child, otherwise the new node is appended as a leaf.
     *
     * @return the id of the new node.
     */
    public HepNodeId addNode(HepNodeId parentId, @Nullable HepNodeId childId, Operator operator) {
        Preconditions.checkArgument(operator != null, "Null operator");
        HepNode parent = node(parentId);
        if (childId == null) {
            HepNodeId newId = allocate(operator, parentId);
            parent.children.add(newId);
            version++;
            return newId;
        }
        HepNode child = node(childId);
        int pos = parent.children.indexOf(childId);
        Preconditions.checkArgument(pos >= 0, "%s is not a child of %s", childId, parentId);

        HepNodeId newId = allocate(operator, parentId);
        node(newId).children.add(childId);
        child.parent = newId;
        parent.children.set(pos, newId);
        version++;
        return newId;
    }

    /**
     * Adds a new root above the current one.
     */
    public HepNodeId addRoot(Operator operator) {
        Preconditions.checkArgument(operator != null, "Null operator");
        HepNodeId oldRoot = root;
        HepNodeId newId = allocate(operator, null);
        node(newId).children.add(oldRoot);
        node(oldRoot).parent = newId;
        root = newId;
        version++;
        return newId;
    }

    /**
     * Exchanges the operators of two nodes, the structure stays the same.
     */
    public void swapNode(HepNodeId a, HepNodeId b) {
        HepNode nodeA = node(a);
        HepNode nodeB = node(b);
        if (nodeA.operator.equals(nodeB.operator)) {
            return;
        }
        Operator op = nodeA.operator;
        nodeA.operator = nodeB.operator;
        nodeB.operator = op;
        version++;
    }

    /**
     * Removes the node at `id`. With `withChildren` its whole subtree goes away, otherwise its children
     * are spliced into its parent at its position. The root can only be removed alone, and only if it
     * has exactly one child, which becomes the root.
     *
     * @return the operator of the removed node.
     */
    public Operator removeNode(HepNodeId id, boolean withChildren) {
        HepNode node = node(id);
        Operator operator = node.operator;
        HepNodeId parentId = node.parent;

        if (parentId == null) {
            Preconditions.checkState(!withChildren, "Cannot remove the whole plan");
            Preconditions.checkState(node.children.size() == 1,
                    "Cannot remove root %s with %s children", id, node.children.size());
            HepNodeId newRoot = node.children.get(0);
            node(newRoot).parent = null;
            release(id);
            root = newRoot;
            version++;
            return operator;
        }

        List<HepNodeId> siblings = node(parentId).children;
        int pos = siblings.indexOf(id);
        siblings.remove(pos);
        if (withChildren) {
            deleteSubtree(id);
        } else {
            siblings.addAll(pos, node.children);
            for (HepNodeId child : node.children) {
                node(child).parent = parentId;
            }
            release(id);
        }
        version++;
        return operator;
    }

    /**
     * Materializes the plan rooted at {@link #root()}.
     */
    public LogicalPlan toPlan() {
        return toPlan(root);
    }

    public LogicalPlan toPlan(HepNodeId id) {
        HepNode node = node(id);
        List<LogicalPlan> children = new ArrayList<>(node.children.size());
        for (HepNodeId child : node.children) {
            children.add(toPlan(child));
        }
        return new LogicalPlan(node.operator, children);
    }

    /** Like {@link LogicalPlan#treeString()}, with node ids. */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(root, 0, sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return treeString();
    }

    private void appendTree(HepNodeId id, int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        HepNode node = node(id);
        sb.append(id).append(' ').append(node.operator.simpleString()).append('\n');
        for (HepNodeId child : node.children) {
            appendTree(child, depth + 1, sb);
        }
    }

    private HepNode node(HepNodeId id) {
        if (!contains(id)) {
            throw new NodeNotFoundException(id);
        }
        return nodes.get(id.index());
    }

    private HepNodeId allocate(Operator operator, HepNodeId parent) {
        HepNodeId id = new HepNodeId(nodes.size());
        nodes.add(new HepNode(operator, parent));
        liveCount++;
        return id;
    }

    private void release(HepNodeId id) {
        nodes.set(id.index(), null);
        liveCount--;
    }

    private HepNodeId insertPlan(LogicalPlan plan, HepNodeId parent) {
        HepNodeId id = allocate(plan.operator, parent);
        for (LogicalPlan child : plan.children) {
            HepNodeId childId = insertPlan(child, id);
            node(id).children.add(childId);
        }
        return id;
    }

    private void deleteSubtree(HepNodeId id) {
        Deque<HepNodeId> stack = new ArrayDeque<>();
        stack.push(id);
        while (!stack.isEmpty()) {
            HepNodeId cur = stack.pop();
            for (HepNodeId child : node(cur).children) {
                stack.push(child);
            }
            release(cur);
        }
    }
}
