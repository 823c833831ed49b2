package io.hepplan.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import io.hepplan.plan.operator.Operator;

import static io.hepplan.util.Trick.concatToList;

/**
 * A tree of operators, the form a plan takes before and after heuristic optimization.
 * The order of children is significant, e.g. the left and right side of a join.
 */
public class LogicalPlan {
    @JsonProperty("operator")
    public final Operator operator;
    @JsonProperty("children")
    public final List<LogicalPlan> children;

    @JsonCreator
    public LogicalPlan(@JsonProperty("operator") Operator operator,
                       @JsonProperty("children") List<LogicalPlan> children) {
        Preconditions.checkArgument(operator != null, "Plan without operator");
        this.operator = operator;
        this.children = children == null ? ImmutableList.of() : ImmutableList.copyOf(children);
    }

    public static LogicalPlan of(Operator operator, LogicalPlan... children) {
        return new LogicalPlan(operator, Arrays.asList(children));
    }

    public Operator operator() {return operator;}

    public List<LogicalPlan> children() {return children;}

    /**
     * Find the first node that satisfies the condition specified by `p`.
     * The condition is recursively applied to this node and all of its children (pre-order).
     */
    public LogicalPlan find(Predicate<? super LogicalPlan> p) {
        if (p.test(this)) {
            return this;
        }
        for (LogicalPlan c : children) {
            LogicalPlan found = c.find(p);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Runs the given function on this node and then recursively on children.
     */
    public void foreach(Consumer<? super LogicalPlan> f) {
        f.accept(this);
        children.forEach(c -> c.foreach(f));
    }

    /**
     * Runs the given function recursively on children then on this node.
     */
    public void foreachUp(Consumer<? super LogicalPlan> f) {
        children.forEach(c -> c.foreachUp(f));
        f.accept(this);
    }

    /**
     * Collect the elements produced by `f` and not null, in pre-order.
     */
    public <A> List<A> collect(Function<? super LogicalPlan, A> f) {
        List<A> list = new ArrayList<>();
        foreach(node -> {
            A res = f.apply(node);
            if (res != null) list.add(res);
        });
        return list;
    }

    public int size() {
        int size = 1;
        for (LogicalPlan c : children) {
            size += c.size();
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogicalPlan that = (LogicalPlan) o;
        return operator.equals(that.operator) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, children);
    }

    @Override
    public String toString() {
        return treeString();
    }

    /** Returns a string representation of the nodes in this tree */
    public String treeString() {
        return generateTreeString(0, Collections.emptyList(), new StringBuilder()).toString();
    }

    /**
     * Appends the string represent of this node and its children to the given StringBuilder.
     *
     * The `i`-th element in `lastChildren` indicates whether the ancestor of the current node at
     * depth `i + 1` is the last child of its own parent node.  The depth of the root node is 0, and
     * `lastChildren` for the root node should be empty.
     */
    StringBuilder generateTreeString(int depth, List<Boolean> lastChildren, StringBuilder builder) {
        if (depth > 0) {
            lastChildren.subList(0, lastChildren.size() - 1).forEach(isLast -> {
                String prefixFragment = isLast ? "   " : ":  ";
                builder.append(prefixFragment);
            });

            String branch = lastChildren.get(lastChildren.size() - 1) ? "+- " : ":- ";
            builder.append(branch);
        }

        builder.append(operator.simpleString());
        builder.append("\n");

        if (!children.isEmpty()) {
            children.subList(0, children.size() - 1).forEach(c -> {
                c.generateTreeString(depth + 1, concatToList(lastChildren, false), builder);
            });
            children.get(children.size() - 1).generateTreeString(
                    depth + 1,
                    concatToList(lastChildren, true),
                    builder);
        }

        return builder;
    }
}
