package io.hepplan.optimizer.core;

import com.google.common.base.Preconditions;

import java.util.Arrays;

import io.hepplan.plan.operator.OperatorType;

/**
 * Describes a plan shape: a predicate over the operator of one node plus a policy for its children.
 * Patterns are immutable and independent of any plan graph, one instance is shared by every match attempt of a rule.
 */
public class Pattern {
    public final OperatorPredicate predicate;
    public final PatternChildrenPredicate children;

    public Pattern(OperatorPredicate predicate, PatternChildrenPredicate children) {
        Preconditions.checkArgument(predicate != null, "Pattern without predicate");
        Preconditions.checkArgument(children != null, "Pattern without children predicate");
        this.predicate = predicate;
        this.children = children;
    }

    /** Matches a node of the given type, children are not checked. */
    public static Pattern of(OperatorType type) {
        return new Pattern(OperatorPredicate.typeOf(type), PatternChildrenPredicate.none());
    }

    /** Matches a node of the given type whose every child matches every one of `childPatterns`. */
    public static Pattern of(OperatorType type, Pattern... childPatterns) {
        return new Pattern(OperatorPredicate.typeOf(type), PatternChildrenPredicate.predicate(Arrays.asList(childPatterns)));
    }

    /** Matches a node of the given type whose i-th child matches the i-th of `childPatterns`. */
    public static Pattern positional(OperatorType type, Pattern... childPatterns) {
        return new Pattern(OperatorPredicate.typeOf(type), PatternChildrenPredicate.positional(Arrays.asList(childPatterns)));
    }

    /** Matches a subtree made only of nodes of the given type. */
    public static Pattern all(OperatorType type) {
        return new Pattern(OperatorPredicate.typeOf(type), PatternChildrenPredicate.recursive());
    }

    @Override
    public String toString() {
        return predicate.toString() + children.toString();
    }
}
