package io.hepplan.optimizer.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;

import java.util.Collections;
import java.util.List;

/**
 * How the children of a node are checked once its operator satisfied the root predicate.
 */
public class PatternChildrenPredicate {
    public enum Kind {
        /** Children are not checked. */
        NONE,
        /** Every node of the subtree, the matched node included, satisfies the root predicate. */
        RECURSIVE,
        /** Every child satisfies every one of the sub-patterns. */
        PREDICATE,
        /** The i-th child satisfies the i-th sub-pattern, child count equals the number of sub-patterns. */
        POSITIONAL,
    }

    private static final PatternChildrenPredicate NONE = new PatternChildrenPredicate(Kind.NONE, Collections.emptyList());
    private static final PatternChildrenPredicate RECURSIVE = new PatternChildrenPredicate(Kind.RECURSIVE, Collections.emptyList());

    public final Kind kind;
    public final List<Pattern> patterns;

    private PatternChildrenPredicate(Kind kind, List<Pattern> patterns) {
        this.kind = kind;
        this.patterns = patterns;
    }

    public static PatternChildrenPredicate none() {
        return NONE;
    }

    public static PatternChildrenPredicate recursive() {
        return RECURSIVE;
    }

    public static PatternChildrenPredicate predicate(List<Pattern> patterns) {
        Preconditions.checkArgument(patterns != null, "Null sub-patterns");
        return new PatternChildrenPredicate(Kind.PREDICATE, ImmutableList.copyOf(patterns));
    }

    public static PatternChildrenPredicate positional(List<Pattern> patterns) {
        Preconditions.checkArgument(patterns != null, "Null sub-patterns");
        return new PatternChildrenPredicate(Kind.POSITIONAL, ImmutableList.copyOf(patterns));
    }

    @Override
    public String toString() {
        switch (kind) {
            case NONE:
                return "";
            case RECURSIVE:
                return "*";
            default:
                return (kind == Kind.POSITIONAL ? "(" : "[") + StringUtils.join(patterns, ", ") + (kind == Kind.POSITIONAL ? ")" : "]");
        }
    }
}
