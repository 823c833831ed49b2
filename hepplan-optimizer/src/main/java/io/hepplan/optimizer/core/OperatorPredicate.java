package io.hepplan.optimizer.core;

import io.hepplan.plan.operator.Operator;
import io.hepplan.plan.operator.OperatorType;

/**
 * Predicate over a single operator, the root check of a {@link Pattern}.
 */
@FunctionalInterface
public interface OperatorPredicate {
    boolean test(Operator op);

    static OperatorPredicate typeOf(OperatorType type) {
        return new TypeOf(type);
    }

    static OperatorPredicate any() {
        return op -> true;
    }

    default OperatorPredicate and(OperatorPredicate other) {
        return op -> test(op) && other.test(op);
    }

    class TypeOf implements OperatorPredicate {
        public final OperatorType type;

        TypeOf(OperatorType type) {
            this.type = type;
        }

        @Override
        public boolean test(Operator op) {
            return op.type() == type;
        }

        @Override
        public String toString() {
            return type.name();
        }
    }
}
