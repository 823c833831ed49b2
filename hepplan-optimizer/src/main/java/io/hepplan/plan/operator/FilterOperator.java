package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the rows satisfying all of the conjuncts.
 */
public class FilterOperator extends Operator {
    @JsonProperty("conjuncts")
    public final List<String> conjuncts;
    @JsonProperty("having")
    public final boolean having;

    @JsonCreator
    public FilterOperator(@JsonProperty("conjuncts") List<String> conjuncts,
                          @JsonProperty("having") boolean having) {
        Preconditions.checkArgument(conjuncts != null && !conjuncts.isEmpty(), "Filter without predicate");
        this.conjuncts = ImmutableList.copyOf(conjuncts);
        this.having = having;
    }

    public FilterOperator(List<String> conjuncts) {
        this(conjuncts, false);
    }

    @Override
    public OperatorType type() {return OperatorType.FILTER;}

    @Override
    protected List<Object> args() {
        return Arrays.asList(conjuncts, having ? "having" : null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterOperator that = (FilterOperator) o;
        return having == that.having && conjuncts.equals(that.conjuncts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conjuncts, having);
    }
}
