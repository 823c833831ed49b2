package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class AggregateOperator extends Operator {
    @JsonProperty("groupBy")
    public final List<String> groupBy;
    @JsonProperty("aggCalls")
    public final List<String> aggCalls;

    @JsonCreator
    public AggregateOperator(@JsonProperty("groupBy") List<String> groupBy,
                             @JsonProperty("aggCalls") List<String> aggCalls) {
        this.groupBy = groupBy == null ? ImmutableList.of() : ImmutableList.copyOf(groupBy);
        this.aggCalls = aggCalls == null ? ImmutableList.of() : ImmutableList.copyOf(aggCalls);
        Preconditions.checkArgument(!this.groupBy.isEmpty() || !this.aggCalls.isEmpty(), "Empty aggregate");
    }

    @Override
    public OperatorType type() {return OperatorType.AGGREGATE;}

    @Override
    protected List<Object> args() {
        return Arrays.asList(groupBy.isEmpty() ? null : groupBy, aggCalls.isEmpty() ? null : aggCalls);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateOperator that = (AggregateOperator) o;
        return groupBy.equals(that.groupBy) && aggCalls.equals(that.aggCalls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupBy, aggCalls);
    }
}
