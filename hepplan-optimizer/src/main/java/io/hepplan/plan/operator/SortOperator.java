package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;

public class SortOperator extends Operator {
    @JsonProperty("sortKeys")
    public final List<String> sortKeys;

    @JsonCreator
    public SortOperator(@JsonProperty("sortKeys") List<String> sortKeys) {
        Preconditions.checkArgument(sortKeys != null && !sortKeys.isEmpty(), "Sort without keys");
        this.sortKeys = ImmutableList.copyOf(sortKeys);
    }

    @Override
    public OperatorType type() {return OperatorType.SORT;}

    @Override
    protected List<Object> args() {return Collections.singletonList(sortKeys);}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return sortKeys.equals(((SortOperator) o).sortKeys);
    }

    @Override
    public int hashCode() {
        return sortKeys.hashCode();
    }
}
