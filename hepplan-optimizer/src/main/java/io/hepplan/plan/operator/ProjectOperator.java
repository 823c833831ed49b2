package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;

public class ProjectOperator extends Operator {
    @JsonProperty("columns")
    public final List<String> columns;

    @JsonCreator
    public ProjectOperator(@JsonProperty("columns") List<String> columns) {
        Preconditions.checkArgument(columns != null && !columns.isEmpty(), "Project without columns");
        this.columns = ImmutableList.copyOf(columns);
    }

    @Override
    public OperatorType type() {return OperatorType.PROJECT;}

    @Override
    protected List<Object> args() {return Collections.singletonList(columns);}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return columns.equals(((ProjectOperator) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }
}
