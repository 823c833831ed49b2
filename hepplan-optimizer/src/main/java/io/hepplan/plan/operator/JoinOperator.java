package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Joins its first child (left side) with its second child (right side).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JoinOperator extends Operator {
    @JsonProperty("joinType")
    public final JoinType joinType;
    @JsonProperty("condition")
    public final String condition;

    @JsonCreator
    public JoinOperator(@JsonProperty("joinType") JoinType joinType,
                        @JsonProperty("condition") @Nullable String condition) {
        Preconditions.checkArgument(joinType != null, "Join without type");
        Preconditions.checkArgument(joinType != JoinType.CROSS || condition == null, "Cross join with condition");
        this.joinType = joinType;
        this.condition = condition;
    }

    @Override
    public OperatorType type() {return OperatorType.JOIN;}

    @Override
    protected List<Object> args() {
        return Arrays.asList(joinType, condition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JoinOperator that = (JoinOperator) o;
        return joinType == that.joinType && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, condition);
    }
}
