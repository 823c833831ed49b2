package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import org.apache.commons.lang.StringUtils;

import java.util.List;

/**
 * One relational algebra step. Operators are immutable values, a rewrite always installs a new instance.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScanOperator.class, name = "scan"),
        @JsonSubTypes.Type(value = ProjectOperator.class, name = "project"),
        @JsonSubTypes.Type(value = FilterOperator.class, name = "filter"),
        @JsonSubTypes.Type(value = JoinOperator.class, name = "join"),
        @JsonSubTypes.Type(value = LimitOperator.class, name = "limit"),
        @JsonSubTypes.Type(value = SortOperator.class, name = "sort"),
        @JsonSubTypes.Type(value = AggregateOperator.class, name = "aggregate"),
        @JsonSubTypes.Type(value = DummyOperator.class, name = "dummy"),
})
public abstract class Operator {

    @JsonIgnore
    public abstract OperatorType type();

    /** Arguments shown by {@link #simpleString()}. */
    protected abstract List<Object> args();

    public boolean is(OperatorType type) {
        return type() == type;
    }

    public String nodeName() {
        String name = type().name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }

    /** STRING representation of this operator without any children */
    public String simpleString() {
        StringBuilder sb = new StringBuilder(nodeName());
        List<Object> args = args();
        boolean first = true;
        for (Object arg : args) {
            if (arg == null) {
                continue;
            }
            sb.append(first ? " " : ", ");
            if (arg instanceof List) {
                sb.append('[').append(StringUtils.join((List) arg, ", ")).append(']');
            } else {
                sb.append(arg);
            }
            first = false;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return simpleString();
    }
}
