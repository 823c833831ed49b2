package io.hepplan.plan.operator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * Placeholder operator without payload, used to build plans in tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DummyOperator extends Operator {
    public static final DummyOperator INSTANCE = new DummyOperator();

    @Override
    public OperatorType type() {return OperatorType.DUMMY;}

    @Override
    protected List<Object> args() {return Collections.emptyList();}

    @Override
    public boolean equals(Object o) {
        return o instanceof DummyOperator;
    }

    @Override
    public int hashCode() {
        return DummyOperator.class.hashCode();
    }
}
