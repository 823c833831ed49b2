package io.hepplan.plan.operator;

public enum OperatorType {
    SCAN,
    PROJECT,
    FILTER,
    JOIN,
    LIMIT,
    SORT,
    AGGREGATE,
    DUMMY,
}
