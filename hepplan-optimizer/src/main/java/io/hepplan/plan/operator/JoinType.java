package io.hepplan.plan.operator;

public enum JoinType {
    INNER,
    LEFT,
    RIGHT,
    FULL,
    CROSS,
}
