package io.hepplan.optimizer.heuristic;

/**
 * The order of graph traversal when looking for rule matches.
 */
public enum HepMatchOrder {
    /**
     * Match from root down. A match attempt at an ancestor always precedes all
     * match attempts at its descendants.
     */
    TOP_DOWN,

    /**
     * Match from leaves up. A match attempt at a descendant precedes all match
     * attempts at its ancestors.
     */
    BOTTOM_UP,
}
