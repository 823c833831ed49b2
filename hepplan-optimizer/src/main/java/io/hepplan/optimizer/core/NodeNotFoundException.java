package io.hepplan.optimizer.core;

import io.hepplan.optimizer.heuristic.HepNodeId;

public class NodeNotFoundException extends OptimizerException {
    private final HepNodeId nodeId;

    public NodeNotFoundException(HepNodeId nodeId) {
        super(String.format("Node %s not found in plan graph", nodeId));
        this.nodeId = nodeId;
    }

    public HepNodeId nodeId() {
        return nodeId;
    }
}
