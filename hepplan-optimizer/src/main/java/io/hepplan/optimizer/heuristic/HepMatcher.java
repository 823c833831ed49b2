package io.hepplan.optimizer.heuristic;

import java.util.List;

import io.hepplan.optimizer.core.MalformedPatternException;
import io.hepplan.optimizer.core.MatchDepthExceededException;
import io.hepplan.optimizer.core.Pattern;
import io.hepplan.optimizer.core.PatternMatcher;

/**
 * Use pattern to determines which rule can be applied at a node.
 * Matching only reads the graph, a matcher lives for a single match attempt.
 */
public class HepMatcher implements PatternMatcher {
    public static final int DEFAULT_DEPTH_LIMIT = 128;

    private final Pattern pattern;
    private final HepNodeId startId;
    private final HepGraphView graph;
    private final HepMatchOrder matchOrder;
    private final int depth;
    private final int depthLimit;

    public HepMatcher(Pattern pattern, HepNodeId startId, HepGraphView graph) {
        this(pattern, startId, graph, HepMatchOrder.TOP_DOWN, DEFAULT_DEPTH_LIMIT);
    }

    public HepMatcher(Pattern pattern, HepNodeId startId, HepGraphView graph, HepMatchOrder matchOrder, int depthLimit) {
        this(pattern, startId, graph, matchOrder, 0, depthLimit);
    }

    private HepMatcher(Pattern pattern, HepNodeId startId, HepGraphView graph, HepMatchOrder matchOrder, int depth, int depthLimit) {
        this.pattern = pattern;
        this.startId = startId;
        this.graph = graph;
        this.matchOrder = matchOrder;
        this.depth = depth;
        this.depthLimit = depthLimit;
    }

    @Override
    public boolean matchOptExpr() {
        // Check the root node predicate, most attempts stop here.
        if (!pattern.predicate.test(graph.operator(startId))) {
            return false;
        }

        switch (pattern.children.kind) {
            case NONE:
                break;
            case RECURSIVE:
                for (HepNodeId nodeId : graph.nodesIter(matchOrder, startId)) {
                    if (!pattern.predicate.test(graph.operator(nodeId))) {
                        return false;
                    }
                }
                break;
            case PREDICATE:
                for (HepNodeId childId : graph.childrenAt(startId)) {
                    for (Pattern childPattern : pattern.children.patterns) {
                        if (!child(childPattern, childId).matchOptExpr()) {
                            return false;
                        }
                    }
                }
                break;
            case POSITIONAL:
                List<HepNodeId> children = graph.childrenAt(startId);
                List<Pattern> childPatterns = pattern.children.patterns;
                if (children.size() != childPatterns.size()) {
                    throw new MalformedPatternException(String.format(
                            "Pattern %s expects %d children, node %s %s has %d",
                            pattern, childPatterns.size(), startId, graph.operator(startId), children.size()));
                }
                for (int i = 0; i < children.size(); i++) {
                    if (!child(childPatterns.get(i), children.get(i)).matchOptExpr()) {
                        return false;
                    }
                }
                break;
            default:
                throw new IllegalStateException("Unknown children predicate " + pattern.children.kind);
        }
        return true;
    }

    private HepMatcher child(Pattern childPattern, HepNodeId childId) {
        if (depth + 1 > depthLimit) {
            throw new MatchDepthExceededException(depthLimit);
        }
        return new HepMatcher(childPattern, childId, graph, matchOrder, depth + 1, depthLimit);
    }
}
