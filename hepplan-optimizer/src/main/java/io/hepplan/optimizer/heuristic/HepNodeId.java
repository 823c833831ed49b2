package io.hepplan.optimizer.heuristic;

import com.google.common.base.Preconditions;

/**
 * Handle of a node slot in the {@link HepGraph} which issued it. Slots are never reused.
 */
public final class HepNodeId implements Comparable<HepNodeId> {
    private final int index;

    public HepNodeId(int index) {
        Preconditions.checkArgument(index >= 0, "Negative node index: %s", index);
        this.index = index;
    }

    public static HepNodeId of(int index) {
        return new HepNodeId(index);
    }

    public int index() {
        return index;
    }

    @Override
    public int compareTo(HepNodeId o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof HepNodeId && ((HepNodeId) o).index == index);
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
