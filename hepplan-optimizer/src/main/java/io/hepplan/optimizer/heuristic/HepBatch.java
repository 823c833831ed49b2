package io.hepplan.optimizer.heuristic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

import io.hepplan.optimizer.core.Rule;

/** A batch of rules, applied in declared order under one strategy. */
public class HepBatch {
    public final String name;
    public final HepBatchStrategy strategy;
    public final List<Rule> rules;

    public HepBatch(String name, HepBatchStrategy strategy, List<Rule> rules) {
        Preconditions.checkArgument(name != null, "Batch without name");
        Preconditions.checkArgument(strategy != null, "Batch %s without strategy", name);
        Preconditions.checkArgument(rules != null && !rules.isEmpty(), "Batch %s without rules", name);
        this.name = name;
        this.strategy = strategy;
        this.rules = ImmutableList.copyOf(rules);
    }

    public HepBatch(String name, HepBatchStrategy strategy, Rule... rules) {
        this(name, strategy, Arrays.asList(rules));
    }

    @Override
    public String toString() {
        return name;
    }
}
