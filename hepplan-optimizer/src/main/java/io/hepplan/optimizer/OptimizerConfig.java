package io.hepplan.optimizer;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;

import io.hepplan.optimizer.heuristic.HepMatcher;
import io.hepplan.util.PropertiesUtils;

public class OptimizerConfig {
    private static final Logger log = LoggerFactory.getLogger(OptimizerConfig.class);

    public static final String RESOURCE = "hepplan.properties";

    public static final String MAX_ITERATIONS = "hepplan.optimizer.max.iterations";
    public static final String MATCH_DEPTH_LIMIT = "hepplan.optimizer.match.depth.limit";
    public static final String TIMEOUT_MS = "hepplan.optimizer.timeout.ms";

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /** Passes allowed to fix point batches. */
    public final int maxIterations;
    /** Maximum nesting of sub-pattern matching. */
    public final int matchDepthLimit;
    /** Time budget checked between batches, 0 for none. */
    public final long timeoutMs;

    public OptimizerConfig(int maxIterations, int matchDepthLimit, long timeoutMs) {
        Preconditions.checkArgument(maxIterations > 0, "%s must be positive: %s", MAX_ITERATIONS, maxIterations);
        Preconditions.checkArgument(matchDepthLimit > 0, "%s must be positive: %s", MATCH_DEPTH_LIMIT, matchDepthLimit);
        Preconditions.checkArgument(timeoutMs >= 0, "%s must not be negative: %s", TIMEOUT_MS, timeoutMs);
        this.maxIterations = maxIterations;
        this.matchDepthLimit = matchDepthLimit;
        this.timeoutMs = timeoutMs;
    }

    public static OptimizerConfig defaults() {
        return new OptimizerConfig(DEFAULT_MAX_ITERATIONS, HepMatcher.DEFAULT_DEPTH_LIMIT, 0);
    }

    public static OptimizerConfig fromProperties(Properties properties) {
        return new OptimizerConfig(
                PropertiesUtils.getInt(properties, MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS),
                PropertiesUtils.getInt(properties, MATCH_DEPTH_LIMIT, HepMatcher.DEFAULT_DEPTH_LIMIT),
                PropertiesUtils.getLong(properties, TIMEOUT_MS, 0));
    }

    /**
     * Loads {@link #RESOURCE} from classpath, defaults if it is not there.
     */
    public static OptimizerConfig load() throws IOException {
        Properties properties = PropertiesUtils.loadRs(RESOURCE);
        if (properties == null) {
            log.debug("{} not found in classpath, use defaults", RESOURCE);
            return defaults();
        }
        return fromProperties(properties);
    }

    public static OptimizerConfig load(Path path) throws IOException {
        return fromProperties(PropertiesUtils.load(path));
    }

    @Override
    public String toString() {
        return String.format("OptimizerConfig{maxIterations=%d, matchDepthLimit=%d, timeoutMs=%d}",
                maxIterations, matchDepthLimit, timeoutMs);
    }
}
