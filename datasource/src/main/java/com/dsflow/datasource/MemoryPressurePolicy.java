package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.common.MemoryMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Advisory eviction: once memory use passes the threshold, the entity that just produced a
 * sample drops its cached raw data. No hard budget is enforced.
 */
public class MemoryPressurePolicy {
    private static final Logger logger = LoggerFactory.getLogger(MemoryPressurePolicy.class);

    private final double maxMemPercent;
    private final MemoryMonitor monitor;
    private final PipelineMetrics metrics;

    public MemoryPressurePolicy(double maxMemPercent, MemoryMonitor monitor, PipelineMetrics metrics) {
        if (!(maxMemPercent > 0.0 && maxMemPercent <= 1.0)) {
            throw new IllegalArgumentException("maxMemPercent must be in (0, 1], got " + maxMemPercent);
        }
        this.maxMemPercent = maxMemPercent;
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return true if the entity's raw data was released
     */
    public boolean afterAccept(Entity<?, ?> entity) {
        double used = monitor.usedFraction();
        if (used <= maxMemPercent) {
            return false;
        }
        entity.evictData();
        metrics.evicted();
        logger.debug("Memory at {}% > {}%: evicted raw data of entity {}",
                Math.round(used * 100), Math.round(maxMemPercent * 100), entity.getUniqueId());
        return true;
    }
}
