package com.dsflow.common;

/**
 * Process-wide memory utilization probe.
 */
@FunctionalInterface
public interface MemoryMonitor {
    /** @return fraction of available memory in use, in [0, 1] */
    double usedFraction();
}
