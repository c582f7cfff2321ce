package com.dsflow.common;

/**
 * Heap utilization as seen by {@link Runtime}: (total - free) / max.
 */
public final class RuntimeMemoryMonitor implements MemoryMonitor {
    private final Runtime runtime;

    public RuntimeMemoryMonitor() {
        this(Runtime.getRuntime());
    }

    RuntimeMemoryMonitor(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public double usedFraction() {
        long maxMemory  = runtime.maxMemory();
        long usedMemory = runtime.totalMemory() - runtime.freeMemory();
        if (maxMemory <= 0 || maxMemory == Long.MAX_VALUE) {
            maxMemory = runtime.totalMemory();
        }
        double f = (double) usedMemory / maxMemory;
        return Math.max(0.0, Math.min(1.0, f));
    }
}
