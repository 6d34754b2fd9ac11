package com.queryroute.execution;

/**
 * Heap utilization check consulted between result pages.
 */
public interface MemoryMonitor {

    /**
     * @return used heap as a fraction of the maximum, between 0 and 1
     */
    double utilization();

    /**
     * Hints the runtime to reclaim memory.
     */
    void requestGc();
}
