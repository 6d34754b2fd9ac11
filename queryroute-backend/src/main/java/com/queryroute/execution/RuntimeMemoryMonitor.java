package com.queryroute.execution;

import org.springframework.stereotype.Component;

@Component
public class RuntimeMemoryMonitor implements MemoryMonitor {

    @Override
    public double utilization() {
        Runtime rt = Runtime.getRuntime();
        long used = rt.totalMemory() - rt.freeMemory();
        long max = rt.maxMemory();
        if (max <= 0 || max == Long.MAX_VALUE) {
            return 0.0;
        }
        return (double) used / max;
    }

    @Override
    public void requestGc() {
        System.gc();
    }
}
