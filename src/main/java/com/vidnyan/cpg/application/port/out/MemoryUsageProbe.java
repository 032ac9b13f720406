package com.vidnyan.cpg.application.port.out;

/**
 * Port reporting heap usage of the running process.
 */
public interface MemoryUsageProbe {

    long usedBytes();

    long maxBytes();

    default double usedFraction() {
        long max = maxBytes();
        return max <= 0 ? 0.0 : (double) usedBytes() / max;
    }
}
