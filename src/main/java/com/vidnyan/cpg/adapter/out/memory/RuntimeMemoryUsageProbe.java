package com.vidnyan.cpg.adapter.out.memory;

import com.vidnyan.cpg.application.port.out.MemoryUsageProbe;
import org.springframework.stereotype.Component;

/**
 * Heap usage of the running JVM.
 */
@Component
public class RuntimeMemoryUsageProbe implements MemoryUsageProbe {

    @Override
    public long usedBytes() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    @Override
    public long maxBytes() {
        return Runtime.getRuntime().maxMemory();
    }
}
