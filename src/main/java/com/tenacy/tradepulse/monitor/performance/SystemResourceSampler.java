package com.tenacy.tradepulse.monitor.performance;

import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Samples host CPU and physical memory through the platform MXBean.
 */
@Component
public class SystemResourceSampler {

    private static final double MB = 1024.0 * 1024.0;

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    public ResourceUsage sample() {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean sunOsBean)) {
            throw new IllegalStateException("Host resource metrics are not available on this JVM");
        }

        double cpuLoad = sunOsBean.getCpuLoad();
        double total = sunOsBean.getTotalMemorySize();
        double free = sunOsBean.getFreeMemorySize();
        double used = total - free;

        return ResourceUsage.builder()
                .cpuUsagePercent(cpuLoad < 0 ? 0.0 : cpuLoad * 100.0)
                .memoryUsagePercent(total > 0 ? used / total * 100.0 : 0.0)
                .memoryTotalMb(total / MB)
                .memoryUsedMb(used / MB)
                .memoryFreeMb(free / MB)
                .build();
    }
}
