package com.tenacy.tradepulse.monitor.performance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage {
    private double cpuUsagePercent;
    private double memoryUsagePercent;
    private double memoryTotalMb;
    private double memoryUsedMb;
    private double memoryFreeMb;
}
