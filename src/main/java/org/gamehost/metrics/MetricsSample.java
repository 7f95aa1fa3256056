package org.gamehost.metrics;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 归一化后的资源使用，内存百分比由消费者自行计算
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSample {
    
    private String instanceId;
    
    private double cpuPercent;
    
    private long memoryUsedBytes;
    
    private long memoryLimitBytes;
    
    private long timestamp;
}
