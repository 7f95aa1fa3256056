package org.gamehost.runtime;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 运行时原始累计计数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawStatsSample {
    
    /**
     * 容器累计 CPU 时间（纳秒）
     */
    private long cpuTotalUsage;
    
    /**
     * 宿主机累计 CPU 时间（纳秒）
     */
    private long systemCpuUsage;
    
    private int onlineCpus;
    
    private long memoryUsage;
    
    private long memoryLimit;
}
