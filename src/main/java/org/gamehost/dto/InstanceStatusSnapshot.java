package org.gamehost.dto;

import lombok.Data;
import org.gamehost.entity.InstanceStatus;

import java.time.LocalDateTime;

/**
 * 实例实时状态
 */
@Data
public class InstanceStatusSnapshot {
    
    private String instanceId;
    
    private InstanceStatus status;
    
    /**
     * 运行时原始状态，容器不存在时为 null
     */
    private String runtimeStatus;
    
    private String health;
    
    private boolean running;
    
    private Integer restartCount;
    
    private Long exitCode;
    
    private String startedAt;
    
    private Long memoryLimitBytes;
    
    private Integer port;
    
    private String ipAddress;
    
    private String region;
    
    private LocalDateTime lastTransition;
}
