package org.gamehost.runtime;

import lombok.Data;

/**
 * 容器运行状态快照
 */
@Data
public class ContainerState {
    
    private String containerId;
    
    /**
     * 运行时原始状态: created / running / restarting / paused / exited / dead
     */
    private String status;
    
    private boolean running;
    
    /**
     * 健康状态: starting / healthy / unhealthy / none
     */
    private String health;
    
    private Long exitCode;
    
    private Integer restartCount;
    
    private String startedAt;
    
    private Long memoryLimit;
}
