package org.gamehost.dto;

import lombok.Data;
import org.gamehost.entity.InstanceStatus;

import java.time.LocalDateTime;

/**
 * 实例信息响应（不含密码）
 */
@Data
public class InstanceInfo {
    
    private String id;
    
    private String ownerId;
    
    private String name;
    
    private String version;
    
    private Integer memoryMb;
    
    private Integer diskGb;
    
    private Integer port;
    
    private String ipAddress;
    
    private String region;
    
    private InstanceStatus status;
    
    private String failureReason;
    
    private LocalDateTime createdTime;
    
    private LocalDateTime updatedTime;
}
