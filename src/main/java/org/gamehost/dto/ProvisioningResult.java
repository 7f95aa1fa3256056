package org.gamehost.dto;

import lombok.Data;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 预配结果，secret 只在创建时返回一次
 */
@Data
public class ProvisioningResult {
    
    private String instanceId;
    
    private Integer port;
    
    private String ipAddress;
    
    private String location;
    
    private String region;
    
    @ToString.Exclude
    private String secret;
    
    private Integer rconPort;
    
    private String status;
    
    private LocalDateTime provisionedAt;
}
