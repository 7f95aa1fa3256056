package org.gamehost.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分配的网络地址
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EndpointAssignment {
    
    private String address;
    
    /**
     * 地址池名称，例如 EU-Central
     */
    private String label;
    
    private String region;
}
