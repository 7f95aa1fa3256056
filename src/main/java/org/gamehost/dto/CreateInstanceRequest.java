package org.gamehost.dto;

import lombok.Data;

/**
 * 创建实例请求
 */
@Data
public class CreateInstanceRequest {
    
    private String name;
    
    /**
     * 内存（GB），1-16
     */
    private Integer memory;
    
    /**
     * 磁盘（GB），5-500
     */
    private Integer diskSpace;
    
    /**
     * 游戏版本，默认 LATEST
     */
    private String version;
}
