package org.gamehost.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 游戏服务器实例实体
 */
@Data
@TableName("game_instance")
public class GameInstance {
    
    @TableId(type = IdType.INPUT)
    private String id;
    
    private String ownerId;
    
    private String name;
    
    private String image;
    
    private String version;
    
    private Integer memoryMb;
    
    /**
     * 磁盘配额（GB），仅作参考，由运行时执行
     */
    private Integer diskGb;
    
    private Integer port;
    
    private String ipAddress;
    
    private String region;
    
    /**
     * RCON/管理密码，只在创建结果中返回一次
     */
    @ToString.Exclude
    private String secret;
    
    private String containerId;
    
    private String dataPath;
    
    private InstanceStatus status;
    
    private String failureReason;
    
    private LocalDateTime createdTime;
    
    /**
     * 最近一次状态变更时间
     */
    private LocalDateTime updatedTime;
}
