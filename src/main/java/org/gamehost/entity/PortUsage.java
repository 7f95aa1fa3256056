package org.gamehost.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 端口使用记录
 */
@Data
@TableName("port_usage")
public class PortUsage {
    
    @TableId(type = IdType.INPUT)
    private Integer port;
    
    private String instanceId;
    
    private PortState status;
    
    private LocalDateTime allocatedTime;
    
    /**
     * 最近一次释放时间，用于隔离期判断
     */
    private LocalDateTime releasedTime;
}
