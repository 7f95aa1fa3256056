package org.gamehost.runtime;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 健康检查配置
 */
@Data
public class HealthCheckConfig {
    
    /**
     * 健康检查测试命令，例如 ["CMD", "mc-health"]
     */
    private List<String> test = new ArrayList<>(List.of("CMD-SHELL", "mc-health"));
    
    /**
     * 检查间隔（默认30s）
     */
    private Duration interval = Duration.ofSeconds(30);
    
    /**
     * 超时时间（默认10s）
     */
    private Duration timeout = Duration.ofSeconds(10);
    
    /**
     * 连续失败多少次判定为 unhealthy（默认3）
     */
    private Integer retries = 3;
    
    /**
     * 首次探测前的宽限期（默认60s）
     */
    private Duration startPeriod = Duration.ofSeconds(60);
}
