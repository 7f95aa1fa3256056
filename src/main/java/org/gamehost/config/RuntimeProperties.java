package org.gamehost.config;

import lombok.Data;
import org.gamehost.runtime.HealthCheckConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 容器运行时与实例启动参数
 */
@Data
@ConfigurationProperties(prefix = "gamehost.runtime")
public class RuntimeProperties {
    
    private String image = "itzg/minecraft-server:latest";
    
    /**
     * 容器内游戏端口，宿主机分配端口映射到此端口
     */
    private int internalPort = 25565;
    
    private int rconPort = 25575;
    
    /**
     * 实例持久化目录根路径，实例目录为 {dataBasePath}/{instanceId}
     */
    private String dataBasePath = "/var/lib/gamehost/data";
    
    private int startupGraceSeconds = 60;
    
    private long readinessPollMillis = 1000;
    
    private int stopGraceSeconds = 10;
    
    private int maxLogLines = 1000;
    
    private boolean pullImageOnStartup = false;
    
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
}
