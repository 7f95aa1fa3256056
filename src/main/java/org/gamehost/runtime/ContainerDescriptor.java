package org.gamehost.runtime;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 容器创建描述
 */
@Data
public class ContainerDescriptor {
    
    private String name;
    
    private String image;
    
    private Map<String, String> env = new LinkedHashMap<>();
    
    private Map<String, String> labels = new LinkedHashMap<>();
    
    private long memoryBytes;
    
    private int hostPort;
    
    private int containerPort;
    
    /**
     * 宿主机持久化目录，按实例ID区分
     */
    private String hostDataPath;
    
    private String containerDataPath = "/data";
    
    /**
     * 重启策略，默认除非显式停止否则自动重启
     */
    private String restartPolicy = "unless-stopped";
    
    private HealthCheckConfig healthCheck;
    
    private String logMaxSize = "10m";
    
    private String logMaxFile = "5";
}
