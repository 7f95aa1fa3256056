package org.gamehost.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 网络地址池配置（按区域划分的地址段）
 */
@Data
@ConfigurationProperties(prefix = "gamehost.endpoint")
public class EndpointProperties {
    
    private List<Pool> pools = new ArrayList<>();
    
    @Data
    public static class Pool {
        
        /**
         * 展示名称，例如 US-East
         */
        private String name;
        
        /**
         * 地址前缀，例如 154.12.1.
         */
        private String prefix;
        
        /**
         * 区域标识，例如 us-east-1
         */
        private String region;
    }
}
