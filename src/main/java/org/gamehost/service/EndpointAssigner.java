package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.config.EndpointProperties;
import org.gamehost.dto.EndpointAssignment;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.List;

/**
 * 从配置的区域地址池中分配网络地址，不考虑当前负载
 */
@Slf4j
@Service
public class EndpointAssigner {

    private final EndpointProperties endpointProperties;
    private final SecureRandom random = new SecureRandom();

    public EndpointAssigner(EndpointProperties endpointProperties) {
        this.endpointProperties = endpointProperties;
    }

    public EndpointAssignment assignEndpointAddress() {
        List<EndpointProperties.Pool> pools = endpointProperties.getPools();
        if (pools == null || pools.isEmpty()) {
            throw new IllegalStateException("未配置地址池 gamehost.endpoint.pools");
        }
        EndpointProperties.Pool pool = pools.get(random.nextInt(pools.size()));
        // 跳过 .0 和 .255
        int octet = 1 + random.nextInt(254);
        String address = pool.getPrefix() + octet;
        log.info("分配地址 {} ({})", address, pool.getName());
        return new EndpointAssignment(address, pool.getName(), pool.getRegion());
    }
}
