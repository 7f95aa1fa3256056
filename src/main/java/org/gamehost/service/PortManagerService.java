package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.dao.mapper.PortUsageMapper;
import org.gamehost.entity.PortState;
import org.gamehost.entity.PortUsage;
import org.gamehost.exception.PortException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 端口管理服务
 * 两级检查：持久化的预留记录 + 操作系统绑定检测；预留写入使用条件更新保证并发安全
 */
@Slf4j
@Service
public class PortManagerService {

    private final PortUsageMapper portUsageMapper;
    private final PortProbe portProbe;
    private final PortArena arena;
    private final long quarantineSeconds;

    public PortManagerService(PortUsageMapper portUsageMapper,
                              PortProbe portProbe,
                              @Value("${gamehost.port.min:25565}") int minPort,
                              @Value("${gamehost.port.max:26000}") int maxPort,
                              @Value("${gamehost.port.release-quarantine-seconds:0}") long quarantineSeconds) {
        this.portUsageMapper = portUsageMapper;
        this.portProbe = portProbe;
        this.arena = new PortArena(minPort, maxPort);
        this.quarantineSeconds = quarantineSeconds;
    }

    /**
     * 按持久化记录恢复进程内端口状态
     */
    @PostConstruct
    public void loadReservations() {
        List<PortUsage> held = portUsageMapper.selectHeldPorts(arena.getRangeMin(), arena.getRangeMax());
        for (PortUsage usage : held) {
            arena.restore(usage.getPort(), usage.getStatus());
        }
        log.info("端口范围 [{}-{}] 已恢复 {} 条占用记录", arena.getRangeMin(), arena.getRangeMax(), held.size());
    }

    /**
     * 在配置的端口范围内分配端口
     */
    public Integer allocatePort(String ownerUserId, String instanceId) {
        return allocatePort(arena.getRangeMin(), arena.getRangeMax(), ownerUserId, instanceId);
    }

    /**
     * 分配端口，范围耗尽时抛出 PORTS_EXHAUSTED，调用方不应重试
     */
    public Integer allocatePort(int rangeMin, int rangeMax, String ownerUserId, String instanceId) {
        if (rangeMin > rangeMax || !arena.contains(rangeMin) || !arena.contains(rangeMax)) {
            throw new PortException(PortException.ERROR_CODE_INVALID_RANGE,
                String.format("请求的端口范围 [%d-%d] 超出配置范围 [%d-%d]",
                    rangeMin, rangeMax, arena.getRangeMin(), arena.getRangeMax()));
        }

        // 1. 持久化层面已预留或处于隔离期的端口
        LocalDateTime cutoff = LocalDateTime.now().minusSeconds(quarantineSeconds);
        Set<Integer> unavailable = new HashSet<>(
            portUsageMapper.selectUnavailablePorts(rangeMin, rangeMax, cutoff));

        // 2. 从最小端口开始查找
        for (int port = rangeMin; port <= rangeMax; port++) {
            if (unavailable.contains(port)) {
                continue;
            }
            // 进程内逐端口加锁，检测期间其他请求会跳过该端口
            if (!arena.tryReserve(port)) {
                continue;
            }

            boolean claimed = false;
            try {
                if (!portProbe.isAvailable(port)) {
                    log.debug("端口 {} 被系统其他进程占用，跳过", port);
                    continue;
                }
                if (persistReservation(port, instanceId, cutoff)) {
                    claimed = true;
                    log.info("分配端口: {} 给实例: {}, userId={}", port, instanceId, ownerUserId);
                    return port;
                }
            } finally {
                if (!claimed) {
                    arena.release(port);
                }
            }
        }

        log.warn("端口范围 [{}-{}] 已用完, instanceId={}", rangeMin, rangeMax, instanceId);
        throw new PortException(PortException.ERROR_CODE_PORTS_EXHAUSTED,
            String.format("没有可用的端口，端口范围 [%d-%d] 已用完", rangeMin, rangeMax));
    }

    /**
     * 容器启动成功后将端口标记为 BOUND
     */
    public void markBound(Integer port, String instanceId) {
        if (port == null) {
            return;
        }
        int updated = portUsageMapper.markBound(port, instanceId);
        if (arena.contains(port)) {
            arena.markBound(port);
        }
        if (updated == 0) {
            log.debug("端口 {} 未处于该实例的预留状态（可能已绑定）: instanceId={}", port, instanceId);
        }
    }

    /**
     * 释放端口，只释放属于该实例的记录
     */
    public void releasePort(Integer port, String instanceId) {
        if (port == null) {
            log.warn("端口号为空，无法释放");
            return;
        }

        try {
            int updated = portUsageMapper.release(port, instanceId, LocalDateTime.now());
            if (updated > 0) {
                if (arena.contains(port)) {
                    arena.release(port);
                }
                log.info("释放端口: {}, instanceId={}", port, instanceId);
            } else {
                log.warn("端口 {} 不属于实例 {} 或已释放", port, instanceId);
            }
        } catch (RuntimeException e) {
            log.error("释放端口失败: port={}", port, e);
            throw new PortException(PortException.ERROR_CODE_PORT_RELEASE_FAILED,
                "释放端口失败: " + port, e);
        }
    }

    /**
     * 获取端口使用记录
     */
    public PortUsage getPortUsage(Integer port) {
        return portUsageMapper.selectById(port);
    }

    /**
     * 端口记录是否仍由该实例占用
     */
    public boolean isHeldBy(Integer port, String instanceId) {
        if (port == null) {
            return false;
        }
        PortUsage usage = portUsageMapper.selectById(port);
        return usage != null && usage.getStatus() != PortState.FREE && instanceId.equals(usage.getInstanceId());
    }

    public PortState getLocalState(int port) {
        return arena.stateOf(port);
    }

    private boolean persistReservation(int port, String instanceId, LocalDateTime cutoff) {
        LocalDateTime now = LocalDateTime.now();
        PortUsage existing = portUsageMapper.selectById(port);
        if (existing == null) {
            PortUsage portUsage = new PortUsage();
            portUsage.setPort(port);
            portUsage.setInstanceId(instanceId);
            portUsage.setStatus(PortState.RESERVED);
            portUsage.setAllocatedTime(now);
            try {
                portUsageMapper.insert(portUsage);
                return true;
            } catch (DuplicateKeyException e) {
                // 其他节点同时插入了该端口
                log.debug("端口 {} 插入冲突，继续查找: {}", port, e.getMessage());
                return false;
            }
        }
        if (existing.getStatus() != PortState.FREE) {
            return false;
        }
        // UPDATE ... WHERE status='FREE' 保证原子性
        return portUsageMapper.claimFreePort(port, instanceId, now, cutoff) > 0;
    }
}
