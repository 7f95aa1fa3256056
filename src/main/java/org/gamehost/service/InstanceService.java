package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.dao.mapper.GameInstanceMapper;
import org.gamehost.dto.CreateInstanceRequest;
import org.gamehost.dto.InstanceInfo;
import org.gamehost.dto.ProvisioningResult;
import org.gamehost.entity.GameInstance;
import org.gamehost.entity.InstanceStatus;
import org.gamehost.exception.AuthorizationException;
import org.gamehost.exception.ContainerException;
import org.gamehost.exception.InstanceNotFoundException;
import org.gamehost.exception.LifecycleConflictException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 实例创建编排与归属校验
 */
@Slf4j
@Service
public class InstanceService {
    
    public static final int MIN_MEMORY_GB = 1;
    public static final int MAX_MEMORY_GB = 16;
    public static final int MIN_DISK_GB = 5;
    public static final int MAX_DISK_GB = 500;
    
    private final InstanceLifecycleService lifecycleService;
    private final ProvisioningService provisioningService;
    private final PortManagerService portManagerService;
    private final GameInstanceMapper gameInstanceMapper;
    
    public InstanceService(InstanceLifecycleService lifecycleService,
                           ProvisioningService provisioningService,
                           PortManagerService portManagerService,
                           GameInstanceMapper gameInstanceMapper) {
        this.lifecycleService = lifecycleService;
        this.provisioningService = provisioningService;
        this.portManagerService = portManagerService;
        this.gameInstanceMapper = gameInstanceMapper;
    }
    
    /**
     * 创建实例：登记 → 预配 → 启动
     */
    public ProvisioningResult createInstance(String ownerId, CreateInstanceRequest request) {
        validate(request);
        GameInstance instance = lifecycleService.register(ownerId, request);
        lifecycleService.markProvisioning(instance.getId());
        
        ProvisioningResult provisioning;
        try {
            provisioning = provisioningService.provision(instance);
        } catch (RuntimeException e) {
            try {
                lifecycleService.markFailed(instance.getId(), e.getMessage());
            } catch (RuntimeException markError) {
                log.error("实例{}标记失败状态时出错", instance.getId(), markError);
                e.addSuppressed(markError);
            }
            throw e;
        }
        
        try {
            lifecycleService.launch(instance.getId(), provisioning);
        } catch (LifecycleConflictException e) {
            // 启动前实例已被其他操作接管（如销毁），预留端口交还
            portManagerService.releasePort(provisioning.getPort(), instance.getId());
            throw e;
        } catch (ContainerException e) {
            if (ContainerException.ERROR_CODE_INVALID_STATE.equals(e.getErrorCode())) {
                portManagerService.releasePort(provisioning.getPort(), instance.getId());
            }
            throw e;
        }
        
        provisioning.setStatus(InstanceStatus.RUNNING.name());
        log.info("实例创建完成: instanceId={}, userId={}", instance.getId(), ownerId);
        return provisioning;
    }
    
    /**
     * 校验实例归属，不属于该用户时拒绝访问
     */
    public GameInstance requireOwned(String ownerId, String instanceId) {
        GameInstance instance = gameInstanceMapper.selectById(instanceId);
        if (instance == null) {
            throw new InstanceNotFoundException(instanceId);
        }
        if (!instance.getOwnerId().equals(ownerId)) {
            log.warn("拒绝访问他人实例: userId={}, instanceId={}", ownerId, instanceId);
            throw new AuthorizationException(AuthorizationException.ERROR_CODE_ACCESS_DENIED, "无权访问该实例");
        }
        return instance;
    }
    
    public List<InstanceInfo> listInstances(String ownerId) {
        return gameInstanceMapper.selectActiveByOwner(ownerId).stream()
            .map(InstanceService::toInfo)
            .collect(Collectors.toList());
    }
    
    public InstanceInfo getInstance(String ownerId, String instanceId) {
        return toInfo(requireOwned(ownerId, instanceId));
    }
    
    static void validate(CreateInstanceRequest request) {
        if (request == null || !StringUtils.hasText(request.getName())) {
            throw new IllegalArgumentException("实例名称不能为空");
        }
        if (request.getMemory() == null
            || request.getMemory() < MIN_MEMORY_GB || request.getMemory() > MAX_MEMORY_GB) {
            throw new IllegalArgumentException(
                String.format("内存必须在 %d-%d GB 之间", MIN_MEMORY_GB, MAX_MEMORY_GB));
        }
        if (request.getDiskSpace() == null
            || request.getDiskSpace() < MIN_DISK_GB || request.getDiskSpace() > MAX_DISK_GB) {
            throw new IllegalArgumentException(
                String.format("磁盘必须在 %d-%d GB 之间", MIN_DISK_GB, MAX_DISK_GB));
        }
    }
    
    private static InstanceInfo toInfo(GameInstance instance) {
        InstanceInfo info = new InstanceInfo();
        info.setId(instance.getId());
        info.setOwnerId(instance.getOwnerId());
        info.setName(instance.getName());
        info.setVersion(instance.getVersion());
        info.setMemoryMb(instance.getMemoryMb());
        info.setDiskGb(instance.getDiskGb());
        info.setPort(instance.getPort());
        info.setIpAddress(instance.getIpAddress());
        info.setRegion(instance.getRegion());
        info.setStatus(instance.getStatus());
        info.setFailureReason(instance.getFailureReason());
        info.setCreatedTime(instance.getCreatedTime());
        info.setUpdatedTime(instance.getUpdatedTime());
        return info;
    }
}
