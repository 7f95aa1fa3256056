package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.config.RuntimeProperties;
import org.gamehost.dao.mapper.GameInstanceMapper;
import org.gamehost.dto.CreateInstanceRequest;
import org.gamehost.dto.InstanceStatusSnapshot;
import org.gamehost.dto.ProvisioningResult;
import org.gamehost.entity.GameInstance;
import org.gamehost.entity.InstanceStatus;
import org.gamehost.exception.ContainerException;
import org.gamehost.exception.GameHostException;
import org.gamehost.exception.InstanceNotFoundException;
import org.gamehost.exception.RuntimeUnavailableException;
import org.gamehost.runtime.ContainerDescriptor;
import org.gamehost.runtime.ContainerRuntime;
import org.gamehost.runtime.ContainerState;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 实例生命周期管理
 * 实例状态只在这里写入；同一实例的操作通过 InstanceOperationGuard 串行化
 */
@Slf4j
@Service
public class InstanceLifecycleService {

    public static final String CONTAINER_NAME_PREFIX = "gs-";
    public static final String LABEL_INSTANCE_ID = "gamehost.instance-id";
    public static final String LABEL_OWNER_ID = "gamehost.owner-id";

    /**
     * Aikar 推荐的 G1 参数
     */
    private static final String JVM_XX_OPTS = "-XX:+UseG1GC -XX:+ParallelRefProcEnabled -XX:MaxGCPauseMillis=200 "
        + "-XX:+UnlockExperimentalVMOptions -XX:+DisableExplicitGC -XX:+AlwaysPreTouch "
        + "-XX:G1NewSizePercent=30 -XX:G1MaxNewSizePercent=40 -XX:G1HeapRegionSize=8M "
        + "-XX:G1ReservePercent=20 -XX:G1HeapWastePercent=5 -XX:G1MixedGCCountTarget=4 "
        + "-XX:InitiatingHeapOccupancyPercent=15 -XX:G1MixedGCLiveThresholdPercent=90 "
        + "-XX:G1RSetUpdatingPauseTimePercent=5 -XX:SurvivorRatio=32 -XX:+PerfDisableSharedMem "
        + "-XX:MaxTenuringThreshold=1";

    private final GameInstanceMapper gameInstanceMapper;
    private final ContainerRuntime containerRuntime;
    private final PortManagerService portManagerService;
    private final FileManagerService fileManagerService;
    private final InstanceOperationGuard operationGuard;
    private final RuntimeProperties runtimeProperties;

    public InstanceLifecycleService(GameInstanceMapper gameInstanceMapper,
                                    ContainerRuntime containerRuntime,
                                    PortManagerService portManagerService,
                                    FileManagerService fileManagerService,
                                    InstanceOperationGuard operationGuard,
                                    RuntimeProperties runtimeProperties) {
        this.gameInstanceMapper = gameInstanceMapper;
        this.containerRuntime = containerRuntime;
        this.portManagerService = portManagerService;
        this.fileManagerService = fileManagerService;
        this.operationGuard = operationGuard;
        this.runtimeProperties = runtimeProperties;
    }

    /**
     * 登记新实例，状态为 REQUESTED
     */
    public GameInstance register(String ownerId, CreateInstanceRequest request) {
        GameInstance instance = new GameInstance();
        instance.setId(CONTAINER_NAME_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
        instance.setOwnerId(ownerId);
        instance.setName(request.getName());
        instance.setImage(runtimeProperties.getImage());
        instance.setVersion(request.getVersion() == null || request.getVersion().trim().isEmpty()
            ? "LATEST" : request.getVersion().trim());
        instance.setMemoryMb(request.getMemory() * 1024);
        instance.setDiskGb(request.getDiskSpace());
        instance.setStatus(InstanceStatus.REQUESTED);
        LocalDateTime now = LocalDateTime.now();
        instance.setCreatedTime(now);
        instance.setUpdatedTime(now);
        gameInstanceMapper.insert(instance);
        log.info("登记实例: instanceId={}, userId={}, name={}", instance.getId(), ownerId, instance.getName());
        return instance;
    }

    public void markProvisioning(String instanceId) {
        operationGuard.call(instanceId, "provision", () -> {
            GameInstance instance = requireInstance(instanceId);
            if (instance.getStatus() != InstanceStatus.REQUESTED) {
                throw invalidState(instance, "provision");
            }
            transition(instance, InstanceStatus.PROVISIONING);
            return null;
        });
    }

    /**
     * 预配阶段失败，实例进入 FAILED
     */
    public void markFailed(String instanceId, String reason) {
        operationGuard.call(instanceId, "fail", () -> {
            GameInstance instance = requireInstance(instanceId);
            instance.setFailureReason(reason);
            transition(instance, InstanceStatus.FAILED);
            return null;
        });
    }

    /**
     * 按预配结果创建并启动容器，等待进入运行状态
     * 失败时删除半成品容器、释放端口，实例进入 FAILED
     */
    public GameInstance launch(String instanceId, ProvisioningResult provisioning) {
        return operationGuard.call(instanceId, "launch", () -> {
            GameInstance instance = requireInstance(instanceId);
            if (instance.getStatus() != InstanceStatus.PROVISIONING) {
                throw invalidState(instance, "launch");
            }
            instance.setPort(provisioning.getPort());
            instance.setIpAddress(provisioning.getIpAddress());
            instance.setRegion(provisioning.getRegion());
            instance.setSecret(provisioning.getSecret());
            return doLaunch(instance);
        });
    }

    /**
     * 停止实例，已停止时直接返回
     */
    public InstanceStatus stop(String instanceId, Integer graceSeconds) {
        int grace = graceSeconds == null ? runtimeProperties.getStopGraceSeconds() : graceSeconds;
        if (grace < 0) {
            throw new IllegalArgumentException("graceSeconds 不能为负数: " + grace);
        }
        return operationGuard.call(instanceId, "stop", () -> doStop(requireInstance(instanceId), grace));
    }

    /**
     * 重启实例，沿用原端口、地址、密码和数据目录
     */
    public GameInstance restart(String instanceId) {
        return operationGuard.call(instanceId, "restart", () -> {
            GameInstance instance = requireInstance(instanceId);
            switch (instance.getStatus()) {
                case RUNNING:
                case STOPPING:
                    doStop(instance, runtimeProperties.getStopGraceSeconds());
                    break;
                case STOPPED:
                    break;
                case FAILED:
                    if (!portManagerService.isHeldBy(instance.getPort(), instanceId)) {
                        throw new ContainerException(ContainerException.ERROR_CODE_INVALID_STATE,
                            "实例端口已释放，无法重启，请重新创建: " + instanceId);
                    }
                    break;
                default:
                    throw invalidState(instance, "restart");
            }
            transition(instance, InstanceStatus.PROVISIONING);
            return doLaunch(instance);
        });
    }

    /**
     * 销毁实例：停止并删除容器、释放端口；purge 为 true 时同时删除数据目录
     */
    public InstanceStatus destroy(String instanceId, boolean purge) {
        return operationGuard.call(instanceId, "destroy", () -> {
            GameInstance instance = requireInstance(instanceId);
            if (instance.getStatus() == InstanceStatus.DESTROYED) {
                log.info("实例已销毁，忽略: {}", instanceId);
                return InstanceStatus.DESTROYED;
            }
            if (instance.getStatus() == InstanceStatus.RUNNING || instance.getStatus() == InstanceStatus.STOPPING) {
                doStop(instance, runtimeProperties.getStopGraceSeconds());
            }
            if (instance.getContainerId() != null) {
                containerRuntime.remove(instance.getContainerId(), false);
                log.info("删除容器: instanceId={}, containerId={}", instanceId, instance.getContainerId());
            }
            if (purge) {
                fileManagerService.deleteDirectory(instance.getDataPath() != null
                    ? Paths.get(instance.getDataPath()) : fileManagerService.dataDirOf(instanceId));
            }
            portManagerService.releasePort(instance.getPort(), instanceId);
            transition(instance, InstanceStatus.DESTROYED);
            return InstanceStatus.DESTROYED;
        });
    }

    /**
     * 查询实例实时状态；运行时观测结果与记录不一致且实例空闲时回写记录
     */
    public InstanceStatusSnapshot getStatus(String instanceId) {
        GameInstance instance = requireInstance(instanceId);
        Optional<ContainerState> state = instance.getContainerId() == null
            ? Optional.empty() : containerRuntime.inspect(instance.getContainerId());

        InstanceStatus observed = reconcile(instance.getStatus(), instance.getContainerId(), state);
        if (observed != instance.getStatus()) {
            InstanceStatus recorded = instance.getStatus();
            boolean applied = operationGuard.tryRun(instanceId, () -> {
                GameInstance latest = requireInstance(instanceId);
                if (latest.getStatus() == recorded) {
                    if (observed == InstanceStatus.FAILED) {
                        latest.setFailureReason(state.map(s -> "容器状态: " + s.getStatus()).orElse("容器不存在"));
                    }
                    transition(latest, observed);
                    copyState(latest, instance);
                }
            });
            if (!applied) {
                log.debug("实例忙碌，跳过状态回写: {}", instanceId);
            }
        }
        return toSnapshot(instance, state.orElse(null));
    }

    /**
     * 最近 tailLines 行控制台输出，不影响实时控制台会话
     */
    public List<String> getLogBuffer(String instanceId, int tailLines) {
        if (tailLines <= 0) {
            throw new IllegalArgumentException("tail 必须为正数: " + tailLines);
        }
        GameInstance instance = requireInstance(instanceId);
        if (instance.getContainerId() == null) {
            return Collections.emptyList();
        }
        int bounded = Math.min(tailLines, runtimeProperties.getMaxLogLines());
        return containerRuntime.logs(instance.getContainerId(), bounded);
    }

    public GameInstance requireInstance(String instanceId) {
        GameInstance instance = gameInstanceMapper.selectById(instanceId);
        if (instance == null) {
            throw new InstanceNotFoundException(instanceId);
        }
        return instance;
    }

    /**
     * 运行时状态到实例状态的映射，过渡态与终态以记录为准
     */
    static InstanceStatus reconcile(InstanceStatus recorded, String containerId, Optional<ContainerState> state) {
        if (recorded != InstanceStatus.RUNNING && recorded != InstanceStatus.STOPPED) {
            return recorded;
        }
        if (containerId == null) {
            return recorded;
        }
        if (!state.isPresent()) {
            return InstanceStatus.FAILED;
        }
        String runtimeStatus = state.get().getStatus();
        if (runtimeStatus == null) {
            return recorded;
        }
        switch (runtimeStatus) {
            case "running":
            case "restarting":
                return InstanceStatus.RUNNING;
            case "created":
            case "exited":
            case "paused":
            case "removing":
                return InstanceStatus.STOPPED;
            case "dead":
                return InstanceStatus.FAILED;
            default:
                return recorded;
        }
    }

    private GameInstance doLaunch(GameInstance instance) {
        String instanceId = instance.getId();
        String containerId = null;
        try {
            instance.setDataPath(fileManagerService.prepareDataDir(instanceId));
            ContainerDescriptor descriptor = buildDescriptor(instance);

            // 同名容器可能是上次启动失败或重启前留下的
            if (instance.getContainerId() != null) {
                containerRuntime.remove(instance.getContainerId(), false);
                instance.setContainerId(null);
            }
            containerRuntime.remove(descriptor.getName(), false);

            containerId = containerRuntime.create(descriptor);
            instance.setContainerId(containerId);
            containerRuntime.start(containerId);
            awaitRunning(instanceId, containerId);

            portManagerService.markBound(instance.getPort(), instanceId);
            instance.setFailureReason(null);
            transition(instance, InstanceStatus.RUNNING);
            log.info("实例启动成功: instanceId={}, containerId={}, port={}", instanceId, containerId, instance.getPort());
            return instance;
        } catch (RuntimeException e) {
            log.error("实例启动失败: instanceId={}", instanceId, e);
            cleanupFailedLaunch(instance, containerId, e);
            if (e instanceof GameHostException) {
                throw e;
            }
            throw new ContainerException(ContainerException.ERROR_CODE_START_FAILED,
                "启动实例失败: " + e.getMessage(), e);
        }
    }

    private void cleanupFailedLaunch(GameInstance instance, String containerId, RuntimeException cause) {
        if (containerId != null) {
            try {
                containerRuntime.remove(containerId, false);
                instance.setContainerId(null);
            } catch (RuntimeException removeError) {
                cause.addSuppressed(removeError);
                log.warn("清理失败容器出错: containerId={}", containerId);
            }
        }
        try {
            portManagerService.releasePort(instance.getPort(), instance.getId());
        } catch (RuntimeException releaseError) {
            cause.addSuppressed(releaseError);
        }
        instance.setFailureReason(cause.getMessage());
        transition(instance, InstanceStatus.FAILED);
    }

    private void awaitRunning(String instanceId, String containerId) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(runtimeProperties.getStartupGraceSeconds());
        while (true) {
            ContainerState state = containerRuntime.inspect(containerId)
                .orElseThrow(() -> new ContainerException(ContainerException.ERROR_CODE_NOT_FOUND,
                    "容器启动后不存在: " + containerId));
            if (state.isRunning() && !"unhealthy".equals(state.getHealth())) {
                return;
            }
            if ("exited".equals(state.getStatus()) || "dead".equals(state.getStatus())) {
                throw new ContainerException(ContainerException.ERROR_CODE_START_FAILED,
                    String.format("容器启动后退出: status=%s, exitCode=%s", state.getStatus(), state.getExitCode()));
            }
            if (System.nanoTime() >= deadline) {
                throw new ContainerException(ContainerException.ERROR_CODE_STARTUP_TIMEOUT,
                    String.format("实例 %s 在 %d 秒内未进入运行状态", instanceId, runtimeProperties.getStartupGraceSeconds()));
            }
            try {
                Thread.sleep(runtimeProperties.getReadinessPollMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerException(ContainerException.ERROR_CODE_START_FAILED, "等待实例启动被中断", e);
            }
        }
    }

    private InstanceStatus doStop(GameInstance instance, int graceSeconds) {
        InstanceStatus previous = instance.getStatus();
        switch (previous) {
            case STOPPED:
            case FAILED:
                log.info("实例未运行，忽略停止: instanceId={}, status={}", instance.getId(), previous);
                return previous;
            case RUNNING:
            case STOPPING:
                break;
            default:
                throw invalidState(instance, "stop");
        }

        transition(instance, InstanceStatus.STOPPING);
        String containerId = instance.getContainerId();
        try {
            if (containerId != null) {
                try {
                    containerRuntime.stop(containerId, graceSeconds);
                } catch (ContainerException e) {
                    if (!ContainerException.ERROR_CODE_NOT_FOUND.equals(e.getErrorCode())) {
                        throw e;
                    }
                    log.warn("容器不存在，视为已停止: {}", containerId);
                }
                Optional<ContainerState> after = containerRuntime.inspect(containerId);
                if (after.isPresent() && after.get().isRunning()) {
                    log.warn("宽限期后容器仍在运行，强制终止: {}", containerId);
                    containerRuntime.kill(containerId);
                }
            }
        } catch (RuntimeUnavailableException | ContainerException e) {
            // 未确认停止，恢复原状态
            transition(instance, previous);
            throw e;
        }
        transition(instance, InstanceStatus.STOPPED);
        log.info("实例已停止: {}", instance.getId());
        return InstanceStatus.STOPPED;
    }

    private ContainerDescriptor buildDescriptor(GameInstance instance) {
        ContainerDescriptor descriptor = new ContainerDescriptor();
        // 实例ID自带 gs- 前缀，直接作为容器名
        descriptor.setName(instance.getId());
        descriptor.setImage(instance.getImage() != null ? instance.getImage() : runtimeProperties.getImage());
        descriptor.setMemoryBytes(instance.getMemoryMb() * 1024L * 1024L);
        descriptor.setHostPort(instance.getPort());
        descriptor.setContainerPort(runtimeProperties.getInternalPort());
        descriptor.setHostDataPath(instance.getDataPath());
        descriptor.setHealthCheck(runtimeProperties.getHealthCheck());

        descriptor.getEnv().put("EULA", "TRUE");
        descriptor.getEnv().put("TYPE", "VANILLA");
        descriptor.getEnv().put("VERSION", instance.getVersion());
        descriptor.getEnv().put("MEMORY", instance.getMemoryMb() + "M");
        descriptor.getEnv().put("ENABLE_RCON", "true");
        descriptor.getEnv().put("RCON_PASSWORD", instance.getSecret());
        descriptor.getEnv().put("RCON_PORT", String.valueOf(runtimeProperties.getRconPort()));
        descriptor.getEnv().put("MAX_PLAYERS", "20");
        descriptor.getEnv().put("MOTD", instance.getName() != null ? instance.getName() : instance.getId());
        descriptor.getEnv().put("JVM_XX_OPTS", JVM_XX_OPTS);

        descriptor.getLabels().put(LABEL_INSTANCE_ID, instance.getId());
        descriptor.getLabels().put(LABEL_OWNER_ID, instance.getOwnerId());
        return descriptor;
    }

    private void transition(GameInstance instance, InstanceStatus next) {
        InstanceStatus previous = instance.getStatus();
        instance.setStatus(next);
        instance.setUpdatedTime(LocalDateTime.now());
        gameInstanceMapper.updateById(instance);
        if (previous != next) {
            log.info("实例状态变更: instanceId={}, {} -> {}", instance.getId(), previous, next);
        }
    }

    private static void copyState(GameInstance from, GameInstance to) {
        to.setStatus(from.getStatus());
        to.setFailureReason(from.getFailureReason());
        to.setUpdatedTime(from.getUpdatedTime());
    }

    private static ContainerException invalidState(GameInstance instance, String operation) {
        return new ContainerException(ContainerException.ERROR_CODE_INVALID_STATE,
            String.format("实例 %s 当前状态 %s 不允许 %s", instance.getId(), instance.getStatus(), operation));
    }

    private static InstanceStatusSnapshot toSnapshot(GameInstance instance, ContainerState state) {
        InstanceStatusSnapshot snapshot = new InstanceStatusSnapshot();
        snapshot.setInstanceId(instance.getId());
        snapshot.setStatus(instance.getStatus());
        snapshot.setPort(instance.getPort());
        snapshot.setIpAddress(instance.getIpAddress());
        snapshot.setRegion(instance.getRegion());
        snapshot.setLastTransition(instance.getUpdatedTime());
        if (state != null) {
            snapshot.setRuntimeStatus(state.getStatus());
            snapshot.setHealth(state.getHealth());
            snapshot.setRunning(state.isRunning());
            snapshot.setRestartCount(state.getRestartCount());
            snapshot.setExitCode(state.getExitCode());
            snapshot.setStartedAt(state.getStartedAt());
            snapshot.setMemoryLimitBytes(state.getMemoryLimit());
        }
        return snapshot;
    }
}
