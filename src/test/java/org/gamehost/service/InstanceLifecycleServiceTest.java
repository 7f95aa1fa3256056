package org.gamehost.service;

import org.gamehost.config.RuntimeProperties;
import org.gamehost.dto.CreateInstanceRequest;
import org.gamehost.dto.InstanceStatusSnapshot;
import org.gamehost.dto.ProvisioningResult;
import org.gamehost.entity.GameInstance;
import org.gamehost.entity.InstanceStatus;
import org.gamehost.entity.PortState;
import org.gamehost.entity.PortUsage;
import org.gamehost.exception.ContainerException;
import org.gamehost.exception.GameHostException;
import org.gamehost.exception.LifecycleConflictException;
import org.gamehost.exception.RuntimeUnavailableException;
import org.gamehost.runtime.ContainerDescriptor;
import org.gamehost.support.FakeContainerRuntime;
import org.gamehost.support.InMemoryMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstanceLifecycleServiceTest {

    @TempDir
    Path dataRoot;

    private Map<String, GameInstance> instances;
    private Map<Integer, PortUsage> ports;
    private FakeContainerRuntime runtime;
    private PortManagerService portManagerService;
    private InstanceOperationGuard guard;
    private RuntimeProperties properties;
    private InstanceLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        instances = InMemoryMappers.newInstanceTable();
        ports = InMemoryMappers.newPortTable();
        runtime = new FakeContainerRuntime();
        portManagerService = new PortManagerService(
            InMemoryMappers.portUsageMapper(ports), port -> true, 25565, 25565, 0);
        guard = new InstanceOperationGuard();

        properties = new RuntimeProperties();
        properties.setDataBasePath(dataRoot.toString());
        properties.setStartupGraceSeconds(1);
        properties.setReadinessPollMillis(10);
        properties.setMaxLogLines(3);

        lifecycle = new InstanceLifecycleService(
            InMemoryMappers.gameInstanceMapper(instances),
            runtime,
            portManagerService,
            new FileManagerService(properties),
            guard,
            properties);
    }

    private GameInstance registerProvisioning(String ownerId) {
        CreateInstanceRequest request = new CreateInstanceRequest();
        request.setName("survival");
        request.setMemory(2);
        request.setDiskSpace(10);
        GameInstance instance = lifecycle.register(ownerId, request);
        lifecycle.markProvisioning(instance.getId());
        return instance;
    }

    private ProvisioningResult provisioningFor(GameInstance instance) {
        ProvisioningResult result = new ProvisioningResult();
        result.setInstanceId(instance.getId());
        result.setPort(portManagerService.allocatePort(instance.getOwnerId(), instance.getId()));
        result.setIpAddress("154.12.1.20");
        result.setRegion("us-east-1");
        result.setSecret("Ab3dEf6hIj9k");
        return result;
    }

    private GameInstance launchNew(String ownerId) {
        GameInstance instance = registerProvisioning(ownerId);
        return lifecycle.launch(instance.getId(), provisioningFor(instance));
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void createsRequestedRecordWithDefaults() {
            CreateInstanceRequest request = new CreateInstanceRequest();
            request.setName("creative");
            request.setMemory(4);
            request.setDiskSpace(20);

            GameInstance instance = lifecycle.register("user-1", request);

            assertTrue(instance.getId().matches("gs-[0-9a-f]{12}"));
            assertEquals(InstanceStatus.REQUESTED, instances.get(instance.getId()).getStatus());
            assertEquals(4096, instance.getMemoryMb());
            assertEquals("LATEST", instance.getVersion());
            assertEquals(properties.getImage(), instance.getImage());
        }
    }

    @Nested
    @DisplayName("launch")
    class Launch {

        @Test
        void startsContainerAndBindsPort() {
            GameInstance instance = launchNew("user-1");

            assertEquals(InstanceStatus.RUNNING, instance.getStatus());
            GameInstance stored = instances.get(instance.getId());
            assertEquals(InstanceStatus.RUNNING, stored.getStatus());
            assertEquals(25565, stored.getPort());
            assertEquals("154.12.1.20", stored.getIpAddress());
            assertNotNull(stored.getContainerId());
            assertEquals(PortState.BOUND, ports.get(25565).getStatus());
            assertTrue(Files.isDirectory(dataRoot.resolve(instance.getId())));
        }

        @Test
        void descriptorCarriesGameSettings() {
            GameInstance instance = launchNew("user-1");

            ContainerDescriptor descriptor = runtime.descriptorOf(instance.getContainerId());
            assertEquals(instance.getId(), descriptor.getName());
            assertEquals(25565, descriptor.getHostPort());
            assertEquals(25565, descriptor.getContainerPort());
            assertEquals(2048L * 1024 * 1024, descriptor.getMemoryBytes());
            assertEquals("TRUE", descriptor.getEnv().get("EULA"));
            assertEquals("2048M", descriptor.getEnv().get("MEMORY"));
            assertEquals("Ab3dEf6hIj9k", descriptor.getEnv().get("RCON_PASSWORD"));
            assertEquals(dataRoot.resolve(instance.getId()).toString(), descriptor.getHostDataPath());
            assertEquals("/data", descriptor.getContainerDataPath());
            assertEquals("unless-stopped", descriptor.getRestartPolicy());
            assertEquals(instance.getId(), descriptor.getLabels().get(InstanceLifecycleService.LABEL_INSTANCE_ID));
            assertNotNull(descriptor.getHealthCheck());
        }

        @Test
        void createFailureMarksFailedAndReleasesPort() {
            runtime.failCreateWith(new ContainerException(ContainerException.ERROR_CODE_CREATE_FAILED, "镜像不存在"));
            GameInstance instance = registerProvisioning("user-1");
            ProvisioningResult provisioning = provisioningFor(instance);

            assertThrows(ContainerException.class, () -> lifecycle.launch(instance.getId(), provisioning));

            GameInstance stored = instances.get(instance.getId());
            assertEquals(InstanceStatus.FAILED, stored.getStatus());
            assertEquals("镜像不存在", stored.getFailureReason());
            assertEquals(PortState.FREE, ports.get(25565).getStatus());
        }

        @Test
        void containerExitingDuringStartupIsRemoved() {
            runtime.setStatusAfterStart("exited");
            GameInstance instance = registerProvisioning("user-1");
            ProvisioningResult provisioning = provisioningFor(instance);

            ContainerException e = assertThrows(ContainerException.class,
                () -> lifecycle.launch(instance.getId(), provisioning));

            assertEquals(ContainerException.ERROR_CODE_START_FAILED, e.getErrorCode());
            assertEquals(0, runtime.containerCount());
            assertEquals(InstanceStatus.FAILED, instances.get(instance.getId()).getStatus());
        }

        @Test
        void startupTimeoutFailsTheLaunch() {
            runtime.setStatusAfterStart("created");
            properties.setStartupGraceSeconds(0);
            GameInstance instance = registerProvisioning("user-1");
            ProvisioningResult provisioning = provisioningFor(instance);

            ContainerException e = assertThrows(ContainerException.class,
                () -> lifecycle.launch(instance.getId(), provisioning));

            assertEquals(ContainerException.ERROR_CODE_STARTUP_TIMEOUT, e.getErrorCode());
            assertEquals(PortState.FREE, ports.get(25565).getStatus());
        }

        @Test
        void unreachableRuntimeFailsFast() {
            GameInstance instance = registerProvisioning("user-1");
            ProvisioningResult provisioning = provisioningFor(instance);
            runtime.setUnavailable(true);

            assertThrows(RuntimeUnavailableException.class, () -> lifecycle.launch(instance.getId(), provisioning));

            assertEquals(InstanceStatus.FAILED, instances.get(instance.getId()).getStatus());
            assertEquals(PortState.FREE, ports.get(25565).getStatus());
        }

        @Test
        @DisplayName("数据目录创建失败：实例进入 FAILED，端口可再次分配")
        void storageFailureMarksFailedAndReleasesPort() throws Exception {
            Path notADirectory = Files.createFile(dataRoot.resolve("occupied"));
            properties.setDataBasePath(notADirectory.toString());
            GameInstance instance = registerProvisioning("user-1");
            ProvisioningResult provisioning = provisioningFor(instance);

            GameHostException e = assertThrows(GameHostException.class,
                () -> lifecycle.launch(instance.getId(), provisioning));

            assertEquals(FileManagerService.ERROR_CODE_STORAGE_FAILED, e.getErrorCode());
            GameInstance stored = instances.get(instance.getId());
            assertEquals(InstanceStatus.FAILED, stored.getStatus());
            assertNotNull(stored.getFailureReason());
            assertEquals(PortState.FREE, ports.get(25565).getStatus());
            assertEquals(0, runtime.containerCount());
            assertEquals(25565, portManagerService.allocatePort("user-2", "gs-next"));
        }

        @Test
        void launchRequiresProvisioningState() {
            GameInstance instance = launchNew("user-1");

            ContainerException e = assertThrows(ContainerException.class,
                () -> lifecycle.launch(instance.getId(), new ProvisioningResult()));
            assertEquals(ContainerException.ERROR_CODE_INVALID_STATE, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        void stopIsIdempotent() {
            GameInstance instance = launchNew("user-1");

            assertEquals(InstanceStatus.STOPPED, lifecycle.stop(instance.getId(), 5));
            assertEquals(InstanceStatus.STOPPED, lifecycle.stop(instance.getId(), 5));

            assertEquals(1, runtime.stopCalls.get());
            assertEquals(InstanceStatus.STOPPED, instances.get(instance.getId()).getStatus());
            assertEquals(PortState.BOUND, ports.get(25565).getStatus());
        }

        @Test
        void forceKillsWhenGracefulStopDoesNotTakeEffect() {
            GameInstance instance = launchNew("user-1");
            runtime.setIgnoreStop(true);

            assertEquals(InstanceStatus.STOPPED, lifecycle.stop(instance.getId(), 0));

            assertEquals(1, runtime.killCalls.get());
        }

        @Test
        void missingContainerCountsAsStopped() {
            GameInstance instance = launchNew("user-1");
            runtime.vanish(instance.getContainerId());

            assertEquals(InstanceStatus.STOPPED, lifecycle.stop(instance.getId(), 5));
        }

        @Test
        void runtimeOutageRestoresPreviousStatus() {
            GameInstance instance = launchNew("user-1");
            runtime.setUnavailable(true);

            assertThrows(RuntimeUnavailableException.class, () -> lifecycle.stop(instance.getId(), 5));

            assertEquals(InstanceStatus.RUNNING, instances.get(instance.getId()).getStatus());
        }

        @Test
        void negativeGraceIsRejected() {
            GameInstance instance = launchNew("user-1");

            assertThrows(IllegalArgumentException.class, () -> lifecycle.stop(instance.getId(), -1));
        }

        @Test
        void concurrentOperationIsRejectedImmediately() {
            GameInstance instance = launchNew("user-1");

            guard.call(instance.getId(), "restart", () -> {
                assertThrows(LifecycleConflictException.class, () -> lifecycle.stop(instance.getId(), 5));
                assertThrows(LifecycleConflictException.class, () -> lifecycle.destroy(instance.getId(), false));
                return null;
            });

            assertFalse(guard.isBusy(instance.getId()));
            assertEquals(InstanceStatus.STOPPED, lifecycle.stop(instance.getId(), 5));
        }
    }

    @Nested
    @DisplayName("restart")
    class Restart {

        @Test
        void restartKeepsPortSecretAndStorage() {
            GameInstance instance = launchNew("user-1");
            String firstContainer = instance.getContainerId();

            GameInstance restarted = lifecycle.restart(instance.getId());

            assertEquals(InstanceStatus.RUNNING, restarted.getStatus());
            assertEquals(25565, restarted.getPort());
            assertEquals("Ab3dEf6hIj9k", restarted.getSecret());
            assertEquals(instance.getDataPath(), restarted.getDataPath());
            assertNotEquals(firstContainer, restarted.getContainerId());
            assertFalse(runtime.exists(firstContainer));
            assertEquals("Ab3dEf6hIj9k", runtime.descriptorOf(restarted.getContainerId()).getEnv().get("RCON_PASSWORD"));
            assertEquals(PortState.BOUND, ports.get(25565).getStatus());
        }

        @Test
        void restartFromStopped() {
            GameInstance instance = launchNew("user-1");
            lifecycle.stop(instance.getId(), 5);

            assertEquals(InstanceStatus.RUNNING, lifecycle.restart(instance.getId()).getStatus());
        }

        @Test
        void storageFailureDuringRestartDoesNotStrandInstance() throws Exception {
            GameInstance instance = launchNew("user-1");
            properties.setDataBasePath(Files.createFile(dataRoot.resolve("occupied")).toString());

            assertThrows(GameHostException.class, () -> lifecycle.restart(instance.getId()));

            assertEquals(InstanceStatus.FAILED, instances.get(instance.getId()).getStatus());
            assertEquals(PortState.FREE, ports.get(25565).getStatus());
        }

        @Test
        void failedInstanceWithReleasedPortCannotRestart() {
            runtime.setStatusAfterStart("exited");
            GameInstance instance = registerProvisioning("user-1");
            ProvisioningResult provisioning = provisioningFor(instance);
            assertThrows(ContainerException.class, () -> lifecycle.launch(instance.getId(), provisioning));

            ContainerException e = assertThrows(ContainerException.class, () -> lifecycle.restart(instance.getId()));
            assertEquals(ContainerException.ERROR_CODE_INVALID_STATE, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("destroy")
    class Destroy {

        @Test
        @DisplayName("销毁后端口可立即分配给新实例")
        void destroyedPortIsReallocated() {
            GameInstance first = launchNew("user-1");

            assertEquals(InstanceStatus.DESTROYED, lifecycle.destroy(first.getId(), false));

            assertEquals(PortState.FREE, ports.get(25565).getStatus());
            assertFalse(runtime.exists(first.getContainerId()));
            GameInstance second = launchNew("user-2");
            assertEquals(25565, second.getPort());
        }

        @Test
        void destroyIsIdempotentAndKeepsStorageByDefault() {
            GameInstance instance = launchNew("user-1");

            lifecycle.destroy(instance.getId(), false);
            assertEquals(InstanceStatus.DESTROYED, lifecycle.destroy(instance.getId(), false));

            assertEquals(InstanceStatus.DESTROYED, instances.get(instance.getId()).getStatus());
            assertTrue(Files.isDirectory(Paths.get(instance.getDataPath())));
        }

        @Test
        void purgeDeletesStorage() throws Exception {
            GameInstance instance = launchNew("user-1");
            Files.write(Paths.get(instance.getDataPath(), "server.properties"), "motd=hi".getBytes());

            lifecycle.destroy(instance.getId(), true);

            assertFalse(Files.exists(Paths.get(instance.getDataPath())));
        }
    }

    @Nested
    @DisplayName("getStatus")
    class Status {

        @Test
        void reportsRuntimeDetails() {
            GameInstance instance = launchNew("user-1");

            InstanceStatusSnapshot snapshot = lifecycle.getStatus(instance.getId());

            assertEquals(InstanceStatus.RUNNING, snapshot.getStatus());
            assertEquals("running", snapshot.getRuntimeStatus());
            assertTrue(snapshot.isRunning());
            assertEquals(25565, snapshot.getPort());
        }

        @Test
        void externallyStoppedContainerIsReconciled() {
            GameInstance instance = launchNew("user-1");
            runtime.setStatus(instance.getContainerId(), "exited");

            assertEquals(InstanceStatus.STOPPED, lifecycle.getStatus(instance.getId()).getStatus());
            assertEquals(InstanceStatus.STOPPED, instances.get(instance.getId()).getStatus());
        }

        @Test
        void vanishedContainerMarksFailed() {
            GameInstance instance = launchNew("user-1");
            runtime.vanish(instance.getContainerId());

            InstanceStatusSnapshot snapshot = lifecycle.getStatus(instance.getId());

            assertEquals(InstanceStatus.FAILED, snapshot.getStatus());
            assertNull(snapshot.getRuntimeStatus());
            assertEquals("容器不存在", instances.get(instance.getId()).getFailureReason());
        }

        @Test
        void busyInstanceIsNotRewritten() {
            GameInstance instance = launchNew("user-1");
            runtime.setStatus(instance.getContainerId(), "exited");

            guard.call(instance.getId(), "stop", () -> {
                assertEquals(InstanceStatus.RUNNING, lifecycle.getStatus(instance.getId()).getStatus());
                return null;
            });
            assertEquals(InstanceStatus.RUNNING, instances.get(instance.getId()).getStatus());
        }

        @Test
        void runtimeStateMapping() {
            assertEquals(InstanceStatus.RUNNING,
                InstanceLifecycleService.reconcile(InstanceStatus.STOPPED, "c-1", java.util.Optional.of(state("restarting"))));
            assertEquals(InstanceStatus.STOPPED,
                InstanceLifecycleService.reconcile(InstanceStatus.RUNNING, "c-1", java.util.Optional.of(state("paused"))));
            assertEquals(InstanceStatus.FAILED,
                InstanceLifecycleService.reconcile(InstanceStatus.RUNNING, "c-1", java.util.Optional.of(state("dead"))));
            assertEquals(InstanceStatus.STOPPING,
                InstanceLifecycleService.reconcile(InstanceStatus.STOPPING, "c-1", java.util.Optional.empty()));
        }

        private org.gamehost.runtime.ContainerState state(String status) {
            org.gamehost.runtime.ContainerState state = new org.gamehost.runtime.ContainerState();
            state.setStatus(status);
            return state;
        }
    }

    @Nested
    @DisplayName("getLogBuffer")
    class Logs {

        @Test
        void tailIsBoundedByConfiguredMaximum() {
            GameInstance instance = launchNew("user-1");
            runtime.setLogLines(Arrays.asList("l1", "l2", "l3", "l4", "l5"));

            assertEquals(List.of("l4", "l5"), lifecycle.getLogBuffer(instance.getId(), 2));
            assertEquals(List.of("l3", "l4", "l5"), lifecycle.getLogBuffer(instance.getId(), 100));
        }

        @Test
        void instanceWithoutContainerHasNoLogs() {
            GameInstance instance = registerProvisioning("user-1");

            assertTrue(lifecycle.getLogBuffer(instance.getId(), 10).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> lifecycle.getLogBuffer(instance.getId(), 0));
        }
    }
}
