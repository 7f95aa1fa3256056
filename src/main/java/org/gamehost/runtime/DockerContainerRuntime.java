package org.gamehost.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.CpuStatsConfig;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HealthCheck;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.LogConfig;
import com.github.dockerjava.api.model.MemoryStatsConfig;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.RestartPolicy;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.api.model.Volume;
import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.ContainerException;
import org.gamehost.exception.RuntimeUnavailableException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 基于 docker-java 的容器运行时实现
 */
@Slf4j
@Component
public class DockerContainerRuntime implements ContainerRuntime {

    private static final String DOCKER_HINT = "请确认 Docker 守护进程已启动且当前用户有权限访问 Docker socket";

    private final DockerClient dockerClient;
    private final int logTimeoutSeconds;

    public DockerContainerRuntime(DockerClient dockerClient,
                                  @Value("${gamehost.runtime.log-timeout-seconds:10}") int logTimeoutSeconds) {
        this.dockerClient = dockerClient;
        this.logTimeoutSeconds = logTimeoutSeconds;
    }

    @Override
    public void ping() {
        callDocker("ping", () -> dockerClient.pingCmd().exec());
    }

    @Override
    public void pullImage(String image) {
        callDocker("pull image", () -> {
            try {
                dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerException(ContainerException.ERROR_CODE_CREATE_FAILED,
                    "拉取镜像被中断: " + image, e);
            }
        });
    }

    @Override
    public String create(ContainerDescriptor descriptor) {
        ExposedPort gamePort = ExposedPort.tcp(descriptor.getContainerPort());
        Ports portBindings = new Ports();
        portBindings.bind(gamePort, Ports.Binding.bindPort(descriptor.getHostPort()));

        HostConfig hostConfig = HostConfig.newHostConfig()
            .withPortBindings(portBindings)
            .withMemory(descriptor.getMemoryBytes())
            .withRestartPolicy(RestartPolicy.parse(descriptor.getRestartPolicy()))
            .withBinds(new Bind(descriptor.getHostDataPath(), new Volume(descriptor.getContainerDataPath())))
            .withLogConfig(new LogConfig(LogConfig.LoggingType.JSON_FILE, Map.of(
                "max-size", descriptor.getLogMaxSize(),
                "max-file", descriptor.getLogMaxFile())));

        List<String> env = descriptor.getEnv().entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.toList());

        Supplier<String> createCmd = () -> dockerClient.createContainerCmd(descriptor.getImage())
            .withName(descriptor.getName())
            .withEnv(env)
            .withLabels(descriptor.getLabels())
            .withExposedPorts(gamePort)
            .withHostConfig(hostConfig)
            .withHealthcheck(toHealthCheck(descriptor.getHealthCheck()))
            .withStdinOpen(true)
            .withTty(false)
            .exec()
            .getId();
        try {
            return callDocker("create container", createCmd);
        } catch (NotFoundException e) {
            log.info("本地不存在镜像 {}，开始拉取", descriptor.getImage());
            pullImage(descriptor.getImage());
            try {
                return callDocker("create container", createCmd);
            } catch (NotFoundException retryError) {
                throw new ContainerException(ContainerException.ERROR_CODE_CREATE_FAILED,
                    "镜像不存在或无法拉取: " + descriptor.getImage(), retryError);
            }
        } catch (ConflictException e) {
            throw new ContainerException(ContainerException.ERROR_CODE_CREATE_FAILED,
                "容器名称冲突: " + descriptor.getName(), e);
        }
    }

    @Override
    public void start(String containerId) {
        try {
            callDocker("start container", () -> dockerClient.startContainerCmd(containerId).exec());
        } catch (NotModifiedException e) {
            log.info("容器已在运行: {}", containerId);
        }
    }

    @Override
    public boolean stop(String containerId, int graceSeconds) {
        try {
            callDocker("stop container", () -> dockerClient.stopContainerCmd(containerId)
                .withTimeout(graceSeconds)
                .exec());
            return true;
        } catch (NotModifiedException e) {
            log.info("容器已处于停止状态: {}", containerId);
            return false;
        } catch (NotFoundException e) {
            throw new ContainerException(ContainerException.ERROR_CODE_NOT_FOUND,
                "容器不存在: " + containerId, e);
        }
    }

    @Override
    public void kill(String containerId) {
        try {
            callDocker("kill container", () -> dockerClient.killContainerCmd(containerId).exec());
        } catch (ConflictException e) {
            log.info("容器未在运行，无需强制终止: {}", containerId);
        } catch (NotFoundException e) {
            throw new ContainerException(ContainerException.ERROR_CODE_NOT_FOUND,
                "容器不存在: " + containerId, e);
        }
    }

    @Override
    public void remove(String containerId, boolean removeVolumes) {
        try {
            callDocker("remove container", () -> dockerClient.removeContainerCmd(containerId)
                .withRemoveVolumes(removeVolumes)
                .withForce(true)
                .exec());
        } catch (NotFoundException e) {
            log.info("容器不存在，跳过删除: {}", containerId);
        }
    }

    @Override
    public Optional<ContainerState> inspect(String containerId) {
        InspectContainerResponse response;
        try {
            response = callDocker("inspect container",
                () -> dockerClient.inspectContainerCmd(containerId).exec());
        } catch (NotFoundException e) {
            return Optional.empty();
        }

        InspectContainerResponse.ContainerState state = response.getState();
        ContainerState result = new ContainerState();
        result.setContainerId(response.getId());
        result.setStatus(state.getStatus());
        result.setRunning(Boolean.TRUE.equals(state.getRunning()));
        result.setHealth(state.getHealth() != null ? state.getHealth().getStatus() : "none");
        result.setExitCode(state.getExitCodeLong());
        result.setRestartCount(response.getRestartCount());
        result.setStartedAt(state.getStartedAt());
        result.setMemoryLimit(response.getHostConfig() != null ? response.getHostConfig().getMemory() : null);
        return Optional.of(result);
    }

    @Override
    public Closeable stats(String containerId, StreamListener<RawStatsSample> listener) {
        return callDocker("stream stats", () -> dockerClient.statsCmd(containerId)
            .exec(new ResultCallback.Adapter<Statistics>() {
                @Override
                public void onNext(Statistics statistics) {
                    if (statistics != null) {
                        listener.onNext(toRawSample(statistics));
                    }
                }

                @Override
                public void onError(Throwable throwable) {
                    listener.onError(throwable);
                }

                @Override
                public void onComplete() {
                    listener.onComplete();
                }
            }));
    }

    @Override
    public List<String> logs(String containerId, int tailLines) {
        StringBuilder output = new StringBuilder();
        try {
            boolean completed = callDocker("read logs", () -> dockerClient.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withTail(tailLines)
                .withFollowStream(false)
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        if (frame != null && frame.getPayload() != null) {
                            synchronized (output) {
                                output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                            }
                        }
                    }
                }))
                .awaitCompletion(logTimeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                log.warn("读取容器日志超时，返回已读取部分: containerId={}", containerId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("读取容器日志被中断: {}", containerId);
        } catch (NotFoundException e) {
            throw new ContainerException(ContainerException.ERROR_CODE_NOT_FOUND,
                "容器不存在: " + containerId, e);
        }

        String text;
        synchronized (output) {
            text = output.toString();
        }
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\r?\\n")));
        // 防止运行时返回超出请求的行数
        if (lines.size() > tailLines) {
            return new ArrayList<>(lines.subList(lines.size() - tailLines, lines.size()));
        }
        return lines;
    }

    @Override
    public ConsoleAttachment attach(String containerId, StreamListener<byte[]> output) {
        PipedInputStream containerInput = new PipedInputStream(16 * 1024);
        PipedOutputStream clientWriter;
        try {
            clientWriter = new PipedOutputStream(containerInput);
        } catch (IOException e) {
            throw new ContainerException(ContainerException.ERROR_CODE_NOT_RUNNING,
                "创建控制台输入管道失败: " + containerId, e);
        }

        ResultCallback.Adapter<Frame> callback = callDocker("attach container",
            () -> dockerClient.attachContainerCmd(containerId)
                .withStdIn(containerInput)
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(true)
                .withLogs(false)
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        if (frame != null && frame.getPayload() != null) {
                            output.onNext(frame.getPayload());
                        }
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        output.onError(throwable);
                    }

                    @Override
                    public void onComplete() {
                        output.onComplete();
                    }
                }));

        return new PipedConsoleAttachment(clientWriter, callback);
    }

    private RawStatsSample toRawSample(Statistics statistics) {
        RawStatsSample sample = new RawStatsSample();
        CpuStatsConfig cpu = statistics.getCpuStats();
        if (cpu != null) {
            if (cpu.getCpuUsage() != null && cpu.getCpuUsage().getTotalUsage() != null) {
                sample.setCpuTotalUsage(cpu.getCpuUsage().getTotalUsage());
            }
            if (cpu.getSystemCpuUsage() != null) {
                sample.setSystemCpuUsage(cpu.getSystemCpuUsage());
            }
            if (cpu.getOnlineCpus() != null) {
                sample.setOnlineCpus(cpu.getOnlineCpus().intValue());
            } else if (cpu.getCpuUsage() != null && cpu.getCpuUsage().getPercpuUsage() != null) {
                sample.setOnlineCpus(cpu.getCpuUsage().getPercpuUsage().size());
            }
        }
        MemoryStatsConfig memory = statistics.getMemoryStats();
        if (memory != null) {
            sample.setMemoryUsage(memory.getUsage() != null ? memory.getUsage() : 0L);
            sample.setMemoryLimit(memory.getLimit() != null ? memory.getLimit() : 0L);
        }
        return sample;
    }

    private HealthCheck toHealthCheck(HealthCheckConfig config) {
        if (config == null) {
            return null;
        }
        return new HealthCheck()
            .withTest(config.getTest())
            .withInterval(config.getInterval().toNanos())
            .withTimeout(config.getTimeout().toNanos())
            .withRetries(config.getRetries())
            .withStartPeriod(config.getStartPeriod().toNanos());
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof RuntimeUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            log.error("Docker 守护进程不可达，操作失败: {}", action);
            return new RuntimeUnavailableException(
                "无法执行 " + action + "，Docker 守护进程不可达。" + DOCKER_HINT, e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "connection refused")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    private static class PipedConsoleAttachment implements ConsoleAttachment {

        private final PipedOutputStream clientWriter;
        private final ResultCallback.Adapter<Frame> callback;

        PipedConsoleAttachment(PipedOutputStream clientWriter, ResultCallback.Adapter<Frame> callback) {
            this.clientWriter = clientWriter;
            this.callback = callback;
        }

        @Override
        public synchronized void write(byte[] input) throws IOException {
            clientWriter.write(input);
            clientWriter.flush();
        }

        @Override
        public void close() throws IOException {
            try {
                clientWriter.close();
            } finally {
                callback.close();
            }
        }
    }
}
