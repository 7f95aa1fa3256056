package org.gamehost.config;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.RuntimeUnavailableException;
import org.gamehost.runtime.ContainerRuntime;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时检查容器运行时，按配置预拉取游戏镜像
 * 运行时不可达不阻止服务启动，后续操作会返回 RUNTIME_UNAVAILABLE
 */
@Slf4j
@Component
public class RuntimeStartupCheck implements ApplicationRunner {

    private final ContainerRuntime containerRuntime;
    private final RuntimeProperties runtimeProperties;

    public RuntimeStartupCheck(ContainerRuntime containerRuntime, RuntimeProperties runtimeProperties) {
        this.containerRuntime = containerRuntime;
        this.runtimeProperties = runtimeProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            containerRuntime.ping();
            log.info("容器运行时连接正常");
        } catch (RuntimeUnavailableException e) {
            log.error("容器运行时不可达: {}", e.getMessage());
            return;
        }

        if (runtimeProperties.isPullImageOnStartup()) {
            String image = runtimeProperties.getImage();
            log.info("预拉取游戏镜像: {}", image);
            try {
                containerRuntime.pullImage(image);
                log.info("镜像拉取完成: {}", image);
            } catch (RuntimeException e) {
                log.warn("镜像拉取失败，将在创建实例时由运行时拉取: {}, error={}", image, e.getMessage());
            }
        }
    }
}
