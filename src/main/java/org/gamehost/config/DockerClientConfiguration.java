package org.gamehost.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient.Builder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * DockerClient 配置，控制 socket 地址可通过 gamehost.runtime.docker-host 覆盖
 */
@Configuration
public class DockerClientConfiguration {

    @Bean
    public DockerClient dockerClient(
            @Value("${gamehost.runtime.docker-host:unix:///var/run/docker.sock}") String dockerHost,
            @Value("${gamehost.runtime.connect-timeout-seconds:5}") int connectTimeoutSeconds,
            @Value("${gamehost.runtime.response-timeout-seconds:30}") int responseTimeoutSeconds) {
        DefaultDockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder()
            .withDockerHost(dockerHost)
            .build();

        Builder httpClientBuilder = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .connectionTimeout(Duration.ofSeconds(connectTimeoutSeconds))
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds));

        ApacheDockerHttpClient httpClient = httpClientBuilder
            .maxConnections(100)
            .build();

        return DockerClientImpl.getInstance(config, httpClient);
    }
}
