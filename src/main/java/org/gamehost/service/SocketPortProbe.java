package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 通过短暂绑定 ServerSocket 检测端口，超时视为不可用
 */
@Slf4j
@Component
public class SocketPortProbe implements PortProbe {

    private final String bindHost;
    private final long timeoutMillis;
    private final ExecutorService executorService = Executors.newCachedThreadPool();

    public SocketPortProbe(@Value("${gamehost.port.bind-host:0.0.0.0}") String bindHost,
                           @Value("${gamehost.port.bind-check-timeout-ms:2000}") long timeoutMillis) {
        this.bindHost = bindHost;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public boolean isAvailable(int port) {
        Future<Boolean> check = executorService.submit(() -> tryBind(port));
        try {
            return check.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            check.cancel(true);
            log.warn("端口检测超时，视为不可用: port={}", port);
            return false;
        } catch (ExecutionException e) {
            log.warn("端口检测失败: port={}", port, e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean tryBind(int port) {
        try (ServerSocket serverSocket = new ServerSocket()) {
            serverSocket.setReuseAddress(false);
            serverSocket.bind(new InetSocketAddress(bindHost, port));
            return true;
        } catch (IOException e) {
            log.debug("端口 {} 已被系统占用: {}", port, e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void destroy() {
        executorService.shutdownNow();
    }
}
