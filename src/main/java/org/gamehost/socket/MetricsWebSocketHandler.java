package org.gamehost.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.RuntimeUnavailableException;
import org.gamehost.metrics.MetricsListener;
import org.gamehost.metrics.MetricsSample;
import org.gamehost.metrics.MetricsSampler;
import org.gamehost.metrics.MetricsSubscription;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import javax.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 资源监控会话处理器，只读，推送限流后的 JSON 样本
 */
@Slf4j
@Component
public class MetricsWebSocketHandler extends TextWebSocketHandler {

    private final MetricsSampler metricsSampler;
    private final ObjectMapper objectMapper;
    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final Map<String, MetricsSessionContext> sessionContexts = new ConcurrentHashMap<>();

    public MetricsWebSocketHandler(MetricsSampler metricsSampler, ObjectMapper objectMapper) {
        this.metricsSampler = metricsSampler;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        SessionPrincipal principal = SessionPrincipal.from(session);
        if (principal == null) {
            log.warn("监控会话缺少认证信息: sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        // 只保留最新样本
        SessionChannel channel = new SessionChannel(session, 1, SessionChannel.OverflowPolicy.DROP_OLDEST);
        MetricsSessionContext context = new MetricsSessionContext(channel);
        sessionContexts.put(session.getId(), context);
        channel.start(executorService);

        try {
            context.subscription = metricsSampler.subscribe(principal.getInstanceId(), principal.getContainerId(),
                new MetricsListener() {
                    @Override
                    public void onSample(MetricsSample sample) {
                        try {
                            channel.offer(new TextMessage(objectMapper.writeValueAsString(sample)));
                        } catch (JsonProcessingException e) {
                            log.warn("序列化监控样本失败: instanceId={}", sample.getInstanceId(), e);
                        }
                    }

                    @Override
                    public void onDetach(Throwable cause) {
                        channel.closeAfterDrain(ConsoleWebSocketHandler.STREAM_DETACH);
                    }
                });
            if (!sessionContexts.containsKey(session.getId())) {
                context.subscription.close();
                return;
            }
        } catch (RuntimeUnavailableException e) {
            log.error("订阅资源流失败，容器运行时不可用: instanceId={}", principal.getInstanceId());
            channel.close();
            safeCloseSession(session, ConsoleWebSocketHandler.RUNTIME_UNAVAILABLE);
            return;
        } catch (RuntimeException e) {
            log.error("订阅资源流失败: instanceId={}", principal.getInstanceId(), e);
            channel.close();
            safeCloseSession(session, ConsoleWebSocketHandler.STREAM_DETACH);
            return;
        }

        log.info("监控会话建立: sessionId={}, userId={}, instanceId={}",
            session.getId(), principal.getUserId(), principal.getInstanceId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("监控会话为只读，忽略客户端消息: sessionId={}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        MetricsSessionContext context = sessionContexts.remove(session.getId());
        if (context != null) {
            context.channel.close();
            if (context.subscription != null) {
                context.subscription.close();
            }
        }
        log.info("监控会话关闭: sessionId={}, status={}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.warn("WebSocket 传输异常: sessionId={}", session.getId(), exception);
        safeCloseSession(session, CloseStatus.SERVER_ERROR);
    }

    private void safeCloseSession(WebSocketSession session, CloseStatus status) {
        if (session != null && session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                log.debug("关闭WebSocket失败", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        executorService.shutdownNow();
    }

    private static class MetricsSessionContext {
        private final SessionChannel channel;
        private volatile MetricsSubscription subscription;

        MetricsSessionContext(SessionChannel channel) {
            this.channel = channel;
        }
    }
}
