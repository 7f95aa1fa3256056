package org.gamehost.socket;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.RuntimeUnavailableException;
import org.gamehost.runtime.ConsoleAttachment;
import org.gamehost.runtime.ContainerRuntime;
import org.gamehost.runtime.StreamListener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 控制台会话处理器：将客户端与容器主进程的 stdin/stdout 双向桥接
 * 每个会话独立附加到容器，互不影响
 */
@Slf4j
@Component
public class ConsoleWebSocketHandler extends TextWebSocketHandler {

    public static final CloseStatus STREAM_DETACH = new CloseStatus(4010, "STREAM_DETACH");
    public static final CloseStatus RUNTIME_UNAVAILABLE = new CloseStatus(4503, "RUNTIME_UNAVAILABLE");

    private final ContainerRuntime containerRuntime;
    private final int bufferFrames;
    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final Map<String, ConsoleSessionContext> sessionContexts = new ConcurrentHashMap<>();

    public ConsoleWebSocketHandler(ContainerRuntime containerRuntime,
                                   @Value("${gamehost.stream.console-buffer-frames:256}") int bufferFrames) {
        this.containerRuntime = containerRuntime;
        this.bufferFrames = bufferFrames;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        SessionPrincipal principal = SessionPrincipal.from(session);
        if (principal == null) {
            log.warn("控制台会话缺少认证信息: sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        SessionChannel channel = new SessionChannel(session, bufferFrames, SessionChannel.OverflowPolicy.DISCONNECT);
        ConsoleSessionContext context = new ConsoleSessionContext(principal, channel);
        sessionContexts.put(session.getId(), context);
        channel.start(executorService);

        ConsoleOutputDecoder decoder = new ConsoleOutputDecoder();
        try {
            ConsoleAttachment attachment = containerRuntime.attach(principal.getContainerId(), new StreamListener<byte[]>() {
                @Override
                public void onNext(byte[] payload) {
                    if (payload == null || payload.length == 0) {
                        return;
                    }
                    forward(decoder.decode(payload));
                }

                @Override
                public void onError(Throwable throwable) {
                    log.warn("控制台流异常断开: instanceId={}, error={}", principal.getInstanceId(), throwable.getMessage());
                    forward(decoder.finish());
                    channel.closeAfterDrain(STREAM_DETACH);
                }

                @Override
                public void onComplete() {
                    log.info("控制台流已结束: instanceId={}", principal.getInstanceId());
                    forward(decoder.finish());
                    channel.closeAfterDrain(STREAM_DETACH);
                }

                private void forward(String text) {
                    if (!text.isEmpty()) {
                        channel.offer(new TextMessage(text));
                    }
                }
            });
            context.attachment = attachment;
            if (!sessionContexts.containsKey(session.getId())) {
                // 附加期间客户端已断开
                closeQuietly(attachment);
                return;
            }
        } catch (RuntimeUnavailableException e) {
            log.error("附加控制台失败，容器运行时不可用: instanceId={}", principal.getInstanceId());
            channel.close();
            safeCloseSession(session, RUNTIME_UNAVAILABLE);
            return;
        } catch (RuntimeException e) {
            log.error("附加控制台失败: instanceId={}", principal.getInstanceId(), e);
            channel.close();
            safeCloseSession(session, STREAM_DETACH);
            return;
        }

        log.info("控制台会话建立: sessionId={}, userId={}, instanceId={}",
            session.getId(), principal.getUserId(), principal.getInstanceId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        ConsoleSessionContext context = sessionContexts.get(session.getId());
        if (context == null || context.attachment == null) {
            log.warn("未找到会话上下文: sessionId={}", session.getId());
            session.close(new CloseStatus(4001, "状态已失效"));
            return;
        }
        try {
            context.attachment.write(message.getPayload().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("写入容器stdin失败: instanceId={}, error={}", context.principal.getInstanceId(), e.getMessage());
            context.channel.close();
            safeCloseSession(session, STREAM_DETACH);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        cleanupSession(session.getId());
        log.info("控制台会话关闭: sessionId={}, status={}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.warn("WebSocket 传输异常: sessionId={}", session.getId(), exception);
        safeCloseSession(session, CloseStatus.SERVER_ERROR);
    }

    public int activeSessionCount() {
        return sessionContexts.size();
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

    private void cleanupSession(String sessionId) {
        ConsoleSessionContext context = sessionContexts.remove(sessionId);
        if (context == null) {
            return;
        }
        context.channel.close();
        if (context.attachment != null) {
            closeQuietly(context.attachment);
        }
    }

    private void closeQuietly(ConsoleAttachment attachment) {
        try {
            attachment.close();
        } catch (IOException e) {
            log.debug("关闭控制台附加失败", e);
        }
    }

    @PreDestroy
    public void destroy() {
        sessionContexts.keySet().forEach(this::cleanupSession);
        executorService.shutdownNow();
    }

    private static class ConsoleSessionContext {
        private final SessionPrincipal principal;
        private final SessionChannel channel;
        private volatile ConsoleAttachment attachment;

        ConsoleSessionContext(SessionPrincipal principal, SessionChannel channel) {
            this.principal = principal;
            this.channel = channel;
        }
    }
}
