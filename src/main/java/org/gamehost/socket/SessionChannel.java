package org.gamehost.socket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 会话出站通道
 * 有界队列加单个发送任务：上游只做非阻塞入队，慢客户端只阻塞自己的发送任务
 */
@Slf4j
public class SessionChannel {
    
    public static final CloseStatus SLOW_CONSUMER = new CloseStatus(4008, "SLOW_CONSUMER");
    
    public enum OverflowPolicy {
        /**
         * 队列满时断开会话（控制台输出不能丢字节）
         */
        DISCONNECT,
        /**
         * 队列满时丢弃最旧的消息（监控样本只保留最新）
         */
        DROP_OLDEST
    }
    
    private final WebSocketSession session;
    private final BlockingQueue<Outbound> queue;
    private final OverflowPolicy overflowPolicy;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Future<?> writerTask;
    
    public SessionChannel(WebSocketSession session, int capacity, OverflowPolicy overflowPolicy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("通道容量必须为正数: " + capacity);
        }
        this.session = session;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.overflowPolicy = overflowPolicy;
    }
    
    public void start(ExecutorService executor) {
        writerTask = executor.submit(this::drain);
    }
    
    /**
     * 非阻塞入队
     *
     * @return false 表示通道已关闭，或队列已满且策略为 DISCONNECT（此时会话已被关闭）
     */
    public boolean offer(WebSocketMessage<?> message) {
        if (closed.get()) {
            return false;
        }
        Outbound outbound = new Outbound(message, null);
        if (queue.offer(outbound)) {
            return true;
        }
        if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
            synchronized (queue) {
                queue.poll();
                return queue.offer(outbound);
            }
        }
        log.warn("会话发送队列已满，断开慢客户端: sessionId={}", session.getId());
        closeSession(SLOW_CONSUMER, true);
        return false;
    }
    
    /**
     * 发送完已入队的消息后关闭会话；队列已满时立即关闭
     */
    public void closeAfterDrain(CloseStatus status) {
        if (closed.get()) {
            return;
        }
        if (!queue.offer(new Outbound(null, status))) {
            closeSession(status, true);
        }
    }
    
    /**
     * 停止发送任务并丢弃未发送的消息，不关闭底层会话
     */
    public void close() {
        shutdown(true);
    }
    
    public boolean isClosed() {
        return closed.get();
    }
    
    public int pending() {
        return queue.size();
    }
    
    private void drain() {
        try {
            while (!closed.get()) {
                Outbound next = queue.take();
                if (next.closeStatus != null) {
                    closeSession(next.closeStatus, false);
                    return;
                }
                if (!session.isOpen()) {
                    return;
                }
                session.sendMessage(next.message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | IllegalStateException e) {
            log.warn("发送WebSocket消息失败: sessionId={}, error={}", session.getId(), e.getMessage());
            closeSession(CloseStatus.SERVER_ERROR, false);
        }
    }
    
    private void shutdown(boolean interruptWriter) {
        if (closed.compareAndSet(false, true)) {
            Future<?> task = writerTask;
            if (interruptWriter && task != null) {
                task.cancel(true);
            }
            queue.clear();
        }
    }
    
    /**
     * @param interruptWriter 从发送任务自身调用时为 false
     */
    private void closeSession(CloseStatus status, boolean interruptWriter) {
        shutdown(interruptWriter);
        if (session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                log.debug("关闭WebSocket失败", e);
            }
        }
    }
    
    private static final class Outbound {
        private final WebSocketMessage<?> message;
        private final CloseStatus closeStatus;
        
        Outbound(WebSocketMessage<?> message, CloseStatus closeStatus) {
            this.message = message;
            this.closeStatus = closeStatus;
        }
    }
}
