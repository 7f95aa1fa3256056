package org.gamehost.socket;

import org.gamehost.runtime.ContainerDescriptor;
import org.gamehost.support.FakeContainerRuntime;
import org.gamehost.support.FakeContainerRuntime.FakeAttachment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class ConsoleWebSocketHandlerTest {

    private FakeContainerRuntime runtime;
    private ConsoleWebSocketHandler handler;
    private String containerId;

    @BeforeEach
    void setUp() {
        runtime = new FakeContainerRuntime();
        ContainerDescriptor descriptor = new ContainerDescriptor();
        descriptor.setName("gs-console");
        descriptor.setImage("itzg/minecraft-server");
        containerId = runtime.create(descriptor);
        runtime.start(containerId);
        handler = new ConsoleWebSocketHandler(runtime, 16);
    }

    @AfterEach
    void tearDown() {
        handler.destroy();
    }

    private WebSocketSession session(String id, SessionPrincipal principal) {
        Map<String, Object> attributes = new HashMap<>();
        if (principal != null) {
            attributes.put(SessionPrincipal.ATTRIBUTE_KEY, principal);
        }
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(attributes);
        return session;
    }

    private SessionPrincipal principal() {
        return new SessionPrincipal("user-a", "gs-console", containerId, SessionKind.CONSOLE);
    }

    @Test
    void relaysContainerOutputToClient() throws Exception {
        WebSocketSession session = session("s-1", principal());
        handler.afterConnectionEstablished(session);

        FakeAttachment attachment = runtime.getAttachments().get(0);
        attachment.emit("[Server thread/INFO]: Done (3.2s)!\n");

        verify(session, timeout(2000)).sendMessage(new TextMessage("[Server thread/INFO]: Done (3.2s)!\n"));
        assertEquals(1, handler.activeSessionCount());
    }

    @Test
    @DisplayName("多字节字符被帧边界切断时仍原样送达")
    void multiByteCharacterSplitAcrossFramesIsReassembled() throws Exception {
        WebSocketSession session = session("s-1", principal());
        handler.afterConnectionEstablished(session);
        byte[] bytes = "玩家加入\n".getBytes(StandardCharsets.UTF_8);

        FakeAttachment attachment = runtime.getAttachments().get(0);
        attachment.emitBytes(Arrays.copyOfRange(bytes, 0, 4));
        attachment.emitBytes(Arrays.copyOfRange(bytes, 4, bytes.length));

        verify(session, timeout(2000)).sendMessage(new TextMessage("玩"));
        verify(session, timeout(2000)).sendMessage(new TextMessage("家加入\n"));
        verify(session, never()).sendMessage(argThat((WebSocketMessage<?> m) ->
            ((String) m.getPayload()).contains("\uFFFD")));
    }

    @Test
    void forwardsClientInputToStdin() throws Exception {
        WebSocketSession session = session("s-1", principal());
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("say hello\n"));

        assertEquals("say hello\n", runtime.getAttachments().get(0).stdinText());
    }

    @Test
    void upstreamCompletionClosesWithStreamDetach() throws Exception {
        WebSocketSession session = session("s-1", principal());
        handler.afterConnectionEstablished(session);

        FakeAttachment attachment = runtime.getAttachments().get(0);
        attachment.emit("Stopping server\n");
        attachment.complete();

        verify(session, timeout(2000)).close(ConsoleWebSocketHandler.STREAM_DETACH);
        verify(session).sendMessage(new TextMessage("Stopping server\n"));
    }

    @Test
    void upstreamErrorClosesWithStreamDetach() throws Exception {
        WebSocketSession session = session("s-1", principal());
        handler.afterConnectionEstablished(session);

        runtime.getAttachments().get(0).fail(new IOException("connection reset"));

        verify(session, timeout(2000)).close(ConsoleWebSocketHandler.STREAM_DETACH);
    }

    @Test
    void clientDisconnectReleasesAttachment() throws Exception {
        WebSocketSession session = session("s-1", principal());
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertTrue(runtime.getAttachments().get(0).isClosed());
        assertEquals(0, handler.activeSessionCount());
    }

    @Test
    @DisplayName("多个会话各自独立附加，其中一个断开不影响另一个")
    void concurrentSessionsAreIndependent() throws Exception {
        WebSocketSession first = session("s-1", principal());
        WebSocketSession second = session("s-2", principal());
        handler.afterConnectionEstablished(first);
        handler.afterConnectionEstablished(second);
        assertEquals(2, runtime.getAttachments().size());

        handler.afterConnectionClosed(first, CloseStatus.NORMAL);
        FakeAttachment remaining = runtime.getAttachments().get(1);
        remaining.emit("still here\n");

        assertFalse(remaining.isClosed());
        verify(second, timeout(2000)).sendMessage(new TextMessage("still here\n"));
        verify(first, never()).sendMessage(any());
    }

    @Test
    void sessionWithoutPrincipalIsRejected() throws Exception {
        WebSocketSession session = session("s-1", null);

        handler.afterConnectionEstablished(session);

        verify(session).close(CloseStatus.POLICY_VIOLATION);
        assertTrue(runtime.getAttachments().isEmpty());
    }

    @Test
    void unreachableRuntimeClosesWithRuntimeUnavailable() throws Exception {
        runtime.setUnavailable(true);
        WebSocketSession session = session("s-1", principal());

        handler.afterConnectionEstablished(session);

        verify(session).close(ConsoleWebSocketHandler.RUNTIME_UNAVAILABLE);
    }

    @Test
    void slowConsumerIsDisconnected() throws Exception {
        WebSocketSession session = session("s-1", principal());
        CountDownLatch unblock = new CountDownLatch(1);
        doAnswer(inv -> {
            unblock.await();
            return null;
        }).when(session).sendMessage(any());
        handler.afterConnectionEstablished(session);

        try {
            FakeAttachment attachment = runtime.getAttachments().get(0);
            for (int i = 0; i < 40; i++) {
                attachment.emit("line " + i + "\n");
            }

            verify(session, timeout(2000)).close(SessionChannel.SLOW_CONSUMER);
        } finally {
            unblock.countDown();
        }
    }
}
