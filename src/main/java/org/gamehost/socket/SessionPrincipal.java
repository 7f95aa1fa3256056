package org.gamehost.socket;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.web.socket.WebSocketSession;

/**
 * 握手阶段认证通过的会话身份
 */
@Getter
@ToString
@AllArgsConstructor
public class SessionPrincipal {
    
    public static final String ATTRIBUTE_KEY = "gamehost.session.principal";
    
    private final String userId;
    
    private final String instanceId;
    
    private final String containerId;
    
    private final SessionKind kind;
    
    public static SessionPrincipal from(WebSocketSession session) {
        Object principal = session.getAttributes().get(ATTRIBUTE_KEY);
        return principal instanceof SessionPrincipal ? (SessionPrincipal) principal : null;
    }
}
