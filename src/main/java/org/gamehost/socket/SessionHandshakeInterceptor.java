package org.gamehost.socket;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.AuthorizationException;
import org.gamehost.exception.ContainerException;
import org.gamehost.security.TokenAuthenticator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * 握手拦截：认证失败时直接返回 HTTP 错误，不建立会话，不附加任何上游流
 */
@Slf4j
public class SessionHandshakeInterceptor implements HandshakeInterceptor {
    
    private final SessionAuthenticator sessionAuthenticator;
    private final SessionKind kind;
    
    public SessionHandshakeInterceptor(SessionAuthenticator sessionAuthenticator, SessionKind kind) {
        this.sessionAuthenticator = sessionAuthenticator;
        this.kind = kind;
    }
    
    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        String instanceId = params.getFirst("instanceId");
        String token = params.getFirst("token");
        if (token == null) {
            token = TokenAuthenticator.extractBearer(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        }
        
        try {
            SessionPrincipal principal = sessionAuthenticator.authorize(token, instanceId, kind);
            attributes.put(SessionPrincipal.ATTRIBUTE_KEY, principal);
            return true;
        } catch (AuthorizationException e) {
            log.warn("{} 会话认证失败: instanceId={}, reason={}", kind, instanceId, e.getMessage());
            response.setStatusCode(e.isAuthenticationFailure() ? HttpStatus.UNAUTHORIZED : HttpStatus.FORBIDDEN);
            return false;
        } catch (ContainerException e) {
            log.warn("{} 会话被拒绝: {}", kind, e.getMessage());
            response.setStatusCode(HttpStatus.CONFLICT);
            return false;
        }
    }
    
    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // 无需处理
    }
}
