package org.gamehost.config;

import org.gamehost.socket.ConsoleWebSocketHandler;
import org.gamehost.socket.MetricsWebSocketHandler;
import org.gamehost.socket.SessionAuthenticator;
import org.gamehost.socket.SessionHandshakeInterceptor;
import org.gamehost.socket.SessionKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 配置
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConsoleWebSocketHandler consoleWebSocketHandler;
    private final MetricsWebSocketHandler metricsWebSocketHandler;
    private final SessionAuthenticator sessionAuthenticator;
    private final String[] allowedOrigins;

    public WebSocketConfig(ConsoleWebSocketHandler consoleWebSocketHandler,
                           MetricsWebSocketHandler metricsWebSocketHandler,
                           SessionAuthenticator sessionAuthenticator,
                           @Value("${gamehost.stream.allowed-origins:*}") String[] allowedOrigins) {
        this.consoleWebSocketHandler = consoleWebSocketHandler;
        this.metricsWebSocketHandler = metricsWebSocketHandler;
        this.sessionAuthenticator = sessionAuthenticator;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {

        registry.addHandler(consoleWebSocketHandler, "/ws/console")
            .addInterceptors(new SessionHandshakeInterceptor(sessionAuthenticator, SessionKind.CONSOLE))
            .setAllowedOriginPatterns(allowedOrigins);

        registry.addHandler(metricsWebSocketHandler, "/ws/metrics")
            .addInterceptors(new SessionHandshakeInterceptor(sessionAuthenticator, SessionKind.METRICS))
            .setAllowedOriginPatterns(allowedOrigins);
    }
}
