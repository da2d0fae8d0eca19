package com.bbthechange.mobilelogin.config;

import com.bbthechange.mobilelogin.socket.LoginSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws";

    private final LoginSocketHandler loginSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(LoginSocketHandler loginSocketHandler,
                           @Value("${websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.loginSocketHandler = loginSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(loginSocketHandler, ENDPOINT)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
