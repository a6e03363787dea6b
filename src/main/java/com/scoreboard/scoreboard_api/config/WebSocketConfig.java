package com.scoreboard.scoreboard_api.config;

import com.scoreboard.scoreboard_api.security.JwtUtil;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * STOMP push for the live scoreboard. Clients subscribe to /topic/matches
 * and re-query the stats endpoints whenever a match is recorded or deleted.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final JwtUtil jwtUtil;

    public WebSocketConfig(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws-scoreboard")
                .setAllowedOriginPatterns("*")
                .setHandshakeHandler(new TokenHandshakeHandler(jwtUtil));
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    /**
     * Connection mode:
     *
     *   ws://.../ws-scoreboard?token=eyJhbG...
     *
     * The principal is the user id from the token. Without a valid token the
     * session is anonymous, which is enough to follow the public topic.
     */
    static class TokenHandshakeHandler extends DefaultHandshakeHandler {

        private final JwtUtil jwtUtil;

        TokenHandshakeHandler(JwtUtil jwtUtil) {
            this.jwtUtil = jwtUtil;
        }

        @Override
        protected Principal determineUser(ServerHttpRequest request,
                                          WebSocketHandler wsHandler,
                                          Map<String, Object> attributes) {
            if (request instanceof ServletServerHttpRequest servletRequest) {
                String token = servletRequest.getServletRequest().getParameter("token");
                Optional<UUID> accountId = jwtUtil.accountIdOf(token);
                if (accountId.isPresent()) {
                    String name = accountId.get().toString();
                    return () -> name;
                }
            }
            return null;
        }
    }
}
