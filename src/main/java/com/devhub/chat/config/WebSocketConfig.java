package com.devhub.chat.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final ChatProperties properties;
    private final StompAuthInterceptor stompAuthInterceptor;
    private final TaskScheduler heartbeatScheduler;

    public WebSocketConfig(ChatProperties properties,
                           StompAuthInterceptor stompAuthInterceptor,
                           @Qualifier("heartbeatScheduler") TaskScheduler heartbeatScheduler) {
        this.properties = properties;
        this.stompAuthInterceptor = stompAuthInterceptor;
        this.heartbeatScheduler = heartbeatScheduler;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // Every event goes to /user/queue/events of the target session; rooms are
        // fanned out by the registry, not by broker topics
        long heartbeat = properties.getHeartbeat().toMillis();
        config.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{heartbeat, heartbeat})
                .setTaskScheduler(heartbeatScheduler);

        // Prefix for messages FROM client TO server
        config.setApplicationDestinationPrefixes("/app");

        // Prefix for user-specific messages
        config.setUserDestinationPrefix("/user");

        // Keeps each session's outbound frames in publish order
        config.setPreservePublishOrder(true);
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(stompAuthInterceptor);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS(); // SockJS fallback for non-WebSocket browsers
    }
}
