package com.devhub.chat.config;

import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.service.ChatCommandDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Ties STOMP session lifecycle to the connection registry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketEventListener {

    private final ConnectionRegistry connectionRegistry;
    private final ChatCommandDispatcher dispatcher;
    private final SimpMessagingTemplate messagingTemplate;

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.wrap(event.getMessage());
        String sessionId = headers.getSessionId();
        if (!(event.getUser() instanceof IdentityPrincipal)) {
            // the inbound interceptor rejects these before CONNECTED is sent
            log.warn("Connected session {} has no identity, ignoring", sessionId);
            return;
        }
        IdentityPrincipal principal = (IdentityPrincipal) event.getUser();
        connectionRegistry.admit(sessionId, principal.getIdentity(),
                new StompConnectionHandle(messagingTemplate, sessionId));
        log.debug("New WebSocket connection: sessionId={}, user={}", sessionId, principal.getName());
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        dispatcher.close(sessionId);
        connectionRegistry.remove(sessionId);
        log.debug("WebSocket disconnected: sessionId={}, status={}", sessionId, event.getCloseStatus());
    }
}
