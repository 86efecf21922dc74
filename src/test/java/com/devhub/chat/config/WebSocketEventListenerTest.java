package com.devhub.chat.config;

import com.devhub.chat.model.Identity;
import com.devhub.chat.registry.ConnectionHandle;
import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.service.ChatCommandDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class WebSocketEventListenerTest {

    private final Identity alice = Identity.builder().id(7L).displayName("alice").build();

    @Test
    void connected_admits_disconnect_removes() {
        var registry = mock(ConnectionRegistry.class);
        var dispatcher = mock(ChatCommandDispatcher.class);
        var listener = new WebSocketEventListener(registry, dispatcher, mock(SimpMessagingTemplate.class));

        listener.handleWebSocketConnectListener(
                new SessionConnectedEvent(this, message("s1"), new IdentityPrincipal(alice)));
        listener.handleWebSocketDisconnectListener(
                new SessionDisconnectEvent(this, message("s1"), "s1", CloseStatus.NORMAL, new IdentityPrincipal(alice)));

        verify(registry).admit(eq("s1"), eq(alice), any(ConnectionHandle.class));
        verify(dispatcher).close("s1");
        verify(registry).remove("s1");
    }

    @Test
    void connectedWithoutPrincipal_isIgnored() {
        var registry = mock(ConnectionRegistry.class);
        var listener = new WebSocketEventListener(registry, mock(ChatCommandDispatcher.class),
                mock(SimpMessagingTemplate.class));

        listener.handleWebSocketConnectListener(new SessionConnectedEvent(this, message("s2")));

        verifyNoInteractions(registry);
    }

    private Message<byte[]> message(String sessionId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECTED);
        accessor.setSessionId(sessionId);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }
}
