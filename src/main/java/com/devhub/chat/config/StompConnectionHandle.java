package com.devhub.chat.config;

import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.registry.ConnectionHandle;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Delivers events to exactly one STOMP session on {@code /user/queue/events}.
 */
public class StompConnectionHandle implements ConnectionHandle {

    public static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final String sessionId;

    public StompConnectionHandle(SimpMessagingTemplate messagingTemplate, String sessionId) {
        this.messagingTemplate = messagingTemplate;
        this.sessionId = sessionId;
    }

    @Override
    public void deliver(ChatEvent event) {
        messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION, event, sessionHeaders());
    }

    /** Addressing by session id makes the user destination resolve to this session only */
    private MessageHeaders sessionHeaders() {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        return headerAccessor.getMessageHeaders();
    }
}
