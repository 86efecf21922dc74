package com.devhub.chat.controller;

import com.devhub.chat.config.IdentityPrincipal;
import com.devhub.chat.model.ChatCommand;
import com.devhub.chat.model.ChatCommand.Operation;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.service.ChatCommandDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * Handles all inbound WebSocket messages from clients.
 *
 * Flow:
 *  Client → /app/chat.join        → become a member and start receiving the room
 *  Client → /app/chat.subscribe   → start receiving a room already joined
 *  Client → /app/chat.unsubscribe → stop receiving a room on this connection
 *  Client → /app/chat.leave       → give up membership
 *  Client → /app/chat.send        → post a message
 *  Client → /app/chat.typing      → typing indicator
 *  Client → /app/chat.dm          → message another user directly
 *  Client → /app/chat.online      → who is online in a room
 *  Client → /app/chat.react       → toggle a reaction
 *  Client → /app/chat.edit        → edit own message
 *  Client → /app/chat.delete      → delete a message
 *
 * Every reply and broadcast arrives on /user/queue/events. Requests are only queued
 * here; they run on the connection's inbox in arrival order.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatController {

    private final ChatCommandDispatcher dispatcher;

    @MessageMapping("/chat.join")
    public void joinRoom(@Payload ChatDTOs.RoomRequest request, Principal principal,
                         SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.JOIN, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.subscribe")
    public void subscribe(@Payload ChatDTOs.RoomRequest request, Principal principal,
                          SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.SUBSCRIBE, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.unsubscribe")
    public void unsubscribe(@Payload ChatDTOs.RoomRequest request, Principal principal,
                            SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.UNSUBSCRIBE, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.leave")
    public void leaveRoom(@Payload ChatDTOs.RoomRequest request, Principal principal,
                          SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.LEAVE, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.send")
    public void sendMessage(@Payload ChatDTOs.SendMessageRequest request, Principal principal,
                            SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.SEND, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.typing")
    public void handleTyping(@Payload ChatDTOs.TypingRequest request, Principal principal,
                             SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.TYPING, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.dm")
    public void directMessage(@Payload ChatDTOs.DirectMessageRequest request, Principal principal,
                              SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.DIRECT_MESSAGE, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.online")
    public void onlineUsers(@Payload ChatDTOs.RoomRequest request, Principal principal,
                            SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.ONLINE_USERS, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.react")
    public void react(@Payload ChatDTOs.ReactionRequest request, Principal principal,
                      SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.REACT, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.edit")
    public void edit(@Payload ChatDTOs.EditMessageRequest request, Principal principal,
                     SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.EDIT, request, principal, headerAccessor);
    }

    @MessageMapping("/chat.delete")
    public void delete(@Payload ChatDTOs.DeleteMessageRequest request, Principal principal,
                       SimpMessageHeaderAccessor headerAccessor) {
        submit(Operation.DELETE, request, principal, headerAccessor);
    }

    private void submit(Operation operation, ChatDTOs.InboundRequest request, Principal principal,
                        SimpMessageHeaderAccessor headerAccessor) {
        if (!(principal instanceof IdentityPrincipal)) {
            log.warn("Dropping {} from unauthenticated session {}", operation, headerAccessor.getSessionId());
            return;
        }
        dispatcher.dispatch(new ChatCommand(headerAccessor.getSessionId(),
                ((IdentityPrincipal) principal).getIdentity(), operation, request));
    }
}
