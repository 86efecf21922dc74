package com.devhub.chat.config;

import com.devhub.chat.model.Identity;
import com.devhub.chat.service.IdentityDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Authenticates the STOMP CONNECT frame from its {@code Authorization} header and
 * refuses SEND/SUBSCRIBE frames on sessions that never authenticated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompAuthInterceptor implements ChannelInterceptor {

    static final String AUTHORIZATION = "Authorization";

    private final IdentityDirectory identityDirectory;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() == null) {
            return message;
        }

        StompCommand command = accessor.getCommand();
        if (command == StompCommand.CONNECT) {
            String credential = Optional.ofNullable(accessor.getFirstNativeHeader(AUTHORIZATION))
                    .orElse(accessor.getFirstNativeHeader(AUTHORIZATION.toLowerCase()));
            Identity identity = identityDirectory.verify(credential)
                    .orElseThrow(() -> {
                        log.info("Rejected STOMP connect on session {}: bad credential", accessor.getSessionId());
                        return new MessagingException(message, "UNAUTHENTICATED");
                    });
            accessor.setUser(new IdentityPrincipal(identity));
            log.debug("Session {} authenticated as user {}", accessor.getSessionId(), identity.getId());
        } else if ((command == StompCommand.SEND || command == StompCommand.SUBSCRIBE)
                && !(accessor.getUser() instanceof IdentityPrincipal)) {
            throw new MessagingException(message, "UNAUTHENTICATED");
        }
        return message;
    }
}
