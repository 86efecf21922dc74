package com.devhub.chat.service;

import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatCommand;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.registry.Connection;
import com.devhub.chat.registry.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Executes one {@link ChatCommand} on behalf of its connection. Replies and failures
 * go back to that connection only; nothing thrown here closes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatCommandHandler {

    private final ConnectionRegistry connectionRegistry;
    private final RoomSessionService roomSessionService;
    private final MessageService messageService;
    private final PresenceService presenceService;
    private final DirectRoomResolver directRoomResolver;
    private final ReactionService reactionService;

    public void handle(ChatCommand command) {
        Connection connection = connectionRegistry.find(command.getConnectionId()).orElse(null);
        if (connection == null) {
            log.debug("Dropping {} for closed connection {}", command.getOperation(), command.getConnectionId());
            return;
        }
        connectionRegistry.touch(connection.getId());
        try {
            execute(command, connection);
        } catch (ChatException e) {
            log.debug("{} by user {} rejected: {} {}", command.getOperation(), command.getIdentity().getId(),
                    e.getKind(), e.getMessage());
            connection.deliver(ChatEvent.error(e.getKind().name(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("{} by user {} failed", command.getOperation(), command.getIdentity().getId(), e);
            connection.deliver(ChatEvent.error(ErrorKind.TRANSIENT_FAILURE.name(), "Something went wrong, please retry"));
        }
    }

    private void execute(ChatCommand command, Connection connection) {
        Identity identity = command.getIdentity();
        switch (command.getOperation()) {
            case JOIN: {
                Long roomId = roomId(command);
                connection.deliver(ChatEvent.of(EventType.JOINED_ROOM, roomId,
                        roomSessionService.join(identity, roomId, connection.getId())));
                break;
            }
            case SUBSCRIBE: {
                Long roomId = roomId(command);
                connection.deliver(ChatEvent.of(EventType.JOINED_ROOM, roomId,
                        roomSessionService.subscribe(identity, roomId, connection.getId())));
                break;
            }
            case UNSUBSCRIBE:
                connectionRegistry.unsubscribe(connection.getId(), roomId(command));
                break;
            case LEAVE:
                roomSessionService.leave(identity, roomId(command), true);
                break;
            case SEND: {
                ChatDTOs.SendMessageRequest request = command.requestAs(ChatDTOs.SendMessageRequest.class);
                messageService.send(identity, request.getRoomId(), request.getContent(),
                        request.getKind(), request.getReplyToId(), request.getMetadata());
                break;
            }
            case TYPING: {
                ChatDTOs.TypingRequest request = command.requestAs(ChatDTOs.TypingRequest.class);
                messageService.typing(identity, request.getRoomId(), request.isTyping());
                break;
            }
            case DIRECT_MESSAGE: {
                ChatDTOs.DirectMessageRequest request = command.requestAs(ChatDTOs.DirectMessageRequest.class);
                directRoomResolver.sendDirect(identity, request.getRecipientId(), request.getContent());
                break;
            }
            case ONLINE_USERS: {
                Long roomId = roomId(command);
                if (!connection.isSubscribedTo(roomId)) {
                    throw ChatException.notAMember(roomId);
                }
                connection.deliver(ChatEvent.of(EventType.ONLINE_USERS, roomId, presenceService.onlinePayload(roomId)));
                break;
            }
            case REACT: {
                ChatDTOs.ReactionRequest request = command.requestAs(ChatDTOs.ReactionRequest.class);
                reactionService.toggle(identity, request.getMessageId(), request.getEmoji());
                break;
            }
            case EDIT: {
                ChatDTOs.EditMessageRequest request = command.requestAs(ChatDTOs.EditMessageRequest.class);
                messageService.edit(identity, request.getMessageId(), request.getContent());
                break;
            }
            case DELETE:
                messageService.delete(identity, command.requestAs(ChatDTOs.DeleteMessageRequest.class).getMessageId());
                break;
            default:
                throw new IllegalStateException("Unhandled operation " + command.getOperation());
        }
    }

    private Long roomId(ChatCommand command) {
        Long roomId = command.requestAs(ChatDTOs.RoomRequest.class).getRoomId();
        if (roomId == null) {
            throw ChatException.roomNotFound(null);
        }
        return roomId;
    }
}
