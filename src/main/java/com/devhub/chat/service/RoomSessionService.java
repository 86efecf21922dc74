package com.devhub.chat.service;

import com.devhub.chat.config.ChatProperties;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.RoomMembership;
import com.devhub.chat.registry.Connection;
import com.devhub.chat.registry.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Room operations that touch both durable membership and live subscriptions,
 * shared by the STOMP and REST surfaces.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomSessionService {

    private final RoomMembershipService membershipService;
    private final ConnectionRegistry connectionRegistry;
    private final MessageService messageService;
    private final PresenceService presenceService;
    private final ChatProperties properties;

    /**
     * Joins the room and, when a connection is given, subscribes it and returns the
     * room with its recent messages for that connection.
     */
    public ChatDTOs.JoinedRoomPayload join(Identity identity, Long roomId, String connectionId) {
        boolean wasMember = membershipService.isActiveMember(identity.getId(), roomId);
        RoomMembership membership = membershipService.join(identity, roomId);
        if (!wasMember && connectionId != null) {
            messageService.postSystemNotice(identity, roomId, identity.getDisplayName() + " joined the room");
        }
        if (connectionId != null) {
            attach(connectionId, roomId);
        }
        log.debug("User {} joined room {} as {}", identity.getId(), roomId, membership.getRole());
        return snapshot(identity, roomId);
    }

    /** Subscribes a connection to a room its identity already belongs to. */
    public ChatDTOs.JoinedRoomPayload subscribe(Identity identity, Long roomId, String connectionId) {
        attach(connectionId, roomId);
        membershipService.touchLastSeen(identity.getId(), roomId);
        return snapshot(identity, roomId);
    }

    /**
     * Leaves the room: the membership is deactivated, then every connection of the
     * identity stops receiving it. Leaving twice is a no-op.
     */
    public void leave(Identity identity, Long roomId, boolean announce) {
        if (announce && membershipService.isActiveMember(identity.getId(), roomId)
                && membershipService.findActiveRoom(roomId).isPresent()) {
            messageService.postSystemNotice(identity, roomId, identity.getDisplayName() + " left the room");
        }
        List<Connection> detached = membershipService.withRoomLock(roomId, () -> {
            membershipService.leave(identity, roomId);
            List<Connection> connections = connectionRegistry.connectionsOf(identity.getId());
            for (Connection connection : connections) {
                connectionRegistry.unsubscribe(connection.getId(), roomId);
            }
            return connections;
        });
        if (announce) {
            for (Connection connection : detached) {
                connection.deliver(ChatEvent.of(EventType.LEFT_ROOM, roomId,
                        ChatDTOs.RoomLeftPayload.builder().roomId(roomId).build()));
            }
        }
    }

    /** Deactivates the room and detaches every live subscriber. */
    public void deactivate(Identity admin, Long roomId) {
        List<Connection> subscribers = membershipService.withRoomLock(roomId, () -> {
            membershipService.deactivateRoom(admin, roomId);
            List<Connection> connections = connectionRegistry.subscribersOf(roomId);
            for (Connection connection : connections) {
                connectionRegistry.unsubscribe(connection.getId(), roomId);
            }
            return connections;
        });
        for (Connection connection : subscribers) {
            connection.deliver(ChatEvent.of(EventType.LEFT_ROOM, roomId,
                    ChatDTOs.RoomLeftPayload.builder().roomId(roomId).roomClosed(true).build()));
        }
        log.info("Room {} closed, {} connection(s) detached", roomId, subscribers.size());
    }

    // Membership is checked and the subscription added under the room lock that leave holds
    private void attach(String connectionId, Long roomId) {
        membershipService.withRoomLock(roomId, () -> {
            membershipService.requireActiveRoom(roomId);
            connectionRegistry.subscribe(connectionId, roomId);
        });
    }

    private ChatDTOs.JoinedRoomPayload snapshot(Identity identity, Long roomId) {
        ChatRoom room = membershipService.requireActiveRoom(roomId);
        return ChatDTOs.JoinedRoomPayload.builder()
                .room(presenceService.describe(room))
                .messages(messageService.recentMessages(identity, roomId, properties.getMessages().getHistoryLimit()))
                .build();
    }
}
