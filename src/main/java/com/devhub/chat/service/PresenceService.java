package com.devhub.chat.service;

import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.PresenceState;
import com.devhub.chat.registry.Connection;
import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.registry.PresenceTransitionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives who is online in a room and tells the room when that changes.
 * Nothing here is stored; every answer is computed from the live registry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipService membershipService;

    /**
     * Active members with at least one live connection subscribed to the room,
     * in join order.
     */
    public Set<Long> onlineIn(Long roomId) {
        Set<Long> subscribed = connectionRegistry.identitiesSubscribedTo(roomId);
        if (subscribed.isEmpty()) {
            return Set.of();
        }
        Set<Long> online = new LinkedHashSet<>();
        for (Long member : membershipService.listActiveMembers(roomId)) {
            if (subscribed.contains(member)) {
                online.add(member);
            }
        }
        return online;
    }

    public ChatDTOs.OnlineUsersPayload onlinePayload(Long roomId) {
        List<Long> users = List.copyOf(onlineIn(roomId));
        return ChatDTOs.OnlineUsersPayload.builder().roomId(roomId).users(users).count(users.size()).build();
    }

    /**
     * Notifies the other subscribers of a room. Best-effort: failures are logged
     * and never reach the operation that caused the transition.
     */
    public void broadcastTransition(Identity identity, Long roomId, PresenceState state) {
        try {
            ChatEvent event = ChatEvent.of(EventType.PRESENCE, roomId, ChatDTOs.PresencePayload.builder()
                    .roomId(roomId)
                    .userId(identity.getId())
                    .displayName(identity.getDisplayName())
                    .state(state)
                    .build());
            int delivered = 0;
            for (Connection connection : connectionRegistry.subscribersOf(roomId)) {
                if (!identity.getId().equals(connection.getIdentityId()) && connection.deliver(event)) {
                    delivered++;
                }
            }
            log.debug("User {} is {} in room {} (notified {} connection(s))", identity.getId(), state, roomId, delivered);
        } catch (RuntimeException e) {
            log.warn("Presence broadcast for user {} in room {} failed: {}", identity.getId(), roomId, e.getMessage());
        }
    }

    @EventListener
    public void onTransition(PresenceTransitionEvent event) {
        broadcastTransition(event.getIdentity(), event.getRoomId(), event.getState());
    }

    /** Room info with live member and online counts. */
    public ChatDTOs.RoomPayload describe(ChatRoom room) {
        return ChatDTOs.RoomPayload.builder()
                .id(room.getId())
                .name(room.getName())
                .description(room.getDescription())
                .kind(room.getKind())
                .maxParticipants(room.getMaxParticipants())
                .memberCount((int) membershipService.countActiveMembers(room.getId()))
                .onlineCount(onlineIn(room.getId()).size())
                .build();
    }
}
