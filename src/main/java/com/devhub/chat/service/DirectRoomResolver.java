package com.devhub.chat.service;

import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.DirectPairKey;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.MembershipRole;
import com.devhub.chat.model.RoomKind;
import com.devhub.chat.model.RoomMembership;
import com.devhub.chat.registry.Connection;
import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.repository.ChatRoomRepository;
import com.devhub.chat.repository.RoomMembershipRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Gives every pair of identities exactly one direct room.
 *
 * <p>The pair is canonicalized to a {@link DirectPairKey} whose storage form sits in
 * the unique {@code chat_rooms.direct_key} column. Concurrent first contacts all try
 * to insert; the database lets one through and the losers re-read the winner's row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DirectRoomResolver {

    private static final int MAX_ATTEMPTS = 3;

    private final ChatRoomRepository chatRoomRepository;
    private final RoomMembershipRepository membershipRepository;
    private final IdentityDirectory identityDirectory;
    private final RoomMembershipService membershipService;
    private final ConnectionRegistry connectionRegistry;
    private final MessageService messageService;
    private final PresenceService presenceService;
    private final PlatformTransactionManager transactionManager;

    /**
     * Returns the direct room of {@code a} and {@code b}, creating it on first contact.
     * Calls with the arguments swapped return the same room.
     */
    public ChatRoom resolve(Identity a, Long b) {
        if (a == null || b == null || a.getId().equals(b)) {
            throw new ChatException(ErrorKind.INVALID_RECIPIENT, "A direct room needs two different users");
        }
        if (identityDirectory.findById(b).isEmpty()) {
            throw new ChatException(ErrorKind.INVALID_RECIPIENT, "Recipient " + b + " not found");
        }
        DirectPairKey key = DirectPairKey.of(a.getId(), b);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<ChatRoom> existing = chatRoomRepository.findByDirectKey(key.storageKey());
            if (existing.isPresent()) {
                return reactivate(existing.get(), key);
            }
            try {
                return create(a.getId(), key);
            } catch (DataAccessException | TransactionException e) {
                // DUPLICATE_ROOM: someone else created the pair's room first, read theirs
                log.debug("Direct room {} created concurrently (attempt {}): {}", key.storageKey(), attempt, e.getMessage());
            }
        }
        return chatRoomRepository.findByDirectKey(key.storageKey())
                .orElseThrow(() -> new ChatException(ErrorKind.TRANSIENT_FAILURE,
                        "Direct room could not be opened, please retry"));
    }

    /**
     * Sends a direct message, opening the room if needed. Live connections of both
     * users are subscribed to the room and the recipient is told about it before the
     * message is fanned out.
     */
    public ChatDTOs.MessagePayload sendDirect(Identity sender, Long recipientId, String content) {
        ChatRoom room = resolve(sender, recipientId);
        Identity recipient = identityDirectory.findById(recipientId)
                .orElseThrow(() -> new ChatException(ErrorKind.INVALID_RECIPIENT, "Recipient " + recipientId + " not found"));

        subscribeAll(sender.getId(), room.getId());
        subscribeAll(recipientId, room.getId());

        ChatDTOs.RoomPayload roomPayload = presenceService.describe(room);
        for (Connection connection : connectionRegistry.connectionsOf(recipientId)) {
            connection.deliver(ChatEvent.of(EventType.DIRECT_ROOM, room.getId(), ChatDTOs.DirectRoomPayload.builder()
                    .room(roomPayload)
                    .otherUserId(sender.getId())
                    .otherUserName(sender.getDisplayName())
                    .build()));
        }
        log.debug("Direct message from {} to {} in room {}", sender.getId(), recipient.getId(), room.getId());
        return messageService.send(sender, room.getId(), content, null, null);
    }

    private ChatRoom create(Long creatorId, DirectPairKey key) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return tx.execute(status -> {
            ChatRoom room = chatRoomRepository.saveAndFlush(ChatRoom.builder()
                    .name("Direct " + key.getLow() + " & " + key.getHigh())
                    .description("Direct message conversation")
                    .kind(RoomKind.DIRECT)
                    .createdBy(creatorId)
                    .maxParticipants(2)
                    .active(true)
                    .directKey(key.storageKey())
                    .build());
            LocalDateTime now = LocalDateTime.now();
            for (Long member : new Long[]{key.getLow(), key.getHigh()}) {
                membershipRepository.save(RoomMembership.builder()
                        .userId(member)
                        .roomId(room.getId())
                        .role(MembershipRole.MEMBER)
                        .joinedAt(now)
                        .lastSeenAt(now)
                        .active(true)
                        .build());
            }
            log.info("Created direct room {} for {}", room.getId(), key.storageKey());
            return room;
        });
    }

    // A participant who left the direct room gets back in on the next contact
    private ChatRoom reactivate(ChatRoom room, DirectPairKey key) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.executeWithoutResult(status -> {
            for (Long member : new Long[]{key.getLow(), key.getHigh()}) {
                membershipRepository.findByUserIdAndRoomId(member, room.getId())
                        .filter(membership -> !membership.isActive())
                        .ifPresent(membership -> {
                            membership.setActive(true);
                            membership.setJoinedAt(LocalDateTime.now());
                            membershipRepository.save(membership);
                        });
            }
        });
        return room;
    }

    private void subscribeAll(Long identityId, Long roomId) {
        membershipService.withRoomLock(roomId, () -> {
            for (Connection connection : connectionRegistry.connectionsOf(identityId)) {
                try {
                    connectionRegistry.subscribe(connection.getId(), roomId);
                } catch (ChatException e) {
                    log.debug("Connection {} not subscribed to direct room {}: {}", connection.getId(), roomId, e.getMessage());
                }
            }
        });
    }
}
