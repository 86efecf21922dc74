package com.devhub.chat.service;

import com.devhub.chat.config.ChatProperties;
import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.MembershipRole;
import com.devhub.chat.model.RoomKind;
import com.devhub.chat.model.RoomMembership;
import com.devhub.chat.repository.ChatRoomRepository;
import com.devhub.chat.repository.RoomMembershipRepository;
import com.devhub.chat.support.KeyedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Authoritative room and membership state.
 *
 * <p>Join, leave, invite and update of a room are serialized twice: in-process by a
 * per-room lock, and in the database by a {@code PESSIMISTIC_WRITE} lock on the room
 * row taken inside the transaction. The first keeps a single node from racing
 * itself, the second keeps several nodes from racing each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomMembershipService {

    private final ChatRoomRepository chatRoomRepository;
    private final RoomMembershipRepository membershipRepository;
    private final IdentityDirectory identityDirectory;
    private final TransactionTemplate transactionTemplate;
    private final ChatProperties properties;

    private final KeyedLocks<Long> roomLocks = new KeyedLocks<>();

    // ── Rooms ──────────────────────────────────────────────────────────────────

    /**
     * Creates a public or private room with the creator as its admin, atomically.
     */
    @Transactional
    public ChatRoom createRoom(Identity creator, String name, String description,
                               RoomKind kind, Integer capacity) {
        RoomKind roomKind = kind == null ? RoomKind.PUBLIC : kind;
        if (roomKind == RoomKind.DIRECT) {
            throw new ChatException(ErrorKind.INVALID_ROOM_KIND,
                    "Direct rooms are created by messaging a user, not explicitly");
        }
        ChatRoom room = chatRoomRepository.save(ChatRoom.builder()
                .name(validName(name))
                .description(validDescription(description))
                .kind(roomKind)
                .createdBy(creator.getId())
                .maxParticipants(validCapacity(capacity == null ? properties.getRooms().getDefaultCapacity() : capacity))
                .active(true)
                .build());

        LocalDateTime now = LocalDateTime.now();
        membershipRepository.save(RoomMembership.builder()
                .userId(creator.getId())
                .roomId(room.getId())
                .role(MembershipRole.ADMIN)
                .joinedAt(now)
                .lastSeenAt(now)
                .active(true)
                .build());

        log.info("User {} created {} room '{}' (id={})", creator.getId(), roomKind, room.getName(), room.getId());
        return room;
    }

    public ChatRoom updateRoom(Identity actor, Long roomId, String name, String description, Integer capacity) {
        return roomLocks.withLock(roomId, () -> transactionTemplate.execute(status -> {
            ChatRoom room = lockActiveRoom(roomId);
            if (room.isDirect()) {
                throw new ChatException(ErrorKind.FORBIDDEN, "Direct rooms cannot be changed");
            }
            requireAdmin(actor, roomId);
            if (name != null) {
                room.setName(validName(name));
            }
            if (description != null) {
                room.setDescription(validDescription(description));
            }
            if (capacity != null) {
                int validated = validCapacity(capacity);
                if (validated < membershipRepository.countByRoomIdAndActiveTrue(roomId)) {
                    throw new ChatException(ErrorKind.ROOM_FULL,
                            "Capacity cannot be lower than the current member count");
                }
                room.setMaxParticipants(validated);
            }
            return chatRoomRepository.save(room);
        }));
    }

    public void deactivateRoom(Identity actor, Long roomId) {
        roomLocks.withLock(roomId, () -> transactionTemplate.executeWithoutResult(status -> {
            ChatRoom room = lockActiveRoom(roomId);
            if (room.isDirect()) {
                throw new ChatException(ErrorKind.FORBIDDEN, "Direct rooms cannot be deactivated");
            }
            requireAdmin(actor, roomId);
            room.setActive(false);
            chatRoomRepository.save(room);
            log.info("Room {} deactivated by user {}", roomId, actor.getId());
        }));
    }

    @Transactional(readOnly = true)
    public Optional<ChatRoom> findActiveRoom(Long roomId) {
        return roomId == null ? Optional.empty() : chatRoomRepository.findByIdAndActiveTrue(roomId);
    }

    public ChatRoom requireActiveRoom(Long roomId) {
        return findActiveRoom(roomId).orElseThrow(() -> ChatException.roomNotFound(roomId));
    }

    @Transactional(readOnly = true)
    public List<ChatRoom> roomsOf(Long userId) {
        return chatRoomRepository.findActiveRoomsOf(userId);
    }

    // ── Membership ─────────────────────────────────────────────────────────────

    /**
     * Adds the identity to the room, or reactivates its earlier membership.
     * Joining a room the identity is already active in returns that membership.
     */
    public RoomMembership join(Identity identity, Long roomId) {
        return roomLocks.withLock(roomId, () -> transactionTemplate.execute(status -> {
            ChatRoom room = lockActiveRoom(roomId);
            Optional<RoomMembership> existing = membershipRepository.findByUserIdAndRoomId(identity.getId(), roomId);

            if (existing.isPresent() && existing.get().isActive()) {
                return existing.get();
            }
            if (existing.isEmpty() && room.getKind() != RoomKind.PUBLIC) {
                throw new ChatException(ErrorKind.PRIVATE_ROOM_DENIED, "Access denied to private room");
            }
            if (membershipRepository.countByRoomIdAndActiveTrue(roomId) >= room.getMaxParticipants()) {
                throw new ChatException(ErrorKind.ROOM_FULL, "Room is at maximum capacity");
            }

            LocalDateTime now = LocalDateTime.now();
            RoomMembership membership = existing.orElseGet(() -> RoomMembership.builder()
                    .userId(identity.getId())
                    .roomId(roomId)
                    .role(MembershipRole.MEMBER)
                    .build());
            membership.setActive(true);
            membership.setJoinedAt(now);
            membership.setLastSeenAt(now);
            RoomMembership saved = membershipRepository.save(membership);
            log.info("User {} joined room {}", identity.getId(), roomId);
            return saved;
        }));
    }

    /**
     * Marks the membership inactive. Leaving a room one is not active in is a no-op.
     */
    public void leave(Identity identity, Long roomId) {
        roomLocks.withLock(roomId, () -> transactionTemplate.executeWithoutResult(status ->
                membershipRepository.findByUserIdAndRoomId(identity.getId(), roomId)
                        .filter(RoomMembership::isActive)
                        .ifPresent(membership -> {
                            membership.setActive(false);
                            membership.setLastSeenAt(LocalDateTime.now());
                            membershipRepository.save(membership);
                            log.info("User {} left room {}", identity.getId(), roomId);
                        })));
    }

    /**
     * Records an invitation: an inactive membership row that a later {@link #join} reactivates.
     */
    public RoomMembership invite(Identity actor, Long roomId, Long inviteeId) {
        return roomLocks.withLock(roomId, () -> transactionTemplate.execute(status -> {
            ChatRoom room = lockActiveRoom(roomId);
            if (room.isDirect()) {
                throw new ChatException(ErrorKind.FORBIDDEN, "Nobody can be invited to a direct room");
            }
            requireAdmin(actor, roomId);
            if (identityDirectory.findById(inviteeId).isEmpty()) {
                throw new ChatException(ErrorKind.INVALID_RECIPIENT, "User " + inviteeId + " not found");
            }
            return membershipRepository.findByUserIdAndRoomId(inviteeId, roomId)
                    .orElseGet(() -> {
                        log.info("User {} invited user {} to room {}", actor.getId(), inviteeId, roomId);
                        return membershipRepository.save(RoomMembership.builder()
                                .userId(inviteeId)
                                .roomId(roomId)
                                .role(MembershipRole.MEMBER)
                                .active(false)
                                .build());
                    });
        }));
    }

    /** Identity ids of active members in join order. */
    @Transactional(readOnly = true)
    public List<Long> listActiveMembers(Long roomId) {
        return activeMemberships(roomId).stream()
                .map(RoomMembership::getUserId)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RoomMembership> activeMemberships(Long roomId) {
        return membershipRepository.findByRoomIdAndActiveTrueOrderByJoinedAtAscIdAsc(roomId);
    }

    @Transactional(readOnly = true)
    public long countActiveMembers(Long roomId) {
        return membershipRepository.countByRoomIdAndActiveTrue(roomId);
    }

    @Transactional(readOnly = true)
    public boolean isActiveMember(Long userId, Long roomId) {
        return userId != null && roomId != null
                && membershipRepository.existsByUserIdAndRoomIdAndActiveTrue(userId, roomId);
    }

    @Transactional(readOnly = true)
    public RoomMembership requireActiveMembership(Long userId, Long roomId) {
        return membershipRepository.findByUserIdAndRoomId(userId, roomId)
                .filter(RoomMembership::isActive)
                .orElseThrow(() -> ChatException.notAMember(roomId));
    }

    @Transactional
    public void touchLastSeen(Long userId, Long roomId) {
        membershipRepository.findByUserIdAndRoomId(userId, roomId)
                .filter(RoomMembership::isActive)
                .ifPresent(membership -> membership.setLastSeenAt(LocalDateTime.now()));
    }

    /**
     * Runs {@code action} holding the in-process lock that join, leave and room
     * updates take. The lock is reentrant, so the action may call those methods.
     */
    public <T> T withRoomLock(Long roomId, Supplier<T> action) {
        return roomLocks.withLock(roomId, action);
    }

    public void withRoomLock(Long roomId, Runnable action) {
        roomLocks.withLock(roomId, action);
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private ChatRoom lockActiveRoom(Long roomId) {
        return chatRoomRepository.findByIdForUpdate(roomId)
                .filter(ChatRoom::isActive)
                .orElseThrow(() -> ChatException.roomNotFound(roomId));
    }

    private void requireAdmin(Identity actor, Long roomId) {
        boolean admin = membershipRepository.findByUserIdAndRoomId(actor.getId(), roomId)
                .filter(RoomMembership::isActive)
                .map(RoomMembership::isAdmin)
                .orElse(false);
        if (!admin) {
            throw new ChatException(ErrorKind.FORBIDDEN, "Only room admins can do that");
        }
    }

    private String validName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty() || trimmed.length() > properties.getRooms().getMaxNameLength()) {
            throw new ChatException(ErrorKind.INVALID_NAME,
                    "Room name must be 1-" + properties.getRooms().getMaxNameLength() + " characters");
        }
        return trimmed;
    }

    private String validDescription(String description) {
        if (description == null) {
            return null;
        }
        String trimmed = description.trim();
        if (trimmed.length() > properties.getRooms().getMaxDescriptionLength()) {
            throw new ChatException(ErrorKind.INVALID_NAME,
                    "Description must be at most " + properties.getRooms().getMaxDescriptionLength() + " characters");
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    private int validCapacity(int capacity) {
        if (capacity < 2 || capacity > properties.getRooms().getMaxCapacity()) {
            throw new ChatException(ErrorKind.INVALID_CAPACITY,
                    "Capacity must be between 2 and " + properties.getRooms().getMaxCapacity());
        }
        return capacity;
    }
}
