package com.devhub.chat.service;

import com.devhub.chat.cache.RecentMessageBuffer;
import com.devhub.chat.cache.SendRateLimiter;
import com.devhub.chat.config.ChatProperties;
import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatMessage;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.MessageKind;
import com.devhub.chat.model.RoomMembership;
import com.devhub.chat.registry.Connection;
import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.repository.ChatMessageRepository;
import com.devhub.chat.support.KeyedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Persists chat messages and fans them out to the subscribed connections of a room.
 *
 * <p>Persist and deliver run under one per-room lock. The database id assigned in
 * the persist step therefore matches the order in which every connection sees the
 * messages of that room. Delivery is at-most-once: a connection that subscribes
 * after the fan-out catches up through {@link #recentMessages} or {@link #backfill}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private static final int DEFAULT_BACKFILL = 20;
    private static final int MAX_METADATA_ENTRIES = 20;

    private final ChatMessageRepository messageRepository;
    private final RoomMembershipService membershipService;
    private final ConnectionRegistry connectionRegistry;
    private final RecentMessageBuffer recentBuffer;
    private final SendRateLimiter rateLimiter;
    private final IdentityDirectory identityDirectory;
    private final TransactionTemplate transactionTemplate;
    private final ChatProperties properties;

    private final KeyedLocks<Long> roomLocks = new KeyedLocks<>();

    // ── Send ───────────────────────────────────────────────────────────────────

    public ChatDTOs.MessagePayload send(Identity sender, Long roomId, String content,
                                        MessageKind kind, Long replyToId) {
        return send(sender, roomId, content, kind, replyToId, null);
    }

    /**
     * @param metadata free-form attachment details stored and returned with the message,
     *                 may be null
     */
    public ChatDTOs.MessagePayload send(Identity sender, Long roomId, String content,
                                        MessageKind kind, Long replyToId, Map<String, Object> metadata) {
        MessageKind messageKind = kind == null ? MessageKind.TEXT : kind;
        if (messageKind == MessageKind.SYSTEM) {
            throw new ChatException(ErrorKind.INVALID_CONTENT, "System messages are reserved for the server");
        }
        return publish(sender, roomId, content, messageKind, replyToId, validMetadata(metadata), true);
    }

    /** Join and leave notices; the author must still be an active member. */
    public ChatDTOs.MessagePayload postSystemNotice(Identity actor, Long roomId, String content) {
        return publish(actor, roomId, content, MessageKind.SYSTEM, null, null, false);
    }

    private ChatDTOs.MessagePayload publish(Identity sender, Long roomId, String content, MessageKind kind,
                                            Long replyToId, Map<String, Object> metadata, boolean rateLimited) {
        return roomLocks.withLock(roomId, () -> {
            ChatMessage saved = persist(sender, roomId, content, kind, replyToId, metadata, rateLimited);
            ChatDTOs.MessagePayload payload = toPayload(saved, sender);

            recentBuffer.append(payload);
            int delivered = fanOut(ChatEvent.of(EventType.MESSAGE_CREATED, roomId, payload), roomId, null);
            log.debug("Message id={} from user {} in room {} delivered to {} connection(s)",
                    saved.getId(), sender.getId(), roomId, delivered);
            return payload;
        });
    }

    private ChatMessage persist(Identity sender, Long roomId, String content, MessageKind kind,
                                Long replyToId, Map<String, Object> metadata, boolean rateLimited) {
        try {
            return transactionTemplate.execute(status -> {
                membershipService.requireActiveRoom(roomId);
                membershipService.requireActiveMembership(sender.getId(), roomId);
                String body = validContent(content);
                if (replyToId != null && !messageRepository.existsByIdAndRoomId(replyToId, roomId)) {
                    throw new ChatException(ErrorKind.INVALID_REPLY, "Replies must reference a message in the same room");
                }
                if (rateLimited) {
                    rateLimiter.check(sender.getId());
                }
                return messageRepository.save(ChatMessage.builder()
                        .content(body)
                        .senderId(sender.getId())
                        .roomId(roomId)
                        .kind(kind)
                        .replyToId(replyToId)
                        .metadata(metadata)
                        .build());
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Persisting message of user {} in room {} failed", sender.getId(), roomId, e);
            throw new ChatException(ErrorKind.TRANSIENT_FAILURE, "Message could not be saved, please retry", e);
        }
    }

    // ── Typing ─────────────────────────────────────────────────────────────────

    /**
     * Forwards a typing indicator to the other subscribers. Nothing is stored and
     * nothing is reported back; indicators from non-members are dropped.
     */
    public void typing(Identity identity, Long roomId, boolean typing) {
        try {
            if (!membershipService.isActiveMember(identity.getId(), roomId)) {
                log.debug("Dropping typing indicator of non-member {} in room {}", identity.getId(), roomId);
                return;
            }
            ChatEvent event = ChatEvent.of(typing ? EventType.TYPING_STARTED : EventType.TYPING_STOPPED, roomId,
                    ChatDTOs.TypingPayload.builder()
                            .roomId(roomId)
                            .userId(identity.getId())
                            .displayName(identity.getDisplayName())
                            .typing(typing)
                            .build());
            fanOut(event, roomId, identity.getId());
        } catch (RuntimeException e) {
            log.warn("Typing indicator of user {} in room {} failed: {}", identity.getId(), roomId, e.getMessage());
        }
    }

    // ── Edit / delete ──────────────────────────────────────────────────────────

    public ChatDTOs.MessagePayload edit(Identity editor, Long messageId, String content) {
        ChatMessage original = requireVisible(messageId);
        return roomLocks.withLock(original.getRoomId(), () -> {
            ChatMessage updated = transactionTemplate.execute(status -> {
                ChatMessage message = requireVisible(messageId);
                if (!message.getSenderId().equals(editor.getId()) || message.getKind() == MessageKind.SYSTEM) {
                    throw new ChatException(ErrorKind.FORBIDDEN, "Only the author can edit a message");
                }
                membershipService.requireActiveMembership(editor.getId(), message.getRoomId());
                message.setContent(validContent(content));
                message.setEdited(true);
                return messageRepository.save(message);
            });
            ChatDTOs.MessagePayload payload = toPayload(updated, editor);
            recentBuffer.evict(updated.getRoomId());
            fanOut(ChatEvent.of(EventType.MESSAGE_UPDATED, updated.getRoomId(), payload), updated.getRoomId(), null);
            return payload;
        });
    }

    /** Soft-deletes a message. Allowed for its author and for room admins. */
    public void delete(Identity actor, Long messageId) {
        ChatMessage original = requireVisible(messageId);
        roomLocks.withLock(original.getRoomId(), () -> {
            transactionTemplate.executeWithoutResult(status -> {
                ChatMessage message = requireVisible(messageId);
                RoomMembership membership = membershipService.requireActiveMembership(actor.getId(), message.getRoomId());
                if (!message.getSenderId().equals(actor.getId()) && !membership.isAdmin()) {
                    throw new ChatException(ErrorKind.FORBIDDEN, "Only the author or a room admin can delete a message");
                }
                message.setDeleted(true);
                messageRepository.save(message);
            });
            recentBuffer.evict(original.getRoomId());
            fanOut(ChatEvent.of(EventType.MESSAGE_DELETED, original.getRoomId(),
                    ChatDTOs.MessageDeletedPayload.builder()
                            .messageId(messageId)
                            .roomId(original.getRoomId())
                            .build()), original.getRoomId(), null);
            log.debug("Message {} deleted by user {}", messageId, actor.getId());
        });
    }

    // ── Reads ──────────────────────────────────────────────────────────────────

    /**
     * Latest messages of a room, oldest first, served from the recent buffer when
     * it is warm and from the database otherwise.
     */
    public List<ChatDTOs.MessagePayload> recentMessages(Identity reader, Long roomId, int limit) {
        membershipService.requireActiveMembership(reader.getId(), roomId);
        int wanted = Math.max(1, Math.min(limit, properties.getCache().getRecentSize()));
        List<ChatDTOs.MessagePayload> buffered = roomLocks.withLock(roomId, () -> {
            Optional<RecentMessageBuffer.Window> cached = recentBuffer.read(roomId)
                    .filter(window -> window.covers(wanted));
            if (cached.isPresent()) {
                return cached.get().getMessages();
            }
            int recentSize = properties.getCache().getRecentSize();
            List<ChatDTOs.MessagePayload> loaded = toPayloads(messageRepository.findLatest(
                    roomId, PageRequest.of(0, recentSize)));
            Collections.reverse(loaded);
            recentBuffer.seed(roomId, loaded, loaded.size() < recentSize);
            return loaded;
        });
        return buffered.size() <= wanted
                ? buffered
                : new ArrayList<>(buffered.subList(buffered.size() - wanted, buffered.size()));
    }

    /**
     * Durable history read, oldest first: up to {@code limit} visible messages with
     * an id below {@code beforeId}, or the latest ones when {@code beforeId} is null.
     */
    public List<ChatDTOs.MessagePayload> backfill(Identity reader, Long roomId, Long beforeId, Integer limit) {
        membershipService.requireActiveMembership(reader.getId(), roomId);
        int size = limit == null ? DEFAULT_BACKFILL : Math.max(1, Math.min(limit, properties.getMessages().getMaxBackfill()));
        PageRequest page = PageRequest.of(0, size);
        List<ChatMessage> messages = beforeId == null
                ? messageRepository.findLatest(roomId, page)
                : messageRepository.findBefore(roomId, beforeId, page);
        List<ChatDTOs.MessagePayload> payloads = toPayloads(messages);
        Collections.reverse(payloads);
        return payloads;
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    /**
     * Delivers an event to every connection subscribed to the room right now,
     * optionally skipping the connections of one identity.
     *
     * @return number of connections the event was handed to
     */
    int fanOut(ChatEvent event, Long roomId, Long excludedIdentity) {
        int delivered = 0;
        for (Connection connection : connectionRegistry.subscribersOf(roomId)) {
            if (excludedIdentity != null && excludedIdentity.equals(connection.getIdentityId())) {
                continue;
            }
            if (connection.deliver(event)) {
                delivered++;
            }
        }
        return delivered;
    }

    private ChatMessage requireVisible(Long messageId) {
        return messageRepository.findById(messageId)
                .filter(message -> !message.isDeleted())
                .orElseThrow(() -> new ChatException(ErrorKind.MESSAGE_NOT_FOUND, "Message " + messageId + " not found"));
    }

    private String validContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ChatException(ErrorKind.INVALID_CONTENT, "Message content is required");
        }
        if (content.length() > properties.getMessages().getMaxLength()) {
            throw new ChatException(ErrorKind.INVALID_CONTENT,
                    "Message content must be at most " + properties.getMessages().getMaxLength() + " characters");
        }
        return content;
    }

    private Map<String, Object> validMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        if (metadata.size() > MAX_METADATA_ENTRIES) {
            throw new ChatException(ErrorKind.INVALID_CONTENT,
                    "Message metadata must have at most " + MAX_METADATA_ENTRIES + " entries");
        }
        return new LinkedHashMap<>(metadata);
    }

    public ChatDTOs.MessagePayload toPayload(ChatMessage message, Identity sender) {
        return ChatDTOs.MessagePayload.builder()
                .id(message.getId())
                .roomId(message.getRoomId())
                .senderId(message.getSenderId())
                .senderName(sender == null ? null : sender.getDisplayName())
                .senderAvatar(sender == null ? null : sender.getAvatar())
                .content(message.getContent())
                .kind(message.getKind())
                .replyToId(message.getReplyToId())
                .metadata(message.getMetadata())
                .edited(message.isEdited())
                .createdAt(message.getCreatedAt())
                .build();
    }

    private List<ChatDTOs.MessagePayload> toPayloads(List<ChatMessage> messages) {
        if (messages.isEmpty()) {
            return new ArrayList<>();
        }
        Set<Long> senderIds = messages.stream().map(ChatMessage::getSenderId).collect(Collectors.toSet());
        Map<Long, Identity> senders = identityDirectory.findAllById(senderIds);
        return messages.stream()
                .map(message -> toPayload(message, senders.get(message.getSenderId())))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
