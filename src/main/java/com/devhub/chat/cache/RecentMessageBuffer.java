package com.devhub.chat.cache;

import com.devhub.chat.config.ChatProperties;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.support.KeyedLocks;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sliding window of the latest messages per room, kept in the ephemeral cache.
 * A miss or a cache failure is never an error: callers fall back to the database.
 *
 * <p>A buffer seeded with a room's whole history starts with a marker entry. The
 * marker lives and expires with the list, and is trimmed away once the list holds
 * {@code recent-size} messages, so a short buffer without it only means the
 * buffer was rebuilt by appends after it expired.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecentMessageBuffer {

    private final EphemeralCache cache;
    private final ObjectMapper objectMapper;
    private final ChatProperties properties;

    private static final String HISTORY_START = "#history-start";

    private final KeyedLocks<Long> roomLocks = new KeyedLocks<>();

    public static String key(Long roomId) {
        return "chat:room:" + roomId + ":recent";
    }

    public void append(ChatDTOs.MessagePayload message) {
        roomLocks.withLock(message.getRoomId(), () -> {
            try {
                cache.appendToList(key(message.getRoomId()), objectMapper.writeValueAsString(message),
                        properties.getCache().getRecentSize(), properties.getCache().getRecentTtl());
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("Could not buffer message {} of room {}: {}", message.getId(), message.getRoomId(), e.getMessage());
            }
        });
    }

    /**
     * @return the buffered messages oldest first, or empty when nothing is buffered
     */
    public Optional<Window> read(Long roomId) {
        List<String> raw;
        try {
            raw = cache.listRange(key(roomId));
        } catch (RuntimeException e) {
            log.warn("Could not read recent messages of room {}: {}", roomId, e.getMessage());
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        boolean wholeHistory = HISTORY_START.equals(raw.get(0));
        List<ChatDTOs.MessagePayload> messages = new ArrayList<>(raw.size());
        for (String json : wholeHistory ? raw.subList(1, raw.size()) : raw) {
            try {
                messages.add(objectMapper.readValue(json, ChatDTOs.MessagePayload.class));
            } catch (JsonProcessingException e) {
                log.warn("Dropping unreadable buffer of room {}: {}", roomId, e.getOriginalMessage());
                evict(roomId);
                return Optional.empty();
            }
        }
        boolean complete = wholeHistory || messages.size() >= properties.getCache().getRecentSize();
        return Optional.of(new Window(messages, complete));
    }

    /**
     * Replaces the buffer with messages read from the database, oldest first.
     *
     * @param wholeHistory the messages are every visible message of the room
     */
    public void seed(Long roomId, List<ChatDTOs.MessagePayload> messages, boolean wholeHistory) {
        roomLocks.withLock(roomId, () -> {
            try {
                List<String> raw = new ArrayList<>(messages.size() + 1);
                if (wholeHistory) {
                    raw.add(HISTORY_START);
                }
                for (ChatDTOs.MessagePayload message : messages) {
                    raw.add(objectMapper.writeValueAsString(message));
                }
                if (!raw.isEmpty()) {
                    cache.replaceList(key(roomId), raw, properties.getCache().getRecentTtl());
                }
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("Could not seed recent messages of room {}: {}", roomId, e.getMessage());
            }
        });
    }

    public void evict(Long roomId) {
        roomLocks.withLock(roomId, () -> {
            try {
                cache.delete(key(roomId));
            } catch (RuntimeException e) {
                log.warn("Could not evict recent messages of room {}: {}", roomId, e.getMessage());
            }
        });
    }

    /** Buffered messages, oldest first. */
    @Value
    public static class Window {
        List<ChatDTOs.MessagePayload> messages;
        // nothing older than the first message exists, or the window is full
        boolean complete;

        public boolean covers(int wanted) {
            return complete || messages.size() >= wanted;
        }
    }
}
