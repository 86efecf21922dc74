package com.devhub.chat.model;

import lombok.Builder;
import lombok.Value;

/**
 * Envelope for everything the server pushes to a connection.
 * {@code roomId} is null for events not scoped to a room (errors, DM notices).
 */
@Value
@Builder
public class ChatEvent {
    EventType type;
    Long roomId;
    Object payload;

    public static ChatEvent of(EventType type, Long roomId, Object payload) {
        return new ChatEvent(type, roomId, payload);
    }

    public static ChatEvent error(String code, String message) {
        return new ChatEvent(EventType.ERROR, null,
                ChatDTOs.ErrorPayload.builder().code(code).message(message).build());
    }
}
