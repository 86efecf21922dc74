package com.devhub.chat.exception;

import lombok.Getter;

/**
 * Structured failure of a chat operation. The message is a human readable
 * summary safe to show to clients; causes are kept for logging only.
 */
@Getter
public class ChatException extends RuntimeException {

    private final ErrorKind kind;

    public ChatException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChatException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ChatException notAMember(Long roomId) {
        return new ChatException(ErrorKind.NOT_A_MEMBER, "You are not a member of room " + roomId);
    }

    public static ChatException roomNotFound(Long roomId) {
        return new ChatException(ErrorKind.ROOM_NOT_FOUND, "Room " + roomId + " not found");
    }

    public static ChatException unauthenticated() {
        return new ChatException(ErrorKind.UNAUTHENTICATED, "Authentication required");
    }
}
