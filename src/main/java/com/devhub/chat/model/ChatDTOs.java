package com.devhub.chat.model;

import jakarta.validation.constraints.NotNull;
import lombok.*;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * All DTOs (Data Transfer Objects) used by the STOMP and REST surfaces.
 */
public class ChatDTOs {

    /** Marker for every client request that travels through a connection's inbox. */
    public interface InboundRequest {
    }

    // ── Inbound (Client → Server) ─────────────────────────────────────────────

    /** Join, leave, subscribe, unsubscribe and online-list requests only name a room */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class RoomRequest implements InboundRequest {
        @NotNull
        private Long roomId;
    }

    /** Sent when a user sends a chat message */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class SendMessageRequest implements InboundRequest {
        private Long roomId;
        private String content;
        private MessageKind kind;
        private Long replyToId;
        // attachment details of IMAGE and FILE messages (name, size, url, ...)
        private Map<String, Object> metadata;
    }

    /** Sent when typing status changes */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class TypingRequest implements InboundRequest {
        private Long roomId;
        private boolean typing;
    }

    /** First-contact or follow-up message to another user */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class DirectMessageRequest implements InboundRequest {
        private Long recipientId;
        private String content;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ReactionRequest implements InboundRequest {
        private Long messageId;
        private String emoji;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class EditMessageRequest implements InboundRequest {
        private Long messageId;
        private String content;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class DeleteMessageRequest implements InboundRequest {
        private Long messageId;
    }

    /** REST body for room creation; name and capacity rules are enforced by the service */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class CreateRoomRequest {
        private String name;
        private String description;
        private RoomKind kind;
        private Integer maxParticipants;
    }

    /** REST body for room updates; null fields are left unchanged */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class UpdateRoomRequest {
        private String name;
        private String description;
        private Integer maxParticipants;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class InviteRequest {
        @NotNull
        private Long userId;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class PostMessageRequest {
        private String content;
        private MessageKind kind;
        private Long replyToId;
        private Map<String, Object> metadata;
    }

    // ── Outbound (Server → Client) ────────────────────────────────────────────

    /** Full message payload sent to subscribers */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class MessagePayload {
        private Long id;
        private Long roomId;
        private Long senderId;
        private String senderName;
        private String senderAvatar;
        private String content;
        private MessageKind kind;
        private Long replyToId;
        private Map<String, Object> metadata;
        private boolean edited;
        private LocalDateTime createdAt;
    }

    /** Room info payload */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class RoomPayload {
        private Long id;
        private String name;
        private String description;
        private RoomKind kind;
        private int maxParticipants;
        private int memberCount;
        private int onlineCount;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class MembershipPayload {
        private Long roomId;
        private Long userId;
        private MembershipRole role;
        private boolean active;
        private LocalDateTime joinedAt;
    }

    /** Room info and recent messages, sent to the joining connection only */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class JoinedRoomPayload {
        private RoomPayload room;
        private List<MessagePayload> messages;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class PresencePayload {
        private Long roomId;
        private Long userId;
        private String displayName;
        private PresenceState state;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class TypingPayload {
        private Long roomId;
        private Long userId;
        private String displayName;
        private boolean typing;
    }

    /** Online member list for a room */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class OnlineUsersPayload {
        private Long roomId;
        private List<Long> users;
        private int count;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class DirectRoomPayload {
        private RoomPayload room;
        private Long otherUserId;
        private String otherUserName;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ReactionPayload {
        private Long messageId;
        private Long roomId;
        private Long userId;
        private String emoji;
        private boolean added;
        private long count;
    }

    /** Sent to a connection that stopped receiving a room */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class RoomLeftPayload {
        private Long roomId;
        private boolean roomClosed;
    }

    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class MessageDeletedPayload {
        private Long messageId;
        private Long roomId;
    }

    /** Error payload */
    @Data @NoArgsConstructor @AllArgsConstructor @Builder
    public static class ErrorPayload {
        private String code;
        private String message;
    }
}
