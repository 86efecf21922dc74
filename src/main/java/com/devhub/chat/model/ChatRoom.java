package com.devhub.chat.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * A conversation. Rooms are deactivated, never deleted, so message history
 * always points at an existing row.
 */
@Entity
@Table(name = "chat_rooms", indexes = {
        @Index(name = "room_kind_idx", columnList = "kind"),
        @Index(name = "room_created_by_idx", columnList = "createdBy")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRoom {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RoomKind kind;

    @Column(nullable = false)
    private Long createdBy;

    @Column(nullable = false)
    private int maxParticipants;

    @Builder.Default
    private boolean active = true;

    /** Canonical pair key of a direct room, see {@link DirectPairKey}. Null for other kinds. */
    @Column(unique = true, length = 64)
    private String directKey;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isDirect() {
        return kind == RoomKind.DIRECT;
    }
}
