package com.devhub.chat.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * Join state of one identity in one room. Leaving flips {@code active}; the row
 * itself is kept so "left" stays distinguishable from "never joined".
 */
@Entity
@Table(name = "room_memberships",
        uniqueConstraints = @UniqueConstraint(name = "user_room_idx", columnNames = {"user_id", "room_id"}),
        indexes = @Index(name = "membership_room_idx", columnList = "room_id, active"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MembershipRole role;

    private LocalDateTime joinedAt;

    private LocalDateTime lastSeenAt;

    private boolean active;

    public boolean isAdmin() {
        return role == MembershipRole.ADMIN;
    }
}
