package com.devhub.chat.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Account row owned by the platform's auth service. The chat server only reads it
 * to resolve bearer tokens and recipient ids.
 */
@Entity
@Table(name = "user_accounts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    private String avatar;

    @Column(unique = true, length = 128)
    private String accessToken;

    @Builder.Default
    private boolean active = true;

    public Identity toIdentity() {
        return Identity.builder().id(id).displayName(username).avatar(avatar).build();
    }
}
