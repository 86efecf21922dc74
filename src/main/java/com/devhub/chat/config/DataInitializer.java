package com.devhub.chat.config;

import com.devhub.chat.model.ChatMessage;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.MembershipRole;
import com.devhub.chat.model.MessageKind;
import com.devhub.chat.model.RoomKind;
import com.devhub.chat.model.RoomMembership;
import com.devhub.chat.model.UserAccount;
import com.devhub.chat.repository.ChatMessageRepository;
import com.devhub.chat.repository.ChatRoomRepository;
import com.devhub.chat.repository.RoomMembershipRepository;
import com.devhub.chat.repository.UserAccountRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Demo data for local runs: a few accounts with fixed tokens and a public
 * {@code general} room. Does nothing once any account exists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chat.seed", name = "enabled", havingValue = "true")
public class DataInitializer {

    private final UserAccountRepository userAccountRepository;
    private final ChatRoomRepository chatRoomRepository;
    private final RoomMembershipRepository membershipRepository;
    private final ChatMessageRepository messageRepository;
    private final TransactionTemplate transactionTemplate;
    private final ChatProperties properties;

    @PostConstruct
    public void seed() {
        if (userAccountRepository.count() > 0) return;
        transactionTemplate.executeWithoutResult(status -> seedDemoData());
    }

    private void seedDemoData() {
        List<UserAccount> accounts = userAccountRepository.saveAll(List.of(
                account("alice", "demo-token-alice"),
                account("bob", "demo-token-bob"),
                account("carol", "demo-token-carol")));
        UserAccount owner = accounts.get(0);

        ChatRoom general = chatRoomRepository.save(ChatRoom.builder()
                .name("general")
                .description("Company-wide announcements and chatter")
                .kind(RoomKind.PUBLIC)
                .createdBy(owner.getId())
                .maxParticipants(properties.getRooms().getDefaultCapacity())
                .build());

        LocalDateTime now = LocalDateTime.now();
        membershipRepository.save(RoomMembership.builder()
                .userId(owner.getId())
                .roomId(general.getId())
                .role(MembershipRole.ADMIN)
                .active(true)
                .joinedAt(now)
                .lastSeenAt(now)
                .build());

        messageRepository.save(ChatMessage.builder()
                .roomId(general.getId())
                .senderId(owner.getId())
                .kind(MessageKind.SYSTEM)
                .content("Welcome to DevHub chat! This is the general channel.")
                .build());

        log.info("Seeded {} demo accounts and room '{}' (id={})", accounts.size(), general.getName(), general.getId());
    }

    private UserAccount account(String username, String token) {
        return UserAccount.builder()
                .username(username)
                .avatar("https://avatars.devhub.local/" + username + ".png")
                .accessToken(token)
                .build();
    }
}
