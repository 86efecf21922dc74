package com.devhub.chat.service;

import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatMessage;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.MessageReaction;
import com.devhub.chat.repository.ChatMessageRepository;
import com.devhub.chat.repository.MessageReactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Emoji reactions. A toggle is stored before it is broadcast, like a message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReactionService {

    private static final int MAX_EMOJI_LENGTH = 32;

    private final MessageReactionRepository reactionRepository;
    private final ChatMessageRepository messageRepository;
    private final RoomMembershipService membershipService;
    private final MessageService messageService;
    private final TransactionTemplate transactionTemplate;

    public ChatDTOs.ReactionPayload toggle(Identity identity, Long messageId, String emoji) {
        String value = emoji == null ? "" : emoji.trim();
        if (value.isEmpty() || value.length() > MAX_EMOJI_LENGTH) {
            throw new ChatException(ErrorKind.INVALID_CONTENT, "Reaction must be 1-" + MAX_EMOJI_LENGTH + " characters");
        }

        ChatDTOs.ReactionPayload payload = transactionTemplate.execute(status -> {
            ChatMessage message = messageRepository.findById(messageId)
                    .filter(m -> !m.isDeleted())
                    .orElseThrow(() -> new ChatException(ErrorKind.MESSAGE_NOT_FOUND, "Message " + messageId + " not found"));
            membershipService.requireActiveRoom(message.getRoomId());
            membershipService.requireActiveMembership(identity.getId(), message.getRoomId());

            Optional<MessageReaction> existing =
                    reactionRepository.findByMessageIdAndUserIdAndEmoji(messageId, identity.getId(), value);
            boolean added = existing.isEmpty();
            if (added) {
                reactionRepository.save(MessageReaction.builder()
                        .messageId(messageId)
                        .userId(identity.getId())
                        .emoji(value)
                        .build());
            } else {
                reactionRepository.delete(existing.get());
            }
            reactionRepository.flush();

            return ChatDTOs.ReactionPayload.builder()
                    .messageId(messageId)
                    .roomId(message.getRoomId())
                    .userId(identity.getId())
                    .emoji(value)
                    .added(added)
                    .count(reactionRepository.countByMessageIdAndEmoji(messageId, value))
                    .build();
        });

        messageService.fanOut(ChatEvent.of(EventType.REACTION_UPDATED, payload.getRoomId(), payload),
                payload.getRoomId(), null);
        log.debug("User {} {} {} on message {}", identity.getId(), payload.isAdded() ? "added" : "removed", value, messageId);
        return payload;
    }
}
