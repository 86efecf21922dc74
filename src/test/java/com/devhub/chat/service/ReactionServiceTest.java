package com.devhub.chat.service;

import com.devhub.chat.IntegrationTestSupport;
import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.RoomKind;
import com.devhub.chat.registry.RecordingConnectionHandle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReactionServiceTest extends IntegrationTestSupport {

    @Autowired
    private ReactionService reactionService;

    @Autowired
    private MessageService messageService;

    @Autowired
    private RoomMembershipService membershipService;

    @Test
    void toggle_addsThenRemoves_andBroadcastsCounts() {
        Identity alice = newUser("alice");
        Identity bob = newUser("bob");
        ChatRoom room = membershipService.createRoom(alice, "reactions", null, RoomKind.PUBLIC, 10);
        membershipService.join(bob, room.getId());
        String aliceConn = connectionId();
        RecordingConnectionHandle aliceHandle = connect(alice, aliceConn);
        connectionRegistry.subscribe(aliceConn, room.getId());
        ChatDTOs.MessagePayload message = messageService.send(alice, room.getId(), "ship it", null, null);

        ChatDTOs.ReactionPayload added = reactionService.toggle(bob, message.getId(), "👍");
        ChatDTOs.ReactionPayload alsoAdded = reactionService.toggle(alice, message.getId(), "👍");
        ChatDTOs.ReactionPayload removed = reactionService.toggle(bob, message.getId(), "👍");

        assertThat(added.isAdded()).isTrue();
        assertThat(alsoAdded.getCount()).isEqualTo(2);
        assertThat(removed.isAdded()).isFalse();
        assertThat(removed.getCount()).isEqualTo(1);
        assertThat(aliceHandle.events(EventType.REACTION_UPDATED)).hasSize(3);
    }

    @Test
    void toggle_byNonMember_isRejected() {
        Identity alice = newUser("alice");
        Identity eve = newUser("eve");
        ChatRoom room = membershipService.createRoom(alice, "closed", null, RoomKind.PUBLIC, 10);
        ChatDTOs.MessagePayload message = messageService.send(alice, room.getId(), "hi", null, null);

        assertThatThrownBy(() -> reactionService.toggle(eve, message.getId(), "🎉"))
                .isInstanceOf(ChatException.class)
                .satisfies(e -> assertThat(((ChatException) e).getKind()).isEqualTo(ErrorKind.NOT_A_MEMBER));
    }
}
