package com.devhub.chat.service;

import com.devhub.chat.IntegrationTestSupport;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatCommand;
import com.devhub.chat.model.ChatCommand.Operation;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.MessageKind;
import com.devhub.chat.model.RoomKind;
import com.devhub.chat.registry.RecordingConnectionHandle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the command handler the way the STOMP controller does, one connection at a time.
 */
public class ChatCommandHandlerTest extends IntegrationTestSupport {

    @Autowired
    private ChatCommandHandler handler;

    @Autowired
    private RoomMembershipService membershipService;

    @Autowired
    private PresenceService presenceService;

    @Test
    void joinSendLeave_flow() {
        Identity alice = newUser("alice");
        Identity bob = newUser("bob");
        ChatRoom room = membershipService.createRoom(alice, "lobby", null, RoomKind.PUBLIC, 10);
        String aliceConn = connectionId();
        String bobConn = connectionId();
        RecordingConnectionHandle aliceHandle = connect(alice, aliceConn);
        RecordingConnectionHandle bobHandle = connect(bob, bobConn);

        handler.handle(command(aliceConn, alice, Operation.SUBSCRIBE, new ChatDTOs.RoomRequest(room.getId())));
        handler.handle(command(bobConn, bob, Operation.JOIN, new ChatDTOs.RoomRequest(room.getId())));

        List<ChatEvent> joined = bobHandle.events(EventType.JOINED_ROOM);
        assertThat(joined).hasSize(1);
        ChatDTOs.JoinedRoomPayload snapshot = (ChatDTOs.JoinedRoomPayload) joined.get(0).getPayload();
        assertThat(snapshot.getRoom().getMemberCount()).isEqualTo(2);
        assertThat(snapshot.getMessages()).extracting(ChatDTOs.MessagePayload::getKind).contains(MessageKind.SYSTEM);
        assertThat(aliceHandle.events(EventType.PRESENCE)).hasSize(1);
        assertThat(presenceService.onlineIn(room.getId())).containsExactly(alice.getId(), bob.getId());

        handler.handle(command(bobConn, bob, Operation.SEND,
                ChatDTOs.SendMessageRequest.builder().roomId(room.getId()).content("hi all").build()));
        assertThat(aliceHandle.events(EventType.MESSAGE_CREATED))
                .extracting(e -> ((ChatDTOs.MessagePayload) e.getPayload()).getContent())
                .contains("hi all");

        handler.handle(command(bobConn, bob, Operation.LEAVE, new ChatDTOs.RoomRequest(room.getId())));

        assertThat(bobHandle.events(EventType.LEFT_ROOM)).hasSize(1);
        assertThat(membershipService.isActiveMember(bob.getId(), room.getId())).isFalse();
        assertThat(presenceService.onlineIn(room.getId())).containsExactly(alice.getId());
    }

    @Test
    void failures_becomeErrorEvents_andConnectionSurvives() {
        Identity alice = newUser("alice");
        Identity eve = newUser("eve");
        ChatRoom room = membershipService.createRoom(alice, "private", null, RoomKind.PRIVATE, 10);
        String eveConn = connectionId();
        RecordingConnectionHandle eveHandle = connect(eve, eveConn);

        handler.handle(command(eveConn, eve, Operation.SEND,
                ChatDTOs.SendMessageRequest.builder().roomId(room.getId()).content("let me in").build()));
        handler.handle(command(eveConn, eve, Operation.JOIN, new ChatDTOs.RoomRequest(room.getId())));
        handler.handle(command(eveConn, eve, Operation.JOIN, new ChatDTOs.RoomRequest(null)));

        assertThat(eveHandle.events(EventType.ERROR))
                .extracting(e -> ((ChatDTOs.ErrorPayload) e.getPayload()).getCode())
                .containsExactly(ErrorKind.NOT_A_MEMBER.name(), ErrorKind.PRIVATE_ROOM_DENIED.name(),
                        ErrorKind.ROOM_NOT_FOUND.name());
        assertThat(connectionRegistry.find(eveConn)).isPresent();
    }

    @Test
    void onlineUsers_requiresSubscription() {
        Identity alice = newUser("alice");
        ChatRoom room = membershipService.createRoom(alice, "who", null, RoomKind.PUBLIC, 10);
        String aliceConn = connectionId();
        RecordingConnectionHandle aliceHandle = connect(alice, aliceConn);

        handler.handle(command(aliceConn, alice, Operation.ONLINE_USERS, new ChatDTOs.RoomRequest(room.getId())));
        assertThat(aliceHandle.events(EventType.ERROR)).hasSize(1);

        handler.handle(command(aliceConn, alice, Operation.SUBSCRIBE, new ChatDTOs.RoomRequest(room.getId())));
        handler.handle(command(aliceConn, alice, Operation.ONLINE_USERS, new ChatDTOs.RoomRequest(room.getId())));

        List<ChatEvent> online = aliceHandle.events(EventType.ONLINE_USERS);
        assertThat(online).hasSize(1);
        assertThat(((ChatDTOs.OnlineUsersPayload) online.get(0).getPayload()).getUsers()).containsExactly(alice.getId());
    }

    @Test
    void commandsForClosedConnection_areDropped() {
        Identity alice = newUser("alice");
        ChatRoom room = membershipService.createRoom(alice, "gone", null, RoomKind.PUBLIC, 10);
        String aliceConn = connectionId();
        RecordingConnectionHandle aliceHandle = connect(alice, aliceConn);
        connectionRegistry.remove(aliceConn);

        handler.handle(command(aliceConn, alice, Operation.SUBSCRIBE, new ChatDTOs.RoomRequest(room.getId())));

        assertThat(aliceHandle.events()).isEmpty();
        assertThat(connectionRegistry.subscribersOf(room.getId())).isEmpty();
    }

    private ChatCommand command(String connectionId, Identity identity, Operation operation,
                                ChatDTOs.InboundRequest request) {
        return new ChatCommand(connectionId, identity, operation, request);
    }
}
