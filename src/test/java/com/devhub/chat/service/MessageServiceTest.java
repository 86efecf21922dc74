package com.devhub.chat.service;

import com.devhub.chat.IntegrationTestSupport;
import com.devhub.chat.cache.RecentMessageBuffer;
import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.ChatMessage;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.EventType;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.MessageKind;
import com.devhub.chat.model.RoomKind;
import com.devhub.chat.registry.RecordingConnectionHandle;
import com.devhub.chat.repository.ChatMessageRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

public class MessageServiceTest extends IntegrationTestSupport {

    @Autowired
    private MessageService messageService;

    @Autowired
    private RoomMembershipService membershipService;

    @SpyBean
    private ChatMessageRepository messageRepository;

    @Autowired
    private RecentMessageBuffer recentBuffer;

    @Test
    void send_reachesEverySubscribedMember_andNobodyElse() {
        Identity alice = newUser("alice");
        Identity bob = newUser("bob");
        Identity carol = newUser("carol");
        ChatRoom room = membershipService.createRoom(alice, "general", null, RoomKind.PUBLIC, 10);
        membershipService.join(bob, room.getId());

        String aliceConn = connectionId();
        String bobConn = connectionId();
        RecordingConnectionHandle aliceHandle = connect(alice, aliceConn);
        RecordingConnectionHandle bobHandle = connect(bob, bobConn);
        RecordingConnectionHandle carolHandle = connect(carol, connectionId());
        connectionRegistry.subscribe(aliceConn, room.getId());
        connectionRegistry.subscribe(bobConn, room.getId());

        ChatDTOs.MessagePayload sent = messageService.send(alice, room.getId(), "hello", null, null);

        assertThat(sent.getId()).isNotNull();
        assertThat(sent.getKind()).isEqualTo(MessageKind.TEXT);
        assertThat(sent.getSenderName()).isEqualTo(alice.getDisplayName());
        for (RecordingConnectionHandle handle : List.of(aliceHandle, bobHandle)) {
            List<ChatEvent> created = handle.events(EventType.MESSAGE_CREATED);
            assertThat(created).hasSize(1);
            assertThat(((ChatDTOs.MessagePayload) created.get(0).getPayload()).getContent()).isEqualTo("hello");
        }
        assertThat(carolHandle.events()).isEmpty();
    }

    @Test
    void send_byNonMember_persistsNothing() {
        Identity alice = newUser("alice");
        Identity mallory = newUser("mallory");
        ChatRoom room = membershipService.createRoom(alice, "general", null, RoomKind.PUBLIC, 10);

        assertThatThrownBy(() -> messageService.send(mallory, room.getId(), "spam", null, null))
                .isInstanceOf(ChatException.class)
                .satisfies(e -> assertThat(((ChatException) e).getKind()).isEqualTo(ErrorKind.NOT_A_MEMBER));
        assertThat(messageRepository.countByRoomId(room.getId())).isZero();
    }

    @Test
    void send_whenStorageFails_isTransientAndDeliversNothing() {
        Identity alice = newUser("alice");
        Identity bob = newUser("bob");
        ChatRoom room = membershipService.createRoom(alice, "flaky", null, RoomKind.PUBLIC, 10);
        membershipService.join(bob, room.getId());
        String bobConn = connectionId();
        RecordingConnectionHandle bobHandle = connect(bob, bobConn);
        connectionRegistry.subscribe(bobConn, room.getId());
        bobHandle.clear();
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(messageRepository).save(any(ChatMessage.class));

        assertKind(() -> messageService.send(alice, room.getId(), "lost", null, null), ErrorKind.TRANSIENT_FAILURE);

        assertThat(bobHandle.events()).isEmpty();
        assertThat(recentBuffer.read(room.getId())).isEmpty();
        assertThat(messageRepository.countByRoomId(room.getId())).isZero();
    }

    @Test
    void recentMessages_youngRoom_isServedFromBufferAfterFirstRead() {
        Identity alice = newUser("alice");
        ChatRoom room = membershipService.createRoom(alice, "young", null, RoomKind.PUBLIC, 10);
        ChatDTOs.MessagePayload first = messageService.send(alice, room.getId(), "one", null, null);
        recentBuffer.evict(room.getId());

        assertThat(messageService.recentMessages(alice, room.getId(), 50))
                .extracting(ChatDTOs.MessagePayload::getId)
                .containsExactly(first.getId());
        ChatDTOs.MessagePayload second = messageService.send(alice, room.getId(), "two", null, null);
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(messageRepository).findLatest(any(), any());

        assertThat(messageService.recentMessages(alice, room.getId(), 50))
                .extracting(ChatDTOs.MessagePayload::getId)
                .containsExactly(first.getId(), second.getId());
    }

    @Test
    void fileMessage_keepsItsMetadataThroughHistory() {
        Identity alice = newUser("alice");
        ChatRoom room = membershipService.createRoom(alice, "files", null, RoomKind.PUBLIC, 10);
        Map<String, Object> attachment = Map.of("fileName", "notes.pdf", "fileSize", 2048, "mimeType", "application/pdf");

        ChatDTOs.MessagePayload sent = messageService.send(alice, room.getId(), "notes.pdf", MessageKind.FILE, null, attachment);
        recentBuffer.evict(room.getId());

        assertThat(sent.getMetadata()).containsEntry("fileName", "notes.pdf");
        ChatDTOs.MessagePayload stored = messageService.backfill(alice, room.getId(), null, null).get(0);
        assertThat(stored.getKind()).isEqualTo(MessageKind.FILE);
        assertThat(stored.getMetadata())
                .containsEntry("fileName", "notes.pdf")
                .containsEntry("mimeType", "application/pdf")
                .containsKey("fileSize");
        assertThat(messageService.recentMessages(alice, room.getId(), 10).get(0).getMetadata())
                .containsEntry("fileName", "notes.pdf");
    }

    @Test
    void send_rejectsBadContentAndForeignReplies() {
        Identity alice = newUser("alice");
        ChatRoom room = membershipService.createRoom(alice, "one", null, RoomKind.PUBLIC, 10);
        ChatRoom other = membershipService.createRoom(alice, "two", null, RoomKind.PUBLIC, 10);
        ChatDTOs.MessagePayload elsewhere = messageService.send(alice, other.getId(), "over here", null, null);

        assertKind(() -> messageService.send(alice, room.getId(), "   ", null, null), ErrorKind.INVALID_CONTENT);
        assertKind(() -> messageService.send(alice, room.getId(), "x".repeat(4001), null, null), ErrorKind.INVALID_CONTENT);
        assertKind(() -> messageService.send(alice, room.getId(), "sys", MessageKind.SYSTEM, null), ErrorKind.INVALID_CONTENT);
        assertKind(() -> messageService.send(alice, room.getId(), "re", null, elsewhere.getId()), ErrorKind.INVALID_REPLY);

        ChatDTOs.MessagePayload root = messageService.send(alice, room.getId(), "root", null, null);
        ChatDTOs.MessagePayload reply = messageService.send(alice, room.getId(), "re", null, root.getId());
        assertThat(reply.getReplyToId()).isEqualTo(root.getId());
    }

    @Test
    void concurrentSenders_everySubscriberSeesPersistedOrder() throws Exception {
        Identity alice = newUser("alice");
        Identity bob = newUser("bob");
        Identity watcher = newUser("watcher");
        ChatRoom room = membershipService.createRoom(alice, "busy", null, RoomKind.PUBLIC, 10);
        membershipService.join(bob, room.getId());
        membershipService.join(watcher, room.getId());
        String watcherConn = connectionId();
        RecordingConnectionHandle watcherHandle = connect(watcher, watcherConn);
        connectionRegistry.subscribe(watcherConn, room.getId());

        ExecutorService es = Executors.newFixedThreadPool(2);
        var start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Identity sender : List.of(alice, bob)) {
            futures.add(es.submit(() -> {
                start.await();
                for (int i = 0; i < 20; i++) {
                    messageService.send(sender, room.getId(), sender.getDisplayName() + " " + i, null, null);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        es.shutdownNow();

        List<Long> seen = watcherHandle.events(EventType.MESSAGE_CREATED).stream()
                .map(e -> ((ChatDTOs.MessagePayload) e.getPayload()).getId())
                .collect(Collectors.toList());
        assertThat(seen).hasSize(40).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void recentMessages_andBackfill_areOldestFirst() {
        Identity alice = newUser("alice");
        ChatRoom room = membershipService.createRoom(alice, "history", null, RoomKind.PUBLIC, 10);
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(messageService.send(alice, room.getId(), "m" + i, null, null).getId());
        }

        assertThat(messageService.recentMessages(alice, room.getId(), 3))
                .extracting(ChatDTOs.MessagePayload::getId)
                .containsExactly(ids.get(2), ids.get(3), ids.get(4));
        assertThat(messageService.backfill(alice, room.getId(), ids.get(3), 2))
                .extracting(ChatDTOs.MessagePayload::getId)
                .containsExactly(ids.get(1), ids.get(2));
        assertThat(messageService.backfill(alice, room.getId(), null, null)).hasSize(5);
    }

    @Test
    void editAndDelete_followAuthorship() {
        Identity alice = newUser("alice");
        Identity bob = newUser("bob");
        ChatRoom room = membershipService.createRoom(alice, "edits", null, RoomKind.PUBLIC, 10);
        membershipService.join(bob, room.getId());
        String bobConn = connectionId();
        RecordingConnectionHandle bobHandle = connect(bob, bobConn);
        connectionRegistry.subscribe(bobConn, room.getId());

        ChatDTOs.MessagePayload bobs = messageService.send(bob, room.getId(), "tpyo", null, null);
        ChatDTOs.MessagePayload alices = messageService.send(alice, room.getId(), "mine", null, null);

        assertKind(() -> messageService.edit(alice, bobs.getId(), "hijack"), ErrorKind.FORBIDDEN);
        assertKind(() -> messageService.delete(bob, alices.getId()), ErrorKind.FORBIDDEN);

        ChatDTOs.MessagePayload edited = messageService.edit(bob, bobs.getId(), "typo");
        assertThat(edited.isEdited()).isTrue();
        // room admins may delete anyone's message
        messageService.delete(alice, bobs.getId());

        assertThat(bobHandle.events(EventType.MESSAGE_UPDATED)).hasSize(1);
        assertThat(bobHandle.events(EventType.MESSAGE_DELETED)).hasSize(1);
        assertThat(messageService.backfill(bob, room.getId(), null, null))
                .extracting(ChatDTOs.MessagePayload::getId)
                .containsExactly(alices.getId());
        assertKind(() -> messageService.edit(bob, bobs.getId(), "again"), ErrorKind.MESSAGE_NOT_FOUND);
    }

    @Test
    void typing_fromNonMember_isDroppedSilently() {
        Identity alice = newUser("alice");
        Identity stranger = newUser("stranger");
        ChatRoom room = membershipService.createRoom(alice, "quiet", null, RoomKind.PUBLIC, 10);
        String aliceConn = connectionId();
        RecordingConnectionHandle aliceHandle = connect(alice, aliceConn);
        connectionRegistry.subscribe(aliceConn, room.getId());

        messageService.typing(stranger, room.getId(), true);

        assertThat(aliceHandle.events(EventType.TYPING_STARTED)).isEmpty();
    }

    private void assertKind(org.assertj.core.api.ThrowableAssert.ThrowingCallable call, ErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOf(ChatException.class)
                .satisfies(e -> assertThat(((ChatException) e).getKind()).isEqualTo(kind));
    }
}
