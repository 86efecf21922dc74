package com.devhub.chat.controller;

import com.devhub.chat.exception.ChatException;
import com.devhub.chat.model.ChatDTOs;
import com.devhub.chat.model.ChatRoom;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.RoomMembership;
import com.devhub.chat.service.DirectRoomResolver;
import com.devhub.chat.service.IdentityDirectory;
import com.devhub.chat.service.MessageService;
import com.devhub.chat.service.PresenceService;
import com.devhub.chat.service.RoomMembershipService;
import com.devhub.chat.service.RoomSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST access to rooms, membership and history for clients without a live connection.
 * Every call authenticates with the same bearer token as the STOMP CONNECT frame.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RoomController {

    private final IdentityDirectory identityDirectory;
    private final RoomMembershipService membershipService;
    private final RoomSessionService roomSessionService;
    private final MessageService messageService;
    private final PresenceService presenceService;
    private final DirectRoomResolver directRoomResolver;

    /** Rooms the caller is an active member of, with live counts */
    @GetMapping("/rooms")
    public ResponseEntity<List<ChatDTOs.RoomPayload>> getRooms(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        Identity caller = caller(authorization);
        return ResponseEntity.ok(membershipService.roomsOf(caller.getId()).stream()
                .map(presenceService::describe)
                .collect(Collectors.toList()));
    }

    @PostMapping("/rooms")
    public ResponseEntity<ChatDTOs.RoomPayload> createRoom(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody ChatDTOs.CreateRoomRequest body) {
        Identity caller = caller(authorization);
        ChatRoom room = membershipService.createRoom(caller, body.getName(), body.getDescription(),
                body.getKind(), body.getMaxParticipants());
        return ResponseEntity.status(HttpStatus.CREATED).body(presenceService.describe(room));
    }

    @PatchMapping("/rooms/{roomId}")
    public ResponseEntity<ChatDTOs.RoomPayload> updateRoom(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId,
            @RequestBody ChatDTOs.UpdateRoomRequest body) {
        Identity caller = caller(authorization);
        ChatRoom room = membershipService.updateRoom(caller, roomId, body.getName(), body.getDescription(),
                body.getMaxParticipants());
        return ResponseEntity.ok(presenceService.describe(room));
    }

    @DeleteMapping("/rooms/{roomId}")
    public ResponseEntity<Void> deactivateRoom(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId) {
        roomSessionService.deactivate(caller(authorization), roomId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rooms/{roomId}/join")
    public ResponseEntity<ChatDTOs.JoinedRoomPayload> joinRoom(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId) {
        return ResponseEntity.ok(roomSessionService.join(caller(authorization), roomId, null));
    }

    @PostMapping("/rooms/{roomId}/leave")
    public ResponseEntity<Void> leaveRoom(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId) {
        roomSessionService.leave(caller(authorization), roomId, false);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rooms/{roomId}/invitations")
    public ResponseEntity<ChatDTOs.MembershipPayload> invite(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId,
            @Valid @RequestBody ChatDTOs.InviteRequest body) {
        RoomMembership membership = membershipService.invite(caller(authorization), roomId, body.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(toPayload(membership));
    }

    @GetMapping("/rooms/{roomId}/members")
    public ResponseEntity<List<ChatDTOs.MembershipPayload>> getMembers(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId) {
        membershipService.requireActiveMembership(caller(authorization).getId(), roomId);
        return ResponseEntity.ok(membershipService.activeMemberships(roomId).stream()
                .map(this::toPayload)
                .collect(Collectors.toList()));
    }

    @GetMapping("/rooms/{roomId}/online")
    public ResponseEntity<ChatDTOs.OnlineUsersPayload> getOnline(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId) {
        membershipService.requireActiveMembership(caller(authorization).getId(), roomId);
        return ResponseEntity.ok(presenceService.onlinePayload(roomId));
    }

    /** Older history, oldest first; omit {@code before} for the latest page */
    @GetMapping("/rooms/{roomId}/messages")
    public ResponseEntity<List<ChatDTOs.MessagePayload>> getRoomMessages(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId,
            @RequestParam(required = false) Long before,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(messageService.backfill(caller(authorization), roomId, before, limit));
    }

    @GetMapping("/rooms/{roomId}/messages/recent")
    public ResponseEntity<List<ChatDTOs.MessagePayload>> getRecentMessages(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(messageService.recentMessages(caller(authorization), roomId, limit));
    }

    @PostMapping("/rooms/{roomId}/messages")
    public ResponseEntity<ChatDTOs.MessagePayload> postMessage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long roomId,
            @RequestBody ChatDTOs.PostMessageRequest body) {
        ChatDTOs.MessagePayload sent = messageService.send(caller(authorization), roomId, body.getContent(),
                body.getKind(), body.getReplyToId(), body.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(sent);
    }

    /** Opens (or finds) the direct room between the caller and another user */
    @PostMapping("/direct-rooms/{userId}")
    public ResponseEntity<ChatDTOs.DirectRoomPayload> openDirectRoom(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long userId) {
        ChatRoom room = directRoomResolver.resolve(caller(authorization), userId);
        String otherName = identityDirectory.findById(userId).map(Identity::getDisplayName).orElse(null);
        return ResponseEntity.ok(ChatDTOs.DirectRoomPayload.builder()
                .room(presenceService.describe(room))
                .otherUserId(userId)
                .otherUserName(otherName)
                .build());
    }

    private Identity caller(String authorization) {
        return identityDirectory.verify(authorization).orElseThrow(ChatException::unauthenticated);
    }

    private ChatDTOs.MembershipPayload toPayload(RoomMembership membership) {
        return ChatDTOs.MembershipPayload.builder()
                .roomId(membership.getRoomId())
                .userId(membership.getUserId())
                .role(membership.getRole())
                .active(membership.isActive())
                .joinedAt(membership.getJoinedAt())
                .build();
    }
}
