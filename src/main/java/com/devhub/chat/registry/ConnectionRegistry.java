package com.devhub.chat.registry;

import com.devhub.chat.exception.ChatException;
import com.devhub.chat.model.Identity;
import com.devhub.chat.model.PresenceState;
import com.devhub.chat.service.RoomMembershipService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory map of live connections.
 * Key: transport session id → Value: {@link Connection}
 *
 * <p>Besides the primary map it keeps two indexes, identity → connection ids and
 * room → connection ids, plus a per-room count of subscribed connections per
 * identity from which presence transitions are derived.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final RoomMembershipService membershipService;
    private final ApplicationEventPublisher eventPublisher;

    // connectionId → Connection
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    // identityId → connectionIds
    private final Map<Long, Set<String>> byIdentity = new ConcurrentHashMap<>();
    // roomId → connectionIds
    private final Map<Long, Set<String>> byRoom = new ConcurrentHashMap<>();
    // roomId → (identityId → subscribed connection count)
    private final Map<Long, Map<Long, Integer>> roomPresence = new ConcurrentHashMap<>();

    /**
     * Registers a connection whose identity the transport has already verified.
     *
     * @return the connection id, which is the handle's transport-assigned id
     */
    public String admit(String connectionId, Identity identity, ConnectionHandle handle) {
        if (identity == null || identity.getId() == null) {
            throw ChatException.unauthenticated();
        }
        Connection connection = new Connection(connectionId, identity, handle, System.currentTimeMillis());
        Connection existing = connections.putIfAbsent(connectionId, connection);
        if (existing != null) {
            return existing.getId();
        }
        index(byIdentity, identity.getId(), connectionId);
        log.debug("Connection admitted: {} for user {}", connectionId, identity.getId());
        return connectionId;
    }

    /**
     * Starts fan-out of {@code roomId} to the connection. Idempotent.
     *
     * @throws ChatException {@code NOT_A_MEMBER} without an active membership,
     *                       {@code UNAUTHENTICATED} for unknown or closed connections
     */
    public void subscribe(String connectionId, Long roomId) {
        Connection connection = require(connectionId);
        boolean firstForIdentity;
        synchronized (connection) {
            if (connection.isClosed()) {
                throw ChatException.unauthenticated();
            }
            if (connection.isSubscribedTo(roomId)) {
                return;
            }
            if (!membershipService.isActiveMember(connection.getIdentityId(), roomId)) {
                throw ChatException.notAMember(roomId);
            }
            connection.addRoom(roomId);
            index(byRoom, roomId, connectionId);
            firstForIdentity = adjustPresence(roomId, connection.getIdentityId(), 1) == 1;
        }
        log.debug("Connection {} subscribed to room {}", connectionId, roomId);
        if (firstForIdentity) {
            publish(connection.getIdentity(), roomId, PresenceState.ONLINE);
        }
    }

    /** Stops fan-out of {@code roomId} to the connection. No-op when not subscribed. */
    public void unsubscribe(String connectionId, Long roomId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return;
        }
        boolean lastForIdentity;
        synchronized (connection) {
            if (!connection.removeRoom(roomId)) {
                return;
            }
            lastForIdentity = detach(connectionId, connection.getIdentityId(), roomId);
        }
        log.debug("Connection {} unsubscribed from room {}", connectionId, roomId);
        if (lastForIdentity) {
            publish(connection.getIdentity(), roomId, PresenceState.OFFLINE);
        }
    }

    /**
     * Drops a connection on disconnect. Safe to call repeatedly and concurrently;
     * only the first call has any effect.
     */
    public void remove(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        Long identityId = connection.getIdentityId();
        List<Long> offlineRooms = new ArrayList<>();
        synchronized (connection) {
            for (Long roomId : connection.close()) {
                if (detach(connectionId, identityId, roomId)) {
                    offlineRooms.add(roomId);
                }
            }
        }
        byIdentity.computeIfPresent(identityId, (k, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        log.debug("Connection removed: {} (user {}, offline in {})", connectionId, identityId, offlineRooms);
        for (Long roomId : offlineRooms) {
            publish(connection.getIdentity(), roomId, PresenceState.OFFLINE);
        }
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Connection require(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            throw ChatException.unauthenticated();
        }
        return connection;
    }

    public void touch(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touch(System.currentTimeMillis());
        }
    }

    /** Live connections subscribed to the room right now. */
    public List<Connection> subscribersOf(Long roomId) {
        return resolve(byRoom.getOrDefault(roomId, Set.of()));
    }

    public List<Connection> connectionsOf(Long identityId) {
        return resolve(byIdentity.getOrDefault(identityId, Set.of()));
    }

    public boolean isOnline(Long identityId) {
        return byIdentity.containsKey(identityId);
    }

    /** Identities with at least one connection subscribed to the room. */
    public Set<Long> identitiesSubscribedTo(Long roomId) {
        Map<Long, Integer> counts = roomPresence.get(roomId);
        return counts == null ? Set.of() : Set.copyOf(counts.keySet());
    }

    public int size() {
        return connections.size();
    }

    private List<Connection> resolve(Collection<String> ids) {
        return ids.stream()
                .map(connections::get)
                .filter(c -> c != null && !c.isClosed())
                .collect(Collectors.toList());
    }

    // The add happens inside compute so a concurrent removal of the emptied set cannot orphan it
    private static void index(Map<Long, Set<String>> index, Long key, String connectionId) {
        index.compute(key, (k, ids) -> {
            Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
            set.add(connectionId);
            return set;
        });
    }

    // Returns true when this was the identity's last connection in the room
    private boolean detach(String connectionId, Long identityId, Long roomId) {
        byRoom.computeIfPresent(roomId, (k, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        return adjustPresence(roomId, identityId, -1) == 0;
    }

    private int adjustPresence(Long roomId, Long identityId, int delta) {
        int[] result = new int[1];
        roomPresence.compute(roomId, (k, counts) -> {
            Map<Long, Integer> map = counts != null ? counts : new ConcurrentHashMap<>();
            int updated = Math.max(0, map.getOrDefault(identityId, 0) + delta);
            if (updated == 0) {
                map.remove(identityId);
            } else {
                map.put(identityId, updated);
            }
            result[0] = updated;
            return map.isEmpty() ? null : map;
        });
        return result[0];
    }

    private void publish(Identity identity, Long roomId, PresenceState state) {
        try {
            eventPublisher.publishEvent(new PresenceTransitionEvent(identity, roomId, state));
        } catch (RuntimeException e) {
            log.warn("Presence transition {} for user {} in room {} was not published: {}",
                    state, identity.getId(), roomId, e.getMessage());
        }
    }
}
