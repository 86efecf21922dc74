package com.devhub.chat.registry;

import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.Identity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One live transport session. Mutations are serialized on the instance monitor.
 */
@Slf4j
public class Connection {

    @Getter
    private final String id;
    @Getter
    private final Identity identity;
    private final ConnectionHandle handle;
    @Getter
    private volatile long lastActivityAt;

    // guarded by this
    private final Set<Long> rooms = new LinkedHashSet<>();
    private boolean closed;

    Connection(String id, Identity identity, ConnectionHandle handle, long now) {
        this.id = id;
        this.identity = identity;
        this.handle = handle;
        this.lastActivityAt = now;
    }

    public Long getIdentityId() {
        return identity.getId();
    }

    public synchronized ConnectionState getState() {
        if (closed) {
            return ConnectionState.CLOSED;
        }
        return rooms.isEmpty() ? ConnectionState.ADMITTED : ConnectionState.SUBSCRIBED;
    }

    public synchronized boolean isSubscribedTo(Long roomId) {
        return rooms.contains(roomId);
    }

    /**
     * Best-effort push. A failing transport is logged and reported as {@code false},
     * never thrown, so one broken client cannot disturb a fan-out.
     */
    public boolean deliver(ChatEvent event) {
        synchronized (this) {
            if (closed) {
                return false;
            }
        }
        try {
            handle.deliver(event);
            return true;
        } catch (RuntimeException e) {
            log.warn("Delivery of {} to connection {} failed: {}", event.getType(), id, e.getMessage());
            return false;
        }
    }

    void touch(long now) {
        lastActivityAt = now;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    // Callers hold the monitor
    boolean addRoom(Long roomId) {
        return rooms.add(roomId);
    }

    boolean removeRoom(Long roomId) {
        return rooms.remove(roomId);
    }

    /** Marks the connection closed and hands back the rooms it was subscribed to. */
    synchronized Set<Long> close() {
        if (closed) {
            return Set.of();
        }
        closed = true;
        Set<Long> snapshot = Set.copyOf(rooms);
        rooms.clear();
        return snapshot;
    }
}
