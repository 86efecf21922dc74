package com.devhub.chat.registry;

import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.model.EventType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Collects delivered events for assertions. */
public class RecordingConnectionHandle implements ConnectionHandle {

    private final List<ChatEvent> events = new ArrayList<>();
    private boolean failing;

    @Override
    public synchronized void deliver(ChatEvent event) {
        if (failing) {
            throw new IllegalStateException("socket closed");
        }
        events.add(event);
    }

    public synchronized List<ChatEvent> events() {
        return new ArrayList<>(events);
    }

    public synchronized List<ChatEvent> events(EventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    public synchronized void clear() {
        events.clear();
    }

    public synchronized void failing(boolean failing) {
        this.failing = failing;
    }
}
