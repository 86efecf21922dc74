package com.devhub.chat.registry;

import com.devhub.chat.model.ChatEvent;

/**
 * Outbound side of one transport session.
 */
@FunctionalInterface
public interface ConnectionHandle {

    /**
     * Pushes an event to the client. Must not block on the network; implementations
     * hand the event to the transport's own outbound queue.
     */
    void deliver(ChatEvent event);
}
