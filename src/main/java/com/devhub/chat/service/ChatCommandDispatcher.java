package com.devhub.chat.service;

import com.devhub.chat.model.ChatCommand;
import com.devhub.chat.model.ChatEvent;
import com.devhub.chat.exception.ErrorKind;
import com.devhub.chat.registry.Connection;
import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.support.SerialExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per-connection inbound queues. Commands of one connection run one after another
 * in arrival order; different connections run in parallel on {@code chatExecutor}.
 */
@Slf4j
@Component
public class ChatCommandDispatcher {

    private final Executor chatExecutor;
    private final ChatCommandHandler handler;
    private final ConnectionRegistry connectionRegistry;

    // connectionId → inbox
    private final Map<String, SerialExecutor> inboxes = new ConcurrentHashMap<>();

    public ChatCommandDispatcher(@Qualifier("chatExecutor") Executor chatExecutor,
                                 ChatCommandHandler handler,
                                 ConnectionRegistry connectionRegistry) {
        this.chatExecutor = chatExecutor;
        this.handler = handler;
        this.connectionRegistry = connectionRegistry;
    }

    public void dispatch(ChatCommand command) {
        String connectionId = command.getConnectionId();
        Optional<Connection> connection = connectionRegistry.find(connectionId);
        if (connection.isEmpty()) {
            log.debug("Ignoring {} from unknown connection {}", command.getOperation(), connectionId);
            return;
        }
        SerialExecutor inbox = inboxes.computeIfAbsent(connectionId, id -> new SerialExecutor(chatExecutor));
        if (connectionRegistry.find(connectionId).isEmpty()) {
            // closed between the two lookups
            inboxes.remove(connectionId, inbox);
            inbox.close();
            return;
        }
        try {
            inbox.execute(() -> handler.handle(command));
        } catch (RejectedExecutionException e) {
            log.warn("Connection {} is overloaded, rejecting {}", connectionId, command.getOperation());
            connection.get().deliver(ChatEvent.error(ErrorKind.TRANSIENT_FAILURE.name(), "Server is busy, please retry"));
        }
    }

    /** Drops the connection's queue; called on disconnect. */
    public void close(String connectionId) {
        SerialExecutor inbox = inboxes.remove(connectionId);
        if (inbox != null) {
            inbox.close();
        }
    }

    int openInboxes() {
        return inboxes.size();
    }
}
