package com.devhub.chat.model;

import lombok.Value;

/**
 * One inbound client request, queued on the connection it arrived on.
 */
@Value
public class ChatCommand {

    public enum Operation {
        JOIN,
        SUBSCRIBE,
        UNSUBSCRIBE,
        LEAVE,
        SEND,
        TYPING,
        DIRECT_MESSAGE,
        ONLINE_USERS,
        REACT,
        EDIT,
        DELETE
    }

    String connectionId;
    Identity identity;
    Operation operation;
    ChatDTOs.InboundRequest request;

    @SuppressWarnings("unchecked")
    public <T extends ChatDTOs.InboundRequest> T requestAs(Class<T> type) {
        if (!type.isInstance(request)) {
            throw new IllegalArgumentException(operation + " expects " + type.getSimpleName()
                    + " but got " + (request == null ? "null" : request.getClass().getSimpleName()));
        }
        return (T) request;
    }
}
