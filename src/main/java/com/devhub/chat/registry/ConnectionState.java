package com.devhub.chat.registry;

/**
 * Lifecycle of a connection: {@code UNAUTHENTICATED -> ADMITTED <-> SUBSCRIBED -> CLOSED}.
 * Connections are only registered once admitted, so the registry never holds an
 * {@code UNAUTHENTICATED} one.
 */
public enum ConnectionState {
    UNAUTHENTICATED,
    ADMITTED,
    SUBSCRIBED,
    CLOSED
}
