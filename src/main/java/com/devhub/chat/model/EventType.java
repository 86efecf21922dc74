package com.devhub.chat.model;

/** Kinds of events pushed to a connection's event queue. */
public enum EventType {
    JOINED_ROOM,
    LEFT_ROOM,
    MESSAGE_CREATED,
    MESSAGE_UPDATED,
    MESSAGE_DELETED,
    REACTION_UPDATED,
    TYPING_STARTED,
    TYPING_STOPPED,
    PRESENCE,
    ONLINE_USERS,
    DIRECT_ROOM,
    ERROR
}
