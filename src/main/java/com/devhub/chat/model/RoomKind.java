package com.devhub.chat.model;

public enum RoomKind {
    PUBLIC,
    PRIVATE,
    DIRECT
}
