package com.devhub.chat.model;

public enum PresenceState {
    ONLINE,
    OFFLINE
}
