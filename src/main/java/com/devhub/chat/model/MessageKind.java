package com.devhub.chat.model;

public enum MessageKind {
    TEXT,       // Regular chat message
    IMAGE,      // Image reference in content, details in metadata
    FILE,       // File reference in content, details in metadata
    SYSTEM      // Server notice (join, leave)
}
