package com.devhub.chat.registry;

import com.devhub.chat.model.Identity;
import com.devhub.chat.model.PresenceState;
import lombok.Value;

/**
 * Published when an identity gains its first, or loses its last, connection
 * subscribed to a room.
 */
@Value
public class PresenceTransitionEvent {
    Identity identity;
    Long roomId;
    PresenceState state;
}
