package com.devhub.chat.model;

import lombok.Builder;
import lombok.Value;

/** An authenticated user as seen by the chat core. */
@Value
@Builder
public class Identity {
    Long id;
    String displayName;
    String avatar;
}
