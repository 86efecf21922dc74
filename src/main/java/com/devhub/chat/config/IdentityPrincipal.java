package com.devhub.chat.config;

import com.devhub.chat.model.Identity;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.security.Principal;

/**
 * STOMP session user. The name is the identity id so user destinations resolve per user.
 */
@Getter
@EqualsAndHashCode
public class IdentityPrincipal implements Principal {

    private final Identity identity;

    public IdentityPrincipal(Identity identity) {
        this.identity = identity;
    }

    @Override
    public String getName() {
        return String.valueOf(identity.getId());
    }
}
