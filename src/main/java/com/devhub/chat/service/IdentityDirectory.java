package com.devhub.chat.service;

import com.devhub.chat.model.Identity;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * What the chat core needs from the platform's identity/auth service.
 */
public interface IdentityDirectory {

    /**
     * Resolves a bearer credential to the identity it was issued to.
     *
     * @return empty when the credential is missing, unknown or belongs to a disabled account
     */
    Optional<Identity> verify(String credential);

    Optional<Identity> findById(Long id);

    /** Identities for the given ids; unknown ids are absent from the result. */
    Map<Long, Identity> findAllById(Collection<Long> ids);
}
