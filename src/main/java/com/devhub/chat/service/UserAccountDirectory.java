package com.devhub.chat.service;

import com.devhub.chat.model.Identity;
import com.devhub.chat.model.UserAccount;
import com.devhub.chat.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Identity lookups against the shared {@code user_accounts} table.
 */
@Service
@RequiredArgsConstructor
public class UserAccountDirectory implements IdentityDirectory {

    private static final String BEARER_PREFIX = "Bearer ";

    private final UserAccountRepository userAccountRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> verify(String credential) {
        String token = stripBearer(credential);
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return userAccountRepository.findByAccessTokenAndActiveTrue(token).map(UserAccount::toIdentity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return userAccountRepository.findByIdAndActiveTrue(id).map(UserAccount::toIdentity);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, Identity> findAllById(Collection<Long> ids) {
        return userAccountRepository.findAllById(ids).stream()
                .map(UserAccount::toIdentity)
                .collect(Collectors.toMap(Identity::getId, Function.identity()));
    }

    private String stripBearer(String credential) {
        if (credential == null) {
            return null;
        }
        String trimmed = credential.trim();
        return trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                ? trimmed.substring(BEARER_PREFIX.length()).trim()
                : trimmed;
    }
}
