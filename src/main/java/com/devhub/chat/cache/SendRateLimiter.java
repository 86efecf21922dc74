package com.devhub.chat.cache;

import com.devhub.chat.config.ChatProperties;
import com.devhub.chat.exception.ChatException;
import com.devhub.chat.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fixed-window limit on messages per identity. Fails open when the cache is down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SendRateLimiter {

    private final EphemeralCache cache;
    private final ChatProperties properties;

    public void check(Long identityId) {
        long count;
        try {
            count = cache.incrementWithExpiry("chat:rate:send:" + identityId, properties.getRateLimit().getWindow());
        } catch (RuntimeException e) {
            log.warn("Rate limit check skipped for user {}: {}", identityId, e.getMessage());
            return;
        }
        if (count > properties.getRateLimit().getMessages()) {
            log.debug("User {} exceeded the send rate ({} in window)", identityId, count);
            throw new ChatException(ErrorKind.RATE_LIMITED, "You are sending messages too quickly");
        }
    }
}
