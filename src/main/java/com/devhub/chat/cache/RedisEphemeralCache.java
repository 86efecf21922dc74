package com.devhub.chat.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Cache shared by every application node through Redis.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.cache.type", havingValue = "redis")
public class RedisEphemeralCache implements EphemeralCache {

    private final StringRedisTemplate redis;

    public RedisEphemeralCache(StringRedisTemplate redis) {
        this.redis = redis;
        log.info("Using Redis ephemeral cache");
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redis.delete(key);
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        Long value = redis.opsForValue().increment(key);
        if (value == null) {
            throw new IllegalStateException("INCR returned no value for " + key);
        }
        if (value == 1L) {
            redis.expire(key, ttl);
        }
        return value;
    }

    @Override
    public void appendToList(String key, String value, int maxLength, Duration ttl) {
        redis.opsForList().rightPush(key, value);
        redis.opsForList().trim(key, -maxLength, -1);
        redis.expire(key, ttl);
    }

    @Override
    public List<String> listRange(String key) {
        List<String> values = redis.opsForList().range(key, 0, -1);
        return values == null ? List.of() : values;
    }

    @Override
    public void replaceList(String key, List<String> values, Duration ttl) {
        redis.delete(key);
        if (!values.isEmpty()) {
            redis.opsForList().rightPushAll(key, values);
            redis.expire(key, ttl);
        }
    }
}
