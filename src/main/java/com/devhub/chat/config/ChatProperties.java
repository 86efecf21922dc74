package com.devhub.chat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables bound from the {@code chat.*} block of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    private Rooms rooms = new Rooms();
    private Messages messages = new Messages();
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Executor executor = new Executor();
    private Seed seed = new Seed();

    /** Interval of STOMP heartbeats in both directions. */
    private Duration heartbeat = Duration.ofSeconds(10);

    @Data
    public static class Rooms {
        private int defaultCapacity = 50;
        private int maxCapacity = 1000;
        private int maxNameLength = 255;
        private int maxDescriptionLength = 1000;
    }

    @Data
    public static class Messages {
        private int maxLength = 4000;
        /** Messages handed to a connection when it joins a room. */
        private int historyLimit = 50;
        private int maxBackfill = 50;
    }

    @Data
    public static class Cache {
        /** {@code memory} or {@code redis}. */
        private String type = "memory";
        private int recentSize = 100;
        private Duration recentTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class RateLimit {
        private int messages = 30;
        private Duration window = Duration.ofSeconds(10);
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 1000;
    }

    @Data
    public static class Seed {
        private boolean enabled;
    }
}
