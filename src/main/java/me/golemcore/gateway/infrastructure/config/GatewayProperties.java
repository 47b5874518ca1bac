package me.golemcore.gateway.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the agent gateway.
 *
 * <p>
 * All properties live under the {@code gateway.*} prefix. Nested groups:
 * <ul>
 * <li>{@code runtime} - agent runtime adapter selection
 * <li>{@code cache} - shared cache backend selection (memory, redis, none)
 * <li>{@code session} - TTLs of session records and markers
 * <li>{@code lock} - distributed lock acquisition tuning
 * <li>{@code stream} - producer/consumer channel settings
 * <li>{@code archive} - optional durable session copies on local storage
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private String defaultModel = "sonnet";
    private RuntimeProperties runtime = new RuntimeProperties();
    private CacheProperties cache = new CacheProperties();
    private SessionProperties session = new SessionProperties();
    private LockProperties lock = new LockProperties();
    private StreamProperties stream = new StreamProperties();
    private ArchiveProperties archive = new ArchiveProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class RuntimeProperties {
        /**
         * Agent runtime adapter. {@code echo} answers with the prompt itself.
         */
        private String type = "echo";
    }

    @Data
    public static class CacheProperties {
        /**
         * One of {@code memory}, {@code redis} or {@code none}.
         */
        private String type = "memory";
        private int scanLimit = 1000;
    }

    @Data
    public static class SessionProperties {
        private Duration ttl = Duration.ofHours(24);
        private Duration activeTtl = Duration.ofHours(2);
        private Duration interruptTtl = Duration.ofMinutes(5);
        private int maxPageSize = 100;
    }

    @Data
    public static class LockProperties {
        private Duration acquireTimeout = Duration.ofSeconds(5);
        private Duration ttl = Duration.ofSeconds(30);
        private Duration initialBackoff = Duration.ofMillis(10);
        private Duration maxBackoff = Duration.ofMillis(500);
        private double jitter = 0.1;
    }

    @Data
    public static class StreamProperties {
        private int channelCapacity = 100;
        private Duration disconnectPollInterval = Duration.ofMillis(100);
        /**
         * A consumer that takes no event for this long is treated as gone.
         */
        private Duration consumerStallTimeout = Duration.ofMinutes(2);
        private int producerThreads = 16;
    }

    @Data
    public static class ArchiveProperties {
        private boolean enabled = false;
        private String directory = "sessions";
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }
}
