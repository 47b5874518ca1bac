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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import me.golemcore.gateway.port.outbound.CachePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans and startup logging.
 *
 * <p>
 * Provides the {@link Clock}, the application {@link ObjectMapper} and the
 * bounded executor that runs stream producers. On startup logs the selected
 * cache backend and runtime adapter so a misconfigured replica is visible in
 * the first lines of its log.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final ObjectProvider<CachePort> cachePortProvider;
    private final ObjectProvider<AgentRuntimePort> runtimePortProvider;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "streamProducerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService streamProducerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getStream().getProducerThreads(), r -> {
            Thread t = new Thread(r, "stream-producer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Agent Gateway v{} starting...", version);
        log.info("Default model: {}", properties.getDefaultModel());
        CachePort cache = cachePortProvider.getIfAvailable();
        log.info("Shared cache: {}", cache != null ? cache.getClass().getSimpleName() : "none");
        AgentRuntimePort runtime = runtimePortProvider.getIfAvailable();
        log.info("Agent runtime: {}", runtime != null ? runtime.getClass().getSimpleName() : "none");
        if (properties.getArchive().isEnabled()) {
            log.info("Session archive: {}", properties.getStorage().getBasePath());
        }
    }
}
