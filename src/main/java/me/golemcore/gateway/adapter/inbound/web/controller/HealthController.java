package me.golemcore.gateway.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import me.golemcore.gateway.port.outbound.CachePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Service health with the status of each dependency.
 *
 * <p>
 * Overall status is {@code ok} when every dependency answers, {@code degraded}
 * when some do and {@code unhealthy} when none does. The response is always
 * 200 so load balancers can read the body.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    static final String STATUS_OK = "ok";
    static final String STATUS_ERROR = "error";
    static final String STATUS_DEGRADED = "degraded";
    static final String STATUS_UNHEALTHY = "unhealthy";

    private final Optional<CachePort> cachePort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(this::check)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private HealthResponse check() {
        Map<String, HealthResponse.DependencyStatus> dependencies = new LinkedHashMap<>();
        dependencies.put("cache", checkCache());

        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        return HealthResponse.builder()
                .status(overallStatus(dependencies))
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .dependencies(dependencies)
                .build();
    }

    private HealthResponse.DependencyStatus checkCache() {
        if (cachePort.isEmpty()) {
            return error("Not configured");
        }
        long started = System.nanoTime();
        try {
            if (!cachePort.get().ping()) {
                return error("Ping failed");
            }
        } catch (CacheUnavailableException e) {
            return error(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Health] Cache ping failed: {}", e.getMessage());
            return error("Ping failed");
        }
        double latencyMs = (System.nanoTime() - started) / 1_000_000.0;
        return HealthResponse.DependencyStatus.builder()
                .status(STATUS_OK)
                .latencyMs(Math.round(latencyMs * 100.0) / 100.0)
                .build();
    }

    private static HealthResponse.DependencyStatus error(String message) {
        return HealthResponse.DependencyStatus.builder()
                .status(STATUS_ERROR)
                .error(message)
                .build();
    }

    private static String overallStatus(Map<String, HealthResponse.DependencyStatus> dependencies) {
        long healthy = dependencies.values().stream()
                .filter(dependency -> STATUS_OK.equals(dependency.getStatus()))
                .count();
        if (healthy == dependencies.size()) {
            return STATUS_OK;
        }
        return healthy > 0 ? STATUS_DEGRADED : STATUS_UNHEALTHY;
    }
}
