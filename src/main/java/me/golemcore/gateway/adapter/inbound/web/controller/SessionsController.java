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
import me.golemcore.gateway.adapter.inbound.web.dto.SessionDto;
import me.golemcore.gateway.adapter.inbound.web.dto.SessionListResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.SessionStatusResponse;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.SessionPage;
import me.golemcore.gateway.domain.service.SessionControlService;
import me.golemcore.gateway.domain.service.SessionRecordService;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Session browsing and control endpoints. Sessions owned by another
 * credential are reported as not found.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private static final String STATUS_INTERRUPTED = "interrupted";
    private static final String STATUS_NOT_ACTIVE = "not_active";

    private final SessionRecordService recordService;
    private final SessionControlService controlService;

    @GetMapping
    public Mono<ResponseEntity<SessionListResponse>> listSessions(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return Mono.fromCallable(() -> toListResponse(recordService.list(apiKey, page, pageSize)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionDto>> getSession(
            @PathVariable String id,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return Mono.fromCallable(() -> SessionDto.from(recordService.get(id, apiKey)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(
            @PathVariable String id,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return Mono.fromCallable(() -> {
            recordService.delete(id, apiKey);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/interrupt")
    public Mono<ResponseEntity<SessionStatusResponse>> interruptSession(
            @PathVariable String id,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return Mono.fromCallable(() -> controlService.interrupt(id, apiKey))
                .subscribeOn(Schedulers.boundedElastic())
                .map(interrupted -> ResponseEntity.ok(SessionStatusResponse.builder()
                        .sessionId(id)
                        .status(interrupted ? STATUS_INTERRUPTED : STATUS_NOT_ACTIVE)
                        .build()));
    }

    @PostMapping("/{id}/resume")
    public Mono<ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>>> resumeSession(
            @PathVariable String id,
            @RequestBody QueryRequest request,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return ServerSentEvents.open(() -> controlService.resume(id, request, apiKey));
    }

    @PostMapping("/{id}/fork")
    public Mono<ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>>> forkSession(
            @PathVariable String id,
            @RequestBody QueryRequest request,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return ServerSentEvents.open(() -> controlService.fork(id, request, apiKey));
    }

    private static SessionListResponse toListResponse(SessionPage page) {
        return SessionListResponse.builder()
                .sessions(page.sessions().stream().map(SessionDto::from).toList())
                .total(page.total())
                .page(page.page())
                .pageSize(page.pageSize())
                .build();
    }
}
