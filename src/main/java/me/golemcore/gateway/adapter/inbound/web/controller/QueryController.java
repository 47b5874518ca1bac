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
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.QueryResponse;
import me.golemcore.gateway.domain.service.QueryStreamService;
import me.golemcore.gateway.domain.service.SingleQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Query endpoints: a live SSE stream or a single aggregated response.
 */
@RestController
@RequestMapping("/api/v1/query")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final QueryStreamService queryStreamService;
    private final SingleQueryService singleQueryService;

    @PostMapping("/stream")
    public Mono<ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>>> stream(
            @RequestBody QueryRequest request,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return ServerSentEvents.open(() -> queryStreamService.open(request, apiKey));
    }

    @PostMapping
    public Mono<ResponseEntity<QueryResponse>> query(
            @RequestBody QueryRequest request,
            @RequestHeader(value = ServerSentEvents.API_KEY_HEADER, required = false) String apiKey) {
        return Mono.fromCallable(() -> singleQueryService.execute(request, apiKey))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
