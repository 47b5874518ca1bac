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

import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.stream.EventStreamGenerator;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Adapts a running {@link EventStreamGenerator} to an SSE response.
 */
final class ServerSentEvents {

    static final String API_KEY_HEADER = "X-API-Key";

    private ServerSentEvents() {
    }

    /**
     * Open a stream off the event loop and wrap it as an SSE response. If the
     * request is cancelled before the body is subscribed, the opened stream is
     * cancelled too.
     */
    static Mono<ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>>> open(
            Callable<EventStreamGenerator> opener) {
        AtomicBoolean cancelled = new AtomicBoolean();
        AtomicReference<EventStreamGenerator> opened = new AtomicReference<>();
        return Mono.fromCallable(() -> {
            EventStreamGenerator generator = opener.call();
            opened.set(generator);
            if (cancelled.get()) {
                generator.onTransportDisconnected();
            }
            return generator;
        })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> {
                    cancelled.set(true);
                    EventStreamGenerator generator = opened.get();
                    if (generator != null) {
                        generator.onTransportDisconnected();
                    }
                })
                .doOnDiscard(EventStreamGenerator.class, EventStreamGenerator::onTransportDisconnected)
                .map(ServerSentEvents::response);
    }

    static ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>> response(EventStreamGenerator generator) {
        Flux<ServerSentEvent<Map<String, Object>>> body = generator.toFlux().map(ServerSentEvents::toServerSentEvent);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header("X-Session-Id", generator.getSessionId())
                .body(body);
    }

    static ServerSentEvent<Map<String, Object>> toServerSentEvent(StreamEvent event) {
        return ServerSentEvent.builder(event.payload())
                .event(event.kind().wireName())
                .build();
    }
}
