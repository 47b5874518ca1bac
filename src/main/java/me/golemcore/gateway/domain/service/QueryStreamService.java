package me.golemcore.gateway.domain.service;

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
import me.golemcore.gateway.domain.model.StreamContext;
import me.golemcore.gateway.domain.stream.EventStreamGenerator;
import me.golemcore.gateway.domain.stream.RuntimeMessageMapper;
import me.golemcore.gateway.domain.stream.StreamOrchestrator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;

/**
 * Opens streaming queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryStreamService {

    private final QueryContextFactory contextFactory;
    private final AgentRuntimePort runtime;
    private final ActiveSessionTracker tracker;
    private final SessionRecordService recordService;
    private final StreamOrchestrator orchestrator;
    private final RuntimeMessageMapper mapper;
    private final ExecutorService streamProducerExecutor;
    private final GatewayProperties properties;

    /**
     * Validate the request, register the session and start producing events.
     * The returned generator is already streaming.
     */
    public EventStreamGenerator open(QueryRequest request, String credential) {
        StreamContext ctx = contextFactory.create(request, credential);
        EventStreamGenerator generator = EventStreamGenerator.builder()
                .ctx(ctx)
                .request(request)
                .manifest(contextFactory.manifest(request))
                .runtime(runtime)
                .tracker(tracker)
                .recordService(recordService)
                .orchestrator(orchestrator)
                .mapper(mapper)
                .executor(streamProducerExecutor)
                .channelCapacity(properties.getStream().getChannelCapacity())
                .pollInterval(properties.getStream().getDisconnectPollInterval())
                .consumerStallTimeout(properties.getStream().getConsumerStallTimeout())
                .build();
        generator.start();
        log.info("[Query] Streaming query opened for session {} (model {})", ctx.getSessionId(), ctx.getModel());
        return generator;
    }
}
