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
import me.golemcore.gateway.domain.exception.MalformedRuntimeMessageException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.DoneReason;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.QueryResponse;
import me.golemcore.gateway.domain.model.RuntimeMessage;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.SessionUpdate;
import me.golemcore.gateway.domain.model.StreamContext;
import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.stream.RuntimeMessageMapper;
import me.golemcore.gateway.domain.stream.SingleQueryAggregator;
import me.golemcore.gateway.domain.stream.StreamOrchestrator;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Runs a query to completion on the calling thread and returns one aggregated
 * response.
 *
 * <p>
 * Events are produced by the same orchestrator and mapper as the streaming
 * path and folded by a {@link SingleQueryAggregator}. Failures end up as a
 * sanitized error block; exception text never reaches the response.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SingleQueryService {

    private static final String ERR_STREAM_PRODUCER_FAILED = "ERR_STREAM_PRODUCER_FAILED";
    private static final String INTERNAL_ERROR = "Internal error";

    private final QueryContextFactory contextFactory;
    private final AgentRuntimePort runtime;
    private final ActiveSessionTracker tracker;
    private final SessionRecordService recordService;
    private final StreamOrchestrator orchestrator;
    private final RuntimeMessageMapper mapper;

    public QueryResponse execute(QueryRequest request, String credential) {
        StreamContext ctx = contextFactory.create(request, credential);
        String sessionId = ctx.getSessionId();
        SingleQueryAggregator aggregator = new SingleQueryAggregator();

        tracker.clearInterrupt(sessionId);
        tracker.register(sessionId, ctx.getOwnerCredential());
        boolean interrupted = false;
        try {
            aggregator.accept(orchestrator.buildInit(ctx, contextFactory.manifest(request)));
            ensureSessionRecord(ctx, aggregator);
            interrupted = consumeRuntime(request, ctx, aggregator);
        } catch (MalformedRuntimeMessageException e) {
            log.error("[Query] Invalid runtime init for session {}: {}", sessionId, e.getMessage());
            ctx.setError(true);
            aggregator.accept(orchestrator.buildError(StreamOrchestrator.INIT_INVALID,
                    "Agent runtime failed to initialize"));
        } catch (RuntimeException e) {
            log.error("[Query] Query failed for session {} errorId={}", sessionId, ERR_STREAM_PRODUCER_FAILED, e);
            ctx.setError(true);
            aggregator.accept(orchestrator.buildError(StreamOrchestrator.AGENT_ERROR, INTERNAL_ERROR));
        } finally {
            unregisterQuietly(sessionId);
        }

        DoneReason reason = DoneReason.COMPLETED;
        if (interrupted) {
            reason = DoneReason.INTERRUPTED;
        } else if (ctx.isError()) {
            reason = DoneReason.ERROR;
        }
        aggregator.accept(orchestrator.buildResult(ctx, ctx.elapsedMillis()));
        aggregator.accept(orchestrator.buildDone(reason));
        updateSessionRecord(ctx);

        log.info("[Query] Session {} finished: {} ({} turn(s))", sessionId, reason.wireName(), ctx.getNumTurns());
        return aggregator.toResponse();
    }

    private boolean consumeRuntime(QueryRequest request, StreamContext ctx, SingleQueryAggregator aggregator) {
        String sessionId = ctx.getSessionId();
        try (Stream<RuntimeMessage> messages = runtime.execute(request, sessionId).toStream(1)) {
            Iterator<RuntimeMessage> iterator = messages.iterator();
            while (iterator.hasNext()) {
                Optional<StreamEvent> event = mapper.mapOrSkip(iterator.next(), ctx);
                if (event.isEmpty()) {
                    continue;
                }
                aggregator.accept(event.get());
                if (tracker.isInterrupted(sessionId)) {
                    log.info("[Query] Interrupt observed for session {}", sessionId);
                    runtime.stop(sessionId);
                    return true;
                }
            }
        }
        return false;
    }

    private void ensureSessionRecord(StreamContext ctx, SingleQueryAggregator aggregator) {
        try {
            recordService.createIfAbsent(ctx.getSessionId(), ctx.getModel(), ctx.getOwnerCredential(),
                    ctx.getParentSessionId());
        } catch (RuntimeException e) {
            log.warn("[Query] Failed to ensure session record for {}: {}", ctx.getSessionId(), e.getMessage());
            ctx.setError(true);
            aggregator.accept(orchestrator.buildError(StreamOrchestrator.SESSION_ERROR,
                    "Session record unavailable"));
        }
    }

    private void updateSessionRecord(StreamContext ctx) {
        SessionUpdate update = SessionUpdate.builder()
                .status(ctx.isError() ? SessionStatus.ERROR : SessionStatus.COMPLETED)
                .turnsIncrement(ctx.getNumTurns())
                .costIncrement(ctx.getTotalCostUsd())
                .build();
        try {
            recordService.update(ctx.getSessionId(), update, ctx.getOwnerCredential());
        } catch (SessionNotFoundException e) {
            log.debug("[Query] No session record to update for {}", ctx.getSessionId());
        } catch (RuntimeException e) {
            log.warn("[Query] Failed to update session record {}: {}", ctx.getSessionId(), e.getMessage());
        }
    }

    private void unregisterQuietly(String sessionId) {
        try {
            tracker.unregister(sessionId);
            tracker.clearInterrupt(sessionId);
        } catch (RuntimeException e) {
            log.warn("[Query] Failed to unregister session {}: {}", sessionId, e.getMessage());
        }
    }
}
