package me.golemcore.gateway.domain.stream;

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

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.MalformedRuntimeMessageException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.DoneReason;
import me.golemcore.gateway.domain.model.InitManifest;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.RuntimeMessage;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.SessionUpdate;
import me.golemcore.gateway.domain.model.StreamContext;
import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.model.StreamState;
import me.golemcore.gateway.domain.service.ActiveSessionTracker;
import me.golemcore.gateway.domain.service.SessionRecordService;
import me.golemcore.gateway.port.inbound.EventTransport;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Runs one query and turns it into an ordered, bounded event stream.
 *
 * <p>
 * A producer task on the stream executor emits {@code init}, pulls runtime
 * messages one at a time, maps them and pushes the events onto a
 * {@link BoundedEventChannel}. After each pushed event it checks the shared
 * interrupt marker so a stop request can arrive at any replica. A consumer
 * drains the channel either to an {@link EventTransport} ({@link #forward}) or
 * as a demand-driven {@link Flux} ({@link #toFlux}).
 *
 * <p>
 * While the channel is full the producer waits in slices of the poll
 * interval, re-checking the disconnect flag and the interrupt marker between
 * slices. A consumer that takes nothing for the stall timeout is treated as
 * disconnected.
 *
 * <p>
 * However the run ends, {@code result} and {@code done} are the last two
 * events, the active marker is removed exactly once and the session record is
 * updated with the turns and cost of this run.
 */
@Slf4j
public class EventStreamGenerator {

    private static final String ERR_STREAM_PRODUCER_FAILED = "ERR_STREAM_PRODUCER_FAILED";
    private static final String ERR_RUNTIME_MESSAGE_MALFORMED = "ERR_RUNTIME_MESSAGE_MALFORMED";
    private static final String INTERNAL_ERROR = "Internal error";
    private static final Duration DEFAULT_CONSUMER_STALL_TIMEOUT = Duration.ofMinutes(2);

    private final StreamContext ctx;
    private final QueryRequest request;
    private final InitManifest manifest;
    private final AgentRuntimePort runtime;
    private final ActiveSessionTracker tracker;
    private final SessionRecordService recordService;
    private final StreamOrchestrator orchestrator;
    private final RuntimeMessageMapper mapper;
    private final ExecutorService executor;
    private final BoundedEventChannel channel;
    private final Duration pollInterval;
    private final Duration consumerStallTimeout;

    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.STARTING);
    private final AtomicBoolean disconnected = new AtomicBoolean();
    private final AtomicBoolean interruptObserved = new AtomicBoolean();
    private final AtomicBoolean unregistered = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Object producerGuard = new Object();

    private Thread producerThread;
    private volatile DoneReason doneReason;

    @Builder
    private EventStreamGenerator(StreamContext ctx, QueryRequest request, InitManifest manifest,
            AgentRuntimePort runtime, ActiveSessionTracker tracker, SessionRecordService recordService,
            StreamOrchestrator orchestrator, RuntimeMessageMapper mapper, ExecutorService executor,
            int channelCapacity, Duration pollInterval, Duration consumerStallTimeout) {
        this.ctx = ctx;
        this.request = request;
        this.manifest = manifest;
        this.runtime = runtime;
        this.tracker = tracker;
        this.recordService = recordService;
        this.orchestrator = orchestrator;
        this.mapper = mapper;
        this.executor = executor;
        this.channel = new BoundedEventChannel(channelCapacity);
        this.pollInterval = pollInterval;
        this.consumerStallTimeout = consumerStallTimeout != null ? consumerStallTimeout
                : DEFAULT_CONSUMER_STALL_TIMEOUT;
    }

    /**
     * Register the session as active and launch the producer.
     *
     * @throws me.golemcore.gateway.domain.exception.CacheUnavailableException
     *             if the session cannot be registered; nothing has been
     *             started in that case
     */
    public void start() {
        if (!state.compareAndSet(StreamState.STARTING, StreamState.REGISTERED)) {
            throw new IllegalStateException("Stream already started for session " + ctx.getSessionId());
        }
        String sessionId = ctx.getSessionId();
        try {
            tracker.clearInterrupt(sessionId);
            tracker.register(sessionId, ctx.getOwnerCredential());
        } catch (RuntimeException e) {
            abortBeforeStreaming();
            throw e;
        }

        state.set(StreamState.STREAMING);
        try {
            executor.submit(this::runProducer);
        } catch (RejectedExecutionException e) {
            log.error("[Stream] Producer rejected for session {}", sessionId);
            unregisterOnce();
            abortBeforeStreaming();
            throw e;
        }
        log.debug("[Stream] Started session {}", sessionId);
    }

    /**
     * Drain the stream to {@code transport} on the calling thread until
     * {@code done} was sent or the transport disconnected.
     */
    public void forward(EventTransport transport) {
        try {
            while (true) {
                if (transport.isDisconnected()) {
                    onTransportDisconnected();
                    return;
                }
                StreamEvent event = channel.poll(pollInterval);
                if (event == null) {
                    if (channel.isDrained()) {
                        return;
                    }
                    continue;
                }
                try {
                    transport.send(event);
                } catch (RuntimeException e) {
                    log.info("[Stream] Send failed for session {}: {}", ctx.getSessionId(), e.getMessage());
                    onTransportDisconnected();
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onTransportDisconnected();
        }
    }

    /**
     * The stream as a demand-driven flux. Cancelling the subscription counts
     * as a client disconnect.
     */
    public Flux<StreamEvent> toFlux() {
        return Flux.<StreamEvent>generate(sink -> {
            try {
                StreamEvent event = awaitNext();
                if (event == null) {
                    sink.complete();
                } else {
                    sink.next(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sink.complete();
            }
        })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(this::onTransportDisconnected);
    }

    /**
     * Client went away: stop the runtime, flag the session as interrupted for
     * every replica, drop queued events and cancel the producer.
     */
    public void onTransportDisconnected() {
        if (!disconnected.compareAndSet(false, true) || state.get() == StreamState.TERMINATED) {
            return;
        }
        String sessionId = ctx.getSessionId();
        log.info("[Stream] Client disconnected from session {}", sessionId);
        stopRuntimeQuietly();
        try {
            tracker.markInterrupted(sessionId);
        } catch (RuntimeException e) {
            log.warn("[Stream] Failed to mark session {} interrupted: {}", sessionId, e.getMessage());
        }
        channel.clear();
        synchronized (producerGuard) {
            if (producerThread != null) {
                producerThread.interrupt();
            }
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public StreamState state() {
        return state.get();
    }

    public String getSessionId() {
        return ctx.getSessionId();
    }

    /**
     * Reason sent with {@code done}, or {@code null} while still streaming.
     */
    public DoneReason doneReason() {
        return doneReason;
    }

    BoundedEventChannel channel() {
        return channel;
    }

    private void runProducer() {
        synchronized (producerGuard) {
            producerThread = Thread.currentThread();
        }
        StreamEvent pendingError = null;
        try {
            produce();
        } catch (InterruptedException e) {
            interruptObserved.set(true);
        } catch (MalformedRuntimeMessageException e) {
            log.error("[Stream] Invalid runtime init for session {} errorId={}: {} excerpt={}",
                    ctx.getSessionId(), ERR_RUNTIME_MESSAGE_MALFORMED, e.getMessage(), e.getExcerpt());
            ctx.setError(true);
            pendingError = orchestrator.buildError(StreamOrchestrator.INIT_INVALID,
                    "Agent runtime failed to initialize");
        } catch (RuntimeException e) {
            if (disconnected.get() || Thread.currentThread().isInterrupted()) {
                log.debug("[Stream] Producer for session {} stopped after cancel: {}", ctx.getSessionId(),
                        e.getMessage());
                interruptObserved.set(true);
            } else {
                log.error("[Stream] Producer failed for session {} errorId={}", ctx.getSessionId(),
                        ERR_STREAM_PRODUCER_FAILED, e);
                ctx.setError(true);
                pendingError = orchestrator.buildError(StreamOrchestrator.AGENT_ERROR, INTERNAL_ERROR);
            }
        } finally {
            synchronized (producerGuard) {
                producerThread = null;
            }
            // Cancellation is over; the tail must still be written.
            Thread.interrupted();
        }

        boolean interruptedWhileDraining = false;
        try {
            interruptedWhileDraining = drain(pendingError);
        } finally {
            terminate();
        }
        if (interruptedWhileDraining) {
            Thread.currentThread().interrupt();
        }
    }

    private void produce() throws InterruptedException {
        String sessionId = ctx.getSessionId();
        if (!push(orchestrator.buildInit(ctx, manifest))) {
            return;
        }
        ensureSessionRecord();

        try (Stream<RuntimeMessage> messages = runtime.execute(request, sessionId).toStream(1)) {
            Iterator<RuntimeMessage> iterator = messages.iterator();
            while (!disconnected.get() && iterator.hasNext()) {
                Optional<StreamEvent> event = mapper.mapOrSkip(iterator.next(), ctx);
                if (event.isEmpty()) {
                    continue;
                }
                if (!push(event.get())) {
                    return;
                }
                if (tracker.isInterrupted(sessionId)) {
                    observeInterrupt();
                    return;
                }
            }
        }
    }

    private void ensureSessionRecord() throws InterruptedException {
        try {
            recordService.createIfAbsent(ctx.getSessionId(), ctx.getModel(), ctx.getOwnerCredential(),
                    ctx.getParentSessionId());
        } catch (RuntimeException e) {
            log.warn("[Stream] Failed to ensure session record for {}: {}", ctx.getSessionId(), e.getMessage());
            ctx.setError(true);
            push(orchestrator.buildError(StreamOrchestrator.SESSION_ERROR, "Session record unavailable"));
        }
    }

    /**
     * @return false if the event was not queued and the run should end
     */
    private boolean push(StreamEvent event) throws InterruptedException {
        long waitStarted = System.nanoTime();
        while (!channel.offer(event, pollInterval)) {
            if (channel.isClosed() || disconnected.get()) {
                return false;
            }
            if (tracker.isInterrupted(ctx.getSessionId())) {
                observeInterrupt();
                return false;
            }
            if (stalledSince(waitStarted)) {
                log.warn("[Stream] Consumer of session {} took no event for {} ms, cancelling",
                        ctx.getSessionId(), consumerStallTimeout.toMillis());
                onTransportDisconnected();
                return false;
            }
        }
        return true;
    }

    /**
     * Tail variant of {@link #push}: gives up after the stall timeout or a
     * disconnect so the run can always terminate.
     */
    private boolean pushTail(StreamEvent event) throws InterruptedException {
        long waitStarted = System.nanoTime();
        while (!channel.offer(event, pollInterval)) {
            if (disconnected.get() || stalledSince(waitStarted)) {
                return false;
            }
        }
        return true;
    }

    private boolean stalledSince(long waitStartedNanos) {
        return System.nanoTime() - waitStartedNanos >= consumerStallTimeout.toNanos();
    }

    private void observeInterrupt() {
        log.info("[Stream] Interrupt observed for session {}", ctx.getSessionId());
        interruptObserved.set(true);
        stopRuntimeQuietly();
    }

    /**
     * Append error (if any), result and done, then close the channel.
     *
     * @return true if the thread was interrupted while waiting for space
     */
    private boolean drain(StreamEvent pendingError) {
        state.set(StreamState.DRAINING);
        DoneReason reason = resolveDoneReason();
        doneReason = reason;

        List<StreamEvent> tail = new ArrayList<>(3);
        if (pendingError != null) {
            tail.add(pendingError);
        }
        tail.add(orchestrator.buildResult(ctx, ctx.elapsedMillis()));
        tail.add(orchestrator.buildDone(reason));

        boolean interrupted = false;
        boolean abandoned = false;
        for (StreamEvent event : tail) {
            if (disconnected.get() || interrupted || abandoned) {
                offerReplacingBacklog(event);
                continue;
            }
            try {
                if (!pushTail(event)) {
                    abandoned = true;
                    log.warn("[Stream] Dropping backlog of session {} to finish the stream", ctx.getSessionId());
                    offerReplacingBacklog(event);
                }
            } catch (InterruptedException e) {
                interrupted = true;
                offerReplacingBacklog(event);
            }
        }
        channel.close();
        log.debug("[Stream] Session {} drained with reason {}", ctx.getSessionId(), reason.wireName());
        return interrupted;
    }

    private void offerReplacingBacklog(StreamEvent event) {
        if (!channel.offer(event)) {
            channel.clear();
            channel.offer(event);
        }
    }

    private DoneReason resolveDoneReason() {
        if (disconnected.get() || interruptObserved.get()) {
            return DoneReason.INTERRUPTED;
        }
        if (ctx.isError()) {
            return DoneReason.ERROR;
        }
        return DoneReason.COMPLETED;
    }

    private void terminate() {
        try {
            unregisterOnce();
            clearInterruptQuietly();
            updateSessionRecord();
        } finally {
            state.set(StreamState.TERMINATED);
            terminated.countDown();
            log.info("[Stream] Session {} finished: {} ({} turn(s), {} ms)", ctx.getSessionId(),
                    doneReason != null ? doneReason.wireName() : "unknown", ctx.getNumTurns(),
                    ctx.elapsedMillis());
        }
    }

    private void updateSessionRecord() {
        SessionUpdate update = SessionUpdate.builder()
                .status(ctx.isError() ? SessionStatus.ERROR : SessionStatus.COMPLETED)
                .turnsIncrement(ctx.getNumTurns())
                .costIncrement(ctx.getTotalCostUsd())
                .build();
        try {
            recordService.update(ctx.getSessionId(), update, ctx.getOwnerCredential());
        } catch (SessionNotFoundException e) {
            log.debug("[Stream] No session record to update for {}", ctx.getSessionId());
        } catch (RuntimeException e) {
            log.warn("[Stream] Failed to update session record {}: {}", ctx.getSessionId(), e.getMessage());
        }
    }

    private void unregisterOnce() {
        if (!unregistered.compareAndSet(false, true)) {
            return;
        }
        try {
            tracker.unregister(ctx.getSessionId());
        } catch (RuntimeException e) {
            log.warn("[Stream] Failed to unregister session {}: {}", ctx.getSessionId(), e.getMessage());
        }
    }

    private void clearInterruptQuietly() {
        try {
            tracker.clearInterrupt(ctx.getSessionId());
        } catch (RuntimeException e) {
            log.debug("[Stream] Failed to clear interrupt for {}: {}", ctx.getSessionId(), e.getMessage());
        }
    }

    private void stopRuntimeQuietly() {
        try {
            runtime.stop(ctx.getSessionId());
        } catch (RuntimeException e) { // NOSONAR - stop is best-effort
            log.debug("[Stream] Runtime stop failed for {}: {}", ctx.getSessionId(), e.getMessage());
        }
    }

    private void abortBeforeStreaming() {
        channel.close();
        state.set(StreamState.TERMINATED);
        terminated.countDown();
    }

    private StreamEvent awaitNext() throws InterruptedException {
        while (true) {
            StreamEvent event = channel.poll(pollInterval);
            if (event != null) {
                return event;
            }
            if (channel.isDrained()) {
                return null;
            }
        }
    }
}
