package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.adapter.outbound.cache.InMemoryCacheAdapter;
import me.golemcore.gateway.adapter.outbound.runtime.EchoAgentRuntimeAdapter;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.model.StreamEventKind;
import me.golemcore.gateway.domain.stream.EventStreamGenerator;
import me.golemcore.gateway.domain.stream.RuntimeMessageMapper;
import me.golemcore.gateway.domain.stream.StreamOrchestrator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.RuntimeMessages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryStreamServiceTest {

    private static final String OWNER = "key-a";

    private ExecutorService executor;
    private ActiveSessionTracker tracker;
    private SessionRecordService recordService;
    private QueryStreamService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(clock);
        GatewayProperties properties = new GatewayProperties();
        properties.getStream().setDisconnectPollInterval(Duration.ofMillis(20));
        tracker = new ActiveSessionTracker(Optional.of(cache), properties);
        recordService = new SessionRecordService(Optional.of(cache), Optional.empty(),
                new DistributedLockManager(Optional.of(cache), properties), RuntimeMessages.MAPPER, properties,
                clock);
        EchoAgentRuntimeAdapter runtime = new EchoAgentRuntimeAdapter(RuntimeMessages.MAPPER);
        executor = Executors.newFixedThreadPool(2);
        service = new QueryStreamService(new QueryContextFactory(recordService, runtime, properties), runtime,
                tracker, recordService, new StreamOrchestrator(), new RuntimeMessageMapper(RuntimeMessages.MAPPER),
                executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldOpenStreamingGenerator() throws InterruptedException {
        EventStreamGenerator generator = service.open(QueryRequest.builder().prompt("hello").sessionId("s1")
                .build(), OWNER);

        assertEquals("s1", generator.getSessionId());
        StepVerifier.create(generator.toFlux().map(StreamEvent::kind))
                .expectNext(StreamEventKind.INIT, StreamEventKind.MESSAGE, StreamEventKind.RESULT,
                        StreamEventKind.DONE)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertTrue(generator.awaitTermination(Duration.ofSeconds(5)));
        assertFalse(tracker.isActive("s1"));
        assertEquals(1, recordService.get("s1", OWNER).getTotalTurns());
    }

    @Test
    void shouldFailBeforeStreamingForForeignSession() {
        recordService.create("sonnet", "s1", OWNER, null);

        assertThrows(SessionNotFoundException.class, () -> service.open(QueryRequest.builder().prompt("hi")
                .sessionId("s1").resume(true).build(), "key-b"));
        assertFalse(tracker.isActive("s1"));
    }
}
