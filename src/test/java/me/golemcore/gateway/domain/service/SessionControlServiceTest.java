package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.adapter.outbound.cache.InMemoryCacheAdapter;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.stream.EventStreamGenerator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.RuntimeMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionControlServiceTest {

    private static final String OWNER = "key-a";

    private ActiveSessionTracker tracker;
    private SessionRecordService recordService;
    private QueryStreamService queryStreamService;
    private AgentRuntimePort runtime;
    private SessionControlService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(clock);
        GatewayProperties properties = new GatewayProperties();
        tracker = new ActiveSessionTracker(Optional.of(cache), properties);
        recordService = new SessionRecordService(Optional.of(cache), Optional.empty(),
                new DistributedLockManager(Optional.of(cache), properties), RuntimeMessages.MAPPER, properties,
                clock);
        queryStreamService = mock(QueryStreamService.class);
        runtime = mock(AgentRuntimePort.class);
        service = new SessionControlService(recordService, tracker, queryStreamService, runtime);
    }

    @Test
    void shouldInterruptActiveSession() {
        recordService.create("sonnet", "s1", OWNER, null);
        tracker.register("s1");

        assertTrue(service.interrupt("s1", OWNER));

        assertTrue(tracker.isInterrupted("s1"));
        verify(runtime).stop("s1");
    }

    @Test
    void shouldReportInactiveSession() {
        recordService.create("sonnet", "s1", OWNER, null);

        assertFalse(service.interrupt("s1", OWNER));

        assertFalse(tracker.isInterrupted("s1"));
        verify(runtime, never()).stop(anyString());
    }

    @Test
    void shouldHideForeignSessionOnInterrupt() {
        recordService.create("sonnet", "s1", OWNER, null);
        tracker.register("s1");

        assertThrows(SessionNotFoundException.class, () -> service.interrupt("s1", "key-b"));
        assertFalse(tracker.isInterrupted("s1"));
    }

    @Test
    void shouldInterruptRunningSessionWhoseRecordIsNotYetWritten() {
        tracker.register("fresh", OWNER);

        assertTrue(service.interrupt("fresh", OWNER));
        assertTrue(tracker.isInterrupted("fresh"));
    }

    @Test
    void shouldHideForeignRunningSessionWhoseRecordIsNotYetWritten() {
        tracker.register("fresh", OWNER);

        assertThrows(SessionNotFoundException.class, () -> service.interrupt("fresh", "key-b"));
        assertFalse(tracker.isInterrupted("fresh"));
        verify(runtime, never()).stop(anyString());
    }

    @Test
    void shouldInterruptUnownedRunningSessionForAnyCaller() {
        tracker.register("public");

        assertTrue(service.interrupt("public", "key-b"));
    }

    @Test
    void shouldResumeWithResumeFlag() {
        EventStreamGenerator generator = mock(EventStreamGenerator.class);
        when(queryStreamService.open(any(), eq(OWNER))).thenReturn(generator);

        EventStreamGenerator opened = service.resume("s1", QueryRequest.builder().prompt("again")
                .forkSession(true).build(), OWNER);

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(queryStreamService).open(captor.capture(), eq(OWNER));
        assertSame(generator, opened);
        assertEquals("s1", captor.getValue().getSessionId());
        assertTrue(captor.getValue().isResume());
        assertFalse(captor.getValue().isForkSession());
        assertEquals("again", captor.getValue().getPrompt());
    }

    @Test
    void shouldForkWithForkFlag() {
        EventStreamGenerator generator = mock(EventStreamGenerator.class);
        when(generator.getSessionId()).thenReturn("child");
        when(queryStreamService.open(any(), eq(OWNER))).thenReturn(generator);

        service.fork("parent", QueryRequest.builder().prompt("branch").build(), OWNER);

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(queryStreamService).open(captor.capture(), eq(OWNER));
        assertEquals("parent", captor.getValue().getSessionId());
        assertTrue(captor.getValue().isForkSession());
        assertFalse(captor.getValue().isResume());
    }
}
