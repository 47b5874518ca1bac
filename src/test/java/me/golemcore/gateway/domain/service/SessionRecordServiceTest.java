package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.adapter.outbound.cache.InMemoryCacheAdapter;
import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.SessionPage;
import me.golemcore.gateway.domain.model.SessionRecord;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.SessionUpdate;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SessionArchivePort;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRecordServiceTest {

    private static final String OWNER = "key-a";
    private static final String OTHER = "key-b";

    private MutableClock clock;
    private InMemoryCacheAdapter cache;
    private GatewayProperties properties;
    private SessionRecordService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new InMemoryCacheAdapter(clock);
        properties = new GatewayProperties();
        service = newService(Optional.empty());
    }

    private SessionRecordService newService(Optional<SessionArchivePort> archive) {
        return new SessionRecordService(Optional.of(cache), archive,
                new DistributedLockManager(Optional.of(cache), properties),
                AutoConfiguration.objectMapper(), properties, clock);
    }

    @Test
    void shouldCreateRecordWithOwnerHash() {
        SessionRecord created = service.create("sonnet", "s1", OWNER, null);

        assertEquals("s1", created.getId());
        assertEquals(SessionStatus.ACTIVE, created.getStatus());
        assertEquals(OwnerHashSupport.hash(OWNER), created.getOwnerHash());
        assertEquals(clock.instant(), created.getCreatedAt());
        assertTrue(cache.exists("session:s1"));
        assertTrue(cache.setMembers("session:owner:" + created.getOwnerHash()).contains("s1"));
    }

    @Test
    void shouldGenerateIdWhenNoneGiven() {
        SessionRecord created = service.create("sonnet", null, null, null);

        assertNotNull(created.getId());
        assertNull(created.getOwnerHash());
    }

    @Test
    void shouldReportForeignAndMissingSessionsIdentically() {
        service.create("sonnet", "s1", OWNER, null);

        SessionNotFoundException foreign = assertThrows(SessionNotFoundException.class,
                () -> service.get("s1", OTHER));
        SessionNotFoundException missing = assertThrows(SessionNotFoundException.class,
                () -> service.get("nope", OTHER));

        assertEquals(missing.getMessage(), foreign.getMessage());
        assertEquals(SessionNotFoundException.MESSAGE, foreign.getMessage());
    }

    @Test
    void shouldAllowOwnerAndUnfilteredAccess() {
        service.create("sonnet", "s1", OWNER, null);

        assertEquals("s1", service.get("s1", OWNER).getId());
        assertEquals("s1", service.get("s1", null).getId());
        assertEquals("s1", service.get("s1", "").getId());
    }

    @Test
    void shouldTreatUnownedRecordAsPublic() {
        service.create("sonnet", "s1", null, null);

        assertEquals("s1", service.get("s1", OTHER).getId());
    }

    @Test
    void shouldReturnExistingRecordFromCreateIfAbsent() {
        SessionRecord first = service.createIfAbsent("s1", "sonnet", OWNER, null);
        clock.advance(Duration.ofMinutes(1));

        SessionRecord second = service.createIfAbsent("s1", "opus", OWNER, null);

        assertEquals(first.getCreatedAt(), second.getCreatedAt());
        assertEquals("sonnet", second.getModel());
    }

    @Test
    void shouldApplyUpdateAndBumpUpdatedAt() {
        service.create("sonnet", "s1", OWNER, null);
        clock.advance(Duration.ofSeconds(10));

        SessionRecord updated = service.update("s1", SessionUpdate.builder()
                .status(SessionStatus.COMPLETED)
                .turnsIncrement(2)
                .costIncrement(0.5)
                .build(), OWNER);

        assertEquals(SessionStatus.COMPLETED, updated.getStatus());
        assertEquals(2, updated.getTotalTurns());
        assertEquals(0.5, updated.getTotalCostUsd(), 1e-9);
        assertEquals(clock.instant(), updated.getUpdatedAt());
        assertEquals(2, service.get("s1", OWNER).getTotalTurns());
    }

    @Test
    void shouldRejectUpdateByOtherOwner() {
        service.create("sonnet", "s1", OWNER, null);

        assertThrows(SessionNotFoundException.class,
                () -> service.update("s1", SessionUpdate.incrementTurns(1), OTHER));
        assertEquals(0, service.get("s1", OWNER).getTotalTurns());
    }

    @Test
    void shouldNotLoseConcurrentIncrements() throws Exception {
        service.create("sonnet", "s1", OWNER, null);
        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            List<Future<SessionRecord>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(pool.submit(() -> service.update("s1", SessionUpdate.incrementTurns(1), OWNER)));
            }
            for (Future<SessionRecord> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(10, service.get("s1", OWNER).getTotalTurns());
    }

    @Test
    void shouldDeleteRecordAndOwnerIndexEntry() {
        SessionRecord created = service.create("sonnet", "s1", OWNER, null);

        service.delete("s1", OWNER);

        assertFalse(service.exists("s1"));
        assertFalse(cache.setMembers("session:owner:" + created.getOwnerHash()).contains("s1"));
        assertThrows(SessionNotFoundException.class, () -> service.get("s1", OWNER));
    }

    @Test
    void shouldRejectDeleteByOtherOwner() {
        service.create("sonnet", "s1", OWNER, null);

        assertThrows(SessionNotFoundException.class, () -> service.delete("s1", OTHER));
        assertTrue(service.exists("s1"));
    }

    @Test
    void shouldListOwnSessionsNewestFirstWithPagination() {
        for (int i = 1; i <= 5; i++) {
            service.create("sonnet", "s" + i, OWNER, null);
            clock.advance(Duration.ofSeconds(1));
        }
        service.create("sonnet", "foreign", OTHER, null);

        SessionPage first = service.list(OWNER, 1, 2);
        SessionPage last = service.list(OWNER, 3, 2);

        assertEquals(5, first.total());
        assertEquals(List.of("s5", "s4"), first.sessions().stream().map(SessionRecord::getId).toList());
        assertEquals(List.of("s1"), last.sessions().stream().map(SessionRecord::getId).toList());
        assertTrue(service.list(OWNER, 4, 2).sessions().isEmpty());
    }

    @Test
    void shouldPruneExpiredSessionsFromOwnerIndex() {
        SessionRecord created = service.create("sonnet", "s1", OWNER, null);
        clock.advance(properties.getSession().getTtl());
        service.create("sonnet", "s2", OWNER, null);

        SessionPage page = service.list(OWNER, 1, 10);

        assertEquals(1, page.total());
        assertEquals("s2", page.sessions().get(0).getId());
        assertFalse(cache.setMembers("session:owner:" + created.getOwnerHash()).contains("s1"));
    }

    @Test
    void shouldListAllSessionsWithoutCredential() {
        service.create("sonnet", "s1", OWNER, null);
        service.create("sonnet", "s2", OTHER, null);
        service.create("sonnet", "s3", null, null);

        assertEquals(3, service.list(null, 1, 10).total());
    }

    @Test
    void shouldValidatePaging() {
        assertThrows(IllegalArgumentException.class, () -> service.list(OWNER, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> service.list(OWNER, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> service.list(OWNER, 1, 101));
    }

    @Test
    void shouldDiscardCorruptCacheEntry() {
        cache.set("session:bad", "{not json", Duration.ofHours(1));

        assertThrows(SessionNotFoundException.class, () -> service.get("bad", null));
        assertFalse(cache.exists("session:bad"));
    }

    @Test
    void shouldRestoreFromArchiveWhenCacheMisses() {
        SessionArchivePort archive = mock(SessionArchivePort.class);
        SessionRecord archived = SessionRecord.builder()
                .id("old")
                .model("sonnet")
                .ownerHash(OwnerHashSupport.hash(OWNER))
                .createdAt(clock.instant())
                .build();
        when(archive.load("old")).thenReturn(Optional.of(archived));
        SessionRecordService withArchive = newService(Optional.of(archive));

        assertEquals("old", withArchive.get("old", OWNER).getId());
        assertTrue(cache.exists("session:old"));
        assertThrows(SessionNotFoundException.class, () -> withArchive.get("old", OTHER));
    }

    @Test
    void shouldWriteThroughToArchive() {
        SessionArchivePort archive = mock(SessionArchivePort.class);
        SessionRecordService withArchive = newService(Optional.of(archive));

        SessionRecord created = withArchive.create("sonnet", "s1", OWNER, null);
        withArchive.delete("s1", OWNER);

        verify(archive).save(created);
        verify(archive).delete("s1");
    }

    @Test
    void shouldNotCacheWhenArchiveWriteFails() {
        SessionArchivePort archive = mock(SessionArchivePort.class);
        doThrow(new IllegalStateException("disk full")).when(archive)
                .save(any());
        SessionRecordService withArchive = newService(Optional.of(archive));

        assertThrows(IllegalStateException.class, () -> withArchive.create("sonnet", "s1", OWNER, null));
        assertFalse(cache.exists("session:s1"));
    }

    @Test
    void shouldFailWithoutCache() {
        SessionRecordService noCache = new SessionRecordService(Optional.empty(), Optional.empty(),
                new DistributedLockManager(Optional.empty(), properties), AutoConfiguration.objectMapper(),
                properties, clock);

        assertThrows(CacheUnavailableException.class, () -> noCache.create("sonnet", "s1", OWNER, null));
        assertThrows(CacheUnavailableException.class, () -> noCache.get("s1", OWNER));
    }

    @Test
    void shouldPassOwnerGateForMatchingCredential() {
        SessionRecord sessionRecord = SessionRecord.builder().id("s1").ownerHash(OwnerHashSupport.hash(OWNER))
                .build();

        assertSame(sessionRecord, service.enforceOwner(sessionRecord, OWNER));
        assertThrows(SessionNotFoundException.class, () -> service.enforceOwner(sessionRecord, OTHER));
    }

    @Test
    void shouldCheckArchiveInExists() {
        SessionArchivePort archive = mock(SessionArchivePort.class);
        when(archive.load("old")).thenReturn(Optional.of(SessionRecord.builder().id("old").build()));
        SessionRecordService withArchive = newService(Optional.of(archive));

        assertTrue(withArchive.exists("old"));
        assertFalse(withArchive.exists("other"));
        verify(archive, never()).save(any());
    }
}
