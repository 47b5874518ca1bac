package me.golemcore.gateway.adapter.outbound.cache;

import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCacheAdapterTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryCacheAdapter cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new InMemoryCacheAdapter(clock);
    }

    @Test
    void shouldExpireValuesAfterTtl() {
        cache.set("k", "v", TTL);
        assertEquals(Optional.of("v"), cache.get("k"));

        clock.advance(TTL);

        assertEquals(Optional.empty(), cache.get("k"));
        assertFalse(cache.exists("k"));
    }

    @Test
    void shouldOnlySetIfAbsentWhileKeyIsLive() {
        assertTrue(cache.setIfAbsent("lock:a", "owner-1", TTL));
        assertFalse(cache.setIfAbsent("lock:a", "owner-2", TTL));

        clock.advance(TTL.plusSeconds(1));

        assertTrue(cache.setIfAbsent("lock:a", "owner-2", TTL));
        assertEquals(Optional.of("owner-2"), cache.get("lock:a"));
    }

    @Test
    void shouldDeleteIfValueOnlyForMatchingOwner() {
        cache.set("lock:a", "owner-1", TTL);

        assertFalse(cache.deleteIfValue("lock:a", "owner-2"));
        assertTrue(cache.exists("lock:a"));
        assertTrue(cache.deleteIfValue("lock:a", "owner-1"));
        assertFalse(cache.exists("lock:a"));
    }

    @Test
    void shouldMaintainSets() {
        cache.addToSet("session:owner:h", "s1");
        cache.addToSet("session:owner:h", "s2");
        cache.addToSet("session:owner:h", "s1");

        assertEquals(Set.of("s1", "s2"), cache.setMembers("session:owner:h"));

        cache.removeFromSet("session:owner:h", "s1");
        cache.removeFromSet("session:owner:h", "s2");

        assertTrue(cache.setMembers("session:owner:h").isEmpty());
        assertFalse(cache.exists("session:owner:h"));
    }

    @Test
    void shouldScanLiveKeysByPrefixUpToLimit() {
        cache.set("session:1", "a", TTL);
        cache.set("session:2", "b", Duration.ofSeconds(1));
        cache.set("session:3", "c", TTL);
        cache.set("other:1", "d", TTL);
        clock.advance(Duration.ofSeconds(2));

        List<String> keys = cache.scanKeys("session:", 10);
        assertEquals(Set.of("session:1", "session:3"), Set.copyOf(keys));

        assertEquals(1, cache.scanKeys("session:", 1).size());
    }

    @Test
    void shouldReportWhetherDeleteRemovedSomething() {
        cache.set("k", "v", TTL);

        assertTrue(cache.delete("k"));
        assertFalse(cache.delete("k"));
    }
}
