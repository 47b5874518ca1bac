package me.golemcore.gateway.domain.stream;

import me.golemcore.gateway.domain.model.StreamEvent;
import me.golemcore.gateway.domain.model.StreamEventKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedEventChannelTest {

    private static final Duration SHORT = Duration.ofMillis(20);

    private static StreamEvent event(int n) {
        return StreamEvent.of(StreamEventKind.MESSAGE, Map.of("n", n));
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedEventChannel(0));
    }

    @Test
    void shouldDeliverInOrder() throws InterruptedException {
        BoundedEventChannel channel = new BoundedEventChannel(3);
        channel.put(event(1));
        channel.put(event(2));

        assertEquals(1, channel.poll(SHORT).get("n"));
        assertEquals(2, channel.poll(SHORT).get("n"));
        assertNull(channel.poll(SHORT));
    }

    @Test
    void shouldRefuseOfferWhenFull() {
        BoundedEventChannel channel = new BoundedEventChannel(1);

        assertTrue(channel.offer(event(1)));
        assertFalse(channel.offer(event(2)));
        assertEquals(1, channel.highWaterMark());
    }

    @Test
    void shouldBlockProducerUntilSpaceIsAvailable() throws InterruptedException {
        BoundedEventChannel channel = new BoundedEventChannel(1);
        channel.put(event(1));
        AtomicBoolean secondPut = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                secondPut.set(channel.put(event(2)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        producer.start();

        assertFalse(done.await(100, TimeUnit.MILLISECONDS));
        assertEquals(1, channel.poll(SHORT).get("n"));
        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertTrue(secondPut.get());
        assertEquals(2, channel.poll(SHORT).get("n"));
        assertEquals(1, channel.highWaterMark());
    }

    @Test
    void shouldKeepQueuedEventsReadableAfterClose() throws InterruptedException {
        BoundedEventChannel channel = new BoundedEventChannel(2);
        channel.put(event(1));
        channel.close();

        assertFalse(channel.put(event(2)));
        assertFalse(channel.isDrained());
        assertEquals(1, channel.poll(SHORT).get("n"));
        assertTrue(channel.isDrained());
        assertNull(channel.poll(Duration.ofSeconds(5)));
    }

    @Test
    void shouldReleaseBlockedProducerOnClose() throws InterruptedException {
        BoundedEventChannel channel = new BoundedEventChannel(1);
        channel.put(event(1));
        AtomicBoolean accepted = new AtomicBoolean(true);
        CountDownLatch done = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                accepted.set(channel.put(event(2)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        producer.start();
        channel.close();

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertFalse(accepted.get());
    }

    @Test
    void shouldDropBacklogOnClear() throws InterruptedException {
        BoundedEventChannel channel = new BoundedEventChannel(2);
        channel.put(event(1));
        channel.put(event(2));

        channel.clear();

        assertEquals(0, channel.size());
        assertTrue(channel.offer(event(3)));
        assertEquals(3, channel.poll(SHORT).get("n"));
    }
}
