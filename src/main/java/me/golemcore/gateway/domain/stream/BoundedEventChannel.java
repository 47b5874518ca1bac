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

import me.golemcore.gateway.domain.model.StreamEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO hand-off between a stream producer and its consumer.
 *
 * <p>
 * Holds at most {@code capacity} events: {@link #put} blocks the producer
 * while the channel is full. End of stream is signalled by {@link #close()},
 * after which the consumer drains what is left and {@link #poll} returns
 * {@code null}.
 */
public class BoundedEventChannel {

    private final int capacity;
    private final Deque<StreamEvent> events;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();

    private boolean closed;
    private int highWaterMark;

    public BoundedEventChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    /**
     * Append an event, waiting for space.
     *
     * @return false if the channel was closed and the event dropped
     */
    public boolean put(StreamEvent event) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (events.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            enqueue(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append an event without waiting.
     *
     * @return false if the channel is full or closed
     */
    public boolean offer(StreamEvent event) {
        lock.lock();
        try {
            if (closed || events.size() >= capacity) {
                return false;
            }
            enqueue(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append an event, waiting up to {@code timeout} for space.
     *
     * @return false on timeout or if the channel is closed
     */
    public boolean offer(StreamEvent event, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (events.size() >= capacity && !closed) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = notFull.awaitNanos(remaining);
            }
            if (closed) {
                return false;
            }
            enqueue(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the next event, waiting up to {@code timeout}.
     *
     * @return the event, or {@code null} on timeout or once the channel is
     *         closed and empty
     */
    public StreamEvent poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (events.isEmpty()) {
                if (closed || remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            StreamEvent event = events.pollFirst();
            notFull.signal();
            return event;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark end of stream. Events already queued remain readable.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop all queued events and release a blocked producer.
     */
    public void clear() {
        lock.lock();
        try {
            events.clear();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closed and fully consumed.
     */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && events.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Largest number of events ever queued at once.
     */
    public int highWaterMark() {
        lock.lock();
        try {
            return highWaterMark;
        } finally {
            lock.unlock();
        }
    }

    private void enqueue(StreamEvent event) {
        events.addLast(event);
        highWaterMark = Math.max(highWaterMark, events.size());
        notEmpty.signal();
    }
}
