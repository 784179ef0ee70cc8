package com.p14n.amqpsub.iterator;

import com.p14n.amqpsub.errors.ConcurrentPullException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-producer, single-consumer bridge from push-style delivery to
 * pull-style consumption.
 *
 * <p>
 * Values pushed while a pull is pending are handed straight to that pull;
 * otherwise they are buffered in arrival order. At most one pull may be
 * outstanding. {@link #close()} is terminal: a pending pull resolves with
 * {@link Next#end()} and anything still buffered is discarded.
 * </p>
 *
 * <p>
 * Push, pull and close may be called from different threads. Futures are
 * always completed outside the internal lock, so callbacks chained on a pull
 * never run while the iterator is locked.
 * </p>
 *
 * @param <T> the value type
 */
public class PullIterator<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<T> buffer = new ArrayDeque<>();
    private final int capacity;
    private CompletableFuture<Next<T>> pendingRead;
    private boolean closed;

    /**
     * Creates an iterator with an unbounded buffer.
     */
    public PullIterator() {
        this(Integer.MAX_VALUE);
    }

    /**
     * Creates an iterator that refuses to buffer more than {@code capacity}
     * values.
     *
     * @param capacity the maximum buffer size
     */
    public PullIterator(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Offers a value to the consumer.
     *
     * @param value the value, never null
     * @return true if the value was delivered or buffered, false if the
     *         iterator is closed and the value was dropped
     * @throws IllegalStateException if the buffer is at capacity
     */
    public boolean push(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        CompletableFuture<Next<T>> waiter;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            waiter = pendingRead;
            pendingRead = null;
            if (waiter == null || waiter.isDone()) {
                if (buffer.size() >= capacity) {
                    throw new IllegalStateException("buffer is full (" + capacity + ")");
                }
                buffer.addLast(value);
                return true;
            }
        } finally {
            lock.unlock();
        }
        if (!waiter.complete(Next.of(value))) {
            // the reader abandoned its future between the check and now
            return restore(value);
        }
        return true;
    }

    /**
     * Puts back a value that was handed to a reader who abandoned it, ahead
     * of anything buffered since. Capacity is not checked, the value was
     * already counted when it was first pushed.
     *
     * @param value the value, never null
     * @return false if the iterator is closed and the value was dropped
     */
    public boolean restore(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        CompletableFuture<Next<T>> waiter;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            waiter = pendingRead;
            pendingRead = null;
            if (waiter == null || waiter.isDone()) {
                buffer.addFirst(value);
                return true;
            }
        } finally {
            lock.unlock();
        }
        if (!waiter.complete(Next.of(value))) {
            return restore(value);
        }
        return true;
    }

    /**
     * Requests the next value.
     *
     * @return a future completed with the next value, or with
     *         {@link Next#end()} once closed. Fails with
     *         {@link ConcurrentPullException} if a pull is already pending.
     */
    public CompletableFuture<Next<T>> pull() {
        lock.lock();
        try {
            T head = buffer.pollFirst();
            if (head != null) {
                return CompletableFuture.completedFuture(Next.of(head));
            }
            if (closed) {
                return CompletableFuture.completedFuture(Next.end());
            }
            if (pendingRead != null && !pendingRead.isDone()) {
                return CompletableFuture.failedFuture(new ConcurrentPullException());
            }
            pendingRead = new CompletableFuture<>();
            return pendingRead;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the iterator. Safe to call multiple times.
     *
     * @return the values that were buffered and will never be delivered;
     *         empty if already closed
     */
    public List<T> close() {
        CompletableFuture<Next<T>> waiter;
        List<T> discarded;
        lock.lock();
        try {
            if (closed) {
                return List.of();
            }
            closed = true;
            waiter = pendingRead;
            pendingRead = null;
            discarded = new ArrayList<>(buffer);
            buffer.clear();
        } finally {
            lock.unlock();
        }
        if (waiter != null) {
            waiter.complete(Next.end());
        }
        return discarded;
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
     * @return the number of buffered values
     */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true while a pull is waiting for a value
     */
    public boolean hasPendingRead() {
        lock.lock();
        try {
            return pendingRead != null && !pendingRead.isDone();
        } finally {
            lock.unlock();
        }
    }
}
