package io.avery.dream;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An unbounded FIFO queue of messages, addressed by reference. Any number of threads may {@link #send send} to a
 * mailbox; sends never block. Receivers block until a message arrives or a timeout elapses.
 *
 * <p>Messages sent by a single thread are received in the order they were sent. There is no ordering guarantee across
 * senders. Since the mailbox is unbounded, a sender that outpaces its receivers grows the mailbox without limit.
 *
 * @param <M> the message type
 */
public final class Mailbox<M> {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<M> queue = new ArrayDeque<>();
    
    /**
     * Constructs a new, empty {@code Mailbox}.
     */
    public Mailbox() {
    }
    
    /**
     * Enqueues the message and wakes a waiting receiver, if any. Does not block beyond briefly acquiring the internal
     * lock.
     *
     * @param message the message
     * @throws NullPointerException if message is null
     */
    public void send(M message) {
        Objects.requireNonNull(message);
        lock.lock();
        try {
            queue.offer(message);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Removes and returns the oldest message, waiting as long as necessary for one to arrive.
     *
     * @return the oldest message
     * @throws InterruptedException if interrupted while waiting
     */
    public M receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            M head;
            while ((head = queue.poll()) == null) {
                notEmpty.await();
            }
            return head;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Removes and returns the oldest message, waiting up to the given timeout for one to arrive. Returns {@code null}
     * if the timeout elapsed first. A zero or negative timeout does not wait.
     *
     * @param timeout the maximum time to wait
     * @return the oldest message, or {@code null} if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     * @throws NullPointerException if timeout is null
     */
    public M receive(Duration timeout) throws InterruptedException {
        long nanosRemaining = toNanos(timeout);
        lock.lockInterruptibly();
        try {
            M head;
            while ((head = queue.poll()) == null) {
                if (nanosRemaining <= 0) {
                    return null;
                }
                nanosRemaining = notEmpty.awaitNanos(nanosRemaining);
            }
            return head;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Returns the number of messages currently queued. The result is stale as soon as it is returned, so it is only
     * useful for diagnostics.
     *
     * @return the number of queued messages
     */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
    
    static long toNanos(Duration timeout) {
        Objects.requireNonNull(timeout);
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return timeout.isNegative() ? 0 : Long.MAX_VALUE;
        }
    }
}
