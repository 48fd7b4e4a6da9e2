package io.avery.dream;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A handle to a mailbox carrying a sequence of elements followed by an end marker. Producers {@link #write write}
 * elements and eventually {@link #close close} the stream; consumers block on {@link #next()} until an element or the
 * end marker arrives.
 *
 * <p>A stream is not a data structure. It has no buffer beyond its mailbox, cannot be indexed or replayed, and each
 * successful read permanently removes one element. Any number of threads may write to a stream; elements written by
 * one thread are read in the order that thread wrote them, with no ordering guarantee across writers. Writes never
 * block, and the mailbox is unbounded, so a producer that outpaces its consumers grows the mailbox without limit.
 *
 * <p>Exactly one {@code close} is meaningful per stream. Closing twice enqueues a second end marker, which a single
 * sequential reader never observes as anything but another end; avoiding this is the caller's responsibility.
 *
 * <p>Reads that time out are indistinguishable from reads that saw the end marker through {@link #next()} and
 * {@link #next(Duration)}, which both return an empty optional. Callers that need to tell the two apart use
 * {@link #receive(Duration)}.
 *
 * <p>Elements must not be null.
 *
 * @param <T> the element type
 */
public final class Stream<T> implements AutoCloseable {
    private final Mailbox<Message<T>> mailbox;
    
    private Stream() {
        this.mailbox = new Mailbox<>();
    }
    
    /**
     * Returns a new, empty, open stream.
     *
     * @return a new stream
     * @param <T> the element type
     */
    public static <T> Stream<T> create() {
        return new Stream<>();
    }
    
    /**
     * Enqueues an element without blocking.
     *
     * @param value the element
     * @throws NullPointerException if value is null
     */
    public void write(T value) {
        mailbox.send(new Message.Value<>(value));
    }
    
    /**
     * Enqueues the end marker without blocking. Elements written afterward by the same thread are never read by a
     * sequential reader that stops at the end marker.
     */
    @Override
    public void close() {
        mailbox.send(new Message.End<>());
    }
    
    /**
     * Removes and returns the next element, waiting up to the {@linkplain Defaults#readTimeout() default read
     * timeout}. Returns an empty optional if the end marker was read or the timeout elapsed.
     *
     * @return the next element, or empty
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     */
    public Optional<T> next() throws InterruptedException {
        return next(Defaults.readTimeout());
    }
    
    /**
     * Removes and returns the next element, waiting up to the given timeout. Returns an empty optional if the end
     * marker was read or the timeout elapsed.
     *
     * @param timeout the maximum time to wait
     * @return the next element, or empty
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if timeout is null
     */
    public Optional<T> next(Duration timeout) throws InterruptedException {
        return receive(timeout) instanceof Read.Item<T> item ? Optional.of(item.value()) : Optional.empty();
    }
    
    /**
     * Removes and returns the next message, waiting up to the given timeout. Unlike {@link #next(Duration)}, the
     * result tells an end marker apart from an elapsed timeout.
     *
     * @param timeout the maximum time to wait
     * @return the next element, the end marker, or the timeout
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if timeout is null
     */
    public Read<T> receive(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout);
        Link.check();
        Message<T> message;
        try {
            message = mailbox.receive(timeout);
        } catch (InterruptedException e) {
            throw Link.rethrow(e);
        }
        if (message == null) {
            return new Read.TimedOut<>(timeout);
        } else if (message instanceof Message.Value<T> value) {
            return new Read.Item<>(value.value());
        } else {
            return new Read.Ended<>();
        }
    }
    
    /**
     * The outcome of a {@link #receive(Duration) receive}.
     *
     * @param <T> the element type
     */
    public sealed interface Read<T> {
        /**
         * An element was read.
         *
         * @param value the element
         * @param <T> the element type
         */
        record Item<T>(T value) implements Read<T> { }
        
        /**
         * The end marker was read.
         *
         * @param <T> the element type
         */
        record Ended<T>() implements Read<T> { }
        
        /**
         * The timeout elapsed before anything arrived. The stream may still be written and closed later.
         *
         * @param waited the bound that elapsed
         * @param <T> the element type
         */
        record TimedOut<T>(Duration waited) implements Read<T> { }
    }
}
