package io.avery.dream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.StreamSupport;

/**
 * Constructors, combinators, and terminal operations over {@link Stream Streams}.
 *
 * <p>Combinators that return a new stream ({@link #map map}, {@link #filter filter}, {@link #duplicate duplicate},
 * {@link #fromList fromList}) start a stage that feeds it, {@linkplain Dream#spawn linked} to the calling thread. If a
 * callback passed to such a combinator throws, the stage crashes, its output is never closed, and the calling thread
 * receives a {@link LinkedException} at its next suspension point. Stages never recover from a callback failure.
 *
 * <p>Terminal operations ({@link #collect collect}, {@link #reduce reduce}, {@link #each each},
 * {@link #tryEach tryEach}) run in the calling thread, and read until the end marker, or until a read times out
 * after the {@linkplain Defaults#readTimeout() default read timeout}.
 */
public class Streams {
    private Streams() {}
    
    // --- Constructors ---
    
    /**
     * Returns a new stream that will yield the elements of the list, in order, followed by the end marker. The
     * elements are written by a linked stage, so this method returns immediately.
     *
     * @param list the elements
     * @return a new stream of the elements
     * @param <T> the element type
     * @throws NullPointerException if list is null. A null element crashes the stage.
     */
    public static <T> Stream<T> fromList(List<? extends T> list) {
        return fromIterable(list);
    }
    
    /**
     * Returns a new stream that will yield the elements of the iterable, in iteration order, followed by the end
     * marker. The elements are written by a linked stage, so this method returns immediately.
     *
     * @param iterable the elements
     * @return a new stream of the elements
     * @param <T> the element type
     * @throws NullPointerException if iterable is null. A null element crashes the stage.
     */
    public static <T> Stream<T> fromIterable(Iterable<? extends T> iterable) {
        Objects.requireNonNull(iterable);
        Stream<T> output = Stream.create();
        Dream.spawn(() -> {
            for (T element : iterable) {
                output.write(element);
            }
            output.close();
        });
        return output;
    }
    
    /**
     * Calls the generator in the current thread, with callbacks that write to and close a new stream. Returns the
     * stream after the generator returns.
     *
     * <p>No concurrency is introduced. To produce concurrently, call this method inside a {@link Dream#spawn spawn},
     * or use {@link Stream#create()} directly.
     *
     * @param generator the generator
     * @return the stream the generator wrote to
     * @param <T> the element type
     * @throws NullPointerException if generator is null
     */
    public static <T> Stream<T> generator(Generator<T> generator) {
        Objects.requireNonNull(generator);
        Stream<T> output = Stream.create();
        generator.generate(output::write, output::close);
        return output;
    }
    
    /**
     * Produces the elements of a {@link #generator generator} stream by calling back.
     *
     * @param <T> the element type
     */
    @FunctionalInterface
    public interface Generator<T> {
        /**
         * Produces elements.
         *
         * @param emit writes one element to the stream
         * @param stop closes the stream; should be called exactly once
         */
        void generate(Consumer<? super T> emit, Runnable stop);
    }
    
    // --- Stages ---
    
    /**
     * Returns a new stream of the results of applying the mapper to each element of the input. A linked stage reads
     * the input until it ends, then closes the output.
     *
     * @param input the input stream
     * @param mapper the mapping function; must not return null
     * @return a new stream of mapped elements
     * @param <T> the input element type
     * @param <U> the output element type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> Stream<U> map(Stream<T> input, Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(input);
        Objects.requireNonNull(mapper);
        Stream<U> output = Stream.create();
        Dream.spawn(() -> {
            each(input, value -> output.write(mapper.apply(value)));
            output.close();
        });
        return output;
    }
    
    /**
     * Returns a new stream of the elements of the input that match the predicate. A linked stage reads the input until
     * it ends, then closes the output.
     *
     * @param input the input stream
     * @param predicate the predicate
     * @return a new stream of matching elements
     * @param <T> the element type
     * @throws NullPointerException if any argument is null
     */
    public static <T> Stream<T> filter(Stream<T> input, Predicate<? super T> predicate) {
        Objects.requireNonNull(input);
        Objects.requireNonNull(predicate);
        Stream<T> output = Stream.create();
        Dream.spawn(() -> {
            each(input, value -> {
                if (predicate.test(value)) {
                    output.write(value);
                }
            });
            output.close();
        });
        return output;
    }
    
    /**
     * Returns two new streams that each yield every element of the input, in the same order. A linked stage reads the
     * input until it ends, writing each element to the first stream and then the second, then closes both.
     *
     * @param input the input stream
     * @return two new streams with identical elements
     * @param <T> the element type
     * @throws NullPointerException if input is null
     */
    public static <T> Duplicates<T> duplicate(Stream<T> input) {
        Objects.requireNonNull(input);
        Duplicates<T> outputs = new Duplicates<>(Stream.create(), Stream.create());
        Dream.spawn(() -> {
            each(input, value -> {
                outputs.first().write(value);
                outputs.second().write(value);
            });
            outputs.first().close();
            outputs.second().close();
        });
        return outputs;
    }
    
    /**
     * The two outputs of {@link #duplicate duplicate}.
     *
     * @param first the first output
     * @param second the second output
     * @param <T> the element type
     */
    public record Duplicates<T>(Stream<T> first, Stream<T> second) { }
    
    // --- Terminal operations ---
    
    /**
     * Reads the input until it ends, folding each element into the accumulator as {@code accumulator = f(element,
     * accumulator)}. Runs in the current thread.
     *
     * @param input the input stream
     * @param initial the initial accumulator
     * @param reducer the folding function
     * @return the final accumulator
     * @param <T> the element type
     * @param <A> the accumulator type
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if input or reducer is null
     */
    public static <T, A> A reduce(Stream<T> input, A initial, BiFunction<? super T, ? super A, ? extends A> reducer)
            throws InterruptedException {
        Objects.requireNonNull(input);
        Objects.requireNonNull(reducer);
        A accumulator = initial;
        for (Optional<T> next; (next = input.next()).isPresent(); ) {
            accumulator = reducer.apply(next.get(), accumulator);
        }
        return accumulator;
    }
    
    /**
     * Reads the input until it ends, and returns its elements in read order.
     *
     * @param input the input stream
     * @return the elements read
     * @param <T> the element type
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if input is null
     */
    public static <T> List<T> collect(Stream<T> input) throws InterruptedException {
        List<T> list = new ArrayList<>();
        each(input, list::add);
        return list;
    }
    
    /**
     * Reads the input until it ends, passing each element to the action. Runs in the current thread.
     *
     * @param input the input stream
     * @param action the action
     * @param <T> the element type
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if any argument is null
     */
    public static <T> void each(Stream<T> input, Consumer<? super T> action) throws InterruptedException {
        Objects.requireNonNull(input);
        Objects.requireNonNull(action);
        for (Optional<T> next; (next = input.next()).isPresent(); ) {
            action.accept(next.get());
        }
    }
    
    /**
     * Reads the input until it ends, passing each element to the action, and stops at the first error the action
     * returns. Elements after the failing one are left unread. Runs in the current thread.
     *
     * @param input the input stream
     * @param action the action
     * @return the first error returned by the action, or {@code ok(null)} if the input ended first
     * @param <T> the element type
     * @param <E> the error type
     * @throws InterruptedException if interrupted while waiting
     * @throws LinkedException if a linked task spawned by the current thread crashed
     * @throws NullPointerException if any argument is null, or the action returns null
     */
    public static <T, E> Result<Void, E> tryEach(Stream<T> input,
                                                 Function<? super T, ? extends Result<?, ? extends E>> action)
            throws InterruptedException {
        Objects.requireNonNull(input);
        Objects.requireNonNull(action);
        for (Optional<T> next; (next = input.next()).isPresent(); ) {
            Result<?, ? extends E> result = Objects.requireNonNull(action.apply(next.get()));
            if (result.isErr()) {
                return Result.err(result.error().orElseThrow());
            }
        }
        return Result.ok(null);
    }
    
    /**
     * Returns an iterator that reads one element from the input per advance, and ends when the input ends. The
     * iterator cannot be restarted; reading it consumes the input.
     *
     * <p>The iterator cannot throw {@code InterruptedException}. If interrupted while waiting, it restores the
     * thread's interrupt status and throws {@link CancellationException}.
     *
     * @param input the input stream
     * @return an iterator over the remaining elements
     * @param <T> the element type
     * @throws NullPointerException if input is null
     */
    public static <T> Iterator<T> toIterator(Stream<T> input) {
        Objects.requireNonNull(input);
        
        class StreamIterator implements Iterator<T> {
            T lookahead = null;
            boolean done = false;
            
            @Override
            public boolean hasNext() {
                if (lookahead != null) {
                    return true;
                } else if (done) {
                    return false;
                }
                try {
                    Optional<T> next = input.next();
                    if (next.isPresent()) {
                        lookahead = next.get();
                        return true;
                    }
                    done = true;
                    return false;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    CancellationException ex = new CancellationException("Interrupted while reading stream");
                    ex.initCause(e);
                    throw ex;
                }
            }
            
            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T ret = lookahead;
                lookahead = null;
                return ret;
            }
        }
        
        return new StreamIterator();
    }
    
    /**
     * Returns a sequential {@link java.util.stream.Stream java.util.stream.Stream} that lazily reads the input, as if
     * by {@link #toIterator toIterator}. The returned stream can be traversed only once.
     *
     * @param input the input stream
     * @return a lazy sequential stream over the remaining elements
     * @param <T> the element type
     * @throws NullPointerException if input is null
     */
    public static <T> java.util.stream.Stream<T> toSequence(Stream<T> input) {
        Iterator<T> iterator = toIterator(input);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }
    
    // --- Scoped use ---
    
    /**
     * Calls the body with the stream, then closes the stream, then returns the body's result. The stream is closed
     * even if the body throws.
     *
     * <p>This is the functional form of
     * <pre>{@code
     * try (stream) {
     *     return body.apply(stream);
     * }
     * }</pre>
     *
     * @param stream the stream to close afterward
     * @param body the body
     * @return the body's result
     * @param <T> the element type
     * @param <R> the result type
     * @throws NullPointerException if any argument is null
     */
    public static <T, R> R with(Stream<T> stream, Function<? super Stream<T>, ? extends R> body) {
        Objects.requireNonNull(stream);
        Objects.requireNonNull(body);
        try {
            return body.apply(stream);
        } finally {
            stream.close();
        }
    }
}
