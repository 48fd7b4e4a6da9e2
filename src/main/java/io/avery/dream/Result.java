package io.avery.dream;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The outcome of an operation that reports failure as a value instead of throwing: either {@link #ok ok}, carrying a
 * value, or {@link #err err}, carrying an error. Used by {@link Dream#tryAwait()} and
 * {@link Streams#tryEach Streams.tryEach}.
 *
 * @param <T> the value type
 * @param <E> the error type
 */
public final class Result<T, E> {
    private final boolean isErr;
    private final Object val;
    
    private Result(boolean isErr, Object val) {
        this.isErr = isErr;
        this.val = val;
    }
    
    /**
     * Returns a successful result. The value may be null, as for {@code Result<Void, E>}.
     *
     * @param ok the value
     * @return a successful result
     * @param <T> the value type
     * @param <E> the error type
     */
    public static <T, E> Result<T, E> ok(T ok) {
        return new Result<>(false, ok);
    }
    
    /**
     * Returns a failed result.
     *
     * @param err the (non-null) error
     * @return a failed result
     * @param <T> the value type
     * @param <E> the error type
     */
    public static <T, E> Result<T, E> err(E err) {
        return new Result<>(true, Objects.requireNonNull(err));
    }
    
    public boolean isOk() {
        return !isErr;
    }
    
    public boolean isErr() {
        return isErr;
    }
    
    /**
     * Returns the value if this result is ok, else an empty optional. A null ok value also yields an empty optional.
     *
     * @return the value, if present
     */
    @SuppressWarnings("unchecked")
    public Optional<T> value() {
        return isErr ? Optional.empty() : Optional.ofNullable((T) val);
    }
    
    /**
     * Returns the error if this result failed, else an empty optional.
     *
     * @return the error, if present
     */
    @SuppressWarnings("unchecked")
    public Optional<E> error() {
        return isErr ? Optional.of((E) val) : Optional.empty();
    }
    
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return isErr ? (Result<U, E>) this : ok(mapper.apply((T) val));
    }
    
    @SuppressWarnings("unchecked")
    public T unwrap() {
        if (isErr) {
            throw new AssertionError(val);
        }
        return (T) val;
    }
    
    @SuppressWarnings("unchecked")
    public T expect(String message) {
        if (isErr) {
            throw val instanceof Throwable t ? new AssertionError(message, t) : new AssertionError(message + ": " + val);
        }
        return (T) val;
    }
    
    @SuppressWarnings("unchecked")
    public <X extends Throwable> T unwrap(Function<? super E, X> mapErr) throws X {
        if (isErr) {
            throw mapErr.apply((E) val);
        }
        return (T) val;
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof Result<?, ?> other && isErr == other.isErr && Objects.equals(val, other.val);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(isErr, val);
    }
    
    @Override
    public String toString() {
        return (isErr ? "Err[" : "Ok[") + val + "]";
    }
}
