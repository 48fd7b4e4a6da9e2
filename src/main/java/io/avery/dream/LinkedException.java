package io.avery.dream;

/**
 * Exception thrown in a spawning thread when a task it spawned {@linkplain Dream#spawn linked} has crashed. The crash
 * reason can be inspected using the {@link Throwable#getCause()} method. If several linked tasks crashed before the
 * spawning thread noticed, the later crash reasons are suppressed onto the first.
 *
 * <p>The exception is thrown at the spawning thread's next suspension point: reading a {@link Stream Stream}, or
 * awaiting a {@link Dream Dream}.
 */
public class LinkedException extends RuntimeException {
    /**
     * Constructs a {@code LinkedException} with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the crash reason (which is saved for later retrieval by the {@link Throwable#getCause()} method)
     */
    public LinkedException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Constructs a {@code LinkedException} with the specified cause. The detail message is set to
     * {@code (cause == null ? null : cause.toString())} (which typically contains the class and detail message of
     * {@code cause}).
     *
     * @param cause the crash reason (which is saved for later retrieval by the {@link Throwable#getCause()} method)
     */
    public LinkedException(Throwable cause) {
        super(cause);
    }
}
