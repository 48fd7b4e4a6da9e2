package io.avery.dream;

import java.util.Objects;

/**
 * Exception thrown by the fatal awaits on a {@link Dream Dream}, {@link Dream#await()} and
 * {@link Dream#await(java.time.Duration)}, when the task did not produce a value. The {@link #error() error} tells
 * which way the await failed. For an {@link AwaitError.Exit Exit}, the cause is the exit reason.
 */
public class AwaitException extends RuntimeException {
    private final AwaitError error;
    
    /**
     * Constructs an {@code AwaitException} for the given error.
     *
     * @param error the await error
     */
    public AwaitException(AwaitError error) {
        super(describe(error), error instanceof AwaitError.Exit exit ? exit.reason() : null);
        this.error = error;
    }
    
    /**
     * Returns the await error.
     *
     * @return the await error
     */
    public AwaitError error() {
        return error;
    }
    
    private static String describe(AwaitError error) {
        Objects.requireNonNull(error);
        if (error instanceof AwaitError.Timeout timeout) {
            return "Dream did not complete within " + timeout.waited();
        }
        return "Dream exited abruptly";
    }
}
