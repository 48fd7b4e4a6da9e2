package io.avery.dream;

import java.time.Duration;
import java.util.Objects;

/**
 * The reason an await on a {@link Dream Dream} did not produce a value.
 */
public sealed interface AwaitError {
    /**
     * The await exceeded its bound before the task completed. The task itself is unaffected and keeps running.
     *
     * @param waited the bound that elapsed
     */
    record Timeout(Duration waited) implements AwaitError {
        public Timeout {
            Objects.requireNonNull(waited);
        }
    }
    
    /**
     * The task terminated abruptly.
     *
     * @param reason what the task threw
     */
    record Exit(Throwable reason) implements AwaitError {
        public Exit {
            Objects.requireNonNull(reason);
        }
    }
}
