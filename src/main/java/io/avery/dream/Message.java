package io.avery.dream;

import java.util.Objects;

/**
 * The protocol carried by a {@link Stream Stream}'s mailbox. A message either carries one element, or marks the end of
 * the stream.
 *
 * @param <T> the element type
 */
sealed interface Message<T> {
    /**
     * A message carrying one element.
     *
     * @param value the (non-null) element
     * @param <T> the element type
     */
    record Value<T>(T value) implements Message<T> {
        public Value {
            Objects.requireNonNull(value);
        }
    }
    
    /**
     * A message marking the end of the stream.
     *
     * @param <T> the element type
     */
    record End<T>() implements Message<T> { }
}
