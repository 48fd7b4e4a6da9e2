package io.avery.dream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Library-wide defaults, resolved once from system properties.
 *
 * <ul>
 *     <li>{@value #READ_TIMEOUT_PROPERTY} - the bound applied by {@link Stream#next()}, as an ISO-8601 duration
 *     (for example {@code PT30S}). Defaults to 15 minutes.
 * </ul>
 */
public final class Defaults {
    private static final Logger log = LoggerFactory.getLogger(Defaults.class);
    
    /**
     * System property overriding the default read timeout.
     */
    public static final String READ_TIMEOUT_PROPERTY = "io.avery.dream.readTimeout";
    
    static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(15);
    
    private Defaults() {}
    
    /**
     * Returns the bound applied by {@link Stream#next()} when no timeout is given.
     *
     * @return the default read timeout
     */
    public static Duration readTimeout() {
        return Holder.READ_TIMEOUT;
    }
    
    static Duration parseReadTimeout(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_READ_TIMEOUT;
        }
        try {
            Duration parsed = Duration.parse(value.trim());
            if (parsed.isNegative()) {
                log.warn("Ignoring negative {}={}, using {}", READ_TIMEOUT_PROPERTY, value, DEFAULT_READ_TIMEOUT);
                return DEFAULT_READ_TIMEOUT;
            }
            log.debug("Default read timeout set to {}", parsed);
            return parsed;
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed {}={}, using {}", READ_TIMEOUT_PROPERTY, value, DEFAULT_READ_TIMEOUT);
            return DEFAULT_READ_TIMEOUT;
        }
    }
    
    // Resolved on first use.
    private static class Holder {
        static final Duration READ_TIMEOUT = parseReadTimeout(System.getProperty(READ_TIMEOUT_PROPERTY));
    }
}
