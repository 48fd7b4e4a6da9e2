package io.avery.dream;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DefaultsTest {
    
    @Test
    void testUnsetUsesFifteenMinutes() {
        assertEquals(Duration.ofMinutes(15), Defaults.parseReadTimeout(null));
        assertEquals(Duration.ofMinutes(15), Defaults.parseReadTimeout("  "));
    }
    
    @Test
    void testParsesIsoDuration() {
        assertEquals(Duration.ofSeconds(30), Defaults.parseReadTimeout("PT30S"));
        assertEquals(Duration.ZERO, Defaults.parseReadTimeout("PT0S"));
    }
    
    @Test
    void testIgnoresMalformedAndNegative() {
        assertEquals(Defaults.DEFAULT_READ_TIMEOUT, Defaults.parseReadTimeout("thirty seconds"));
        assertEquals(Defaults.DEFAULT_READ_TIMEOUT, Defaults.parseReadTimeout("-PT1S"));
    }
}
