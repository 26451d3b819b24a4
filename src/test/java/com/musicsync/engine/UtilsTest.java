package com.musicsync.engine;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("AC_DC - Back In Black_", Utils.sanitizeFilename("AC/DC - Back In Black?"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testRetryTransientSucceeds() {
        int result = Utils.retryTransient(() -> 42, 3, 0, "answer");
        assertEquals(42, result);
    }

    @Test
    void testRetryTransientGivesUp() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(TransientBackendException.class, () -> Utils.retryTransient(() -> {
            calls.incrementAndGet();
            throw new TransientBackendException("still down");
        }, 2, 0, "flaky"));
        assertEquals(2, calls.get());
    }

    @Test
    void testNonTransientFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(SessionExpiredException.class, () -> Utils.retryTransient(() -> {
            calls.incrementAndGet();
            throw new SessionExpiredException("login");
        }, 3, 0, "expired"));
        assertEquals(1, calls.get());
    }

    @Test
    void testCheckedFailureBecomesTransient() {
        assertThrows(TransientBackendException.class, () -> Utils.retryTransient(() -> {
            throw new java.io.IOException("reset");
        }, 1, 0, "io"));
    }

    @Test
    void testEnvOrPropDefault() {
        assertEquals("fallback", Utils.envOrProp("MUSICSYNC_TEST_UNSET_KEY", "fallback"));
    }
}
