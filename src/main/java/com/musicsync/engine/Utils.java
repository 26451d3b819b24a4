package com.musicsync.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Utility class for common helper methods used by the sync jobs and the backends.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Sanitizes a filename by replacing each special character with an underscore. Spaces are kept so
     * "Artist - Title" stays readable.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\]", "_").trim();
    }

    /**
     * Runs an action, retrying it when it fails with {@link TransientBackendException}. Backoff grows
     * exponentially: {@code 2^attempt * backoffBaseMs}. Any other exception propagates at once.
     * @param action Callable action to execute
     * @param maxAttempts Total attempts including the first one
     * @param backoffBaseMs Base delay; 0 disables sleeping
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action
     * @throws TransientBackendException if every attempt failed transiently
     * @throws CancelledException if the thread is interrupted while backing off
     */
    public static <T> T retryTransient(Callable<T> action, int maxAttempts, long backoffBaseMs, String actionDesc) {
        int attempts = 0;
        while (true) {
            try {
                return action.call();
            } catch (TransientBackendException e) {
                attempts++;
                if (attempts >= maxAttempts) {
                    logger.error("Giving up on {} after {} attempts: {}", actionDesc, attempts, e.getMessage());
                    throw e;
                }
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                sleepBackoff((long) Math.pow(2, attempts) * backoffBaseMs);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new TransientBackendException("Unexpected failure in " + actionDesc + ": " + e.getMessage(), e);
            }
        }
    }

    private static void sleepBackoff(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis); // Exponential backoff
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while backing off");
        }
    }

    /**
     * Reads an environment variable, then a system property of the same name, then the default.
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }
}
