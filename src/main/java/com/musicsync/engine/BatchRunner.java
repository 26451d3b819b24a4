package com.musicsync.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Per-track loop shared by every batch job.
 * <p>
 * The stop flag is checked before each item and nowhere else, so an item that has started always runs to
 * the end of its store write. Transient failures are retried once with backoff; session-expired,
 * premium-required and not-found failures end the item only. Each failure is handed to
 * {@link ItemHandler#onFailure} so it can be written to the outcome log.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class BatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

    /** One try plus one retry for transient failures. */
    public static final int MAX_ATTEMPTS = 2;

    public interface ItemHandler<T> {
        void process(T item) throws Exception;

        void onFailure(T item, SyncException failure) throws Exception;
    }

    /**
     * Counts for a finished batch.
     */
    public record Summary(int total, int processed, int succeeded, int failed) {}

    private final long backoffBaseMs;

    public BatchRunner(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    /**
     * @throws CancelledException when a stop was requested; items already processed stay processed
     */
    public <T> Summary run(String label, List<T> items, JobContext context, Function<T, String> keyOf,
                           ItemHandler<T> handler) throws Exception {
        int total = items.size();
        int succeeded = 0;
        int failed = 0;
        for (int i = 0; i < total; i++) {
            if (context.token().isCancellationRequested()) {
                logger.info("{} stopped after {} of {} items", label, i, total);
                throw new CancelledException(label + " stopped after " + i + " of " + total);
            }
            T item = items.get(i);
            String key = keyOf.apply(item);
            context.progress(i + 1, total, label, key);
            try {
                Utils.retryTransient(() -> {
                    handler.process(item);
                    return null;
                }, MAX_ATTEMPTS, backoffBaseMs, label + " " + key);
                succeeded++;
            } catch (SyncException e) {
                if (e.kind() == ErrorKind.BUSY || e.kind() == ErrorKind.CANCELLED || e.kind() == ErrorKind.CORRUPT_STATE) {
                    throw e;
                }
                logger.warn("{} failed for '{}' ({}): {}", label, key, e.kind().label(), e.getMessage());
                handler.onFailure(item, e);
                failed++;
            } catch (RuntimeException e) {
                logger.warn("{} failed for '{}' with unexpected error: {}", label, key, e.getMessage());
                handler.onFailure(item, new TransientBackendException(e.getMessage(), e));
                failed++;
            }
        }
        logger.info("{} finished: {} ok, {} failed of {}", label, succeeded, failed, total);
        return new Summary(total, succeeded + failed, succeeded, failed);
    }
}
