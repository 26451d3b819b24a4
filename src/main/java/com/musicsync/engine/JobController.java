package com.musicsync.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs at most one background job at a time.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #submit(String, JobTask)} claims the single slot or throws {@link BusyException}; nothing is queued.</li>
 *   <li>The job publishes progress through its {@link JobContext}; {@link #snapshot()} reads it from any thread.</li>
 *   <li>{@link #stop()} only raises the cooperative flag. The job notices it at the next track boundary and
 *   ends in {@link JobStatus#STOPPED}.</li>
 *   <li>A {@link CancelledException} ends the job as STOPPED, any other exception as FAILED.</li>
 * </ul>
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class JobController implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.idle());
    private final Object slot = new Object();
    private final ExecutorService executor;
    private CancellationToken token;

    public JobController() {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sync-job");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts a job in the background.
     * @param name job name for logs and snapshots
     * @param task job body
     * @return future completing with the terminal state
     * @throws BusyException if another job is running
     */
    public Future<JobState> submit(String name, JobTask task) {
        final CancellationToken jobToken;
        synchronized (slot) {
            JobState current = state.get();
            if (current.isRunning()) {
                logger.warn("Rejected job '{}': '{}' is still running", name, current.jobName());
                throw new BusyException(current.jobName());
            }
            jobToken = new CancellationToken();
            token = jobToken;
            state.set(new JobState(name, JobStatus.RUNNING, ProgressSnapshot.idle(), null, System.currentTimeMillis(), 0));
        }
        logger.info("Job '{}' started", name);
        JobContext context = new JobContext(jobToken, p -> state.updateAndGet(s -> s.withProgress(p)));
        return executor.submit(() -> execute(name, task, context));
    }

    private JobState execute(String name, JobTask task, JobContext context) {
        JobStatus terminal;
        String error = null;
        try {
            task.run(context);
            terminal = JobStatus.COMPLETED;
        } catch (CancelledException e) {
            terminal = JobStatus.STOPPED;
            error = e.getMessage();
        } catch (Exception e) {
            terminal = JobStatus.FAILED;
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            logger.error("Job '{}' failed: {}", name, error, e);
        }
        final JobStatus end = terminal;
        final String message = error;
        JobState done = state.updateAndGet(s -> s.finished(end, message, System.currentTimeMillis()));
        logger.info("Job '{}' ended: {}", name, end);
        return done;
    }

    /**
     * Requests a cooperative stop of the running job.
     * @return true if a running job was signalled
     */
    public boolean stop() {
        synchronized (slot) {
            if (!state.get().isRunning() || token == null) {
                return false;
            }
            token.cancel();
        }
        logger.info("Stop requested for job '{}'", state.get().jobName());
        return true;
    }

    /**
     * Returns the slot to {@link JobStatus#IDLE} after a terminal state has been observed.
     */
    public void acknowledge() {
        synchronized (slot) {
            if (state.get().status().isTerminal()) {
                state.set(JobState.idle());
            }
        }
    }

    public JobState snapshot() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get().isRunning();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
