package com.musicsync.engine;

/**
 * Immutable snapshot of the job slot. The controller owns the only mutable reference to it.
 *
 * @param jobName name of the current or last job, null when none ran yet
 * @param status lifecycle status
 * @param progress last published progress
 * @param error failure message for {@link JobStatus#FAILED}, otherwise null
 * @param startedAt epoch millis the job started, 0 when idle
 * @param finishedAt epoch millis the job ended, 0 while running
 */
public record JobState(String jobName, JobStatus status, ProgressSnapshot progress, String error,
                       long startedAt, long finishedAt) {

    public static JobState idle() {
        return new JobState(null, JobStatus.IDLE, ProgressSnapshot.idle(), null, 0, 0);
    }

    public JobState withProgress(ProgressSnapshot p) {
        return new JobState(jobName, status, p, error, startedAt, finishedAt);
    }

    public JobState finished(JobStatus terminal, String message, long at) {
        return new JobState(jobName, terminal, progress, message, startedAt, at);
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }
}
