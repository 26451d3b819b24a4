package com.musicsync.engine;

/**
 * Raised when a command arrives while another job occupies the controller.
 */
public class BusyException extends SyncException {
    private final String runningJob;

    public BusyException(String runningJob) {
        super(ErrorKind.BUSY, "A job is already running: " + runningJob);
        this.runningJob = runningJob;
    }

    public String runningJob() {
        return runningJob;
    }
}
