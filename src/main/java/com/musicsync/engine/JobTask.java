package com.musicsync.engine;

/**
 * Body of a background job.
 */
@FunctionalInterface
public interface JobTask {
    void run(JobContext context) throws Exception;
}
