package com.musicsync.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JobControllerTest {
    private final JobController jobs = new JobController();

    @AfterEach
    void tearDown() {
        jobs.close();
    }

    @Test
    void testSecondJobIsRejectedWhileRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<JobState> first = jobs.submit("scan", ctx -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(jobs.isRunning());

        BusyException busy = assertThrows(BusyException.class, () -> jobs.submit("crawl", ctx -> {}));
        assertEquals(ErrorKind.BUSY, busy.kind());

        release.countDown();
        JobState done = first.get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals("scan", done.jobName());
    }

    @Test
    void testStopEndsJobAsStopped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        Future<JobState> job = jobs.submit("search_all", ctx -> {
            started.countDown();
            while (true) {
                ctx.token().throwIfCancelled();
                Thread.sleep(5);
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(jobs.stop());

        JobState done = job.get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.STOPPED, done.status());
        assertFalse(jobs.stop());
    }

    @Test
    void testFailureIsReported() throws Exception {
        JobState done = jobs.submit("crawl", ctx -> {
            throw new IllegalStateException("listing unreadable");
        }).get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.FAILED, done.status());
        assertEquals("listing unreadable", done.error());
        assertEquals(JobStatus.FAILED, jobs.snapshot().status());
    }

    @Test
    void testAcknowledgeReturnsToIdle() throws Exception {
        jobs.submit("scan", ctx -> ctx.progress(1, 1, "done", null)).get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.COMPLETED, jobs.snapshot().status());
        assertEquals(1, jobs.snapshot().progress().current());

        jobs.acknowledge();
        assertEquals(JobStatus.IDLE, jobs.snapshot().status());
        assertNotNull(jobs.submit("scan", ctx -> {}).get(5, TimeUnit.SECONDS));
    }
}
