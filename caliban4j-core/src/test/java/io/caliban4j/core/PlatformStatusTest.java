package io.caliban4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformStatusTest {

    private static final Instant DONE = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void gkeStatusShouldFollowPodCounters() {
        assertEquals(GkeJobStatus.SUCCEEDED, GkeJobStatus.fromJobInfo(new GkeJobInfo(0, 1, DONE)));
        assertEquals(GkeJobStatus.FAILED, GkeJobStatus.fromJobInfo(new GkeJobInfo(0, 0, DONE)));
        assertEquals(GkeJobStatus.RUNNING, GkeJobStatus.fromJobInfo(new GkeJobInfo(2, null, null)));
        assertEquals(GkeJobStatus.PENDING, GkeJobStatus.fromJobInfo(new GkeJobInfo(0, null, null)));
        assertEquals(GkeJobStatus.STATE_UNSPECIFIED, GkeJobStatus.fromJobInfo(null));
    }

    @Test
    void missingGkeCountersShouldCountAsZero() {
        GkeJobStatus completed = GkeJobStatus.fromJobInfo(new GkeJobInfo(null, null, DONE));
        assertEquals(GkeJobStatus.FAILED, completed);
        assertTrue(completed.isTerminal());

        assertEquals(GkeJobStatus.PENDING, GkeJobStatus.fromJobInfo(new GkeJobInfo(null, null, null)));
        assertEquals(GkeJobStatus.SUCCEEDED, GkeJobStatus.fromJobInfo(new GkeJobInfo(null, 3, DONE)));
    }

    @Test
    void unspecifiedGkeStateShouldBeUnknown() {
        assertEquals(JobStatus.UNKNOWN, GkeJobStatus.STATE_UNSPECIFIED.canonical());
        assertFalse(GkeJobStatus.STATE_UNSPECIFIED.isTerminal());
        assertEquals(JobStatus.UNKNOWN, Platform.GKE.parseStatus("SOMETHING_NEW").canonical());
    }

    @Test
    void caipStatesShouldMapToCanonicalStatus() {
        assertEquals(JobStatus.SUBMITTED, CaipJobStatus.parse("QUEUED").canonical());
        assertEquals(JobStatus.SUBMITTED, CaipJobStatus.parse("preparing").canonical());
        assertEquals(JobStatus.RUNNING, CaipJobStatus.parse("CANCELLING").canonical());
        assertEquals(JobStatus.STOPPED, CaipJobStatus.parse("CANCELLED").canonical());
        assertEquals(CaipJobStatus.STATE_UNSPECIFIED, CaipJobStatus.parse("SOMETHING_NEW"));
        assertFalse(CaipJobStatus.CANCELLING.isTerminal());
        assertTrue(CaipJobStatus.CANCELLED.isTerminal());
    }

    @Test
    void unavailableGkeJobIsTerminalButUnknown() {
        assertTrue(GkeJobStatus.UNAVAILABLE.isTerminal());
        assertEquals(JobStatus.UNKNOWN, GkeJobStatus.UNAVAILABLE.canonical());
        assertFalse(JobStatus.UNKNOWN.isTerminal());
    }

    @Test
    void runTerminalityShouldUseNativeStatus() {
        Run gone = new Run("r1", "j1", null, "alice", Platform.GKE, DONE,
                JobStatus.UNKNOWN, "UNAVAILABLE", Map.of());
        assertTrue(gone.hasTerminalStatus());
        assertSame(GkeJobStatus.UNAVAILABLE, gone.typedStatus());

        Run stopped = gone.withStatus(JobStatus.STOPPED);
        assertNull(stopped.platformStatus());
        assertEquals(JobStatus.STOPPED, stopped.status());
        assertTrue(stopped.hasTerminalStatus());

        Run queued = gone.withStatus(GkeJobStatus.PENDING);
        assertEquals("PENDING", queued.platformStatus());
        assertFalse(queued.hasTerminalStatus());
    }

    @Test
    void acceleratorShouldSelectJobMode() {
        assertEquals(Accelerator.JobMode.GPU, new Accelerator.Gpu("nvidia-tesla-t4", 1).jobMode());
        assertEquals(Accelerator.JobMode.CPU, new Accelerator.Tpu("v3", 8).jobMode());
        ContainerBuild build = new ContainerBuild("python:3.11", null, null, null, null);
        assertEquals("CPU", build.toSpec().get("job_mode"));
    }
}
