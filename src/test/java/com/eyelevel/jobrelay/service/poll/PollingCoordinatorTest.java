package com.eyelevel.jobrelay.service.poll;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.model.BatchProgress;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.model.SubmittedJob;
import com.eyelevel.jobrelay.service.status.ProgressLedgerReader;
import com.eyelevel.jobrelay.service.status.StatusTracker;
import com.eyelevel.jobrelay.support.RelayFixture;
import com.eyelevel.jobrelay.support.SimulatedWorker;
import com.eyelevel.jobrelay.support.SimulatedWorker.Outcome;
import com.eyelevel.jobrelay.store.BlobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.eyelevel.jobrelay.support.RelayFixture.JOB_TOOL;
import static com.eyelevel.jobrelay.support.RelayFixture.LEDGER_TOOL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PollingCoordinatorTest {

    private final RelayFixture fixture = new RelayFixture();
    private final PollingCoordinator coordinator = fixture.pollingCoordinator;

    @AfterEach
    void tearDown() {
        Thread.interrupted();
        fixture.close();
    }

    @Test
    void returnsOnceTheWorkerCompletesTheJob() {
        fixture.worker(JOB_TOOL);
        SubmittedJob job = fixture.submissionService.submit(JOB_TOOL, RelayFixture.csv(3), "a.csv");

        JobStatusView status = coordinator.waitForTerminal(JOB_TOOL, job.jobId());

        assertThat(status.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(status.resultsReady()).isTrue();
        assertThat(fixture.sleeps.get()).isEqualTo(1);
    }

    @Test
    void returnsFailedWithWorkerError() {
        fixture.worker(JOB_TOOL).behaving((jobId, key) -> Outcome.FAIL);
        SubmittedJob job = fixture.submissionService.submit(JOB_TOOL, RelayFixture.csv(1), "a.csv");

        JobStatusView status = coordinator.waitForTerminal(JOB_TOOL, job.jobId());

        assertThat(status.status()).isEqualTo(JobStatus.FAILED);
        assertThat(status.error()).isEqualTo("simulated worker failure");
    }

    @Test
    void unknownJobReturnsImmediately() {
        JobStatusView status = coordinator.waitForTerminal(JOB_TOOL, "job_20250101_120000_000000");

        assertThat(status.status()).isEqualTo(JobStatus.NOT_FOUND);
        assertThat(fixture.sleeps.get()).isZero();
    }

    @Test
    void hangingJobTimesOutAtTheDeadline() {
        fixture.worker(JOB_TOOL).behaving((jobId, key) -> Outcome.HANG);
        SubmittedJob job = fixture.submissionService.submit(JOB_TOOL, RelayFixture.csv(1), "a.csv");
        Instant started = fixture.clock.instant();

        JobStatusView status = coordinator.waitForTerminal(JOB_TOOL, job.jobId(), Duration.ofSeconds(30));

        assertThat(status.status()).isEqualTo(JobStatus.TIMEOUT);
        assertThat(status.error()).contains("30s");
        assertThat(fixture.sleeps.get()).isEqualTo(6);
        assertThat(Duration.between(started, fixture.clock.instant())).isEqualTo(Duration.ofSeconds(30));
        assertThat(fixture.statusTracker.getStatus(JOB_TOOL, job.jobId()).status()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void zeroWaitStillPollsOnce() {
        SubmittedJob job = fixture.submissionService.submit(JOB_TOOL, RelayFixture.csv(1), "a.csv");

        JobStatusView status = coordinator.waitForTerminal(JOB_TOOL, job.jobId(), Duration.ZERO);

        assertThat(status.status()).isEqualTo(JobStatus.TIMEOUT);
        assertThat(fixture.sleeps.get()).isZero();
    }

    @Test
    void interruptEndsTheWaitWithTimeoutAndKeepsTheFlag() {
        SubmittedJob job = fixture.submissionService.submit(JOB_TOOL, RelayFixture.csv(1), "a.csv");
        Thread.currentThread().interrupt();

        JobStatusView status = coordinator.waitForTerminal(JOB_TOOL, job.jobId());

        assertThat(status.status()).isEqualTo(JobStatus.TIMEOUT);
        assertThat(status.error()).isEqualTo("Wait interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void transportErrorsAreRetriedOnTheNextPoll() {
        StatusTracker tracker = mock(StatusTracker.class);
        String jobId = "job_20250101_120000_aaaaaa";
        when(tracker.getStatus(JOB_TOOL, jobId))
            .thenThrow(new BlobStoreException("connection reset"))
            .thenReturn(new JobStatusView(jobId, JOB_TOOL, JobStatus.COMPLETED, null, true,
                                          "results/" + jobId + "_results.csv", null, null));
        List<Duration> pauses = new ArrayList<>();
        PollingCoordinator withFlakyStore = new PollingCoordinator(
            tracker, mock(ProgressLedgerReader.class), pauses::add,
            Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC), new JobRelayConfig());

        JobStatusView status = withFlakyStore.waitForTerminal(JOB_TOOL, jobId);

        assertThat(status.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(pauses).containsExactly(Duration.ofSeconds(5));
        verify(tracker, times(2)).getStatus(JOB_TOOL, jobId);
    }

    @Test
    void chunkWaitReportsEverySnapshotUntilComplete() {
        SimulatedWorker worker = fixture.worker(LEDGER_TOOL);
        putChunks("s1", 3);
        List<BatchProgress> snapshots = new ArrayList<>();

        BatchProgress progress = coordinator.waitForChunks(LEDGER_TOOL, "s1", 3, Duration.ofMinutes(10),
                                                           snapshots::add);

        assertThat(progress.isComplete()).isTrue();
        assertThat(progress.timedOut()).isFalse();
        assertThat(snapshots).extracting(BatchProgress::completedChunks).containsExactly(0, 3);
        assertThat(worker.processedInputs()).hasSize(3);
    }

    @Test
    void chunkWaitTimesOutWithPartialProgress() {
        fixture.worker(LEDGER_TOOL)
               .behaving((sessionId, key) -> key.endsWith("chunk_2.csv") ? Outcome.HANG : Outcome.COMPLETE);
        putChunks("s2", 3);

        BatchProgress progress = coordinator.waitForChunks(LEDGER_TOOL, "s2", 3, Duration.ofSeconds(20),
                                                           ProgressListener.NONE);

        assertThat(progress.timedOut()).isTrue();
        assertThat(progress.completedChunks()).isEqualTo(2);
        assertThat(progress.fraction()).isCloseTo(2.0 / 3, offset(0.001));
    }

    private void putChunks(String sessionId, int count) {
        BlobStore store = fixture.workspace(LEDGER_TOOL).store();
        for (int i = 1; i <= count; i++) {
            store.put(fixture.workspace(LEDGER_TOOL).layout().sessionChunkKey(sessionId, i),
                      ("id,name\n" + i + ",n" + i + "\n").getBytes(StandardCharsets.UTF_8));
        }
    }
}
