package com.eyelevel.jobrelay.service.poll;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.model.BatchProgress;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.service.status.ProgressLedgerReader;
import com.eyelevel.jobrelay.service.status.StatusTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Blocks the calling thread until a job (or a ledger-mode batch) reaches a terminal state, polling
 * the store at a fixed interval.
 * <p>
 * Timeouts are client-side only: the worker is never told to stop. Interrupting the waiting thread
 * ends the wait early with a {@code timeout} outcome and leaves the interrupt flag set.
 */
@Slf4j
@Service
public class PollingCoordinator {

    private final StatusTracker statusTracker;
    private final ProgressLedgerReader progressLedgerReader;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration defaultMaxWait;

    public PollingCoordinator(final StatusTracker statusTracker, final ProgressLedgerReader progressLedgerReader,
                              final Sleeper sleeper, final Clock clock, final JobRelayConfig config) {
        this.statusTracker = statusTracker;
        this.progressLedgerReader = progressLedgerReader;
        this.sleeper = sleeper;
        this.clock = clock;
        this.pollInterval = config.getPolling().getInterval();
        this.defaultMaxWait = config.getPolling().getMaxWait();
    }

    public Duration defaultMaxWait() {
        return defaultMaxWait;
    }

    public JobStatusView waitForTerminal(final String toolId, final String jobId) {
        return waitForTerminal(toolId, jobId, defaultMaxWait);
    }

    /**
     * Polls the job's status until it is {@code completed}, {@code failed} or {@code not_found},
     * or until {@code maxWait} has elapsed.
     *
     * @return The terminal status, the {@code not_found} status, or a synthetic {@code timeout}.
     */
    public JobStatusView waitForTerminal(final String toolId, final String jobId, final Duration maxWait) {
        final Instant started = clock.instant();
        final Instant deadline = started.plus(maxWait);
        JobStatus lastSeen = null;
        log.info("Waiting up to {}s for job {} of tool '{}'.", maxWait.toSeconds(), jobId, toolId);

        while (true) {
            try {
                final JobStatusView status = statusTracker.getStatus(toolId, jobId);
                if (status.status() != lastSeen) {
                    log.info("Job {} of tool '{}' is now {}.", jobId, toolId, status.status().getValue());
                    lastSeen = status.status();
                }
                if (status.isTerminal() || status.status() == JobStatus.NOT_FOUND) {
                    return status;
                }
            } catch (BlobStoreException e) {
                log.warn("Status read for job {} of tool '{}' failed, will poll again: {}", jobId, toolId,
                         e.getMessage());
            }

            if (!clock.instant().isBefore(deadline)) {
                break;
            }
            if (!pause()) {
                log.warn("Wait for job {} of tool '{}' was interrupted.", jobId, toolId);
                return JobStatusView.timeout(toolId, jobId, "Wait interrupted");
            }
        }
        log.warn("Job {} of tool '{}' did not finish within {}s (last seen: {}).", jobId, toolId,
                 maxWait.toSeconds(), lastSeen == null ? "nothing" : lastSeen.getValue());
        return JobStatusView.timeout(toolId, jobId,
                                     String.format("No terminal state within %ds", maxWait.toSeconds()));
    }

    /**
     * Polls the progress ledger until {@code totalChunks} distinct chunks of {@code runId} are
     * reported completed, or until {@code maxWait} has elapsed. The listener sees every snapshot.
     */
    public BatchProgress waitForChunks(final String toolId, final String runId, final int totalChunks,
                                       final Duration maxWait, final ProgressListener listener) {
        final Instant deadline = clock.instant().plus(maxWait);
        int completed = 0;
        log.info("Waiting up to {}s for {} chunk(s) of session {} on tool '{}'.", maxWait.toSeconds(), totalChunks,
                 runId, toolId);

        while (true) {
            try {
                completed = progressLedgerReader.countCompletedChunks(toolId, runId, totalChunks);
            } catch (BlobStoreException e) {
                log.warn("Ledger read for session {} of tool '{}' failed, will poll again: {}", runId, toolId,
                         e.getMessage());
            }
            final BatchProgress progress = new BatchProgress(runId, completed, totalChunks, false);
            log.debug("Session {} of tool '{}': {}/{} chunk(s) completed ({}%).", runId, toolId, completed,
                      totalChunks, Math.round(progress.fraction() * 100));
            listener.onProgress(progress);
            if (progress.isComplete()) {
                log.info("All {} chunk(s) of session {} completed.", totalChunks, runId);
                return progress;
            }
            if (!clock.instant().isBefore(deadline) || !pause()) {
                break;
            }
        }
        log.warn("Session {} of tool '{}' stopped waiting with {}/{} chunk(s) completed.", runId, toolId, completed,
                 totalChunks);
        return new BatchProgress(runId, completed, totalChunks, true);
    }

    /**
     * @return false if the thread was interrupted while sleeping.
     */
    private boolean pause() {
        try {
            sleeper.sleep(pollInterval);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
