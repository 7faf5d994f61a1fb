package com.eyelevel.jobrelay.service.batch;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.exception.JobNotFoundException;
import com.eyelevel.jobrelay.exception.MergeException;
import com.eyelevel.jobrelay.exception.SubmissionException;
import com.eyelevel.jobrelay.layout.JobIdGenerator;
import com.eyelevel.jobrelay.layout.JobKeyLayout;
import com.eyelevel.jobrelay.model.BatchMode;
import com.eyelevel.jobrelay.model.BatchProgress;
import com.eyelevel.jobrelay.model.BatchResult;
import com.eyelevel.jobrelay.model.ChunkArtifact;
import com.eyelevel.jobrelay.model.ChunkDescriptor;
import com.eyelevel.jobrelay.model.CsvDataset;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.model.MergedArtifact;
import com.eyelevel.jobrelay.model.SessionChunk;
import com.eyelevel.jobrelay.model.SessionEntry;
import com.eyelevel.jobrelay.model.SessionState;
import com.eyelevel.jobrelay.model.SubmittedJob;
import com.eyelevel.jobrelay.service.csv.CsvDatasetCodec;
import com.eyelevel.jobrelay.service.merge.LedgerResultMerger;
import com.eyelevel.jobrelay.service.merge.ResultMerger;
import com.eyelevel.jobrelay.service.plan.ChunkPlanner;
import com.eyelevel.jobrelay.service.poll.PollingCoordinator;
import com.eyelevel.jobrelay.service.poll.ProgressListener;
import com.eyelevel.jobrelay.service.registry.SessionRegistry;
import com.eyelevel.jobrelay.service.status.ProgressLedgerReader;
import com.eyelevel.jobrelay.service.submit.SubmissionService;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs a CSV dataset through a tool end to end: chunking, submission, waiting and merging.
 * <p>
 * Every step is mirrored into the session registry, so a batch interrupted at any point can be
 * picked up again by {@link #resume(String, String, boolean)} from another process. Merge
 * failures end the session in {@code failed} and are reported in the returned result rather than
 * thrown.
 */
@Slf4j
@Service
public class BatchOrchestrationService {

    private final ToolRegistry toolRegistry;
    private final CsvDatasetCodec csvCodec;
    private final ChunkPlanner chunkPlanner;
    private final JobIdGenerator jobIdGenerator;
    private final SubmissionService submissionService;
    private final PollingCoordinator pollingCoordinator;
    private final ProgressLedgerReader progressLedgerReader;
    private final ResultMerger resultMerger;
    private final LedgerResultMerger ledgerResultMerger;
    private final SessionRegistry sessionRegistry;
    private final AsyncTaskExecutor chunkTaskExecutor;
    private final JobRelayConfig config;

    public BatchOrchestrationService(final ToolRegistry toolRegistry, final CsvDatasetCodec csvCodec,
                                     final ChunkPlanner chunkPlanner, final JobIdGenerator jobIdGenerator,
                                     final SubmissionService submissionService,
                                     final PollingCoordinator pollingCoordinator,
                                     final ProgressLedgerReader progressLedgerReader,
                                     final ResultMerger resultMerger, final LedgerResultMerger ledgerResultMerger,
                                     final SessionRegistry sessionRegistry,
                                     @Qualifier("chunkTaskExecutor") final AsyncTaskExecutor chunkTaskExecutor,
                                     final JobRelayConfig config) {
        this.toolRegistry = toolRegistry;
        this.csvCodec = csvCodec;
        this.chunkPlanner = chunkPlanner;
        this.jobIdGenerator = jobIdGenerator;
        this.submissionService = submissionService;
        this.pollingCoordinator = pollingCoordinator;
        this.progressLedgerReader = progressLedgerReader;
        this.resultMerger = resultMerger;
        this.ledgerResultMerger = ledgerResultMerger;
        this.sessionRegistry = sessionRegistry;
        this.chunkTaskExecutor = chunkTaskExecutor;
        this.config = config;
    }

    /**
     * Processes a CSV dataset with {@code toolId}, blocking until every chunk has finished or timed
     * out and the results have been merged.
     *
     * @param chunkSize Rows per chunk, or null for the configured default.
     * @throws InvalidDatasetException if the CSV is unreadable or empty, or the chunk size is out of bounds.
     */
    public BatchResult process(final String toolId, final byte[] csv, final String filename,
                               final Integer chunkSize) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final int size = chunkPlanner.resolveChunkSize(chunkSize);
        final CsvDataset dataset = csvCodec.parse(csv);
        if (dataset.rowCount() == 0) {
            throw new InvalidDatasetException("The dataset has a header but no data rows.");
        }

        final String sessionId = jobIdGenerator.newSessionId();
        final List<ChunkDescriptor> chunks = chunkPlanner.plan(sessionId, dataset.rowCount(), size);
        final SessionEntry entry = SessionEntry.builder()
                                               .sessionId(sessionId)
                                               .tool(toolId)
                                               .mode(workspace.mode())
                                               .sourceFilename(JobKeyLayout.sanitizeFilename(filename))
                                               .totalRows(dataset.rowCount())
                                               .chunkSize(size)
                                               .totalChunks(chunks.size())
                                               .state(SessionState.SUBMITTING)
                                               .chunks(toSessionChunks(chunks))
                                               .build();
        sessionRegistry.register(entry);
        log.info("Processing {} row(s) from '{}' with tool '{}' as session {} ({} chunk(s) of up to {}).",
                 dataset.rowCount(), entry.getSourceFilename(), toolId, sessionId, chunks.size(), size);

        if (entry.isSingleJob()) {
            runChunkPipeline(workspace, entry, entry.getChunks().get(0), csv, entry.getSourceFilename());
            if (!stoppedByInterrupt(entry)) {
                finishSingleJob(workspace, entry);
            }
        } else if (workspace.mode() == BatchMode.LEDGER) {
            uploadLedgerChunks(workspace, entry, dataset, chunks);
            awaitLedger(workspace, entry);
            if (!stoppedByInterrupt(entry)) {
                mergeLedger(workspace, entry);
            }
        } else {
            runJobChunks(workspace, entry, dataset, chunks);
            if (!stoppedByInterrupt(entry)) {
                mergeJobChunks(workspace, entry);
            }
        }
        return BatchResult.from(entry);
    }

    /**
     * Picks up a session from the registry alone: waits for any chunk that has not reached a
     * terminal outcome, then merges. A session that is already merged is returned unchanged
     * unless {@code forceMerge} is set, in which case late results are collected and merged again.
     * <p>
     * Chunks that were never submitted cannot be rebuilt from the registry. A session with such
     * chunks is not merged; it ends in {@code failed} with the missing chunk numbers in its error.
     *
     * @throws JobNotFoundException if the tool has no session with this identifier.
     */
    public BatchResult resume(final String toolId, final String sessionId, final boolean forceMerge) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final SessionEntry entry = sessionRegistry.find(toolId, sessionId).orElseThrow(
                () -> new JobNotFoundException("No session " + sessionId + " for tool '" + toolId + "'"));
        if (entry.getState() == SessionState.MERGED && !forceMerge) {
            log.info("Session {} of tool '{}' is already merged.", sessionId, toolId);
            return BatchResult.from(entry);
        }

        log.info("Resuming session {} of tool '{}' from state {} (force merge: {}).", sessionId, toolId,
                 entry.getState().getValue(), forceMerge);
        if (entry.getMode() == BatchMode.LEDGER && !entry.isSingleJob()) {
            awaitLedger(workspace, entry);
            if (!stoppedByInterrupt(entry)) {
                mergeLedger(workspace, entry);
            }
            return BatchResult.from(entry);
        }

        for (SessionChunk chunk : entry.getChunks()) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (chunk.getJobId() == null || isSettled(chunk.getOutcome())) {
                continue;
            }
            final JobStatusView status = pollingCoordinator.waitForTerminal(toolId, chunk.getJobId());
            record(entry, chunk, c -> {
                c.setOutcome(status.status());
                c.setError(status.error());
            });
        }
        if (stoppedByInterrupt(entry)) {
            return BatchResult.from(entry);
        }
        final List<Integer> unsubmitted = entry.getChunks().stream()
                                               .filter(BatchOrchestrationService::isUnsubmitted)
                                               .map(SessionChunk::getChunkIndex)
                                               .toList();
        if (!unsubmitted.isEmpty()) {
            markUnsubmitted(entry, unsubmitted);
            return BatchResult.from(entry);
        }
        if (entry.isSingleJob()) {
            finishSingleJob(workspace, entry);
        } else {
            mergeJobChunks(workspace, entry);
        }
        return BatchResult.from(entry);
    }

    private void runJobChunks(final ToolWorkspace workspace, final SessionEntry entry, final CsvDataset dataset,
                              final List<ChunkDescriptor> chunks) {
        final List<Runnable> pipelines = new ArrayList<>(chunks.size());
        for (ChunkDescriptor descriptor : chunks) {
            final SessionChunk chunk = entry.getChunks().get(descriptor.chunkIndex() - 1);
            final byte[] payload = csvCodec.write(dataset.slice(descriptor));
            final String filename = chunkFilename(entry, descriptor.chunkIndex());
            pipelines.add(() -> runChunkPipeline(workspace, entry, chunk, payload, filename));
        }

        final int maxInFlight = config.getChunking().getMaxInFlight();
        if (maxInFlight <= 1) {
            for (int i = 0; i < pipelines.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Session {} interrupted; {} chunk(s) left unsubmitted.", entry.getSessionId(),
                             pipelines.size() - i);
                    return;
                }
                pipelines.get(i).run();
            }
            return;
        }
        log.info("Running {} chunk pipeline(s) of session {} with up to {} in flight.", pipelines.size(),
                 entry.getSessionId(), maxInFlight);
        final List<Future<?>> futures = new ArrayList<>(pipelines.size());
        for (Runnable pipeline : pipelines) {
            futures.add(chunkTaskExecutor.submit(pipeline));
        }
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            log.warn("Session {} interrupted; cancelling its chunk pipelines.", entry.getSessionId());
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            throw new SubmissionException("A chunk pipeline of session " + entry.getSessionId() + " failed",
                                          e.getCause());
        }
    }

    /**
     * Submits one chunk and waits for it, resubmitting a failed or timed-out chunk until the
     * configured number of attempts is spent. Never throws: every outcome lands in the registry.
     */
    private void runChunkPipeline(final ToolWorkspace workspace, final SessionEntry entry, final SessionChunk chunk,
                                  final byte[] payload, final String filename) {
        final String toolId = workspace.toolId();
        final int maxAttempts = Math.max(1, config.getChunking().getMaxAttempts());
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Chunk {} of session {} stopped before attempt {}: interrupted.", chunk.getChunkIndex(),
                             entry.getSessionId(), attempt);
                    return;
                }
                final SubmittedJob job;
                try {
                    job = submissionService.submit(toolId, payload, filename);
                } catch (SubmissionException e) {
                    log.warn("Chunk {} of session {} could not be submitted (attempt {}/{}): {}",
                             chunk.getChunkIndex(), entry.getSessionId(), attempt, maxAttempts, e.getMessage());
                    record(entry, chunk, c -> {
                        c.setAttempts(c.getAttempts() + 1);
                        c.setOutcome(JobStatus.FAILED);
                        c.setError(e.getMessage());
                    });
                    continue;
                }
                record(entry, chunk, c -> {
                    c.setJobId(job.jobId());
                    c.setAttempts(c.getAttempts() + 1);
                    c.setOutcome(JobStatus.PENDING);
                    c.setError(null);
                });

                final JobStatusView status = pollingCoordinator.waitForTerminal(toolId, job.jobId());
                record(entry, chunk, c -> {
                    c.setOutcome(status.status());
                    c.setError(status.error());
                });
                if (status.status() == JobStatus.COMPLETED) {
                    log.info("Chunk {} of session {} completed as job {}.", chunk.getChunkIndex(),
                             entry.getSessionId(), job.jobId());
                    return;
                }
                log.warn("Chunk {} of session {} ended as {} on attempt {}/{} (job {}).", chunk.getChunkIndex(),
                         entry.getSessionId(), status.status().getValue(), attempt, maxAttempts, job.jobId());
            }
        } catch (RuntimeException e) {
            log.error("Chunk {} of session {} aborted unexpectedly.", chunk.getChunkIndex(), entry.getSessionId(), e);
            record(entry, chunk, c -> {
                c.setOutcome(JobStatus.UNKNOWN);
                c.setError(e.getMessage());
            });
        }
    }

    private void finishSingleJob(final ToolWorkspace workspace, final SessionEntry entry) {
        final SessionChunk chunk = entry.getChunks().get(0);
        synchronized (entry) {
            if (chunk.getOutcome() == JobStatus.COMPLETED) {
                entry.setState(SessionState.MERGED);
                entry.setMergedKey(workspace.layout().resultKey(chunk.getJobId()));
                entry.setSuccessfulChunks(1);
                entry.setError(null);
                log.info("Session {} finished as single job {}.", entry.getSessionId(), chunk.getJobId());
            } else {
                entry.setState(SessionState.FAILED);
                entry.setSuccessfulChunks(0);
                entry.setError(String.format("Job %s ended as %s%s", chunk.getJobId(),
                                             chunk.getOutcome() == null ? "unknown" : chunk.getOutcome().getValue(),
                                             chunk.getError() == null ? "" : ": " + chunk.getError()));
                log.warn("Session {} failed: {}", entry.getSessionId(), entry.getError());
            }
            sessionRegistry.update(entry);
        }
    }

    private void mergeJobChunks(final ToolWorkspace workspace, final SessionEntry entry) {
        final List<ChunkArtifact> artifacts = entry.getChunks().stream()
                                                   .map(c -> new ChunkArtifact(c.getChunkIndex(), c.getOutcome(),
                                                                               c.getJobId() == null
                                                                                       ? null
                                                                                       : workspace.layout()
                                                                                                  .resultKey(c.getJobId())))
                                                   .toList();
        try {
            final MergedArtifact merged = resultMerger.merge(workspace.toolId(), entry.getSessionId(), artifacts);
            markMerged(entry, merged);
        } catch (MergeException e) {
            markFailed(entry, e);
        }
        sessionRegistry.update(entry);
    }

    private void uploadLedgerChunks(final ToolWorkspace workspace, final SessionEntry entry,
                                    final CsvDataset dataset, final List<ChunkDescriptor> chunks) {
        final String sessionId = entry.getSessionId();
        final JobKeyLayout layout = workspace.layout();
        try {
            final int stale = workspace.store().deletePrefix(layout.sessionChunksPrefix(sessionId))
                    + workspace.store().deletePrefix(layout.sessionResultsPrefix(sessionId));
            if (stale > 0) {
                log.info("Removed {} stale object(s) of session {}.", stale, sessionId);
            }
            for (ChunkDescriptor descriptor : chunks) {
                workspace.store().put(layout.sessionChunkKey(sessionId, descriptor.chunkIndex()),
                                      csvCodec.write(dataset.slice(descriptor)));
                final SessionChunk chunk = entry.getChunks().get(descriptor.chunkIndex() - 1);
                chunk.setAttempts(1);
                chunk.setOutcome(JobStatus.PENDING);
            }
        } catch (BlobStoreException e) {
            entry.setState(SessionState.FAILED);
            entry.setError("Chunk upload failed: " + e.getMessage());
            sessionRegistry.update(entry);
            throw new SubmissionException("Failed to upload chunks of session " + sessionId, e);
        }
        entry.setState(SessionState.SUBMITTED);
        sessionRegistry.update(entry);
        log.info("Uploaded {} chunk(s) of session {} to tool '{}'.", chunks.size(), sessionId, workspace.toolId());
    }

    private void awaitLedger(final ToolWorkspace workspace, final SessionEntry entry) {
        final String toolId = workspace.toolId();
        final String sessionId = entry.getSessionId();
        final ProgressListener listener = progress -> log.info("Session {} progress: {}/{} chunk(s).", sessionId,
                                                                progress.completedChunks(), progress.totalChunks());
        final BatchProgress progress = pollingCoordinator.waitForChunks(toolId, sessionId, entry.getTotalChunks(),
                                                                        config.getPolling().getBatchMaxWait(),
                                                                        listener);
        Set<Integer> completed;
        try {
            completed = progressLedgerReader.completedChunkIndexes(toolId, sessionId, entry.getTotalChunks());
        } catch (BlobStoreException e) {
            log.warn("Could not re-read the ledger for session {}: {}", sessionId, e.getMessage());
            completed = Set.of();
        }
        for (SessionChunk chunk : entry.getChunks()) {
            if (completed.contains(chunk.getChunkIndex())) {
                chunk.setOutcome(JobStatus.COMPLETED);
            } else if (progress.timedOut()) {
                chunk.setOutcome(JobStatus.TIMEOUT);
            }
        }
        sessionRegistry.update(entry);
    }

    private void mergeLedger(final ToolWorkspace workspace, final SessionEntry entry) {
        try {
            final MergedArtifact merged = ledgerResultMerger.mergeLedgerResults(workspace.toolId(),
                                                                                entry.getSessionId(),
                                                                                entry.getTotalChunks());
            markMerged(entry, merged);
        } catch (MergeException e) {
            markFailed(entry, e);
        }
        sessionRegistry.update(entry);
    }

    private void markMerged(final SessionEntry entry, final MergedArtifact merged) {
        entry.setState(SessionState.MERGED);
        entry.setMergedKey(merged.mergedKey());
        entry.setFailuresKey(merged.failuresKey());
        entry.setSuccessfulChunks(merged.successfulChunks());
        entry.setError(null);
        log.info("Session {} merged: {}/{} chunk(s) into '{}'.", entry.getSessionId(), merged.successfulChunks(),
                 merged.totalChunks(), merged.mergedKey());
    }

    private void markUnsubmitted(final SessionEntry entry, final List<Integer> chunkIndexes) {
        synchronized (entry) {
            entry.setState(SessionState.FAILED);
            entry.setError(String.format("Chunk(s) %s of session %s were never submitted; process the dataset "
                                         + "again to cover their rows", chunkIndexes, entry.getSessionId()));
            log.warn("Session {} not merged: chunk(s) {} were never submitted.", entry.getSessionId(), chunkIndexes);
            save(entry);
        }
    }

    /**
     * Leaves the session as it stands when the calling thread has been interrupted, so a later
     * {@link #resume(String, String, boolean)} can pick it up.
     *
     * @return true if the thread is interrupted.
     */
    private boolean stoppedByInterrupt(final SessionEntry entry) {
        if (!Thread.currentThread().isInterrupted()) {
            return false;
        }
        synchronized (entry) {
            log.warn("Session {} interrupted in state {}; not merging.", entry.getSessionId(),
                     entry.getState().getValue());
            save(entry);
        }
        return true;
    }

    private void markFailed(final SessionEntry entry, final MergeException e) {
        entry.setState(SessionState.FAILED);
        entry.setSuccessfulChunks(0);
        entry.setError(e.getMessage());
        log.error("Session {} could not be merged: {}", entry.getSessionId(), e.getMessage());
    }

    /**
     * Applies a change to one chunk and persists the session. Chunk pipelines running in parallel
     * share the entry, so both steps happen under its lock.
     */
    private void record(final SessionEntry entry, final SessionChunk chunk, final Consumer<SessionChunk> change) {
        synchronized (entry) {
            change.accept(chunk);
            save(entry);
        }
    }

    private void save(final SessionEntry entry) {
        try {
            sessionRegistry.update(entry);
        } catch (BlobStoreException e) {
            log.warn("Registry update for session {} failed, keeping state in memory: {}", entry.getSessionId(),
                     e.getMessage());
        }
    }

    private static boolean isUnsubmitted(final SessionChunk chunk) {
        return chunk.getJobId() == null && chunk.getAttempts() == 0;
    }

    private static boolean isSettled(final JobStatus outcome) {
        return outcome == JobStatus.COMPLETED || outcome == JobStatus.FAILED;
    }

    private static String chunkFilename(final SessionEntry entry, final int chunkIndex) {
        return String.format("%s_chunk%d_%s.csv", entry.getSessionId(), chunkIndex,
                             FilenameUtils.getBaseName(entry.getSourceFilename()));
    }

    private static List<SessionChunk> toSessionChunks(final List<ChunkDescriptor> chunks) {
        final List<SessionChunk> sessionChunks = new ArrayList<>(chunks.size());
        for (ChunkDescriptor chunk : chunks) {
            sessionChunks.add(SessionChunk.builder()
                                          .chunkIndex(chunk.chunkIndex())
                                          .startRow(chunk.startRow())
                                          .endRow(chunk.endRow())
                                          .build());
        }
        return sessionChunks;
    }
}
