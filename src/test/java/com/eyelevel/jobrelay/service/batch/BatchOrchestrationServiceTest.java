package com.eyelevel.jobrelay.service.batch;

import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.exception.JobNotFoundException;
import com.eyelevel.jobrelay.model.BatchMode;
import com.eyelevel.jobrelay.model.BatchResult;
import com.eyelevel.jobrelay.model.CsvDataset;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.LookupResult;
import com.eyelevel.jobrelay.model.SessionChunk;
import com.eyelevel.jobrelay.model.SessionEntry;
import com.eyelevel.jobrelay.model.SessionState;
import com.eyelevel.jobrelay.store.BlobStore;
import com.eyelevel.jobrelay.store.memory.InMemoryBlobStoreFactory;
import com.eyelevel.jobrelay.support.RelayFixture;
import com.eyelevel.jobrelay.support.SimulatedWorker;
import com.eyelevel.jobrelay.support.SimulatedWorker.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.eyelevel.jobrelay.support.RelayFixture.JOB_TOOL;
import static com.eyelevel.jobrelay.support.RelayFixture.LEDGER_TOOL;
import static com.eyelevel.jobrelay.support.RelayFixture.csv;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchOrchestrationServiceTest {

    private RelayFixture fixture = new RelayFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void splitsSubmitsAndMergesInRowOrder() {
        fixture.worker(JOB_TOOL);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(120), "leads.csv", 50);

        assertThat(result.state()).isEqualTo(SessionState.MERGED);
        assertThat(result.mode()).isEqualTo(BatchMode.JOB);
        assertThat(result.totalChunks()).isEqualTo(3);
        assertThat(result.successfulChunks()).isEqualTo(3);
        assertThat(result.chunks()).extracting(c -> c.getEndRow() - c.getStartRow()).containsExactly(50, 50, 20);
        assertThat(result.chunks()).allSatisfy(c -> {
            assertThat(c.getOutcome()).isEqualTo(JobStatus.COMPLETED);
            assertThat(c.getAttempts()).isEqualTo(1);
        });
        assertThat(result.mergedKey()).isEqualTo("results/" + result.sessionId() + "_combined_results.csv");

        CsvDataset merged = mergedDataset(JOB_TOOL, result.mergedKey());
        assertThat(merged.header()).containsExactly("id", "name", "processed");
        assertThat(merged.rows()).extracting(row -> row.get(0))
                                 .containsExactlyElementsOf(ids(1, 120));
    }

    @Test
    void chunkInputsCarryTheSessionAndChunkNumber() {
        SimulatedWorker worker = fixture.worker(JOB_TOOL);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(25), "my leads.csv", 10);

        assertThat(worker.processedInputs())
            .hasSize(3)
            .allSatisfy(key -> assertThat(key).contains("_" + result.sessionId() + "_chunk"))
            .anySatisfy(key -> assertThat(key).endsWith(result.sessionId() + "_chunk3_my leads.csv"));
    }

    @Test
    void failedChunkIsResubmittedOnce() {
        Set<String> failedOnce = ConcurrentHashMap.newKeySet();
        fixture.worker(JOB_TOOL).behaving((jobId, key) ->
            key.contains("_chunk2_") && failedOnce.add("chunk2") ? Outcome.FAIL : Outcome.COMPLETE);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(120), "leads.csv", 50);

        SessionChunk second = result.chunks().get(1);
        assertThat(second.getAttempts()).isEqualTo(2);
        assertThat(second.getOutcome()).isEqualTo(JobStatus.COMPLETED);
        assertThat(second.getError()).isNull();
        assertThat(result.successfulChunks()).isEqualTo(3);
    }

    @Test
    void chunkFailingEveryAttemptIsLeftOutOfTheMerge() {
        fixture.worker(JOB_TOOL).behaving((jobId, key) -> key.contains("_chunk2_") ? Outcome.FAIL : Outcome.COMPLETE);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(120), "leads.csv", 50);

        assertThat(result.state()).isEqualTo(SessionState.MERGED);
        assertThat(result.successfulChunks()).isEqualTo(2);
        SessionChunk second = result.chunks().get(1);
        assertThat(second.getAttempts()).isEqualTo(2);
        assertThat(second.getOutcome()).isEqualTo(JobStatus.FAILED);
        assertThat(second.getError()).isEqualTo("simulated worker failure");

        CsvDataset merged = mergedDataset(JOB_TOOL, result.mergedKey());
        assertThat(merged.rowCount()).isEqualTo(70);
        assertThat(merged.rows().get(50).get(0)).isEqualTo("101");
    }

    @Test
    void sessionFailsWhenNoChunkSucceeds() {
        fixture.worker(JOB_TOOL).behaving((jobId, key) -> Outcome.FAIL);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(30), "leads.csv", 10);

        assertThat(result.state()).isEqualTo(SessionState.FAILED);
        assertThat(result.successfulChunks()).isZero();
        assertThat(result.mergedKey()).isNull();
        assertThat(result.error()).isEqualTo("No chunks processed successfully for session "
                                             + result.sessionId() + " (0/3)");
        assertThat(fixture.sessionRegistry.find(JOB_TOOL, result.sessionId()))
            .hasValueSatisfying(entry -> assertThat(entry.getState()).isEqualTo(SessionState.FAILED));
    }

    @Test
    void smallDatasetRunsAsOneJobWithTheOriginalPayload() {
        SimulatedWorker worker = fixture.worker(JOB_TOOL);
        byte[] payload = "id,name\n1,a\n2,b\n".getBytes(StandardCharsets.UTF_8);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, payload, "tiny.csv", null);

        assertThat(result.totalChunks()).isEqualTo(1);
        assertThat(result.state()).isEqualTo(SessionState.MERGED);
        String jobId = result.chunks().get(0).getJobId();
        assertThat(result.mergedKey()).isEqualTo("results/" + jobId + "_results.csv");
        assertThat(worker.processedInputs()).containsExactly("input/" + jobId + "_tiny.csv");
        BlobStore store = fixture.workspace(JOB_TOOL).store();
        assertThat(store.get("input/" + jobId + "_tiny.csv")).hasValueSatisfying(
            bytes -> assertThat(bytes).isEqualTo(payload));
    }

    @Test
    void singleJobFailureFailsTheSession() {
        fixture.config.getChunking().setMaxAttempts(1);
        fixture.worker(JOB_TOOL).behaving((jobId, key) -> Outcome.FAIL);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(5), "tiny.csv", null);

        assertThat(result.state()).isEqualTo(SessionState.FAILED);
        assertThat(result.error()).endsWith("failed: simulated worker failure");
    }

    @Test
    void ledgerModeUploadsChunksAndMergesArchives() {
        fixture.worker(LEDGER_TOOL);

        BatchResult result = fixture.orchestrator.process(LEDGER_TOOL, csv(120), "contacts.csv", 50);

        String prefix = "users/" + result.sessionId() + "/";
        assertThat(result.mode()).isEqualTo(BatchMode.LEDGER);
        assertThat(result.state()).isEqualTo(SessionState.MERGED);
        assertThat(result.successfulChunks()).isEqualTo(3);
        assertThat(result.mergedKey()).isEqualTo(prefix + "results/ALL_SUCCESS.csv");
        assertThat(result.failuresKey()).isEqualTo(prefix + "results/ALL_FAILURES.csv");
        assertThat(result.chunks()).allSatisfy(c -> assertThat(c.getOutcome()).isEqualTo(JobStatus.COMPLETED));
        assertThat(fixture.workspace(LEDGER_TOOL).store().list(prefix + "chunks/")).hasSize(3);

        CsvDataset merged = mergedDataset(LEDGER_TOOL, result.mergedKey());
        assertThat(merged.rows()).extracting(row -> row.get(0)).containsExactlyElementsOf(ids(1, 120));
        assertThat(mergedDataset(LEDGER_TOOL, result.failuresKey()).rowCount()).isEqualTo(3);
    }

    @Test
    void ledgerChunksNotReportedInTimeAreMarkedTimedOut() {
        fixture.worker(LEDGER_TOOL)
               .behaving((sessionId, key) -> key.endsWith("chunk_3.csv") ? Outcome.HANG : Outcome.COMPLETE);

        BatchResult result = fixture.orchestrator.process(LEDGER_TOOL, csv(120), "contacts.csv", 50);

        assertThat(result.chunks()).extracting(SessionChunk::getOutcome)
                                   .containsExactly(JobStatus.COMPLETED, JobStatus.COMPLETED, JobStatus.TIMEOUT);
        assertThat(result.state()).isEqualTo(SessionState.MERGED);
        assertThat(result.successfulChunks()).isEqualTo(2);
    }

    @Test
    void resumeMergesLateResultsOnlyWhenForced() {
        InMemoryBlobStoreFactory stores = new InMemoryBlobStoreFactory();
        fixture.close();
        fixture = new RelayFixture(stores, config -> config.getChunking().setMaxAttempts(1));
        fixture.worker(JOB_TOOL).behaving((jobId, key) -> key.contains("_chunk3_") ? Outcome.HANG : Outcome.COMPLETE);

        BatchResult first = fixture.orchestrator.process(JOB_TOOL, csv(120), "leads.csv", 50);
        assertThat(first.successfulChunks()).isEqualTo(2);
        assertThat(first.chunks().get(2).getOutcome()).isEqualTo(JobStatus.TIMEOUT);

        // the worker finishes chunk 3 after the batch gave up on it
        String lateJob = first.chunks().get(2).getJobId();
        BlobStore store = fixture.workspace(JOB_TOOL).store();
        store.put("results/" + lateJob + "_results.csv",
                  "id,name,processed\n101,name-101,yes\n".getBytes(StandardCharsets.UTF_8));
        store.put("status/" + lateJob + "_status.json",
                  "{\"status\":\"completed\"}".getBytes(StandardCharsets.UTF_8));

        try (RelayFixture otherProcess = new RelayFixture(stores, config -> { })) {
            BatchResult unchanged = otherProcess.orchestrator.resume(JOB_TOOL, first.sessionId(), false);
            assertThat(unchanged.successfulChunks()).isEqualTo(2);

            BatchResult resumed = otherProcess.orchestrator.resume(JOB_TOOL, first.sessionId(), true);
            assertThat(resumed.state()).isEqualTo(SessionState.MERGED);
            assertThat(resumed.successfulChunks()).isEqualTo(3);
            assertThat(resumed.chunks().get(2).getOutcome()).isEqualTo(JobStatus.COMPLETED);
            assertThat(otherProcess.sessionRegistry.find(JOB_TOOL, first.sessionId()))
                .map(SessionEntry::getSuccessfulChunks)
                .hasValue(3);
        }
    }

    @Test
    void interruptStopsSubmittingFurtherChunksAndLeavesTheSessionResumable() {
        fixture.onTick(() -> Thread.currentThread().interrupt());

        BatchResult result = processInterrupted(csv(120));

        BlobStore store = fixture.workspace(JOB_TOOL).store();
        assertThat(store.list("input/")).hasSize(1);
        assertThat(result.state()).isEqualTo(SessionState.SUBMITTING);
        assertThat(result.mergedKey()).isNull();
        SessionChunk first = result.chunks().get(0);
        assertThat(first.getJobId()).isNotNull();
        assertThat(first.getOutcome()).isEqualTo(JobStatus.TIMEOUT);
        assertThat(first.getError()).isEqualTo("Wait interrupted");
        assertThat(result.chunks().subList(1, 3)).allSatisfy(c -> {
            assertThat(c.getJobId()).isNull();
            assertThat(c.getAttempts()).isZero();
            assertThat(c.getOutcome()).isNull();
        });
        assertThat(store.exists("results/" + result.sessionId() + "_combined_results.csv")).isFalse();
        assertThat(fixture.sessionRegistry.find(JOB_TOOL, result.sessionId()))
            .hasValueSatisfying(entry -> assertThat(entry.getState()).isEqualTo(SessionState.SUBMITTING));
    }

    @Test
    void resumeDoesNotMergeASessionWithUnsubmittedChunks() {
        InMemoryBlobStoreFactory stores = new InMemoryBlobStoreFactory();
        fixture.close();
        fixture = new RelayFixture(stores, config -> { });
        fixture.onTick(() -> Thread.currentThread().interrupt());
        BatchResult interrupted = processInterrupted(csv(120));
        String firstJob = interrupted.chunks().get(0).getJobId();

        try (RelayFixture otherProcess = new RelayFixture(stores, config -> { })) {
            otherProcess.worker(JOB_TOOL);

            BatchResult resumed = otherProcess.orchestrator.resume(JOB_TOOL, interrupted.sessionId(), false);

            assertThat(resumed.state()).isEqualTo(SessionState.FAILED);
            assertThat(resumed.mergedKey()).isNull();
            assertThat(resumed.error()).startsWith("Chunk(s) [2, 3] of session " + interrupted.sessionId());
            assertThat(resumed.chunks()).extracting(SessionChunk::getJobId).containsExactly(firstJob, null, null);
            assertThat(resumed.chunks().get(0).getOutcome()).isEqualTo(JobStatus.COMPLETED);
            assertThat(otherProcess.workspace(JOB_TOOL).store()
                                   .exists("results/" + interrupted.sessionId() + "_combined_results.csv"))
                .isFalse();
            assertThat(otherProcess.sessionRegistry.find(JOB_TOOL, interrupted.sessionId()))
                .hasValueSatisfying(entry -> assertThat(entry.getState()).isEqualTo(SessionState.FAILED));
        }
    }

    @Test
    void resumingAnUnknownSessionFails() {
        assertThatThrownBy(() -> fixture.orchestrator.resume(JOB_TOOL, "deadbeef", false))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void concurrentPipelinesMergeInTheSameOrderAsSequentialOnes() {
        fixture.close();
        fixture = new RelayFixture(config -> config.getChunking().setMaxInFlight(3));
        fixture.worker(JOB_TOOL);

        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(95), "leads.csv", 10);

        assertThat(result.state()).isEqualTo(SessionState.MERGED);
        assertThat(result.successfulChunks()).isEqualTo(10);
        assertThat(mergedDataset(JOB_TOOL, result.mergedKey()).rows()).extracting(row -> row.get(0))
                                                                      .containsExactlyElementsOf(ids(1, 95));
        SessionEntry stored = fixture.sessionRegistry.find(JOB_TOOL, result.sessionId()).orElseThrow();
        assertThat(stored.getChunks()).allSatisfy(c -> assertThat(c.getJobId()).isNotNull());
    }

    @Test
    void lookupFindsBothSessionsAndTheirJobs() {
        fixture.worker(JOB_TOOL);
        BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv(60), "leads.csv", 50);

        LookupResult session = fixture.lookupService.lookup(JOB_TOOL, " " + result.sessionId() + " ");
        assertThat(session.kind()).isEqualTo(LookupResult.Kind.SESSION);
        assertThat(session.session().totalChunks()).isEqualTo(2);

        LookupResult job = fixture.lookupService.lookup(JOB_TOOL, result.chunks().get(0).getJobId());
        assertThat(job.kind()).isEqualTo(LookupResult.Kind.JOB);
        assertThat(job.job().status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void rejectsDatasetsWithoutRowsAndOutOfRangeChunkSizes() {
        byte[] headerOnly = "id,name\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> fixture.orchestrator.process(JOB_TOOL, headerOnly, "a.csv", null))
            .isInstanceOf(InvalidDatasetException.class);
        assertThatThrownBy(() -> fixture.orchestrator.process(JOB_TOOL, csv(20), "a.csv", 5))
            .isInstanceOf(InvalidDatasetException.class)
            .hasMessageContaining("[10, 1000]");
        assertThat(fixture.workspace(JOB_TOOL).store().list("registry/")).isEmpty();
    }

    private BatchResult processInterrupted(byte[] csv) {
        try {
            BatchResult result = fixture.orchestrator.process(JOB_TOOL, csv, "leads.csv", 50);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            return result;
        } finally {
            Thread.interrupted();
        }
    }

    private CsvDataset mergedDataset(String toolId, String key) {
        return fixture.csvCodec.parse(fixture.workspace(toolId).store().get(key).orElseThrow());
    }

    private static List<String> ids(int from, int to) {
        return IntStream.rangeClosed(from, to).mapToObj(String::valueOf).collect(Collectors.toList());
    }
}
