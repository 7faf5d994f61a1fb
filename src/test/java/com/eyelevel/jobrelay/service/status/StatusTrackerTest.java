package com.eyelevel.jobrelay.service.status;

import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import com.eyelevel.jobrelay.support.RelayFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.eyelevel.jobrelay.support.RelayFixture.JOB_TOOL;
import static org.assertj.core.api.Assertions.assertThat;

class StatusTrackerTest {

    private static final String JOB_ID = "job_20250101_120000_abcdef";

    private final RelayFixture fixture = new RelayFixture();
    private ToolWorkspace workspace;
    private StatusTracker tracker;

    @BeforeEach
    void setUp() {
        workspace = fixture.workspace(JOB_TOOL);
        tracker = fixture.statusTracker;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void missingStatusRecordIsNotFound() {
        JobStatusView view = tracker.getStatus(JOB_TOOL, JOB_ID);

        assertThat(view.status()).isEqualTo(JobStatus.NOT_FOUND);
        assertThat(view.resultsReady()).isFalse();
        assertThat(view.resultKey()).isNull();
    }

    @Test
    void completedJobReportsResultAvailability() {
        writeStatus("{\"job_id\":\"" + JOB_ID + "\",\"status\":\"completed\",\"updated_at\":\"2025-01-01T12:05:00\"}");

        JobStatusView beforeResult = tracker.getStatus(JOB_TOOL, JOB_ID);
        assertThat(beforeResult.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(beforeResult.resultsReady()).isFalse();
        assertThat(beforeResult.resultKey()).isEqualTo("results/" + JOB_ID + "_results.csv");
        assertThat(beforeResult.updatedAt()).isEqualTo("2025-01-01T12:05:00");

        workspace.store().put("results/" + JOB_ID + "_results.csv", "id\n1\n".getBytes(StandardCharsets.UTF_8));
        assertThat(tracker.getStatus(JOB_TOOL, JOB_ID).resultsReady()).isTrue();
        assertThat(tracker.downloadResults(JOB_TOOL, JOB_ID)).isPresent();
    }

    @Test
    void failedJobCarriesWorkerError() {
        writeStatus("{\"status\":\"failed\",\"error\":\"rate limited\"}");

        JobStatusView view = tracker.getStatus(JOB_TOOL, JOB_ID);
        assertThat(view.status()).isEqualTo(JobStatus.FAILED);
        assertThat(view.error()).isEqualTo("rate limited");
        assertThat(view.resultKey()).isNull();
    }

    @Test
    void failedJobFallsBackToMessageField() {
        writeStatus("{\"status\":\"failed\",\"message\":\"worker crashed\"}");

        assertThat(tracker.getStatus(JOB_TOOL, JOB_ID).error()).isEqualTo("worker crashed");
    }

    @Test
    void unreadableRecordIsUnknown() {
        writeStatus("{\"status\": \"comp");

        JobStatusView view = tracker.getStatus(JOB_TOOL, JOB_ID);
        assertThat(view.status()).isEqualTo(JobStatus.UNKNOWN);
        assertThat(view.error()).isNotBlank();
    }

    @Test
    void unrecognisedStatusValueIsUnknownAndNotTerminal() {
        writeStatus("{\"status\":\"queued_for_review\",\"worker_host\":\"w-7\"}");

        JobStatusView view = tracker.getStatus(JOB_TOOL, JOB_ID);
        assertThat(view.status()).isEqualTo(JobStatus.UNKNOWN);
        assertThat(view.isTerminal()).isFalse();
    }

    @Test
    void resultsAreEmptyBeforeTheWorkerPublishes() {
        assertThat(tracker.downloadResults(JOB_TOOL, JOB_ID)).isEmpty();
    }

    private void writeStatus(String json) {
        workspace.store().put("status/" + JOB_ID + "_status.json", json.getBytes(StandardCharsets.UTF_8));
    }
}
