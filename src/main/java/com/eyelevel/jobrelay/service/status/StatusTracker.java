package com.eyelevel.jobrelay.service.status;

import com.eyelevel.jobrelay.common.json.JsonParser;
import com.eyelevel.jobrelay.exception.json.JsonParsingException;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.model.StatusRecord;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads job state from the status records workers maintain.
 * <p>
 * Store failures propagate as {@link com.eyelevel.jobrelay.exception.BlobStoreException}; every
 * other outcome, including a missing or unreadable record, is reported as a status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusTracker {

    private final ToolRegistry toolRegistry;
    private final JsonParser jsonParser;

    public JobStatusView getStatus(final String toolId, final String jobId) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final String statusKey = workspace.layout().statusKey(jobId);
        final Optional<byte[]> content = workspace.store().get(statusKey);
        if (content.isEmpty()) {
            log.debug("No status record for job {} of tool '{}'.", jobId, toolId);
            return JobStatusView.notFound(toolId, jobId);
        }

        final StatusRecord record;
        try {
            record = jsonParser.parseObject(content.get(), StatusRecord.class);
        } catch (JsonParsingException e) {
            log.warn("Status record '{}' of tool '{}' is malformed: {}", statusKey, toolId, e.getMessage());
            return new JobStatusView(jobId, toolId, JobStatus.UNKNOWN, "Status record could not be parsed", false,
                                     null, null, null);
        }

        final JobStatus status = JobStatus.convertByValue(record.getStatus());
        if (status == JobStatus.UNKNOWN) {
            log.warn("Job {} of tool '{}' reports unrecognised status '{}'.", jobId, toolId, record.getStatus());
        }
        String resultKey = null;
        boolean resultsReady = false;
        if (status == JobStatus.COMPLETED) {
            resultKey = workspace.layout().resultKey(jobId);
            resultsReady = workspace.store().exists(resultKey);
        }
        final String error = record.getError() != null || status != JobStatus.FAILED
                ? record.getError()
                : record.getMessage();
        log.debug("Job {} of tool '{}' is {} (results ready: {}).", jobId, toolId, status, resultsReady);
        return new JobStatusView(jobId, toolId, status, error, resultsReady, resultKey, record.getTimestamp(),
                                 record.getUpdatedAt());
    }

    /**
     * Fetches the result object a worker published for {@code jobId}.
     *
     * @return The result bytes, or empty if the worker has not published one.
     */
    public Optional<byte[]> downloadResults(final String toolId, final String jobId) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        return workspace.store().get(workspace.layout().resultKey(jobId));
    }
}
