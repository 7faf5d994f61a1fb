package com.eyelevel.jobrelay.service.submit;

import com.eyelevel.jobrelay.common.json.JsonSerializer;
import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.exception.SubmissionException;
import com.eyelevel.jobrelay.layout.JobIdGenerator;
import com.eyelevel.jobrelay.layout.JobKeyLayout;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.StatusRecord;
import com.eyelevel.jobrelay.model.SubmittedJob;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Hands a payload to a tool's workers.
 * <p>
 * The write happens in two phases so that a worker never observes a {@code pending} job whose
 * input is missing: the status record is first written as {@code uploading}, then the input
 * object, then the status record is rewritten as {@code pending}. A crash between the phases leaves
 * the job visibly stuck in {@code uploading}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

    private final ToolRegistry toolRegistry;
    private final JobIdGenerator jobIdGenerator;
    private final JsonSerializer jsonSerializer;
    private final Clock clock;

    /**
     * Submits {@code payload} as a new job for {@code toolId}.
     *
     * @param toolId   The tool whose workers should process the payload.
     * @param payload  The raw input bytes, stored unchanged.
     * @param filename The caller's filename; sanitized before it becomes part of the input key.
     * @return The new job, whose status record now reads {@code pending}.
     * @throws SubmissionException if any of the writes fail.
     */
    public SubmittedJob submit(final String toolId, final byte[] payload, final String filename) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final JobKeyLayout layout = workspace.layout();
        final String jobId = jobIdGenerator.newJobId();
        final String inputKey = layout.inputKey(jobId, filename);
        final String statusKey = layout.statusKey(jobId);
        final String submittedAt = now();

        log.info("Submitting job {} to tool '{}' ({} bytes, input key '{}').", jobId, toolId, payload.length,
                 inputKey);
        try {
            writeStatus(workspace, statusKey, jobId, JobStatus.UPLOADING, submittedAt);
            workspace.store().put(inputKey, payload);
            writeStatus(workspace, statusKey, jobId, JobStatus.PENDING, submittedAt);
        } catch (BlobStoreException e) {
            log.error("Submission of job {} to tool '{}' failed: {}", jobId, toolId, e.getMessage());
            throw new SubmissionException(String.format("Failed to submit job %s to tool '%s'", jobId, toolId), e);
        }
        log.info("Job {} is pending for tool '{}'.", jobId, toolId);
        return new SubmittedJob(jobId, toolId, inputKey, statusKey, submittedAt);
    }

    private void writeStatus(final ToolWorkspace workspace, final String statusKey, final String jobId,
                             final JobStatus status, final String submittedAt) {
        final StatusRecord record = StatusRecord.builder()
                                                .jobId(jobId)
                                                .tool(workspace.toolId())
                                                .status(status.getValue())
                                                .timestamp(submittedAt)
                                                .updatedAt(now())
                                                .build();
        workspace.store().put(statusKey, jsonSerializer.serialize(record, true).getBytes(StandardCharsets.UTF_8));
    }

    private String now() {
        return LocalDateTime.now(clock).toString();
    }
}
