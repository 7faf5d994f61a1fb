package com.eyelevel.jobrelay.controller;

import com.eyelevel.jobrelay.dto.common.ApiResponse;
import com.eyelevel.jobrelay.dto.job.JobSubmissionResponse;
import com.eyelevel.jobrelay.dto.rules.request.AddRuleRequest;
import com.eyelevel.jobrelay.dto.tool.ToolSummary;
import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.exception.JobNotFoundException;
import com.eyelevel.jobrelay.model.BatchResult;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.model.LookupResult;
import com.eyelevel.jobrelay.model.RuleSet;
import com.eyelevel.jobrelay.model.RuleUpdate;
import com.eyelevel.jobrelay.model.SubmittedJob;
import com.eyelevel.jobrelay.service.batch.BatchOrchestrationService;
import com.eyelevel.jobrelay.service.download.DownloadService;
import com.eyelevel.jobrelay.service.poll.PollingCoordinator;
import com.eyelevel.jobrelay.service.registry.LookupService;
import com.eyelevel.jobrelay.service.rules.RuleSetService;
import com.eyelevel.jobrelay.service.status.StatusTracker;
import com.eyelevel.jobrelay.service.submit.SubmissionService;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * REST controller exposing job submission, status, waiting, batch processing and worker rules for
 * every configured tool. All JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/relay/v1")
@RequiredArgsConstructor
@Validated
public class JobRelayController implements JobRelayApi {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ToolRegistry toolRegistry;
    private final SubmissionService submissionService;
    private final StatusTracker statusTracker;
    private final PollingCoordinator pollingCoordinator;
    private final BatchOrchestrationService batchOrchestrationService;
    private final LookupService lookupService;
    private final DownloadService downloadService;
    private final RuleSetService ruleSetService;

    @Override
    @GetMapping("/tools")
    public ResponseEntity<ApiResponse<List<ToolSummary>>> listTools() {
        final List<ToolSummary> tools = toolRegistry.all().stream()
                                                    .map(w -> new ToolSummary(w.toolId(), w.name(), w.description(),
                                                                              w.store().bucket(), w.mode()))
                                                    .toList();
        return ok(tools, null);
    }

    @Override
    @PostMapping(value = "/tools/{toolId}/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<JobSubmissionResponse>> submitJob(@PathVariable final String toolId,
                                                                        @RequestPart("file") final MultipartFile file) {
        log.info("Received job for tool '{}': file '{}' ({} bytes).", toolId, file.getOriginalFilename(),
                 file.getSize());
        final SubmittedJob job = submissionService.submit(toolId, readNonEmpty(file), file.getOriginalFilename());
        return ok(JobSubmissionResponse.from(job), "Job submitted successfully.");
    }

    @Override
    @GetMapping("/tools/{toolId}/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusView>> getJobStatus(@PathVariable final String toolId,
                                                                   @PathVariable final String jobId) {
        return ok(requireFound(statusTracker.getStatus(toolId, jobId)), null);
    }

    @Override
    @PostMapping("/tools/{toolId}/jobs/{jobId}/wait")
    public ResponseEntity<ApiResponse<JobStatusView>> waitForJob(
            @PathVariable final String toolId, @PathVariable final String jobId,
            @RequestParam(value = "maxWaitSeconds", required = false) final Integer maxWaitSeconds) {
        final Duration maxWait = maxWaitSeconds == null
                ? pollingCoordinator.defaultMaxWait()
                : Duration.ofSeconds(maxWaitSeconds);
        final JobStatusView status = pollingCoordinator.waitForTerminal(toolId, jobId, maxWait);
        return ok(requireFound(status), null);
    }

    @Override
    @GetMapping("/tools/{toolId}/jobs/{jobId}/results")
    public ResponseEntity<byte[]> downloadJobResults(@PathVariable final String toolId,
                                                     @PathVariable final String jobId) {
        return attachment(downloadService.downloadJobResults(toolId, jobId), jobId + "_results.csv");
    }

    @Override
    @PostMapping(value = "/tools/{toolId}/batches", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<BatchResult>> processBatch(
            @PathVariable final String toolId, @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "chunkSize", required = false) final Integer chunkSize) {
        log.info("Received batch for tool '{}': file '{}' ({} bytes), chunk size {}.", toolId,
                 file.getOriginalFilename(), file.getSize(), chunkSize == null ? "default" : chunkSize);
        final BatchResult result = batchOrchestrationService.process(toolId, readNonEmpty(file),
                                                                     file.getOriginalFilename(), chunkSize);
        return ok(result, "Batch finished in state '" + result.state().getValue() + "'.");
    }

    @Override
    @GetMapping("/tools/{toolId}/lookup/{id}")
    public ResponseEntity<ApiResponse<LookupResult>> lookup(@PathVariable final String toolId,
                                                            @PathVariable final String id) {
        final LookupResult result = lookupService.lookup(toolId, id);
        if (result.kind() == LookupResult.Kind.NOT_FOUND) {
            throw new JobNotFoundException("No job or session '" + id + "' for tool '" + toolId + "'");
        }
        return ok(result, null);
    }

    @Override
    @PostMapping("/tools/{toolId}/batches/{sessionId}/resume")
    public ResponseEntity<ApiResponse<BatchResult>> resumeBatch(
            @PathVariable final String toolId, @PathVariable final String sessionId,
            @RequestParam(value = "forceMerge", defaultValue = "false") final boolean forceMerge) {
        final BatchResult result = batchOrchestrationService.resume(toolId, sessionId, forceMerge);
        return ok(result, "Batch is in state '" + result.state().getValue() + "'.");
    }

    @Override
    @GetMapping("/tools/{toolId}/batches/{sessionId}/artifacts/{name}")
    public ResponseEntity<byte[]> downloadBatchArtifact(@PathVariable final String toolId,
                                                        @PathVariable final String sessionId,
                                                        @PathVariable final String name) {
        final DownloadService.Artifact artifact = downloadService.downloadSessionArtifact(toolId, sessionId, name);
        return attachment(artifact.content(), FilenameUtils.getName(artifact.key()));
    }

    @Override
    @GetMapping("/tools/{toolId}/rules")
    public ResponseEntity<ApiResponse<RuleSet>> getRules(@PathVariable final String toolId) {
        return ok(ruleSetService.load(toolId), null);
    }

    @Override
    @PostMapping("/tools/{toolId}/rules")
    public ResponseEntity<ApiResponse<RuleUpdate>> addRule(@PathVariable final String toolId,
                                                           @RequestBody @Valid final AddRuleRequest request) {
        log.info("Rule change for tool '{}' on '{}': {}", toolId, request.getCategory(),
                 request.getDescription() == null ? "no description" : request.getDescription());
        final RuleUpdate update = ruleSetService.addItems(toolId, request.getCategory(), request.getItems());
        return ok(update, update.message());
    }

    @Override
    @PostMapping("/tools/{toolId}/rules/reset")
    public ResponseEntity<ApiResponse<RuleSet>> resetRules(@PathVariable final String toolId) {
        return ok(ruleSetService.resetToDefaults(toolId), "Rules reset to defaults.");
    }

    private static JobStatusView requireFound(final JobStatusView status) {
        if (status.status() == JobStatus.NOT_FOUND) {
            throw new JobNotFoundException("Job " + status.jobId() + " was not found for tool '" + status.toolId() + "'");
        }
        return status;
    }

    private static byte[] readNonEmpty(final MultipartFile file) {
        if (file.isEmpty()) {
            throw new InvalidDatasetException("The uploaded file is empty.");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InvalidDatasetException("The uploaded file could not be read.", e);
        }
    }

    private static <T> ResponseEntity<ApiResponse<T>> ok(final T data, final String message) {
        final ApiResponse<T> response = ApiResponse.<T>builder()
                                                   .response(data)
                                                   .displayMessage(message)
                                                   .showMessage(message != null)
                                                   .statusCode(HttpStatus.OK.value())
                                                   .build();
        return ResponseEntity.ok(response);
    }

    private static ResponseEntity<byte[]> attachment(final byte[] content, final String filename) {
        final MediaType type = filename.endsWith(".json") ? MediaType.APPLICATION_JSON : TEXT_CSV;
        return ResponseEntity.ok()
                             .contentType(type)
                             .header(HttpHeaders.CONTENT_DISPOSITION,
                                     ContentDisposition.attachment().filename(filename).build().toString())
                             .body(content);
    }
}
