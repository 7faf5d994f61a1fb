package com.eyelevel.jobrelay.controller;

import com.eyelevel.jobrelay.dto.common.ApiResponse;
import com.eyelevel.jobrelay.dto.job.JobSubmissionResponse;
import com.eyelevel.jobrelay.dto.rules.request.AddRuleRequest;
import com.eyelevel.jobrelay.dto.tool.ToolSummary;
import com.eyelevel.jobrelay.model.BatchResult;
import com.eyelevel.jobrelay.model.JobStatusView;
import com.eyelevel.jobrelay.model.LookupResult;
import com.eyelevel.jobrelay.model.RuleSet;
import com.eyelevel.jobrelay.model.RuleUpdate;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Job Relay", description = "Endpoints for submitting CSV datasets to tool workers and collecting their results.")
public interface JobRelayApi {

    @Operation(summary = "List Tools", description = "Lists every tool configured on this relay with its bucket and batching mode.")
    ResponseEntity<ApiResponse<List<ToolSummary>>> listTools();

    @Operation(summary = "Submit Job",
            description = "Stores the uploaded file as the input of a new job. The worker picks it up on its own; the call returns as soon as the job is pending.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job accepted.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Job submitted successfully.",
                                        "response": {
                                            "jobId": "job_20250101_120000_a1b2c3",
                                            "toolId": "name_cleaner",
                                            "inputKey": "input/job_20250101_120000_a1b2c3_names.csv",
                                            "status": "pending",
                                            "submittedAt": "2025-01-01T12:00:00"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown tool or empty file.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "The job could not be written to the store.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobSubmissionResponse>> submitJob(
            @Parameter(description = "The tool whose workers should process the file.", required = true, example = "name_cleaner") String toolId,
            @Parameter(description = "The input file, stored unchanged.", required = true) MultipartFile file);

    @Operation(summary = "Get Job Status", description = "Reads the job's status record once.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Current status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No status record exists for the job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusView>> getJobStatus(String toolId, String jobId);

    @Operation(summary = "Wait For Job",
            description = "Blocks until the job completes or fails, or until the maximum wait elapses, in which case the status is 'timeout'. The worker is not stopped on timeout.")
    ResponseEntity<ApiResponse<JobStatusView>> waitForJob(
            String toolId, String jobId,
            @Parameter(description = "Seconds to wait before giving up; defaults to the configured maximum.", example = "60")
            @Min(value = 1, message = "The 'maxWaitSeconds' must be at least 1.")
            @Max(value = 3600, message = "The 'maxWaitSeconds' must not exceed 3600.") Integer maxWaitSeconds);

    @Operation(summary = "Download Job Results", description = "Returns the CSV a worker published for a completed job.")
    ResponseEntity<byte[]> downloadJobResults(String toolId, String jobId);

    @Operation(summary = "Process Batch",
            description = "Splits the uploaded CSV into chunks, hands them to the tool's workers and merges the results. Blocks until the batch is merged or has timed out.")
    ResponseEntity<ApiResponse<BatchResult>> processBatch(
            String toolId,
            @Parameter(description = "The CSV dataset, header row first.", required = true) MultipartFile file,
            @Parameter(description = "Rows per chunk; defaults to the configured chunk size.", example = "50") Integer chunkSize);

    @Operation(summary = "Look Up Identifier", description = "Resolves an identifier to a job or a batch session of the tool.")
    ResponseEntity<ApiResponse<LookupResult>> lookup(String toolId, String id);

    @Operation(summary = "Resume Batch",
            description = "Waits for any unfinished chunk of a registered session and merges. With forceMerge, a merged session is merged again to pick up late results.")
    ResponseEntity<ApiResponse<BatchResult>> resumeBatch(String toolId, String sessionId, boolean forceMerge);

    @Operation(summary = "Download Batch Artifact", description = "Downloads 'results', 'failures' or 'summary' of a merged session.")
    ResponseEntity<byte[]> downloadBatchArtifact(String toolId, String sessionId, String name);

    @Operation(summary = "Get Worker Rules",
            description = "Returns the rules the tool's workers apply. The first read stores the tool's default rules in its bucket.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Current rules.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown tool, or a tool that keeps no rules.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RuleSet>> getRules(String toolId);

    @Operation(summary = "Add Worker Rule",
            description = "Appends items to an existing list category of the tool's rules. Items already present are skipped.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Rules updated, or unchanged when every item was present.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Added 2 items to titles_remove: m., j.",
                                        "response": {
                                            "category": "titles_remove",
                                            "added": ["m.", "j."],
                                            "message": "Added 2 items to titles_remove: m., j."
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request body, or a category that is missing or not a list.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RuleUpdate>> addRule(
            @Parameter(description = "The tool whose rules should change.", required = true, example = "name_cleaner") String toolId,
            @Valid AddRuleRequest request);

    @Operation(summary = "Reset Worker Rules", description = "Overwrites the tool's stored rules with its defaults.")
    ResponseEntity<ApiResponse<RuleSet>> resetRules(String toolId);
}
