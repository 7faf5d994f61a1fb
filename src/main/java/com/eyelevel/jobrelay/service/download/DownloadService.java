package com.eyelevel.jobrelay.service.download;

import com.eyelevel.jobrelay.exception.JobNotFoundException;
import com.eyelevel.jobrelay.model.BatchMode;
import com.eyelevel.jobrelay.model.SessionEntry;
import com.eyelevel.jobrelay.service.registry.SessionRegistry;
import com.eyelevel.jobrelay.service.status.StatusTracker;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Serves result objects straight from the store: a single job's results, or one of the artifacts a
 * merged session produced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadService {

    private final ToolRegistry toolRegistry;
    private final StatusTracker statusTracker;
    private final SessionRegistry sessionRegistry;

    public byte[] downloadJobResults(final String toolId, final String jobId) {
        log.info("Downloading results of job {} from tool '{}'.", jobId, toolId);
        return statusTracker.downloadResults(toolId, jobId).orElseThrow(
                () -> new JobNotFoundException("No results have been published for job " + jobId));
    }

    /**
     * @param name {@code results} for the merged rows, {@code failures} for merged worker failure
     *             rows (ledger mode only), or {@code summary} for the merge summary.
     * @throws JobNotFoundException if the session, the named artifact, or its object does not exist.
     */
    public Artifact downloadSessionArtifact(final String toolId, final String sessionId, final String name) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final SessionEntry entry = sessionRegistry.find(toolId, sessionId).orElseThrow(
                () -> new JobNotFoundException("No session " + sessionId + " for tool '" + toolId + "'"));

        final String key = switch (name.toLowerCase(Locale.ROOT)) {
            case "results" -> entry.getMergedKey();
            case "failures" -> entry.getFailuresKey();
            case "summary" -> summaryKey(workspace, entry);
            default -> throw new JobNotFoundException("Unknown artifact '" + name + "'");
        };
        if (!StringUtils.hasText(key)) {
            throw new JobNotFoundException("Session " + sessionId + " has no " + name + " artifact");
        }
        log.info("Downloading '{}' of session {} from tool '{}'.", key, sessionId, toolId);
        final byte[] content = workspace.store().get(key).orElseThrow(
                () -> new JobNotFoundException("Artifact '" + key + "' is no longer in the store"));
        return new Artifact(key, content);
    }

    private static String summaryKey(final ToolWorkspace workspace, final SessionEntry entry) {
        if (entry.isSingleJob()) {
            return null;
        }
        return entry.getMode() == BatchMode.LEDGER
                ? workspace.layout().sessionSummaryKey(entry.getSessionId())
                : workspace.layout().combinedSummaryKey(entry.getSessionId());
    }

    public record Artifact(String key, byte[] content) {
    }
}
