package com.eyelevel.jobrelay.service.status;

import com.eyelevel.jobrelay.common.json.JsonParser;
import com.eyelevel.jobrelay.exception.json.JsonParsingException;
import com.eyelevel.jobrelay.model.ProgressEntry;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reads the append-only progress ledger that ledger-mode workers share.
 * <p>
 * Workers append one JSON object per state change, without a reliable separator, so the whole
 * object is rewritten into a JSON array before parsing. A ledger that still does not parse counts
 * as empty for that read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressLedgerReader {

    private static final Pattern RECORD_BOUNDARY = Pattern.compile("\\}\\s*\\{");

    private final ToolRegistry toolRegistry;
    private final JsonParser jsonParser;

    public List<ProgressEntry> readProgressLedger(final String toolId) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final Optional<byte[]> content = workspace.store().get(workspace.layout().ledgerKey());
        if (content.isEmpty()) {
            log.debug("No progress ledger yet for tool '{}'.", toolId);
            return List.of();
        }
        final String raw = new String(content.get(), StandardCharsets.UTF_8).strip();
        if (raw.isEmpty()) {
            return List.of();
        }
        final String array = raw.startsWith("[") ? raw : "[" + RECORD_BOUNDARY.matcher(raw).replaceAll("},{") + "]";
        try {
            return jsonParser.parseList(array, ProgressEntry.class);
        } catch (JsonParsingException e) {
            log.warn("Progress ledger of tool '{}' could not be read: {}", toolId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Returns the distinct chunk indexes the ledger reports as completed for {@code runId}, limited
     * to {@code 1..totalChunks}.
     */
    public SortedSet<Integer> completedChunkIndexes(final String toolId, final String runId, final int totalChunks) {
        final SortedSet<Integer> completed = new TreeSet<>();
        for (ProgressEntry entry : readProgressLedger(toolId)) {
            if (!runId.equals(entry.getRunId()) || !entry.isCompleted()) {
                continue;
            }
            final OptionalInt chunk = entry.chunkNumber();
            if (chunk.isPresent() && chunk.getAsInt() >= 1 && chunk.getAsInt() <= totalChunks) {
                completed.add(chunk.getAsInt());
            }
        }
        return completed;
    }

    public int countCompletedChunks(final String toolId, final String runId, final int totalChunks) {
        return completedChunkIndexes(toolId, runId, totalChunks).size();
    }
}
