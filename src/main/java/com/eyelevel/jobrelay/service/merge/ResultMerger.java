package com.eyelevel.jobrelay.service.merge;

import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.exception.MergeException;
import com.eyelevel.jobrelay.model.ChunkArtifact;
import com.eyelevel.jobrelay.model.CsvDataset;
import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.MergedArtifact;
import com.eyelevel.jobrelay.service.csv.CsvDatasetCodec;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Merges the per-chunk results of a job-mode session into one CSV, in chunk order.
 * <p>
 * A chunk contributes only when its job completed and its result object can be read and parsed.
 * Every other chunk is excluded and counted in the stored merge summary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultMerger {

    private final ToolRegistry toolRegistry;
    private final CsvDatasetCodec csvCodec;
    private final MergeSummaryWriter summaryWriter;

    /**
     * @param chunkArtifacts One entry per chunk of the session, in any order.
     * @throws MergeException if no chunk contributed, or the merged artifact could not be written.
     */
    public MergedArtifact merge(final String toolId, final String sessionId, final List<ChunkArtifact> chunkArtifacts) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final List<ChunkArtifact> ordered = chunkArtifacts.stream()
                                                          .sorted(Comparator.comparingInt(ChunkArtifact::chunkIndex))
                                                          .toList();
        final List<CsvDataset> parts = new ArrayList<>();
        final List<Integer> excluded = new ArrayList<>();
        for (ChunkArtifact chunk : ordered) {
            final Optional<CsvDataset> part = readChunkResult(workspace, sessionId, chunk);
            if (part.isPresent()) {
                parts.add(part.get());
            } else {
                excluded.add(chunk.chunkIndex());
            }
        }

        final int total = ordered.size();
        if (parts.isEmpty()) {
            log.error("No chunks of session {} on tool '{}' processed successfully (0/{}).", sessionId, toolId, total);
            throw new MergeException(String.format("No chunks processed successfully for session %s (0/%d)",
                                                   sessionId, total));
        }

        final CsvDataset merged = csvCodec.concat(parts);
        final String mergedKey = workspace.layout().combinedResultKey(sessionId);
        final String summaryKey = workspace.layout().combinedSummaryKey(sessionId);
        try {
            workspace.store().put(mergedKey, csvCodec.write(merged));
            summaryWriter.write(workspace.store(), summaryKey, sessionId, parts.size(), total, excluded,
                                merged.rowCount(), mergedKey);
        } catch (BlobStoreException e) {
            log.error("Failed to write merged results of session {} on tool '{}'.", sessionId, toolId, e);
            throw new MergeException("Failed to write merged results for session " + sessionId, e);
        }
        log.info("Merged session {} on tool '{}': {}/{} chunk(s), {} row(s) into '{}'.", sessionId, toolId,
                 parts.size(), total, merged.rowCount(), mergedKey);
        return new MergedArtifact(sessionId, mergedKey, null, summaryKey, parts.size(), total, merged.rowCount(),
                                  List.copyOf(excluded));
    }

    private Optional<CsvDataset> readChunkResult(final ToolWorkspace workspace, final String sessionId,
                                                 final ChunkArtifact chunk) {
        if (chunk.outcome() != JobStatus.COMPLETED || chunk.resultKey() == null) {
            log.warn("Excluding chunk {} of session {}: outcome {}.", chunk.chunkIndex(), sessionId,
                     chunk.outcome() == null ? "none" : chunk.outcome().getValue());
            return Optional.empty();
        }
        final Optional<byte[]> content;
        try {
            content = workspace.store().get(chunk.resultKey());
        } catch (BlobStoreException e) {
            log.warn("Excluding chunk {} of session {}: result could not be fetched: {}", chunk.chunkIndex(),
                     sessionId, e.getMessage());
            return Optional.empty();
        }
        if (content.isEmpty()) {
            log.warn("Excluding chunk {} of session {}: completed but no result at '{}'.", chunk.chunkIndex(),
                     sessionId, chunk.resultKey());
            return Optional.empty();
        }
        try {
            return Optional.of(csvCodec.parse(content.get()));
        } catch (InvalidDatasetException e) {
            log.warn("Excluding chunk {} of session {}: result is not valid CSV: {}", chunk.chunkIndex(), sessionId,
                     e.getMessage());
            return Optional.empty();
        }
    }
}
