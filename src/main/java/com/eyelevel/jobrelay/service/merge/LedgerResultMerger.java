package com.eyelevel.jobrelay.service.merge;

import com.eyelevel.jobrelay.exception.BlobStoreException;
import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.exception.MergeException;
import com.eyelevel.jobrelay.layout.JobKeyLayout;
import com.eyelevel.jobrelay.model.CsvDataset;
import com.eyelevel.jobrelay.model.MergedArtifact;
import com.eyelevel.jobrelay.service.csv.CsvDatasetCodec;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Merges the zipped results that ledger-mode workers publish under a session's results folder.
 * <p>
 * Only {@code *.zip} objects named {@code scrape_results_*} are read; workers may leave other
 * archives beside them. Each archive holds {@code result_*.csv} and {@code failures_*.csv} entries. Both families are
 * merged separately, archive by archive in chunk order, into {@code ALL_SUCCESS.csv} and
 * {@code ALL_FAILURES.csv}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerResultMerger {

    private static final Pattern CHUNK_NUMBER = Pattern.compile("chunk[_-]?(\\d{1,9})", Pattern.CASE_INSENSITIVE);
    private static final String SUCCESS_PREFIX = "result_";
    private static final String FAILURE_PREFIX = "failures_";
    private static final String ARCHIVE_MARKER = "scrape_results_";

    private final ToolRegistry toolRegistry;
    private final CsvDatasetCodec csvCodec;
    private final MergeSummaryWriter summaryWriter;

    /**
     * @throws MergeException if no archive contributed an entry, or the merged files could not be written.
     */
    public MergedArtifact mergeLedgerResults(final String toolId, final String sessionId, final int totalChunks) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final JobKeyLayout layout = workspace.layout();
        final List<String> archives = workspace.store().list(layout.sessionResultsPrefix(sessionId)).stream()
                                               .filter(LedgerResultMerger::isResultArchive)
                                               .sorted(Comparator.comparingInt(LedgerResultMerger::chunkNumber)
                                                                 .thenComparing(Comparator.naturalOrder()))
                                               .toList();
        log.info("Found {} result archive(s) for session {} on tool '{}'.", archives.size(), sessionId, toolId);

        final List<CsvDataset> successes = new ArrayList<>();
        final List<CsvDataset> failures = new ArrayList<>();
        int contributing = 0;
        for (String archive : archives) {
            if (extract(workspace, archive, successes, failures)) {
                contributing++;
            }
        }
        if (contributing == 0) {
            log.error("No result archives of session {} on tool '{}' could be merged.", sessionId, toolId);
            throw new MergeException(String.format("No chunks processed successfully for session %s (0/%d)",
                                                   sessionId, totalChunks));
        }

        final int successfulChunks = Math.min(contributing, totalChunks);
        final String successKey = layout.sessionSuccessKey(sessionId);
        String failuresKey = null;
        final CsvDataset mergedSuccess = csvCodec.concat(successes);
        try {
            if (!successes.isEmpty()) {
                workspace.store().put(successKey, csvCodec.write(mergedSuccess));
            }
            if (!failures.isEmpty()) {
                failuresKey = layout.sessionFailuresKey(sessionId);
                workspace.store().put(failuresKey, csvCodec.write(csvCodec.concat(failures)));
            }
            summaryWriter.write(workspace.store(), layout.sessionSummaryKey(sessionId), sessionId, successfulChunks,
                                totalChunks, List.of(), mergedSuccess.rowCount(),
                                successes.isEmpty() ? null : successKey);
        } catch (BlobStoreException e) {
            log.error("Failed to write merged archives of session {} on tool '{}'.", sessionId, toolId, e);
            throw new MergeException("Failed to write merged results for session " + sessionId, e);
        }
        log.info("Merged {} archive(s) of session {} on tool '{}': {} success row(s), {} failure file(s).",
                 contributing, sessionId, toolId, mergedSuccess.rowCount(), failures.size());
        return new MergedArtifact(sessionId, successes.isEmpty() ? null : successKey, failuresKey,
                                  layout.sessionSummaryKey(sessionId), successfulChunks, totalChunks,
                                  mergedSuccess.rowCount(), List.of());
    }

    /**
     * @return true if the archive held at least one result or failures entry.
     */
    private boolean extract(final ToolWorkspace workspace, final String archiveKey, final List<CsvDataset> successes,
                            final List<CsvDataset> failures) {
        final Optional<byte[]> content;
        try {
            content = workspace.store().get(archiveKey);
        } catch (BlobStoreException e) {
            log.warn("Skipping archive '{}': {}", archiveKey, e.getMessage());
            return false;
        }
        if (content.isEmpty()) {
            return false;
        }

        boolean contributed = false;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content.get()))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                final String name = FilenameUtils.getName(entry.getName());
                final boolean success = name.startsWith(SUCCESS_PREFIX) && name.endsWith(".csv");
                final boolean failure = name.startsWith(FAILURE_PREFIX) && name.endsWith(".csv");
                if (!success && !failure) {
                    continue;
                }
                final CsvDataset dataset = parseEntry(archiveKey, name, IOUtils.toByteArray(zip));
                if (dataset == null) {
                    continue;
                }
                (success ? successes : failures).add(dataset);
                contributed = true;
            }
        } catch (IOException e) {
            log.warn("Skipping unreadable archive '{}': {}", archiveKey, e.getMessage());
        }
        return contributed;
    }

    private CsvDataset parseEntry(final String archiveKey, final String entryName, final byte[] bytes) {
        try {
            return csvCodec.parse(bytes);
        } catch (InvalidDatasetException e) {
            log.warn("Skipping entry '{}' of archive '{}': {}", entryName, archiveKey, e.getMessage());
            return null;
        }
    }

    static boolean isResultArchive(final String key) {
        final String name = FilenameUtils.getName(key);
        return name.contains(ARCHIVE_MARKER) && name.toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    static int chunkNumber(final String key) {
        final Matcher matcher = CHUNK_NUMBER.matcher(FilenameUtils.getName(key));
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : Integer.MAX_VALUE;
    }
}
