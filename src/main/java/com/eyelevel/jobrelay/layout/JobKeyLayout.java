package com.eyelevel.jobrelay.layout;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import org.apache.commons.io.FilenameUtils;

/**
 * Every object key the relay and the workers agree on, for one tool's bucket.
 * <p>
 * Workers locate inputs and publish results by these exact names, so a change here is a change to
 * the wire contract with every deployed worker.
 */
public final class JobKeyLayout {

    private static final String SESSION_ROOT = "users";
    private static final String RULES_KEY = "rules/active_rules.json";

    private final String inputFolder;
    private final String statusFolder;
    private final String resultsFolder;
    private final String registryFolder;
    private final String ledgerKey;

    public JobKeyLayout(final JobRelayConfig.Tool tool, final String registryFolder, final String ledgerKey) {
        this(tool.getInputFolder(), tool.getStatusFolder(), tool.getResultsFolder(), registryFolder, ledgerKey);
    }

    public JobKeyLayout(final String inputFolder, final String statusFolder, final String resultsFolder,
                        final String registryFolder, final String ledgerKey) {
        this.inputFolder = inputFolder;
        this.statusFolder = statusFolder;
        this.resultsFolder = resultsFolder;
        this.registryFolder = registryFolder;
        this.ledgerKey = ledgerKey;
    }

    /**
     * The layout every deployed worker uses by default.
     */
    public static JobKeyLayout defaults() {
        return new JobKeyLayout("input", "status", "results", "registry", "progress.jsonl");
    }

    public String inputKey(final String jobId, final String filename) {
        return inputFolder + "/" + jobId + "_" + sanitizeFilename(filename);
    }

    public String statusKey(final String jobId) {
        return statusFolder + "/" + jobId + "_status.json";
    }

    public String resultKey(final String jobId) {
        return resultsFolder + "/" + jobId + "_results.csv";
    }

    public String combinedResultKey(final String sessionId) {
        return resultsFolder + "/" + sessionId + "_combined_results.csv";
    }

    public String combinedSummaryKey(final String sessionId) {
        return resultsFolder + "/" + sessionId + "_merge_summary.json";
    }

    public String sessionChunksPrefix(final String sessionId) {
        return SESSION_ROOT + "/" + sessionId + "/chunks/";
    }

    /**
     * @param chunkIndex 1-based chunk position.
     */
    public String sessionChunkKey(final String sessionId, final int chunkIndex) {
        return sessionChunksPrefix(sessionId) + "chunk_" + chunkIndex + ".csv";
    }

    public String sessionResultsPrefix(final String sessionId) {
        return SESSION_ROOT + "/" + sessionId + "/results/";
    }

    public String sessionSuccessKey(final String sessionId) {
        return sessionResultsPrefix(sessionId) + "ALL_SUCCESS.csv";
    }

    public String sessionFailuresKey(final String sessionId) {
        return sessionResultsPrefix(sessionId) + "ALL_FAILURES.csv";
    }

    public String sessionSummaryKey(final String sessionId) {
        return sessionResultsPrefix(sessionId) + "merge_summary.json";
    }

    public String ledgerKey() {
        return ledgerKey;
    }

    public String rulesKey() {
        return RULES_KEY;
    }

    public String registryKey(final String sessionId) {
        return registryFolder + "/" + sessionId + ".json";
    }

    /**
     * Reduces a caller-supplied filename to its last path segment. Workers match inputs by the
     * name as uploaded, so the segment itself is kept character for character.
     */
    public static String sanitizeFilename(final String filename) {
        final String name = FilenameUtils.getName(filename == null ? "" : filename.trim());
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
            return "upload.csv";
        }
        return name;
    }
}
