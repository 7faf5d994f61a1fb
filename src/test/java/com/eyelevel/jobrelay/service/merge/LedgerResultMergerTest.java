package com.eyelevel.jobrelay.service.merge;

import com.eyelevel.jobrelay.exception.MergeException;
import com.eyelevel.jobrelay.model.MergedArtifact;
import com.eyelevel.jobrelay.store.BlobStore;
import com.eyelevel.jobrelay.support.RelayFixture;
import com.eyelevel.jobrelay.support.SimulatedWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.eyelevel.jobrelay.support.RelayFixture.LEDGER_TOOL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerResultMergerTest {

    private static final String SESSION = "a1b2c3d4";
    private static final String RESULTS = "users/" + SESSION + "/results/";

    private final RelayFixture fixture = new RelayFixture();
    private final BlobStore store = fixture.workspace(LEDGER_TOOL).store();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void mergesArchivesInNumericChunkOrder() {
        putArchive("scrape_results_chunk_10.zip", "result_10.csv", "id,name\n10,j\n");
        putArchive("scrape_results_chunk_2.zip", "result_2.csv", "id,name\n2,b\n");
        putArchive("scrape_results_chunk_1.zip", "result_1.csv", "id,name\n1,a\n");

        MergedArtifact merged = fixture.ledgerResultMerger.mergeLedgerResults(LEDGER_TOOL, SESSION, 10);

        assertThat(merged.mergedKey()).isEqualTo(RESULTS + "ALL_SUCCESS.csv");
        assertThat(read(merged.mergedKey())).isEqualTo("id,name\n1,a\n2,b\n10,j\n");
        assertThat(merged.successfulChunks()).isEqualTo(3);
        assertThat(merged.totalChunks()).isEqualTo(10);
        assertThat(merged.failuresKey()).isNull();
        assertThat(store.exists(RESULTS + "merge_summary.json")).isTrue();
    }

    @Test
    void mergesFailureEntriesSeparately() {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("out/result_1.csv", bytes("id,name\n1,a\n"));
        entries.put("out/failures_1.csv", bytes("name,reason\nx,timeout\n"));
        entries.put("notes.txt", bytes("ignored"));
        store.put(RESULTS + "scrape_results_chunk-1.zip", SimulatedWorker.zip(entries));
        putArchive("scrape_results_chunk-2.zip", "failures_2.csv", "name,reason\ny,blocked\n");

        MergedArtifact merged = fixture.ledgerResultMerger.mergeLedgerResults(LEDGER_TOOL, SESSION, 2);

        assertThat(read(merged.failuresKey())).isEqualTo("name,reason\nx,timeout\ny,blocked\n");
        assertThat(read(merged.mergedKey())).isEqualTo("id,name\n1,a\n");
        assertThat(merged.successfulChunks()).isEqualTo(2);
    }

    @Test
    void unreadableArchivesAndNonArchivesAreSkipped() {
        store.put(RESULTS + "scrape_results_chunk_1.zip", bytes("this is not a zip"));
        store.put(RESULTS + "scrape_results_chunk_2.csv", bytes("id\n1\n"));
        putArchive("scrape_results_chunk_3.zip", "result_3.csv", "id,name\n3,c\n");

        MergedArtifact merged = fixture.ledgerResultMerger.mergeLedgerResults(LEDGER_TOOL, SESSION, 3);

        assertThat(merged.successfulChunks()).isEqualTo(1);
        assertThat(read(merged.mergedKey())).isEqualTo("id,name\n3,c\n");
    }

    @Test
    void archivesWithoutTheResultsMarkerAreIgnored() {
        putArchive("scrape_results_chunk_1.zip", "result_1.csv", "id,name\n1,a\n");
        putArchive("debug_chunk_2.zip", "result_2.csv", "id,name\n2,b\n");

        MergedArtifact merged = fixture.ledgerResultMerger.mergeLedgerResults(LEDGER_TOOL, SESSION, 2);

        assertThat(merged.successfulChunks()).isEqualTo(1);
        assertThat(read(merged.mergedKey())).isEqualTo("id,name\n1,a\n");
        assertThat(LedgerResultMerger.isResultArchive("users/s/results/scrape_results_3.ZIP")).isTrue();
        assertThat(LedgerResultMerger.isResultArchive("users/scrape_results_x/results/other.zip")).isFalse();
    }

    @Test
    void noArchivesFails() {
        assertThatThrownBy(() -> fixture.ledgerResultMerger.mergeLedgerResults(LEDGER_TOOL, SESSION, 4))
            .isInstanceOf(MergeException.class)
            .hasMessage("No chunks processed successfully for session " + SESSION + " (0/4)");
    }

    @Test
    void chunkNumberIsReadFromTheArchiveName() {
        assertThat(LedgerResultMerger.chunkNumber("users/s/results/scrape_results_chunk_12.zip")).isEqualTo(12);
        assertThat(LedgerResultMerger.chunkNumber("users/s/results/CHUNK-3.zip")).isEqualTo(3);
        assertThat(LedgerResultMerger.chunkNumber("users/s/results/other.zip")).isEqualTo(Integer.MAX_VALUE);
    }

    private void putArchive(String archive, String entry, String content) {
        store.put(RESULTS + archive, SimulatedWorker.zip(Map.of(entry, bytes(content))));
    }

    private String read(String key) {
        return new String(store.get(key).orElseThrow(), StandardCharsets.UTF_8);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
