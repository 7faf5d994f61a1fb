package com.eyelevel.jobrelay.model;

import java.util.List;

/**
 * A parsed CSV: one header row plus data rows, each row aligned to the header.
 */
public record CsvDataset(List<String> header, List<List<String>> rows) {

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns the rows of a chunk's half-open range under the same header.
     */
    public CsvDataset slice(final ChunkDescriptor chunk) {
        return new CsvDataset(header, rows.subList(chunk.startRow(), chunk.endRow()));
    }
}
