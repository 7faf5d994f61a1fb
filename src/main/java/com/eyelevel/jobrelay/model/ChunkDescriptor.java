package com.eyelevel.jobrelay.model;

/**
 * One slice of a dataset.
 *
 * @param chunkIndex      1-based position within the batch.
 * @param startRow        First row of the slice, inclusive, 0-based.
 * @param endRow          Row after the last one in the slice, exclusive.
 * @param parentSessionId The batch session the chunk belongs to.
 */
public record ChunkDescriptor(int chunkIndex, int startRow, int endRow, String parentSessionId) {

    public int size() {
        return endRow - startRow;
    }
}
