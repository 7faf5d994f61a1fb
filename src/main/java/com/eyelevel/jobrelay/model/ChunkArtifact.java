package com.eyelevel.jobrelay.model;

/**
 * A chunk as seen by the merger: its final observed outcome and where its result should be.
 *
 * @param chunkIndex 1-based chunk position.
 * @param outcome    The terminal (or last observed) state of the chunk's job.
 * @param resultKey  The key the worker writes the chunk's result to; may be null if never submitted.
 */
public record ChunkArtifact(int chunkIndex, JobStatus outcome, String resultKey) {
}
