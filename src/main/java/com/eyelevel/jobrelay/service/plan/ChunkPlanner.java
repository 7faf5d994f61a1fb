package com.eyelevel.jobrelay.service.plan;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.model.ChunkDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a dataset of {@code n} rows into contiguous chunks of at most {@code chunkSize} rows.
 * The chunks cover every row exactly once, in order, and only the last one may be short.
 */
@Component
public class ChunkPlanner {

    private final JobRelayConfig.Chunking chunking;

    public ChunkPlanner(final JobRelayConfig config) {
        this.chunking = config.getChunking();
    }

    public int defaultChunkSize() {
        return chunking.getDefaultSize();
    }

    /**
     * Checks a caller-supplied chunk size against the configured bounds, substituting the default
     * when none was given.
     *
     * @throws InvalidDatasetException if the size falls outside {@code [min-size, max-size]}.
     */
    public int resolveChunkSize(final Integer requested) {
        if (requested == null) {
            return chunking.getDefaultSize();
        }
        if (requested < chunking.getMinSize() || requested > chunking.getMaxSize()) {
            throw new InvalidDatasetException(String.format("Chunk size %d is outside the allowed range [%d, %d].",
                                                            requested, chunking.getMinSize(),
                                                            chunking.getMaxSize()));
        }
        return requested;
    }

    /**
     * @param sessionId The session the chunks belong to.
     * @param rowCount  Rows in the dataset; zero yields no chunks.
     * @param chunkSize Rows per chunk; must be positive.
     */
    public List<ChunkDescriptor> plan(final String sessionId, final int rowCount, final int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive but was " + chunkSize);
        }
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative but was " + rowCount);
        }
        final int chunkCount = (rowCount + chunkSize - 1) / chunkSize;
        final List<ChunkDescriptor> chunks = new ArrayList<>(chunkCount);
        for (int i = 0; i < chunkCount; i++) {
            final int start = i * chunkSize;
            chunks.add(new ChunkDescriptor(i + 1, start, Math.min(start + chunkSize, rowCount), sessionId));
        }
        return chunks;
    }
}
