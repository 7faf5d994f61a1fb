package com.eyelevel.jobrelay.service.merge;

import com.eyelevel.jobrelay.common.json.JsonSerializer;
import com.eyelevel.jobrelay.model.MergeSummary;
import com.eyelevel.jobrelay.store.BlobStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Component
@RequiredArgsConstructor
public class MergeSummaryWriter {

    private final JsonSerializer jsonSerializer;
    private final Clock clock;

    public MergeSummary write(final BlobStore store, final String summaryKey, final String sessionId,
                              final int successfulChunks, final int totalChunks, final List<Integer> excluded,
                              final int rowCount, final String mergedKey) {
        final double ratio = totalChunks == 0 ? 0.0 : (double) successfulChunks / totalChunks;
        final MergeSummary summary = new MergeSummary(sessionId, successfulChunks, totalChunks,
                                                      totalChunks - successfulChunks, ratio, excluded, rowCount,
                                                      mergedKey, LocalDateTime.now(clock).toString());
        store.put(summaryKey, jsonSerializer.serialize(summary, true).getBytes(StandardCharsets.UTF_8));
        return summary;
    }
}
