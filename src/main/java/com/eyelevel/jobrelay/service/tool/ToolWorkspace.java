package com.eyelevel.jobrelay.service.tool;

import com.eyelevel.jobrelay.layout.JobKeyLayout;
import com.eyelevel.jobrelay.model.BatchMode;
import com.eyelevel.jobrelay.store.BlobStore;

/**
 * Everything needed to talk to one tool's workers: its bucket, its key layout and how it batches.
 */
public record ToolWorkspace(String toolId, String name, String description, BatchMode mode, BlobStore store,
                            JobKeyLayout layout) {
}
