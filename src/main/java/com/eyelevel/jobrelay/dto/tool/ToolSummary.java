package com.eyelevel.jobrelay.dto.tool;

import com.eyelevel.jobrelay.model.BatchMode;

/**
 * Public view of a configured tool.
 */
public record ToolSummary(String id, String name, String description, String bucket, BatchMode mode) {
}
