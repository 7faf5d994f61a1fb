package com.eyelevel.jobrelay.service.tool;

import com.eyelevel.jobrelay.config.JobRelayConfig;
import com.eyelevel.jobrelay.exception.UnknownToolException;
import com.eyelevel.jobrelay.layout.JobKeyLayout;
import com.eyelevel.jobrelay.store.BlobStoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves tool identifiers to their workspaces. The catalogue is read once from
 * {@code app.relay.tools} at startup; tools without a bucket are rejected at that point.
 */
@Slf4j
@Service
public class ToolRegistry {

    private final Map<String, ToolWorkspace> workspaces;

    public ToolRegistry(final JobRelayConfig config, final BlobStoreFactory blobStoreFactory) {
        final Map<String, ToolWorkspace> resolved = new LinkedHashMap<>();
        config.getTools().forEach((toolId, tool) -> {
            if (!StringUtils.hasText(tool.getBucket())) {
                throw new IllegalStateException("Tool '" + toolId + "' has no bucket configured.");
            }
            final JobKeyLayout layout = new JobKeyLayout(tool, config.getRegistryFolder(), config.getLedgerKey());
            final String name = StringUtils.hasText(tool.getName()) ? tool.getName() : toolId;
            resolved.put(toolId, new ToolWorkspace(toolId, name, tool.getDescription(), tool.getMode(),
                                                   blobStoreFactory.open(tool.getBucket()), layout));
            log.info("Registered tool '{}' on bucket '{}' in {} mode.", toolId, tool.getBucket(), tool.getMode());
        });
        this.workspaces = Collections.unmodifiableMap(resolved);
    }

    /**
     * @throws UnknownToolException if no tool is configured under {@code toolId}.
     */
    public ToolWorkspace workspace(final String toolId) {
        final ToolWorkspace workspace = workspaces.get(toolId);
        if (workspace == null) {
            throw new UnknownToolException(toolId);
        }
        return workspace;
    }

    public Collection<ToolWorkspace> all() {
        return workspaces.values();
    }
}
