package com.eyelevel.jobrelay.service.registry;

import com.eyelevel.jobrelay.common.json.JsonParser;
import com.eyelevel.jobrelay.common.json.JsonSerializer;
import com.eyelevel.jobrelay.exception.json.JsonParsingException;
import com.eyelevel.jobrelay.model.SessionEntry;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Keeps batch sessions in the tool's own bucket, so a session can be found and resumed from any
 * process with access to the store.
 * <p>
 * Writers of one entry must serialise their updates themselves; the registry does not lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final ToolRegistry toolRegistry;
    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final Clock clock;

    public void register(final SessionEntry entry) {
        final String now = LocalDateTime.now(clock).toString();
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);
        write(entry);
        log.info("Registered session {} for tool '{}' ({} row(s) in {} chunk(s)).", entry.getSessionId(),
                 entry.getTool(), entry.getTotalRows(), entry.getTotalChunks());
    }

    public void update(final SessionEntry entry) {
        entry.setUpdatedAt(LocalDateTime.now(clock).toString());
        write(entry);
        log.debug("Updated session {} of tool '{}' (state {}).", entry.getSessionId(), entry.getTool(),
                  entry.getState());
    }

    /**
     * @return The stored entry, or empty if none exists or it cannot be parsed.
     */
    public Optional<SessionEntry> find(final String toolId, final String sessionId) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final Optional<byte[]> content = workspace.store().get(workspace.layout().registryKey(sessionId));
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(jsonParser.parseObject(content.get(), SessionEntry.class));
        } catch (JsonParsingException e) {
            log.warn("Registry entry of session {} on tool '{}' is unreadable: {}", sessionId, toolId,
                     e.getMessage());
            return Optional.empty();
        }
    }

    private void write(final SessionEntry entry) {
        final ToolWorkspace workspace = toolRegistry.workspace(entry.getTool());
        workspace.store().put(workspace.layout().registryKey(entry.getSessionId()),
                              jsonSerializer.serialize(entry, true).getBytes(StandardCharsets.UTF_8));
    }
}
