package com.eyelevel.jobrelay.service.rules;

import com.eyelevel.jobrelay.common.json.JsonParser;
import com.eyelevel.jobrelay.common.json.JsonSerializer;
import com.eyelevel.jobrelay.config.JobRelayConfig;
import com.eyelevel.jobrelay.exception.InvalidRuleException;
import com.eyelevel.jobrelay.exception.json.JsonParsingException;
import com.eyelevel.jobrelay.model.RuleSet;
import com.eyelevel.jobrelay.model.RuleUpdate;
import com.eyelevel.jobrelay.service.tool.ToolRegistry;
import com.eyelevel.jobrelay.service.tool.ToolWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maintains the rules a tool's workers read from {@code rules/active_rules.json} in the tool bucket.
 * <p>
 * Defaults come from the classpath location configured as the tool's {@code default-rules}. The
 * stored document is seeded with them the first time it is read. Categories missing from a stored
 * document are filled in from the defaults when it is loaded, without rewriting it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleSetService {

    private static final String VERSION = "1.0";

    private final ToolRegistry toolRegistry;
    private final JobRelayConfig config;
    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final Clock clock;

    /**
     * @throws InvalidRuleException if the tool keeps no rules.
     */
    public RuleSet load(final String toolId) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final RuleSet defaults = defaults(toolId);
        final String key = workspace.layout().rulesKey();
        final Optional<byte[]> stored = workspace.store().get(key);
        if (stored.isEmpty()) {
            log.info("No rules stored for tool '{}'; initialising '{}' with the defaults.", toolId, key);
            return save(workspace, defaults);
        }

        final RuleSet ruleSet;
        try {
            ruleSet = jsonParser.parseObject(stored.get(), RuleSet.class);
        } catch (JsonParsingException e) {
            log.warn("Stored rules of tool '{}' are unreadable, serving the defaults: {}", toolId, e.getMessage());
            return defaults;
        }
        if (ruleSet.getRules() == null) {
            ruleSet.setRules(defaults.getRules());
        } else {
            defaults.getRules().forEach(ruleSet.getRules()::putIfAbsent);
        }
        return ruleSet;
    }

    /**
     * Appends {@code items} to a list category. Items already present are skipped; nothing is
     * written when no item is new.
     *
     * @throws InvalidRuleException if the category is missing or does not hold plain values.
     */
    public RuleUpdate addItems(final String toolId, final String category, final List<String> items) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final RuleSet ruleSet = load(toolId);
        final Object current = ruleSet.getRules().get(category);
        if (!(current instanceof List<?> values)) {
            throw new InvalidRuleException("Category '" + category + "' not found or not a list");
        }
        if (!values.stream().allMatch(String.class::isInstance)) {
            throw new InvalidRuleException("Category '" + category + "' does not hold plain values");
        }

        final List<Object> updated = new ArrayList<>(values);
        final List<String> added = new ArrayList<>();
        for (String item : items) {
            if (!StringUtils.hasText(item)) {
                continue;
            }
            final String value = item.trim();
            if (!updated.contains(value)) {
                updated.add(value);
                added.add(value);
            }
        }
        if (added.isEmpty()) {
            log.info("Rules of tool '{}' unchanged: every item is already in '{}'.", toolId, category);
            return new RuleUpdate(category, List.of(), "All items already present in " + category);
        }

        ruleSet.getRules().put(category, updated);
        save(workspace, ruleSet);
        log.info("Added {} item(s) to '{}' of tool '{}': {}", added.size(), category, toolId, added);
        return new RuleUpdate(category, List.copyOf(added),
                              String.format("Added %d items to %s: %s", added.size(), category,
                                            String.join(", ", added)));
    }

    public RuleSet resetToDefaults(final String toolId) {
        final ToolWorkspace workspace = toolRegistry.workspace(toolId);
        final RuleSet defaults = defaults(toolId);
        log.info("Resetting rules of tool '{}' to the defaults.", toolId);
        return save(workspace, defaults);
    }

    private RuleSet save(final ToolWorkspace workspace, final RuleSet ruleSet) {
        ruleSet.setVersion(VERSION);
        ruleSet.setLastUpdated(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString());
        workspace.store().put(workspace.layout().rulesKey(),
                              jsonSerializer.serialize(ruleSet, true).getBytes(StandardCharsets.UTF_8));
        return ruleSet;
    }

    /**
     * Reads a fresh copy of the tool's default rules, so callers may change it freely.
     */
    private RuleSet defaults(final String toolId) {
        final JobRelayConfig.Tool tool = config.getTools().get(toolId);
        if (tool == null || !StringUtils.hasText(tool.getDefaultRules())) {
            throw new InvalidRuleException("Tool '" + toolId + "' keeps no worker rules");
        }
        try {
            final byte[] content = new ClassPathResource(tool.getDefaultRules()).getContentAsByteArray();
            return jsonParser.parseObject(content, RuleSet.class);
        } catch (IOException e) {
            throw new IllegalStateException("Default rules '" + tool.getDefaultRules() + "' of tool '" + toolId
                                            + "' could not be read", e);
        }
    }
}
