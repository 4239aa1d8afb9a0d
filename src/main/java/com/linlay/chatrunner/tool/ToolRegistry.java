package com.linlay.chatrunner.tool;

import com.linlay.chatrunner.model.FunctionTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ChatTool> toolsByName;

    public ToolRegistry(List<ChatTool> tools) {
        Map<String, ChatTool> byName = new LinkedHashMap<>();
        for (ChatTool tool : tools) {
            String key = normalizeName(tool.name());
            if (byName.putIfAbsent(key, tool) != null) {
                log.warn("Duplicate tool name '{}', keeping the first registration", tool.name());
            }
        }
        this.toolsByName = Map.copyOf(byName);
        log.info("Registered tools: {}", list().stream().map(ChatTool::name).toList());
    }

    public Optional<ChatTool> find(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(toolsByName.get(normalizeName(toolName)));
    }

    public List<ChatTool> list() {
        return toolsByName.values().stream()
                .sorted(Comparator.comparing(ChatTool::name))
                .toList();
    }

    /**
     * Definitions advertised to the upstream model, sorted by name so that identical tool sets
     * always produce the same request.
     */
    public List<FunctionTool> functionTools() {
        return list().stream()
                .map(tool -> new FunctionTool(tool.name(), tool.description(), tool.parametersSchema()))
                .toList();
    }

    private String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
