package com.deskmind.core.tools;

import com.deskmind.core.model.ToolDescriptor;
import com.deskmind.core.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ToolRegistry} over the {@link Tool} beans found at startup.
 * The tool list is fixed once built, so lookups need no locking.
 */
@Component
public class StaticToolRegistry implements ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(StaticToolRegistry.class);

    private final Map<String, Tool> tools;

    public StaticToolRegistry(List<Tool> tools) {
        var byName = new LinkedHashMap<String, Tool>();
        for (Tool tool : tools) {
            Tool previous = byName.putIfAbsent(tool.name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name '" + tool.name() + "': "
                        + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("Registered {} tool(s): {}", byName.size(), byName.keySet());
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return tools.values().stream().map(Tool::descriptor).toList();
    }

    @Override
    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    @Override
    public ToolResult invoke(String name, Map<String, Object> args) {
        Tool tool = name == null ? null : tools.get(name);
        if (tool == null) {
            log.warn("Tool '{}' is not registered", name);
            return ToolResult.notFound(name);
        }
        try {
            return ToolResult.of(tool.invoke(args == null ? Map.of() : args));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(name, e);
        } catch (Exception e) {
            throw new ToolExecutionException(name, e);
        }
    }
}
