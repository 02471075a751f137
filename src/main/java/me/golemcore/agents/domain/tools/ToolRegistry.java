package me.golemcore.agents.domain.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.domain.model.ToolSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed set of registered tools.
 *
 * <p>
 * The registry is built at startup and then sealed: after {@link #seal()} any
 * write fails with {@link IllegalStateException}, and reads never block.
 * Before sealing, concurrent readers and writers are safe because the backing
 * map is concurrent.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public void register(ToolComponent tool) {
        ensureWritable();
        if (tool == null) {
            throw new ToolRegistrationException(ToolRegistrationException.Reason.NIL_TOOL, "tool cannot be nil");
        }
        String name = tool.getName();
        if (name == null || name.isBlank()) {
            throw new ToolRegistrationException(ToolRegistrationException.Reason.EMPTY_TOOL_NAME,
                    "tool name cannot be empty");
        }
        if (tools.putIfAbsent(name, tool) != null) {
            throw new ToolRegistrationException(ToolRegistrationException.Reason.TOOL_ALREADY_EXISTS,
                    "tool already exists: " + name);
        }
        log.debug("[Tools] Registered tool: {}", name);
    }

    public Optional<ToolComponent> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Registered tool names, sorted.
     */
    public List<String> list() {
        List<String> names = new ArrayList<>(tools.keySet());
        names.sort(Comparator.naturalOrder());
        return names;
    }

    /**
     * Schemas of all registered tools, ordered by tool name.
     */
    public List<ToolSchema> getSchemas() {
        List<ToolSchema> schemas = new ArrayList<>();
        for (String name : list()) {
            ToolComponent tool = tools.get(name);
            if (tool != null) {
                schemas.add(tool.getSchema());
            }
        }
        return schemas;
    }

    /**
     * Schemas of the named tools in the given order. Unknown names are skipped.
     */
    public List<ToolSchema> getSchemas(Collection<String> names) {
        List<ToolSchema> schemas = new ArrayList<>();
        for (String name : names) {
            get(name).ifPresent(tool -> schemas.add(tool.getSchema()));
        }
        return schemas;
    }

    /**
     * Provider-facing definitions of the named tools, JSON-Schema parameters
     * included.
     */
    public List<ToolDefinition> getDefinitions(Collection<String> names) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolSchema schema : getSchemas(names)) {
            definitions.add(ToolDefinition.of(schema.getName(), schema.getDescription(),
                    SchemaValidator.toJsonSchema(schema)));
        }
        return definitions;
    }

    /**
     * Names of tools that are registered and currently available, sorted.
     */
    public List<String> listAvailable() {
        List<String> names = new ArrayList<>();
        for (String name : list()) {
            ToolComponent tool = tools.get(name);
            if (tool != null && tool.isAvailable()) {
                names.add(name);
            }
        }
        return names;
    }

    public boolean remove(String name) {
        ensureWritable();
        boolean removed = name != null && tools.remove(name) != null;
        if (removed) {
            log.debug("[Tools] Removed tool: {}", name);
        }
        return removed;
    }

    public void clear() {
        ensureWritable();
        tools.clear();
    }

    public int count() {
        return tools.size();
    }

    /**
     * Freezes the registry. Idempotent.
     */
    public void seal() {
        if (!sealed) {
            sealed = true;
            log.info("[Tools] Registry sealed with {} tools: {}", tools.size(), list());
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    private void ensureWritable() {
        if (sealed) {
            throw new IllegalStateException("tool registry is sealed");
        }
    }
}
