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

package me.golemcore.agents.tools;

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolExample;
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool for validating, formatting and querying JSON documents.
 *
 * <p>
 * {@code get_value} walks a dot-separated path; numeric segments index into
 * arrays ({@code items.0.name}).
 *
 * <p>
 * Uses a private {@link ObjectMapper} so the application's naming strategy
 * never rewrites user keys.
 */
@Component
public class JsonProcessorTool implements ToolComponent {

    static final String NAME = "json_processor";
    private static final String PARAM_JSON = "json_data";
    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_PATH = "path";
    private static final String ERROR_INVALID_JSON = "INVALID_JSON";
    private static final String ERROR_MISSING_PATH = "MISSING_PATH";
    private static final String ERROR_PROCESSING = "PROCESSING_ERROR";
    private static final String ERROR_INVALID_OPERATION = "INVALID_OPERATION";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Processes and validates JSON data")
            .parameter(ToolParameter.builder()
                    .name(PARAM_JSON)
                    .type(ToolParameter.Type.STRING)
                    .description("JSON data as string")
                    .required(true)
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_OPERATION)
                    .type(ToolParameter.Type.STRING)
                    .description("Operation to perform")
                    .required(true)
                    .enumValues(List.of("validate", "pretty_print", "minify", "extract_keys", "get_value"))
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_PATH)
                    .type(ToolParameter.Type.STRING)
                    .description("Dot-separated path for get_value (e.g., 'user.name')")
                    .build())
            .example(new ToolExample("Validate JSON",
                    Map.of(PARAM_JSON, "{\"name\": \"John\", \"age\": 30}", PARAM_OPERATION, "validate"),
                    Map.of("result", Map.of("valid", true, "message", "JSON is valid"),
                            PARAM_OPERATION, "validate")))
            .example(new ToolExample("Read a nested value",
                    Map.of(PARAM_JSON, "{\"user\": {\"name\": \"John\"}}", PARAM_OPERATION, "get_value",
                            PARAM_PATH, "user.name"),
                    Map.of("result", "John", PARAM_OPERATION, "get_value")))
            .build();

    private final ObjectMapper mapper = new ObjectMapper();
    private final DefaultPrettyPrinter prettyPrinter = createPrettyPrinter();

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        String json = (String) input.get(PARAM_JSON);
        String operation = (String) input.get(PARAM_OPERATION);

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(NAME, ERROR_INVALID_JSON, "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ToolExecutionException(NAME, ERROR_INVALID_JSON, "Invalid JSON: empty document");
        }

        Object result = switch (operation) {
        case "validate" -> validationReport();
        case "pretty_print" -> write(root, true);
        case "minify" -> write(root, false);
        case "extract_keys" -> extractKeys(root);
        case "get_value" -> getValue(root, (String) input.get(PARAM_PATH));
        default -> throw new ToolExecutionException(NAME, ERROR_INVALID_OPERATION,
                "unsupported operation: " + operation);
        };

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", result);
        data.put(PARAM_OPERATION, operation);
        return ToolResult.success(data);
    }

    private static Map<String, Object> validationReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("valid", true);
        report.put("message", "JSON is valid");
        return report;
    }

    private String write(JsonNode root, boolean pretty) {
        try {
            return pretty
                    ? mapper.writer(prettyPrinter).writeValueAsString(root)
                    : mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(NAME, ERROR_PROCESSING, "failed to write JSON: " + e.getMessage(), e);
        }
    }

    private static List<String> extractKeys(JsonNode root) {
        List<String> keys = new ArrayList<>();
        if (root.isObject()) {
            root.fieldNames().forEachRemaining(keys::add);
        }
        return keys;
    }

    private Object getValue(JsonNode root, String path) {
        if (path == null || path.isBlank()) {
            throw new ToolExecutionException(NAME, ERROR_MISSING_PATH, "path is required for get_value operation");
        }
        JsonNode current = root;
        for (String key : path.split("\\.")) {
            if (current.isObject()) {
                if (!current.has(key)) {
                    throw new ToolExecutionException(NAME, ERROR_PROCESSING, "key '" + key + "' not found");
                }
                current = current.get(key);
            } else if (current.isArray() && isIndex(key)) {
                int index = Integer.parseInt(key);
                if (index >= current.size()) {
                    throw new ToolExecutionException(NAME, ERROR_PROCESSING,
                            "index " + index + " out of bounds (size " + current.size() + ")");
                }
                current = current.get(index);
            } else {
                throw new ToolExecutionException(NAME, ERROR_PROCESSING,
                        "cannot access key '" + key + "' on non-object");
            }
        }
        return mapper.convertValue(current, Object.class);
    }

    private static boolean isIndex(String key) {
        if (key.isEmpty() || key.length() > 9) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }
}
