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

import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks and normalizes tool input against a {@link ToolSchema}.
 *
 * <p>
 * {@link #validate} is pure: it reports the first violation as a
 * {@link ValidationException}. Required-parameter and unknown-key checks run
 * over the whole schema and input before any value is inspected.
 *
 * <p>
 * {@link #sanitize} returns a new map holding canonical values: numbers as
 * {@link Double}, booleans as {@link Boolean}, strings as {@link String}, with
 * defaults filled in for absent parameters and unknown keys dropped.
 */
public final class SchemaValidator {

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Map<String, Optional<Pattern>> PATTERN_CACHE = new ConcurrentHashMap<>();

    private SchemaValidator() {
    }

    public static void validate(ToolSchema schema, Map<String, Object> input) {
        Map<String, Object> safeInput = input != null ? input : Map.of();

        for (ToolParameter parameter : schema.getParameters()) {
            if (parameter.isRequired() && !safeInput.containsKey(parameter.getName())) {
                throw new ValidationException(parameter.getName(), "required parameter missing", null);
            }
        }

        for (String key : safeInput.keySet()) {
            if (schema.findParameter(key).isEmpty()) {
                throw new ValidationException(key, "unknown parameter", safeInput.get(key));
            }
        }

        for (Map.Entry<String, Object> entry : safeInput.entrySet()) {
            ToolParameter parameter = schema.findParameter(entry.getKey()).orElseThrow();
            validateParameter(parameter, entry.getValue());
        }
    }

    public static Map<String, Object> sanitize(ToolSchema schema, Map<String, Object> input) {
        Map<String, Object> safeInput = input != null ? input : Map.of();
        Map<String, Object> sanitized = new LinkedHashMap<>();

        for (ToolParameter parameter : schema.getParameters()) {
            String name = parameter.getName();
            Object value = safeInput.get(name);
            if (value == null) {
                if (parameter.hasDefault()) {
                    sanitized.put(name, parameter.getDefaultValue());
                }
                continue;
            }
            sanitized.put(name, convert(parameter, value));
        }
        return sanitized;
    }

    /**
     * Renders the schema as a JSON-Schema object for provider tool definitions.
     */
    public static Map<String, Object> toJsonSchema(ToolSchema schema) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();

        for (ToolParameter parameter : schema.getParameters()) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", parameter.getType().jsonName());
            property.put("description", parameter.getDescription() != null ? parameter.getDescription() : "");
            if (parameter.hasDefault()) {
                property.put("default", parameter.getDefaultValue());
            }
            if (parameter.hasEnum()) {
                property.put("enum", parameter.getEnumValues());
            }
            if (parameter.getMinimum() != null) {
                property.put("minimum", parameter.getMinimum());
            }
            if (parameter.getMaximum() != null) {
                property.put("maximum", parameter.getMaximum());
            }
            if (parameter.hasPattern()) {
                property.put("pattern", parameter.getPattern());
            }
            properties.put(parameter.getName(), property);
            if (parameter.isRequired()) {
                required.add(parameter.getName());
            }
        }

        Map<String, Object> jsonSchema = new LinkedHashMap<>();
        jsonSchema.put("type", "object");
        jsonSchema.put("properties", properties);
        jsonSchema.put("required", required);
        return jsonSchema;
    }

    private static void validateParameter(ToolParameter parameter, Object value) {
        if (value == null) {
            if (parameter.isRequired()) {
                throw new ValidationException(parameter.getName(), "required parameter cannot be null", null);
            }
            return;
        }

        switch (parameter.getType()) {
        case STRING -> validateString(parameter, value);
        case NUMBER -> validateNumber(parameter, value);
        case BOOLEAN -> {
            if (toBoolean(value).isEmpty()) {
                throw new ValidationException(parameter.getName(), "expected boolean value", value);
            }
        }
        case OBJECT -> {
            if (!(value instanceof Map)) {
                throw new ValidationException(parameter.getName(), "expected object value", value);
            }
        }
        case ARRAY -> {
            if (!(value instanceof List) && !value.getClass().isArray()) {
                throw new ValidationException(parameter.getName(), "expected array value", value);
            }
        }
        default -> throw new ValidationException(parameter.getName(),
                "unsupported parameter type: " + parameter.getType(), value);
        }
    }

    private static void validateString(ToolParameter parameter, Object value) {
        if (!(value instanceof String str)) {
            throw new ValidationException(parameter.getName(), "expected string value", value);
        }

        if (parameter.hasEnum() && !parameter.getEnumValues().contains(str)) {
            throw new ValidationException(parameter.getName(),
                    "value must be one of: " + String.join(", ", parameter.getEnumValues()), value);
        }

        if (parameter.hasPattern()) {
            Pattern pattern = compile(parameter.getPattern())
                    .orElseThrow(() -> new ValidationException(parameter.getName(),
                            "invalid regex pattern: " + parameter.getPattern(), value));
            if (!pattern.matcher(str).find()) {
                throw new ValidationException(parameter.getName(),
                        "value does not match pattern: " + parameter.getPattern(), value);
            }
        }
    }

    private static void validateNumber(ToolParameter parameter, Object value) {
        Double number = toNumber(value)
                .orElseThrow(() -> new ValidationException(parameter.getName(), "expected number value", value));

        if (parameter.getMinimum() != null && number < parameter.getMinimum()) {
            throw new ValidationException(parameter.getName(),
                    "value must be >= " + formatNumber(parameter.getMinimum()), value);
        }
        if (parameter.getMaximum() != null && number > parameter.getMaximum()) {
            throw new ValidationException(parameter.getName(),
                    "value must be <= " + formatNumber(parameter.getMaximum()), value);
        }
    }

    private static Object convert(ToolParameter parameter, Object value) {
        return switch (parameter.getType()) {
        case STRING -> value instanceof String ? value : String.valueOf(value);
        case NUMBER -> toNumber(value)
                .orElseThrow(() -> new ValidationException(parameter.getName(), "cannot convert to number", value));
        case BOOLEAN -> toBoolean(value)
                .orElseThrow(() -> new ValidationException(parameter.getName(), "cannot convert to boolean", value));
        case ARRAY -> value instanceof Object[] array ? Arrays.asList(array) : value;
        case OBJECT -> value;
        };
    }

    static Optional<Double> toNumber(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String str) {
            String trimmed = str.trim();
            if (NUMERIC.matcher(trimmed).matches()) {
                return Optional.of(Double.parseDouble(trimmed));
            }
        }
        return Optional.empty();
    }

    static Optional<Boolean> toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String str) {
            if ("true".equalsIgnoreCase(str)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(str)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    private static Optional<Pattern> compile(String regex) {
        return PATTERN_CACHE.computeIfAbsent(regex, key -> {
            try {
                return Optional.of(Pattern.compile(key));
            } catch (PatternSyntaxException e) {
                return Optional.empty();
            }
        });
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
