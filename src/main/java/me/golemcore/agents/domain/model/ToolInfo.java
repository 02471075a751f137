package me.golemcore.agents.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalogue view of a registered tool: schema, availability and inferred
 * category.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolInfo {

    String name;
    String description;
    List<ParameterInfo> parameters;
    boolean available;
    String category;
    List<ToolExample> examples;

    public static ToolInfo from(ToolSchema schema, boolean available, String category) {
        List<ParameterInfo> parameters = schema.getParameters().stream()
                .map(ParameterInfo::from)
                .toList();
        return ToolInfo.builder()
                .name(schema.getName())
                .description(schema.getDescription())
                .parameters(parameters)
                .available(available)
                .category(category)
                .examples(schema.getExamples().isEmpty() ? null : schema.getExamples())
                .build();
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ParameterInfo {
        String name;
        String type;
        String description;
        boolean required;

        @JsonProperty("default")
        Object defaultValue;

        @JsonProperty("enum")
        List<String> enumValues;

        Map<String, Double> range;

        static ParameterInfo from(ToolParameter parameter) {
            Map<String, Double> range = null;
            if (parameter.getMinimum() != null || parameter.getMaximum() != null) {
                range = new LinkedHashMap<>();
                if (parameter.getMinimum() != null) {
                    range.put("minimum", parameter.getMinimum());
                }
                if (parameter.getMaximum() != null) {
                    range.put("maximum", parameter.getMaximum());
                }
            }
            return ParameterInfo.builder()
                    .name(parameter.getName())
                    .type(parameter.getType().jsonName())
                    .description(parameter.getDescription())
                    .required(parameter.isRequired())
                    .defaultValue(parameter.getDefaultValue())
                    .enumValues(parameter.hasEnum() ? parameter.getEnumValues() : null)
                    .range(range)
                    .build();
        }
    }
}
