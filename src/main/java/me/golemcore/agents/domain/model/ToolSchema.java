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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parameter contract of a tool: its name, a human readable description, an
 * ordered list of parameters and optional usage examples.
 *
 * <p>
 * Parameter names are unique within a schema; the builder rejects duplicates.
 */
@Value
public class ToolSchema {

    String name;
    String description;
    List<ToolParameter> parameters;
    List<ToolExample> examples;

    @Builder
    private ToolSchema(String name, String description, @Singular List<ToolParameter> parameters,
            @Singular List<ToolExample> examples) {
        Set<String> seen = new HashSet<>();
        for (ToolParameter parameter : parameters) {
            if (!seen.add(parameter.getName())) {
                throw new IllegalArgumentException(
                        "Duplicate parameter '" + parameter.getName() + "' in schema of tool '" + name + "'");
            }
        }
        this.name = name;
        this.description = description;
        this.parameters = List.copyOf(parameters);
        this.examples = List.copyOf(examples);
    }

    public Optional<ToolParameter> findParameter(String parameterName) {
        return parameters.stream()
                .filter(p -> p.getName().equals(parameterName))
                .findFirst();
    }
}
