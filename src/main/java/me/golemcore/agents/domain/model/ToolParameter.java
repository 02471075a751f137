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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Single parameter of a {@link ToolSchema}.
 */
@Value
@Builder
public class ToolParameter {

    String name;
    String description;
    Type type;
    boolean required;
    Object defaultValue;
    List<String> enumValues;
    Double minimum;
    Double maximum;
    String pattern;

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean hasEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public boolean hasPattern() {
        return pattern != null && !pattern.isEmpty();
    }

    public enum Type {
        STRING("string"), NUMBER("number"), BOOLEAN("boolean"), OBJECT("object"), ARRAY("array");

        private final String jsonName;

        Type(String jsonName) {
            this.jsonName = jsonName;
        }

        @JsonValue
        public String jsonName() {
            return jsonName;
        }
    }
}
