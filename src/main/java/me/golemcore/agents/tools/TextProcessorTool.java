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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tool for simple text transformations and extraction.
 *
 * <p>
 * Operations: uppercase, lowercase, title_case, word_count, char_count,
 * reverse, trim, extract_emails, extract_urls. The extraction operations accept
 * an optional {@code pattern} that replaces the built-in regular expression.
 */
@Component
public class TextProcessorTool implements ToolComponent {

    static final String NAME = "text_processor";
    private static final String PARAM_TEXT = "text";
    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_PATTERN = "pattern";
    private static final String ERROR_INVALID_OPERATION = "INVALID_OPERATION";
    private static final String ERROR_PROCESSING = "PROCESSING_ERROR";

    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern URL = Pattern.compile("https?://[^\\s]+");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("\\s+");

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Processes and transforms text (case conversion, counting, extraction)")
            .parameter(ToolParameter.builder()
                    .name(PARAM_TEXT)
                    .type(ToolParameter.Type.STRING)
                    .description("Text to process")
                    .required(true)
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_OPERATION)
                    .type(ToolParameter.Type.STRING)
                    .description("Operation to perform")
                    .required(true)
                    .enumValues(List.of("uppercase", "lowercase", "title_case", "word_count", "char_count",
                            "reverse", "trim", "extract_emails", "extract_urls"))
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_PATTERN)
                    .type(ToolParameter.Type.STRING)
                    .description("Regular expression for the extract operations (optional)")
                    .build())
            .example(new ToolExample("Convert to uppercase",
                    Map.of(PARAM_TEXT, "hello world", PARAM_OPERATION, "uppercase"),
                    Map.of("result", "HELLO WORLD", PARAM_OPERATION, "uppercase", "original", "hello world")))
            .example(new ToolExample("Count words",
                    Map.of(PARAM_TEXT, "hello world example", PARAM_OPERATION, "word_count"),
                    Map.of("result", 3, PARAM_OPERATION, "word_count", "original", "hello world example")))
            .build();

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        String text = (String) input.get(PARAM_TEXT);
        String operation = (String) input.get(PARAM_OPERATION);
        String pattern = (String) input.get(PARAM_PATTERN);

        Object result = switch (operation) {
        case "uppercase" -> text.toUpperCase(Locale.ROOT);
        case "lowercase" -> text.toLowerCase(Locale.ROOT);
        case "title_case" -> titleCase(text);
        case "word_count" -> countWords(text);
        case "char_count" -> text.codePointCount(0, text.length());
        case "reverse" -> new StringBuilder(text).reverse().toString();
        case "trim" -> text.strip();
        case "extract_emails" -> extract(text, compile(pattern, EMAIL));
        case "extract_urls" -> extract(text, compile(pattern, URL));
        default -> throw new ToolExecutionException(NAME, ERROR_INVALID_OPERATION,
                "unsupported operation: " + operation);
        };

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", result);
        data.put(PARAM_OPERATION, operation);
        data.put("original", text);
        return ToolResult.success(data);
    }

    private static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                startOfWord = true;
                sb.append(c);
            } else if (startOfWord) {
                sb.append(Character.toTitleCase(c));
                startOfWord = false;
            } else {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    private static int countWords(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return 0;
        }
        return WORD_BOUNDARY.split(stripped).length;
    }

    private static Pattern compile(String pattern, Pattern fallback) {
        if (pattern == null || pattern.isBlank()) {
            return fallback;
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ToolExecutionException(NAME, ERROR_PROCESSING, "invalid pattern: " + e.getDescription(), e);
        }
    }

    private static List<String> extract(String text, Pattern pattern) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return matches;
    }
}
