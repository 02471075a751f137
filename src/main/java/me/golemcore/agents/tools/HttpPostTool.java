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

import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolExample;
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Tool for HTTP POST requests.
 *
 * <p>
 * With the default {@code application/json} content type the {@code data}
 * object is JSON-encoded; for any other content type its string form is sent.
 */
@Component
public class HttpPostTool extends HttpToolSupport {

    static final String NAME = "http_post";
    private static final String PARAM_DATA = "data";
    private static final String PARAM_CONTENT_TYPE = "content_type";
    private static final String JSON = "application/json";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Performs an HTTP POST request to send data to a URL")
            .parameter(urlParameter("The URL to send the POST request to"))
            .parameter(ToolParameter.builder()
                    .name(PARAM_DATA)
                    .type(ToolParameter.Type.OBJECT)
                    .description("The data to send in the request body (will be JSON encoded)")
                    .build())
            .parameter(headersParameter())
            .parameter(ToolParameter.builder()
                    .name(PARAM_CONTENT_TYPE)
                    .type(ToolParameter.Type.STRING)
                    .description("Content-Type header (default: application/json)")
                    .defaultValue(JSON)
                    .build())
            .parameter(timeoutParameter())
            .example(new ToolExample("Post JSON data to an API",
                    Map.of(PARAM_URL, "https://api.example.com/users",
                            PARAM_DATA, Map.of("name", "John Doe", "email", "john@example.com")),
                    Map.of("status_code", 201, "data", Map.of("id", 123))))
            .build();

    public HttpPostTool(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        super(okHttpClient, objectMapper);
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        String contentType = (String) input.getOrDefault(PARAM_CONTENT_TYPE, JSON);
        if (contentType == null || contentType.isBlank()) {
            contentType = JSON;
        }
        MediaType mediaType = MediaType.parse(contentType);
        Object data = input.get(PARAM_DATA);

        byte[] payload;
        if (data == null) {
            payload = new byte[0];
        } else if (JSON.equals(contentType)) {
            payload = encodeJson(data);
        } else {
            payload = String.valueOf(data).getBytes(StandardCharsets.UTF_8);
        }

        Request request = newRequest(parseUrl((String) input.get(PARAM_URL)), input)
                .header("Content-Type", contentType)
                .post(RequestBody.create(payload, mediaType))
                .build();
        return send(context, request, timeoutOf(input));
    }
}
