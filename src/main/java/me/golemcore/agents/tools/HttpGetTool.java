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
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool for HTTP GET requests.
 *
 * <p>
 * JSON responses are decoded into structured data; anything else is returned
 * as text. Non-2xx statuses are not failures: the status code is part of the
 * result.
 */
@Component
public class HttpGetTool extends HttpToolSupport {

    static final String NAME = "http_get";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Performs an HTTP GET request to retrieve data from a URL")
            .parameter(urlParameter("The URL to send the GET request to"))
            .parameter(headersParameter())
            .parameter(timeoutParameter())
            .example(new ToolExample("Get JSON data from an API",
                    Map.of(PARAM_URL, "https://api.example.com/data",
                            PARAM_HEADERS, Map.of("Accept", "application/json")),
                    Map.of("status_code", 200, "data", "response body")))
            .build();

    public HttpGetTool(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        super(okHttpClient, objectMapper);
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        Request request = newRequest(parseUrl((String) input.get(PARAM_URL)), input)
                .get()
                .build();
        return send(context, request, timeoutOf(input));
    }
}
