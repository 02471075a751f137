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
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing for the HTTP tools: per-call clients derived from the shared
 * {@link OkHttpClient}, header handling, cancellation and response decoding.
 *
 * <p>
 * The in-flight call is cancelled together with the invocation's
 * {@link ExecutionContext}, so a turn cancellation or tool deadline aborts the
 * socket instead of leaving it to the read timeout.
 */
@Slf4j
abstract class HttpToolSupport implements ToolComponent {

    static final String PARAM_URL = "url";
    static final String PARAM_HEADERS = "headers";
    static final String PARAM_TIMEOUT = "timeout";

    static final String ERROR_INVALID_URL = "INVALID_URL";
    static final String ERROR_REQUEST_CREATION = "REQUEST_CREATION_FAILED";
    static final String ERROR_REQUEST_FAILED = "REQUEST_FAILED";
    static final String ERROR_RESPONSE_READ = "RESPONSE_READ_FAILED";

    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    private static final long MAX_RESPONSE_BYTES = 10L * 1024 * 1024;

    private final OkHttpClient okHttpClient;
    protected final ObjectMapper objectMapper;

    protected HttpToolSupport(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    static ToolParameter urlParameter(String description) {
        return ToolParameter.builder()
                .name(PARAM_URL)
                .type(ToolParameter.Type.STRING)
                .description(description)
                .required(true)
                .pattern("^https?://.*")
                .build();
    }

    static ToolParameter headersParameter() {
        return ToolParameter.builder()
                .name(PARAM_HEADERS)
                .type(ToolParameter.Type.OBJECT)
                .description("Optional HTTP headers to include in the request")
                .build();
    }

    static ToolParameter timeoutParameter() {
        return ToolParameter.builder()
                .name(PARAM_TIMEOUT)
                .type(ToolParameter.Type.NUMBER)
                .description("Request timeout in seconds (default: 30)")
                .minimum(1.0)
                .maximum(300.0)
                .defaultValue(DEFAULT_TIMEOUT_SECONDS)
                .build();
    }

    protected HttpUrl parseUrl(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new ToolExecutionException(getName(), ERROR_INVALID_URL, "Invalid URL: " + url);
        }
        return parsed;
    }

    protected Request.Builder newRequest(HttpUrl url, Map<String, Object> input) {
        Request.Builder builder = new Request.Builder().url(url);
        Object headers = input.get(PARAM_HEADERS);
        if (headers instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                try {
                    builder.header(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new ToolExecutionException(getName(), ERROR_REQUEST_CREATION,
                            "Failed to create request: " + e.getMessage(), e);
                }
            }
        }
        return builder;
    }

    protected static Duration timeoutOf(Map<String, Object> input) {
        Object value = input.get(PARAM_TIMEOUT);
        if (value instanceof Number number) {
            return Duration.ofMillis((long) (number.doubleValue() * 1000));
        }
        return Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Executes the request and maps the response into the tool's result shape:
     * {@code status_code}, {@code data}, {@code headers}, {@code content_type},
     * with {@code url} and {@code response_size} as metadata.
     */
    protected ToolResult send(ExecutionContext context, Request request, Duration timeout) {
        OkHttpClient client = okHttpClient.newBuilder()
                .callTimeout(timeout)
                .build();
        Call call = client.newCall(request);
        context.getCancellationToken().onCancel(call::cancel);

        String url = request.url().toString();
        log.debug("[Tools] {} {} {}", getName(), request.method(), url);
        try (Response response = call.execute()) {
            byte[] body = readBody(response);
            String contentType = response.header("Content-Type", "");

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status_code", response.code());
            data.put("data", decodeBody(body, contentType));
            data.put(PARAM_HEADERS, flattenHeaders(response));
            data.put("content_type", contentType);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(PARAM_URL, url);
            metadata.put("response_size", body.length);
            return ToolResult.success(data, metadata);
        } catch (IOException e) {
            if (context.isCancelled()) {
                throw new ToolExecutionException(getName(), ERROR_REQUEST_FAILED, "HTTP request cancelled", e);
            }
            throw new ToolExecutionException(getName(), ERROR_REQUEST_FAILED,
                    "HTTP request failed: " + e.getMessage(), e);
        }
    }

    private byte[] readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return new byte[0];
        }
        long declared = body.contentLength();
        if (declared > MAX_RESPONSE_BYTES) {
            throw new ToolExecutionException(getName(), ERROR_RESPONSE_READ,
                    "Failed to read response: body exceeds " + MAX_RESPONSE_BYTES + " bytes");
        }
        byte[] bytes = body.bytes();
        if (bytes.length > MAX_RESPONSE_BYTES) {
            throw new ToolExecutionException(getName(), ERROR_RESPONSE_READ,
                    "Failed to read response: body exceeds " + MAX_RESPONSE_BYTES + " bytes");
        }
        return bytes;
    }

    private Object decodeBody(byte[] body, String contentType) {
        String text = new String(body, StandardCharsets.UTF_8);
        if (body.length == 0 || !contentType.toLowerCase(Locale.ROOT).contains("application/json")) {
            return text;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (IOException e) {
            log.debug("[Tools] {} response declared JSON but did not parse: {}", getName(), e.getMessage());
            return text;
        }
    }

    private static Map<String, String> flattenHeaders(Response response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : response.headers().toMultimap().entrySet()) {
            headers.put(entry.getKey(), String.join(", ", entry.getValue()));
        }
        return headers;
    }

    protected byte[] encodeJson(Object data) {
        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(getName(), "JSON_ENCODING_FAILED",
                    "Failed to encode JSON: " + e.getOriginalMessage(), e);
        }
    }
}
