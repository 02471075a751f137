package me.golemcore.agents.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tool calls of one session reconstructed from its message history, newest
 * last.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallHistoryResponse {
    private List<Entry> toolCalls;
    private int totalCount;
    private int page;
    private int pageSize;
    private boolean hasMore;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private String toolCallId;
        private String toolName;
        private Map<String, Object> arguments;
        private String result;
        private Instant createdAt;
    }
}
