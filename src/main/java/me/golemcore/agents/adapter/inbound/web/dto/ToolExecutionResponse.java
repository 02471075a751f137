package me.golemcore.agents.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolExecutionResponse {
    private boolean success;
    private String toolName;
    private long durationMs;
    private Object result;
    private String error;
    private String errorCode;
    private Map<String, Object> metadata;
}
