package me.golemcore.agents.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agents.domain.model.ToolCallResult;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolChatResponse {
    private String userMessageId;
    private String assistantMessageId;
    private String response;
    private List<ToolCallResult> toolCalls;
    private Map<String, Object> metadata;
    private String finishReason;
    private List<String> suggestedTools;
}
