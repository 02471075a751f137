package me.golemcore.agents.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of every chat endpoint. Plain chat and streaming read only
 * {@code message} and {@code metadata}; the tool fields apply to
 * {@code /chat/tools}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {
    private String message;
    private Map<String, Object> metadata;
    private boolean stream;
    private List<String> tools;
    private String toolChoice;
    private Double temperature;
    private Integer maxTokens;
}
