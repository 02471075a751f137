package me.golemcore.agents.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of agent create and update. On update, {@code null} fields keep their
 * current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {
    private String name;
    private String description;
    private String provider;
    private String model;
    private String systemPrompt;
    private Double temperature;
    private Integer maxTokens;
    private Map<String, Object> config;
}
