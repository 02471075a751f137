package me.golemcore.agents.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One server-sent event of a streamed answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamChunk {
    private String delta;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> metadata;
    private boolean done;
}
