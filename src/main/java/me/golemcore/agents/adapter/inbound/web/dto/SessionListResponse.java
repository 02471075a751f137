package me.golemcore.agents.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agents.domain.model.ChatSession;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionListResponse {
    private List<ChatSession> sessions;
    private int totalCount;
    private int page;
    private int pageSize;
    private int totalPages;
    private boolean hasMore;
}
