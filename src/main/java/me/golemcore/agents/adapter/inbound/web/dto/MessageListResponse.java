package me.golemcore.agents.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agents.domain.model.Message;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageListResponse {
    private List<Message> messages;
    private int totalCount;
    private int page;
    private int pageSize;
    private boolean hasMore;
}
