package me.golemcore.agents.port.outbound;

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

import me.golemcore.agents.domain.model.ChatSession;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of chat sessions.
 */
public interface SessionPort {

    ChatSession create(ChatSession session);

    Optional<ChatSession> get(String sessionId);

    List<ChatSession> listByAgent(String agentId, int limit, int offset);

    int countByAgent(String agentId);

    ChatSession update(ChatSession session);

    /**
     * Deletes the session together with its message history.
     */
    boolean delete(String sessionId);

    /**
     * Deletes every session of the agent. Returns the number of sessions removed.
     */
    int deleteByAgent(String agentId);
}
