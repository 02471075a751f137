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

import me.golemcore.agents.domain.model.Message;

import java.util.List;

/**
 * Append-only message history per session. Writers of one session are
 * sequential; different sessions are independent.
 */
public interface MessagePort {

    /**
     * Persists one message, assigning id and creation time when absent.
     */
    Message append(Message message);

    /**
     * Persists a batch of messages of one session in order with a single write.
     * Either the whole batch becomes visible or none of it does.
     */
    List<Message> appendAll(String sessionId, List<Message> messages);

    /**
     * Lists messages of a session in append order.
     */
    List<Message> list(String sessionId, int limit, int offset);

    /**
     * The last {@code limit} messages of a session, oldest first.
     */
    List<Message> listRecent(String sessionId, int limit);

    int count(String sessionId);

    /**
     * Removes the whole history of a session. Returns the number of messages
     * removed.
     */
    int deleteBySession(String sessionId);
}
