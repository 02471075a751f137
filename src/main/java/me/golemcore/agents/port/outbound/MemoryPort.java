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

import me.golemcore.agents.domain.model.Memory;
import me.golemcore.agents.domain.model.MemoryQuery;
import me.golemcore.agents.domain.model.MemoryStats;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of agent memories. Expired memories are invisible to every read.
 */
public interface MemoryPort {

    /**
     * Persists a new memory, assigning id and timestamps.
     */
    Memory create(Memory memory);

    Optional<Memory> get(String memoryId);

    Memory update(Memory memory);

    boolean delete(String memoryId);

    /**
     * Memories matching the query, most important first and newest first within
     * equal importance.
     */
    List<Memory> search(MemoryQuery query);

    List<Memory> listByTopic(String agentId, String topic, int limit, int offset);

    /**
     * Statistics for one agent; {@code memoriesByTopic} holds the ten largest
     * topics.
     */
    MemoryStats stats(String agentId);

    /**
     * Removes memories whose expiry has passed. Returns the number removed.
     */
    int deleteExpired();

    /**
     * Removes every memory of the agent. Returns the number removed.
     */
    int deleteByAgent(String agentId);
}
