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

import me.golemcore.agents.domain.model.Agent;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of agent definitions.
 */
public interface AgentPort {

    Agent create(Agent agent);

    Optional<Agent> get(String agentId);

    /**
     * Agents ordered by creation time, newest first.
     */
    List<Agent> list(int limit, int offset);

    int count();

    Agent update(Agent agent);

    boolean delete(String agentId);
}
