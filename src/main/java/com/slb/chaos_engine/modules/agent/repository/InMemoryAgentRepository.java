package com.slb.chaos_engine.modules.agent.repository;

import com.slb.chaos_engine.modules.agent.entity.Agent;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent table kept in memory; access is serialized by the engine's ledger lock.
 */
@Repository
public class InMemoryAgentRepository implements AgentRepository {

    private final Map<Long, Agent> agents = new LinkedHashMap<>();
    private final Map<String, Long> idByOperator = new HashMap<>();
    private long nextId = 1L;
    private long activeCount;

    @Override
    public Agent insert(Agent agent) {
        agent.setId(nextId++);
        agents.put(agent.getId(), agent);
        idByOperator.put(agent.getOperator(), agent.getId());
        if (agent.isActive()) {
            activeCount++;
        }
        return agent;
    }

    @Override
    public Optional<Agent> selectById(long agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Optional<Agent> selectByOperator(String operator) {
        Long id = idByOperator.get(operator);
        return id == null ? Optional.empty() : selectById(id);
    }

    @Override
    public List<Agent> selectAll() {
        return new ArrayList<>(agents.values());
    }

    @Override
    public long countActive() {
        return activeCount;
    }

    @Override
    public void markActive(Agent agent, boolean active) {
        if (agent.isActive() == active) {
            return;
        }
        agent.setActive(active);
        activeCount += active ? 1 : -1;
    }
}
