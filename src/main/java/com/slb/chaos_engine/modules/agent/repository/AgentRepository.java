package com.slb.chaos_engine.modules.agent.repository;

import com.slb.chaos_engine.modules.agent.entity.Agent;

import java.util.List;
import java.util.Optional;

public interface AgentRepository {

    /** Assigns the next id and stores the agent. */
    Agent insert(Agent agent);

    Optional<Agent> selectById(long agentId);

    Optional<Agent> selectByOperator(String operator);

    List<Agent> selectAll();

    long countActive();

    /** Adjusts the active counter after an agent flips between active and inactive. */
    void markActive(Agent agent, boolean active);
}
