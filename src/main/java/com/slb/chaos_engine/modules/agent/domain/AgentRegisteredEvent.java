package com.slb.chaos_engine.modules.agent.domain;

/**
 * Published after a successful registration so the zone index owner can place the agent.
 */
public record AgentRegisteredEvent(long agentId, String operator, int zone, long registrationBlock) {
}
