package com.slb.chaos_engine.modules.world.domain;

/**
 * Pool an agent mines in.
 *
 * @param poolHashrate combined effective hashrate of the pool
 * @param homogeneous  every member runs the same specialization
 * @param tenureBlocks how long the agent has been a member
 */
public record PoolMembership(long poolId, long poolHashrate, boolean homogeneous, long tenureBlocks) {
}
