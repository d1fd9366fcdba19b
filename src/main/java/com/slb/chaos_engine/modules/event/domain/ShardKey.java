package com.slb.chaos_engine.modules.event.domain;

/**
 * One unit of event work: a slice of {@code shardSize} agents in one zone.
 */
public record ShardKey(int zoneId, int shardIndex) {
}
