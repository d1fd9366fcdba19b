package com.slb.chaos_engine.modules.event.entity;

import com.slb.chaos_engine.modules.event.domain.ShardKey;
import com.slb.chaos_engine.modules.event.enums.CosmicEventType;
import com.slb.chaos_engine.modules.event.enums.EventStatus;
import lombok.Data;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Audit record of one cosmic event. Never deleted; only the shard bookkeeping and tallies change
 * after the trigger.
 */
@Data
public class EventRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private CosmicEventType eventType;
    private int severityTier;
    /** Tier base damage in bps, before zone and defense scaling. */
    private int baseDamageBps;
    private int originZone;
    private int affectedZonesMask;
    private long triggerBlock;
    private String triggeredBy;
    private int shardSize;

    /** Agent count of every affected zone at trigger time; fixes the shards this event needs. */
    private Map<Integer, Integer> zoneAgentCounts = new TreeMap<>();
    private Set<ShardKey> shardProcessed = new HashSet<>();

    private long agentsAffected;
    /** Sum of the damage bps applied, for reporting. */
    private long totalDamageBps;

    public boolean affects(int zoneId) {
        return zoneId >= 0 && zoneId < Integer.SIZE && (affectedZonesMask & (1 << zoneId)) != 0;
    }

    public int requiredShards(int zoneId) {
        int agents = zoneAgentCounts.getOrDefault(zoneId, 0);
        return (agents + shardSize - 1) / shardSize;
    }

    public int requiredShardCount() {
        int total = 0;
        for (Integer zoneId : zoneAgentCounts.keySet()) {
            total += requiredShards(zoneId);
        }
        return total;
    }

    /**
     * True once every required (zone, shard) pair has been processed.
     */
    public boolean isProcessed() {
        for (Integer zoneId : zoneAgentCounts.keySet()) {
            int shards = requiredShards(zoneId);
            for (int i = 0; i < shards; i++) {
                if (!shardProcessed.contains(new ShardKey(zoneId, i))) {
                    return false;
                }
            }
        }
        return true;
    }

    public EventStatus getStatus() {
        if (isProcessed()) {
            return EventStatus.PROCESSED;
        }
        return shardProcessed.isEmpty() ? EventStatus.TRIGGERED : EventStatus.SHARDING;
    }
}
