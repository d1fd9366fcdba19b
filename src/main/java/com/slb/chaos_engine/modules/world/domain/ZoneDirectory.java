package com.slb.chaos_engine.modules.world.domain;

/**
 * Zone membership index owned by the zone collaborator. Drives event sharding.
 */
public interface ZoneDirectory {

    int getZoneAgentCount(int zoneId);

    long getZoneAgentAt(int zoneId, int index);
}
