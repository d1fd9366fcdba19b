package com.slb.chaos_engine.modules.capacity.domain;

import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.domain.PoolMembership;
import com.slb.chaos_engine.modules.world.domain.ZoneConfig;

import java.util.List;
import java.util.Optional;

/**
 * Everything the capacity calculation depends on.
 *
 * @param othersHashrate total effective hashrate of every other agent in the network
 */
public record CapacityInput(
        List<EquipmentUnit> units,
        ZoneConfig zone,
        EraConfig era,
        Optional<PoolMembership> pool,
        int pioneerPhase,
        long othersHashrate
) {
}
