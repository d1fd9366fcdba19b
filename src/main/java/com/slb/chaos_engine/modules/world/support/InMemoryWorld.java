package com.slb.chaos_engine.modules.world.support;

import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.agent.domain.AgentRegisteredEvent;
import com.slb.chaos_engine.modules.world.domain.DefenseGateway;
import com.slb.chaos_engine.modules.world.domain.EquipmentGateway;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.domain.PoolDirectory;
import com.slb.chaos_engine.modules.world.domain.PoolMembership;
import com.slb.chaos_engine.modules.world.domain.ZoneDirectory;
import com.slb.chaos_engine.modules.world.service.ZoneRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.slb.chaos_engine.common.util.FixedPointMath.BPS_DENOMINATOR;

/**
 * Equipment, zone membership, defense and pool collaborators kept in memory.
 */
@Component
@Slf4j
public class InMemoryWorld implements EquipmentGateway, ZoneDirectory, DefenseGateway, PoolDirectory {

    private final ZoneRegistry zoneRegistry;
    private final List<List<Long>> zoneMembers;
    private final Map<Long, List<EquipmentUnit>> equipment = new HashMap<>();
    private final Map<Long, int[]> defenses = new HashMap<>();
    private final Map<Long, PoolMembership> pools = new HashMap<>();

    public InMemoryWorld(ZoneRegistry zoneRegistry) {
        this.zoneRegistry = zoneRegistry;
        this.zoneMembers = new ArrayList<>(zoneRegistry.zoneCount());
        for (int i = 0; i < zoneRegistry.zoneCount(); i++) {
            zoneMembers.add(new ArrayList<>());
        }
    }

    @EventListener
    public synchronized void onAgentRegistered(AgentRegisteredEvent event) {
        zoneMembers.get(zoneRegistry.require(event.zone()).zoneId()).add(event.agentId());
        log.debug("Agent placed in zone: agentId={}, zone={}", event.agentId(), event.zone());
    }

    // equipment

    @Override
    public synchronized List<EquipmentUnit> getAgentEquipmentState(long agentId) {
        return Collections.unmodifiableList(new ArrayList<>(equipment.getOrDefault(agentId, List.of())));
    }

    /**
     * Reduces every unit's remaining durability by {@code damageBps} of its current value.
     */
    @Override
    public synchronized void applyDurabilityDamage(long agentId, int damageBps) {
        List<EquipmentUnit> units = equipment.get(agentId);
        if (units == null || units.isEmpty()) {
            return;
        }
        long keep = BPS_DENOMINATOR - FixedPointMath.clamp(damageBps, 0, BPS_DENOMINATOR);
        List<EquipmentUnit> damaged = new ArrayList<>(units.size());
        for (EquipmentUnit unit : units) {
            int durability = (int) FixedPointMath.applyBps(unit.durabilityRatioBps(), keep);
            damaged.add(new EquipmentUnit(unit.baseCapacity(), unit.quirkId(), durability));
        }
        equipment.put(agentId, damaged);
    }

    public synchronized void installEquipment(long agentId, List<EquipmentUnit> units) {
        equipment.put(agentId, new ArrayList<>(units));
    }

    // zones

    @Override
    public synchronized int getZoneAgentCount(int zoneId) {
        return members(zoneId).size();
    }

    @Override
    public synchronized long getZoneAgentAt(int zoneId, int index) {
        List<Long> members = members(zoneId);
        if (index < 0 || index >= members.size()) {
            throw new IndexOutOfBoundsException("zone " + zoneId + " has " + members.size() + " agents, index " + index);
        }
        return members.get(index);
    }

    // defense

    @Override
    public synchronized int getShelterBps(long agentId) {
        return defenses.getOrDefault(agentId, new int[2])[0];
    }

    @Override
    public synchronized int getShieldAbsorptionBps(long agentId) {
        return defenses.getOrDefault(agentId, new int[2])[1];
    }

    public synchronized void setDefense(long agentId, int shelterBps, int shieldAbsorptionBps) {
        defenses.put(agentId, new int[]{shelterBps, shieldAbsorptionBps});
    }

    // pools

    @Override
    public synchronized Optional<PoolMembership> findPool(long agentId) {
        return Optional.ofNullable(pools.get(agentId));
    }

    public synchronized void joinPool(long agentId, PoolMembership membership) {
        pools.put(agentId, membership);
    }

    public synchronized void leavePool(long agentId) {
        pools.remove(agentId);
    }

    private List<Long> members(int zoneId) {
        if (zoneId < 0 || zoneId >= zoneMembers.size()) {
            throw NotFoundException.zone(zoneId);
        }
        return zoneMembers.get(zoneId);
    }
}
