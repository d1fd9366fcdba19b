package com.slb.chaos_engine.modules.capacity.service;

import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.capacity.domain.CapacityBreakdown;
import com.slb.chaos_engine.modules.capacity.domain.CapacityInput;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.mining.service.RewardAccumulator;
import com.slb.chaos_engine.modules.world.domain.EquipmentGateway;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.domain.PoolDirectory;
import com.slb.chaos_engine.modules.world.service.ZoneRegistry;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 有效算力服务 / Recomputes an agent's effective hashrate and reports it to the accumulator.
 * Called after every equipment mutation, heartbeat and event damage.
 */
@Service
public class CapacityService {

    private final AgentRepository agentRepository;
    private final CapacityCalculator calculator;
    private final RewardAccumulator accumulator;
    private final EquipmentGateway equipmentGateway;
    private final PoolDirectory poolDirectory;
    private final ZoneRegistry zoneRegistry;
    private final EraPhaseService eraPhaseService;
    private final LedgerSerializer serializer;

    public CapacityService(AgentRepository agentRepository,
                           CapacityCalculator calculator,
                           RewardAccumulator accumulator,
                           EquipmentGateway equipmentGateway,
                           PoolDirectory poolDirectory,
                           ZoneRegistry zoneRegistry,
                           EraPhaseService eraPhaseService,
                           LedgerSerializer serializer) {
        this.agentRepository = agentRepository;
        this.calculator = calculator;
        this.accumulator = accumulator;
        this.equipmentGateway = equipmentGateway;
        this.poolDirectory = poolDirectory;
        this.zoneRegistry = zoneRegistry;
        this.eraPhaseService = eraPhaseService;
        this.serializer = serializer;
    }

    /**
     * Recomputes and applies the agent's hashrate.
     *
     * @return the new effective hashrate
     */
    public long recompute(long agentId) {
        return serializer.call(() -> recompute(requireAgent(agentId)));
    }

    public long recompute(Agent agent) {
        return serializer.call(() -> {
            long hashrate = agent.isActive() ? computeEffectiveHashrate(agent).effectiveHashrate() : 0L;
            accumulator.updateHashrate(agent, hashrate);
            return hashrate;
        });
    }

    /**
     * Effective hashrate the agent would have right now, without applying it.
     */
    public CapacityBreakdown computeEffectiveHashrate(long agentId) {
        return serializer.call(() -> computeEffectiveHashrate(requireAgent(agentId)));
    }

    public long getEffectiveHashrate(long agentId) {
        return serializer.call(() -> requireAgent(agentId).getEffectiveHashrate());
    }

    private CapacityBreakdown computeEffectiveHashrate(Agent agent) {
        List<EquipmentUnit> units = equipmentGateway.getAgentEquipmentState(agent.getId());
        if (units == null || units.isEmpty()) {
            return CapacityBreakdown.zero();
        }
        CapacityInput input = new CapacityInput(
                units,
                zoneRegistry.require(agent.getZone()),
                eraPhaseService.currentEra(),
                poolDirectory.findPool(agent.getId()),
                agent.getPioneerPhase(),
                Math.max(0L, accumulator.getTotalEffectiveHashrate() - agent.getEffectiveHashrate()));
        return calculator.breakdown(input);
    }

    private Agent requireAgent(long agentId) {
        return agentRepository.selectById(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
    }
}
