package com.slb.chaos_engine.modules.engine.service;

import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.agent.service.AgentRegistryService;
import com.slb.chaos_engine.modules.agent.vo.AgentProfileVo;
import com.slb.chaos_engine.modules.capacity.domain.CapacityBreakdown;
import com.slb.chaos_engine.modules.capacity.service.CapacityService;
import com.slb.chaos_engine.modules.emission.domain.EmissionQuote;
import com.slb.chaos_engine.modules.emission.service.EmissionScheduler;
import com.slb.chaos_engine.modules.engine.vo.GameStateVo;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.era.vo.EraVo;
import com.slb.chaos_engine.modules.event.service.EventEngineService;
import com.slb.chaos_engine.modules.event.vo.EventVo;
import com.slb.chaos_engine.modules.mining.service.MiningService;
import com.slb.chaos_engine.modules.mining.service.RewardAccumulator;
import com.slb.chaos_engine.modules.mining.vo.AccumulatorStateVo;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import com.slb.chaos_engine.modules.token.vo.SupplyMetricsVo;
import com.slb.chaos_engine.modules.vesting.service.VestingLedgerService;
import com.slb.chaos_engine.modules.vesting.vo.VestingEntryVo;
import com.slb.chaos_engine.modules.world.domain.DefenseGateway;
import com.slb.chaos_engine.modules.world.domain.ZoneDirectory;
import com.slb.chaos_engine.modules.world.service.ZoneRegistry;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 引擎统一入口 / Public entry points of the engine. Writes delegate to the owning module; reads are assembled here.
 */
@Service
public class ChaosEngineService {

    private final AgentRegistryService agentRegistry;
    private final MiningService miningService;
    private final CapacityService capacityService;
    private final RewardAccumulator accumulator;
    private final VestingLedgerService vestingLedger;
    private final EventEngineService eventEngine;
    private final EraPhaseService eraPhaseService;
    private final EmissionScheduler emissionScheduler;
    private final TokenLedgerService tokenLedger;
    private final ZoneRegistry zoneRegistry;
    private final ZoneDirectory zoneDirectory;
    private final DefenseGateway defenseGateway;
    private final BlockClock blockClock;
    private final LedgerSerializer serializer;

    public ChaosEngineService(AgentRegistryService agentRegistry,
                              MiningService miningService,
                              CapacityService capacityService,
                              RewardAccumulator accumulator,
                              VestingLedgerService vestingLedger,
                              EventEngineService eventEngine,
                              EraPhaseService eraPhaseService,
                              EmissionScheduler emissionScheduler,
                              TokenLedgerService tokenLedger,
                              ZoneRegistry zoneRegistry,
                              ZoneDirectory zoneDirectory,
                              DefenseGateway defenseGateway,
                              BlockClock blockClock,
                              LedgerSerializer serializer) {
        this.agentRegistry = agentRegistry;
        this.miningService = miningService;
        this.capacityService = capacityService;
        this.accumulator = accumulator;
        this.vestingLedger = vestingLedger;
        this.eventEngine = eventEngine;
        this.eraPhaseService = eraPhaseService;
        this.emissionScheduler = emissionScheduler;
        this.tokenLedger = tokenLedger;
        this.zoneRegistry = zoneRegistry;
        this.zoneDirectory = zoneDirectory;
        this.defenseGateway = defenseGateway;
        this.blockClock = blockClock;
        this.serializer = serializer;
    }

    // ---- agents

    public long register(String operator, int zone, int resilienceBps) {
        return agentRegistry.register(operator, zone, resilienceBps);
    }

    public long heartbeat(long agentId) {
        return agentRegistry.heartbeat(agentId);
    }

    public boolean deactivateIfSilent(long agentId) {
        return agentRegistry.deactivateIfSilent(agentId);
    }

    public long recomputeCapacity(long agentId) {
        return capacityService.recompute(agentId);
    }

    public long getEffectiveHashrate(long agentId) {
        return capacityService.getEffectiveHashrate(agentId);
    }

    public CapacityBreakdown computeEffectiveHashrate(long agentId) {
        return capacityService.computeEffectiveHashrate(agentId);
    }

    public AgentProfileVo getAgentProfile(long agentId) {
        return serializer.call(() -> {
            Agent agent = agentRegistry.requireAgent(agentId);
            AgentProfileVo vo = new AgentProfileVo();
            vo.setAgentId(agent.getId());
            vo.setOperator(agent.getOperator());
            vo.setZone(agent.getZone());
            vo.setZoneName(zoneRegistry.require(agent.getZone()).name());
            vo.setResilienceBps(agent.getResilienceBps());
            vo.setPioneerPhase(agent.getPioneerPhase());
            vo.setRegistrationBlock(agent.getRegistrationBlock());
            vo.setLastTouchBlock(agent.getLastTouchBlock());
            vo.setActive(agent.isActive());
            vo.setEffectiveHashrate(agent.getEffectiveHashrate());
            vo.setPendingRewards(accumulator.pendingRewards(agent));
            vo.setTotalClaimed(agent.getTotalClaimed());
            vo.setLockedInVesting(vestingLedger.lockedBalance(agentId));
            vo.setOperatorBalance(tokenLedger.balanceOf(agent.getOperator()));
            vo.setShelterBps(defenseGateway.getShelterBps(agentId));
            vo.setShieldAbsorptionBps(defenseGateway.getShieldAbsorptionBps(agentId));
            vo.setVestingEntries(vestingLedger.listEntries(agentId));
            return vo;
        });
    }

    // ---- rewards

    public boolean touch() {
        return accumulator.touch();
    }

    public BigInteger claim(long agentId) {
        return miningService.claim(agentId);
    }

    public BigInteger getPendingRewards(long agentId) {
        return miningService.getPendingRewards(agentId);
    }

    public AccumulatorStateVo getAccumulatorState() {
        return accumulator.snapshot();
    }

    public EmissionQuote getEmissionQuote() {
        return serializer.call(emissionScheduler::currentQuote);
    }

    // ---- vesting

    public List<VestingEntryVo> listVestingEntries(long agentId) {
        return vestingLedger.listEntries(agentId);
    }

    public BigInteger availableToWithdraw(long entryId) {
        return vestingLedger.availableToWithdraw(entryId);
    }

    public BigInteger withdrawVested(long entryId) {
        return vestingLedger.withdraw(entryId);
    }

    public BigInteger claimEarly(long entryId) {
        return vestingLedger.claimEarly(entryId);
    }

    // ---- events

    public long triggerEvent(String caller) {
        return eventEngine.triggerEvent(caller);
    }

    public int processShard(long eventId, int zoneId, int shardIndex, String caller) {
        return eventEngine.processShard(eventId, zoneId, shardIndex, caller);
    }

    public EventVo getEvent(long eventId) {
        return eventEngine.getEvent(eventId);
    }

    public List<EventVo> getRecentEvents(int count) {
        return eventEngine.getRecentEvents(count);
    }

    // ---- world

    public EraVo getCurrentEra() {
        return eraPhaseService.toVo(eraPhaseService.currentEra());
    }

    public int getCurrentPhase() {
        return agentRegistry.currentPhase();
    }

    public SupplyMetricsVo getSupplyMetrics() {
        return tokenLedger.getSupplyMetrics();
    }

    public GameStateVo getGameState() {
        return serializer.call(() -> {
            EraConfig era = eraPhaseService.currentEra();
            long activeCount = agentRegistry.activeAgentCount();
            int phase = eraPhaseService.phaseFor(activeCount);
            long lastEventBlock = eventEngine.getLastEventBlock();

            GameStateVo vo = new GameStateVo();
            vo.setBlockNumber(blockClock.currentBlock());
            vo.setEra(eraPhaseService.toVo(era));
            vo.setActiveAgentCount(activeCount);
            vo.setPhase(phase);
            vo.setEventsUnlocked(phase >= eraPhaseService.getMinPhaseForEvents());
            Map<Integer, Integer> counts = new TreeMap<>();
            for (int zoneId = 0; zoneId < zoneRegistry.zoneCount(); zoneId++) {
                counts.put(zoneId, zoneDirectory.getZoneAgentCount(zoneId));
            }
            vo.setZoneAgentCounts(counts);
            vo.setLastEventBlock(lastEventBlock);
            vo.setNextEventBlock(lastEventBlock + era.eventCooldownBlocks());
            vo.setEmissionPerBlock(emissionScheduler.emissionPerBlock());
            vo.setTotalEffectiveHashrate(accumulator.getTotalEffectiveHashrate());
            return vo;
        });
    }
}
