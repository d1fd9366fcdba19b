package com.slb.chaos_engine.support;

import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.common.ledger.ManualBlockClock;
import com.slb.chaos_engine.common.ledger.SeededEntropySource;
import com.slb.chaos_engine.modules.agent.config.AgentProperties;
import com.slb.chaos_engine.modules.agent.domain.AgentRegisteredEvent;
import com.slb.chaos_engine.modules.agent.repository.InMemoryAgentRepository;
import com.slb.chaos_engine.modules.agent.service.AgentRegistryService;
import com.slb.chaos_engine.modules.capacity.config.CapacityProperties;
import com.slb.chaos_engine.modules.capacity.service.CapacityCalculator;
import com.slb.chaos_engine.modules.capacity.service.CapacityService;
import com.slb.chaos_engine.modules.emission.config.EmissionProperties;
import com.slb.chaos_engine.modules.emission.service.EmissionScheduler;
import com.slb.chaos_engine.modules.era.config.EraProperties;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.event.config.EventProperties;
import com.slb.chaos_engine.modules.event.repository.InMemoryEventRecordRepository;
import com.slb.chaos_engine.modules.event.service.DamageCalculator;
import com.slb.chaos_engine.modules.event.service.EventEngineService;
import com.slb.chaos_engine.modules.event.service.EventRandomness;
import com.slb.chaos_engine.modules.mining.config.MiningProperties;
import com.slb.chaos_engine.modules.mining.service.MiningService;
import com.slb.chaos_engine.modules.mining.service.RewardAccumulator;
import com.slb.chaos_engine.modules.token.config.TokenProperties;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import com.slb.chaos_engine.modules.vesting.config.VestingProperties;
import com.slb.chaos_engine.modules.vesting.repository.InMemoryVestingRepository;
import com.slb.chaos_engine.modules.vesting.service.VestingLedgerService;
import com.slb.chaos_engine.modules.world.config.WorldProperties;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.service.ZoneRegistry;
import com.slb.chaos_engine.modules.world.support.InMemoryWorld;

import java.util.List;

/**
 * Wires the engine by hand, without a Spring context. Adjust the properties, then call {@link #build()}.
 */
public class EngineFixture {

    public static final long GENESIS = 1_000L;

    public final TokenProperties tokenProperties = new TokenProperties();
    public final EraProperties eraProperties = new EraProperties();
    public final EmissionProperties emissionProperties = new EmissionProperties();
    public final MiningProperties miningProperties = new MiningProperties();
    public final VestingProperties vestingProperties = new VestingProperties();
    public final AgentProperties agentProperties = new AgentProperties();
    public final CapacityProperties capacityProperties = new CapacityProperties();
    public final WorldProperties worldProperties = new WorldProperties();
    public final EventProperties eventProperties = new EventProperties();

    public final ManualBlockClock clock = new ManualBlockClock(GENESIS);
    public final LedgerSerializer serializer = new LedgerSerializer();
    public final InMemoryAgentRepository agentRepository = new InMemoryAgentRepository();

    public TokenLedgerService tokenLedger;
    public EraPhaseService eraPhaseService;
    public EmissionScheduler emissionScheduler;
    public RewardAccumulator accumulator;
    public ZoneRegistry zoneRegistry;
    public InMemoryWorld world;
    public CapacityService capacityService;
    public VestingLedgerService vestingLedger;
    public AgentRegistryService agentRegistry;
    public MiningService miningService;
    public EventEngineService eventEngine;

    public EngineFixture build() {
        tokenLedger = new TokenLedgerService(tokenProperties, serializer);
        eraPhaseService = new EraPhaseService(eraProperties, clock);
        emissionScheduler = new EmissionScheduler(emissionProperties, agentRepository, eraPhaseService, tokenLedger, clock);
        accumulator = new RewardAccumulator(emissionScheduler, tokenLedger, clock, serializer, miningProperties);
        zoneRegistry = new ZoneRegistry(worldProperties);
        world = new InMemoryWorld(zoneRegistry);
        capacityService = new CapacityService(agentRepository, new CapacityCalculator(capacityProperties), accumulator,
                world, world, zoneRegistry, eraPhaseService, serializer);
        vestingLedger = new VestingLedgerService(new InMemoryVestingRepository(), agentRepository, tokenLedger, clock,
                serializer, vestingProperties);
        agentRegistry = new AgentRegistryService(agentRepository, accumulator, capacityService, eraPhaseService,
                zoneRegistry, clock, serializer, agentProperties, event -> {
                    if (event instanceof AgentRegisteredEvent registered) {
                        world.onAgentRegistered(registered);
                    }
                });
        miningService = new MiningService(agentRepository, accumulator, vestingLedger, clock, serializer, agentProperties);
        eventEngine = new EventEngineService(new InMemoryEventRecordRepository(), agentRepository,
                new EventRandomness(new SeededEntropySource("fixture")), new DamageCalculator(eventProperties),
                capacityService, accumulator, tokenLedger, eraPhaseService, zoneRegistry, world, world, world,
                clock, serializer, eventProperties);
        return this;
    }

    /** Restricts the world to a single zone with neutral modifiers, so every event hits zone 0. */
    public EngineFixture singleZone() {
        WorldProperties.Zone zone = new WorldProperties.Zone();
        zone.setName("Test Zone");
        worldProperties.setZones(List.of(zone));
        return this;
    }

    /** Registers an agent with one pristine unit of {@code capacity} and applies it. */
    public long registerWithRig(String operator, int zone, long capacity) {
        long agentId = agentRegistry.register(operator, zone, 0);
        world.installEquipment(agentId, List.of(new EquipmentUnit(capacity, 0, 10_000)));
        capacityService.recompute(agentId);
        return agentId;
    }
}
