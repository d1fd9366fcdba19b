package com.slb.chaos_engine.modules.event.service;

import com.slb.chaos_engine.common.exception.BizException;
import com.slb.chaos_engine.common.exception.EngineErrorType;
import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.common.exception.PreconditionException;
import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.capacity.service.CapacityService;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.event.config.EventProperties;
import com.slb.chaos_engine.modules.event.domain.EventRoll;
import com.slb.chaos_engine.modules.event.domain.ShardKey;
import com.slb.chaos_engine.modules.event.entity.EventRecord;
import com.slb.chaos_engine.modules.event.repository.EventRecordRepository;
import com.slb.chaos_engine.modules.event.vo.EventVo;
import com.slb.chaos_engine.modules.mining.service.RewardAccumulator;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import com.slb.chaos_engine.modules.world.domain.DefenseGateway;
import com.slb.chaos_engine.modules.world.domain.EquipmentGateway;
import com.slb.chaos_engine.modules.world.domain.ZoneDirectory;
import com.slb.chaos_engine.modules.world.service.ZoneRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 宇宙事件引擎 / Triggers cosmic events and applies their damage shard by shard.
 * <p>
 * A trigger only records the event. Damage is applied by {@link #processShard} calls that anyone may
 * make, in any order, until every (zone, shard) pair the event needs has been processed.
 */
@Service
@Slf4j
public class EventEngineService {

    private final EventRecordRepository eventRepository;
    private final AgentRepository agentRepository;
    private final EventRandomness randomness;
    private final DamageCalculator damageCalculator;
    private final CapacityService capacityService;
    private final RewardAccumulator accumulator;
    private final TokenLedgerService tokenLedger;
    private final EraPhaseService eraPhaseService;
    private final ZoneRegistry zoneRegistry;
    private final ZoneDirectory zoneDirectory;
    private final EquipmentGateway equipmentGateway;
    private final DefenseGateway defenseGateway;
    private final BlockClock blockClock;
    private final LedgerSerializer serializer;
    private final EventProperties properties;

    public EventEngineService(EventRecordRepository eventRepository,
                              AgentRepository agentRepository,
                              EventRandomness randomness,
                              DamageCalculator damageCalculator,
                              CapacityService capacityService,
                              RewardAccumulator accumulator,
                              TokenLedgerService tokenLedger,
                              EraPhaseService eraPhaseService,
                              ZoneRegistry zoneRegistry,
                              ZoneDirectory zoneDirectory,
                              EquipmentGateway equipmentGateway,
                              DefenseGateway defenseGateway,
                              BlockClock blockClock,
                              LedgerSerializer serializer,
                              EventProperties properties) {
        this.eventRepository = eventRepository;
        this.agentRepository = agentRepository;
        this.randomness = randomness;
        this.damageCalculator = damageCalculator;
        this.capacityService = capacityService;
        this.accumulator = accumulator;
        this.tokenLedger = tokenLedger;
        this.eraPhaseService = eraPhaseService;
        this.zoneRegistry = zoneRegistry;
        this.zoneDirectory = zoneDirectory;
        this.equipmentGateway = equipmentGateway;
        this.defenseGateway = defenseGateway;
        this.blockClock = blockClock;
        this.serializer = serializer;
        this.properties = properties;
    }

    /**
     * Permissionless. Rolls a new event from the current block's seed and pays the caller the
     * trigger bounty.
     *
     * @return the new event id
     */
    public long triggerEvent(String caller) {
        requireCaller(caller);
        return serializer.call(() -> {
            long now = blockClock.currentBlock();
            EraConfig era = eraPhaseService.currentEra();
            long lastEventBlock = eventRepository.lastEventBlock().orElse(blockClock.genesisBlock());
            long sinceLast = now - lastEventBlock;
            if (sinceLast < era.eventCooldownBlocks()) {
                throw new PreconditionException(EngineErrorType.EVENT_COOLDOWN,
                        "next event possible in " + (era.eventCooldownBlocks() - sinceLast) + " blocks");
            }
            int phase = eraPhaseService.phaseFor(agentRepository.countActive());
            if (phase < eraPhaseService.getMinPhaseForEvents()) {
                throw new PreconditionException(EngineErrorType.EVENT_PHASE_LOCKED,
                        "events unlock at phase " + eraPhaseService.getMinPhaseForEvents() + ", current phase " + phase);
            }
            accumulator.touch();

            long eventId = eventRepository.nextId();
            EventRoll roll = randomness.roll(now, eventId, era.maxEventTier(), zoneRegistry.zoneCount());
            EventRecord record = new EventRecord();
            record.setEventType(roll.type());
            record.setSeverityTier(roll.severityTier());
            record.setBaseDamageBps(damageCalculator.baseDamageBps(roll.severityTier()));
            record.setOriginZone(roll.originZone());
            record.setAffectedZonesMask(roll.affectedZonesMask());
            record.setTriggerBlock(now);
            record.setTriggeredBy(caller);
            record.setShardSize(properties.getShardSize());
            for (int zoneId = 0; zoneId < zoneRegistry.zoneCount(); zoneId++) {
                if (record.affects(zoneId)) {
                    record.getZoneAgentCounts().put(zoneId, zoneDirectory.getZoneAgentCount(zoneId));
                }
            }
            eventRepository.insert(record);

            BigInteger bounty = tokenLedger.mint(caller, FixedPointMath.toWei(properties.getTriggerBountyTokens())).net();
            log.info("Cosmic event triggered: eventId={}, type={}, tier={}, originZone={}, mask={}, requiredShards={}, bounty={}",
                    record.getId(), record.getEventType(), record.getSeverityTier(), record.getOriginZone(),
                    Integer.toBinaryString(record.getAffectedZonesMask()), record.requiredShardCount(), bounty);
            return record.getId();
        });
    }

    /**
     * Applies the event's damage to one shard of one affected zone and pays the per-agent bounty.
     * An agent whose damage cannot be applied is logged and skipped; the rest of the shard proceeds.
     * Once the equipment write succeeds the agent counts as damaged, even if its capacity refresh fails.
     *
     * @return number of agents damaged
     */
    public int processShard(long eventId, int zoneId, int shardIndex, String caller) {
        requireCaller(caller);
        return serializer.call(() -> {
            EventRecord record = requireEvent(eventId);
            if (!record.affects(zoneId)) {
                throw new PreconditionException(EngineErrorType.ZONE_NOT_AFFECTED,
                        "zone " + zoneId + " is not affected by event " + eventId);
            }
            int requiredShards = record.requiredShards(zoneId);
            if (shardIndex < 0 || shardIndex >= requiredShards) {
                throw new PreconditionException(EngineErrorType.SHARD_OUT_OF_RANGE,
                        "zone " + zoneId + " of event " + eventId + " has shards [0, " + requiredShards + ")");
            }
            ShardKey key = new ShardKey(zoneId, shardIndex);
            if (record.getShardProcessed().contains(key)) {
                throw new PreconditionException(EngineErrorType.SHARD_ALREADY_PROCESSED,
                        "shard " + shardIndex + " of zone " + zoneId + " already processed for event " + eventId);
            }
            accumulator.touch();

            int multiplierBps = zoneRegistry.require(zoneId).damageMultiplierBps(record.getEventType());
            int start = shardIndex * record.getShardSize();
            int end = Math.min(start + record.getShardSize(), record.getZoneAgentCounts().get(zoneId));
            end = Math.min(end, zoneDirectory.getZoneAgentCount(zoneId));

            int damaged = 0;
            long damageSum = 0L;
            for (int index = start; index < end; index++) {
                try {
                    long agentId = zoneDirectory.getZoneAgentAt(zoneId, index);
                    damageSum += applyDamage(record, agentId, multiplierBps);
                    damaged++;
                } catch (RuntimeException e) {
                    log.warn("Event damage skipped: eventId={}, zoneId={}, index={}, reason={}",
                            eventId, zoneId, index, e.getMessage(), e);
                }
            }
            record.getShardProcessed().add(key);
            record.setAgentsAffected(record.getAgentsAffected() + damaged);
            record.setTotalDamageBps(record.getTotalDamageBps() + damageSum);

            BigInteger bounty = BigInteger.ZERO;
            if (damaged > 0) {
                bounty = tokenLedger.mint(caller, FixedPointMath.toWei(properties.getPerAgentBountyTokens())
                        .multiply(BigInteger.valueOf(damaged))).net();
            }
            log.info("Event shard processed: eventId={}, zoneId={}, shardIndex={}, agents={}, bounty={}, eventProcessed={}",
                    eventId, zoneId, shardIndex, damaged, bounty, record.isProcessed());
            return damaged;
        });
    }

    public EventVo getEvent(long eventId) {
        return serializer.call(() -> toVo(requireEvent(eventId)));
    }

    public boolean isProcessed(long eventId) {
        return serializer.call(() -> requireEvent(eventId).isProcessed());
    }

    /**
     * Newest first; {@code count} is clamped to [1, recentEventsLimit].
     */
    public List<EventVo> getRecentEvents(int count) {
        int limit = (int) FixedPointMath.clamp(count, 1, properties.getRecentEventsLimit());
        return serializer.call(() -> eventRepository.selectRecent(limit).stream()
                .map(this::toVo)
                .collect(Collectors.toList()));
    }

    /**
     * Trigger block of the latest event, or the genesis block before the first one.
     */
    public long getLastEventBlock() {
        return serializer.call(() -> eventRepository.lastEventBlock().orElse(blockClock.genesisBlock()));
    }

    private int applyDamage(EventRecord record, long agentId, int multiplierBps) {
        Agent agent = agentRepository.selectById(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
        int damage = damageCalculator.effectiveDamageBps(
                record.getBaseDamageBps(),
                multiplierBps,
                defenseGateway.getShelterBps(agentId),
                defenseGateway.getShieldAbsorptionBps(agentId),
                agent.getResilienceBps());
        if (damage > 0) {
            equipmentGateway.applyDurabilityDamage(agentId, damage);
            // damage is already on the equipment; a failed refresh leaves the old hashrate until the next heartbeat
            try {
                capacityService.recompute(agent);
            } catch (RuntimeException e) {
                log.warn("Capacity refresh after event damage failed: eventId={}, agentId={}, damageBps={}, reason={}",
                        record.getId(), agentId, damage, e.getMessage(), e);
            }
        }
        return damage;
    }

    private EventRecord requireEvent(long eventId) {
        return eventRepository.selectById(eventId).orElseThrow(() -> NotFoundException.event(eventId));
    }

    private static void requireCaller(String caller) {
        if (!StringUtils.hasText(caller)) {
            throw new BizException(EngineErrorType.INVALID_ARGUMENT, "caller must not be blank");
        }
    }

    private EventVo toVo(EventRecord record) {
        EventVo vo = new EventVo();
        vo.setEventId(record.getId());
        vo.setEventType(record.getEventType());
        vo.setSeverityTier(record.getSeverityTier());
        vo.setBaseDamageBps(record.getBaseDamageBps());
        vo.setOriginZone(record.getOriginZone());
        vo.setAffectedZonesMask(record.getAffectedZonesMask());
        vo.setAffectedZones(new ArrayList<>(record.getZoneAgentCounts().keySet()));
        vo.setTriggerBlock(record.getTriggerBlock());
        vo.setTriggeredBy(record.getTriggeredBy());
        vo.setStatus(record.getStatus());
        vo.setProcessed(record.isProcessed());
        vo.setRequiredShards(record.requiredShardCount());
        vo.setProcessedShards(record.getShardProcessed().size());
        vo.setAgentsAffected(record.getAgentsAffected());
        vo.setTotalDamageBps(record.getTotalDamageBps());
        return vo;
    }
}
