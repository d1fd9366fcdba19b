package com.slb.chaos_engine.modules.agent.service;

import com.slb.chaos_engine.common.exception.BizException;
import com.slb.chaos_engine.common.exception.EngineErrorType;
import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.common.exception.PreconditionException;
import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.modules.agent.config.AgentProperties;
import com.slb.chaos_engine.modules.agent.domain.AgentRegisteredEvent;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.capacity.service.CapacityService;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.mining.service.RewardAccumulator;
import com.slb.chaos_engine.modules.world.service.ZoneRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 代理注册与存活服务 / Agent lifecycle: registration, heartbeat liveness and silence deactivation.
 */
@Service
@Slf4j
public class AgentRegistryService {

    private final AgentRepository agentRepository;
    private final RewardAccumulator accumulator;
    private final CapacityService capacityService;
    private final EraPhaseService eraPhaseService;
    private final ZoneRegistry zoneRegistry;
    private final BlockClock blockClock;
    private final LedgerSerializer serializer;
    private final AgentProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    public AgentRegistryService(AgentRepository agentRepository,
                                RewardAccumulator accumulator,
                                CapacityService capacityService,
                                EraPhaseService eraPhaseService,
                                ZoneRegistry zoneRegistry,
                                BlockClock blockClock,
                                LedgerSerializer serializer,
                                AgentProperties properties,
                                ApplicationEventPublisher eventPublisher) {
        this.agentRepository = agentRepository;
        this.accumulator = accumulator;
        this.capacityService = capacityService;
        this.eraPhaseService = eraPhaseService;
        this.zoneRegistry = zoneRegistry;
        this.blockClock = blockClock;
        this.serializer = serializer;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Registers a new agent. The pioneer phase is fixed from the population at this moment.
     *
     * @return the new agent id
     */
    public long register(String operator, int zone, int resilienceBps) {
        if (!StringUtils.hasText(operator)) {
            throw new BizException(EngineErrorType.INVALID_ARGUMENT, "operator must not be blank");
        }
        if (resilienceBps < 0 || resilienceBps > properties.getMaxResilienceBps()) {
            throw new BizException(EngineErrorType.INVALID_ARGUMENT,
                    "resilienceBps must be within [0, " + properties.getMaxResilienceBps() + "]");
        }
        return serializer.call(() -> {
            if (!zoneRegistry.exists(zone)) {
                throw new PreconditionException(EngineErrorType.ZONE_NOT_FOUND, "zone " + zone + " is not configured");
            }
            if (agentRepository.selectByOperator(operator).isPresent()) {
                throw new PreconditionException(EngineErrorType.OPERATOR_ALREADY_REGISTERED,
                        "operator " + operator + " already owns an agent");
            }
            long now = blockClock.currentBlock();
            Agent agent = new Agent();
            agent.setOperator(operator);
            agent.setZone(zone);
            agent.setResilienceBps(resilienceBps);
            agent.setPioneerPhase(eraPhaseService.phaseFor(agentRepository.countActive()));
            agent.setRegistrationBlock(now);
            agent.setLastTouchBlock(now);
            agent.setActive(true);
            accumulator.enroll(agent);
            agentRepository.insert(agent);
            log.info("Agent registered: agentId={}, operator={}, zone={}, pioneerPhase={}",
                    agent.getId(), operator, zone, agent.getPioneerPhase());

            eventPublisher.publishEvent(new AgentRegisteredEvent(agent.getId(), operator, zone, now));
            capacityService.recompute(agent);
            return agent.getId();
        });
    }

    /**
     * Proves liveness, refreshes capacity and reactivates a silenced agent.
     */
    public long heartbeat(long agentId) {
        return serializer.call(() -> {
            Agent agent = requireAgent(agentId);
            accumulator.touch();
            agent.setLastTouchBlock(blockClock.currentBlock());
            if (!agent.isActive()) {
                agentRepository.markActive(agent, true);
                log.info("Agent reactivated: agentId={}", agentId);
            }
            return capacityService.recompute(agent);
        });
    }

    /**
     * Permissionless: deactivates an agent whose last heartbeat or claim is older than the silence
     * window. Its earnings so far stay claimable.
     *
     * @return true if the agent was deactivated by this call
     */
    public boolean deactivateIfSilent(long agentId) {
        return serializer.call(() -> {
            Agent agent = requireAgent(agentId);
            if (!agent.isActive()) {
                return false;
            }
            long silentFor = blockClock.currentBlock() - agent.getLastTouchBlock();
            if (silentFor <= properties.getSilenceWindowBlocks()) {
                return false;
            }
            // the silent window is paid at the population it was mined under
            accumulator.settle(agent);
            agentRepository.markActive(agent, false);
            accumulator.updateHashrate(agent, 0L);
            log.info("Agent deactivated after silence: agentId={}, silentBlocks={}", agentId, silentFor);
            return true;
        });
    }

    public Agent requireAgent(long agentId) {
        return agentRepository.selectById(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
    }

    public long activeAgentCount() {
        return agentRepository.countActive();
    }

    public int currentPhase() {
        return eraPhaseService.phaseFor(agentRepository.countActive());
    }
}
