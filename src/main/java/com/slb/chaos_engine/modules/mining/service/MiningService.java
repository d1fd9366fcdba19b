package com.slb.chaos_engine.modules.mining.service;

import com.slb.chaos_engine.common.exception.EngineErrorType;
import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.common.exception.PreconditionException;
import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.modules.agent.config.AgentProperties;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.mining.vo.PendingRewardsVo;
import com.slb.chaos_engine.modules.vesting.entity.VestingEntry;
import com.slb.chaos_engine.modules.vesting.service.VestingLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * 收益领取服务 / Reward claims. A claim moves the agent's accrued rewards into a new vesting entry.
 */
@Service
@Slf4j
public class MiningService {

    private final AgentRepository agentRepository;
    private final RewardAccumulator accumulator;
    private final VestingLedgerService vestingLedger;
    private final BlockClock blockClock;
    private final LedgerSerializer serializer;
    private final AgentProperties agentProperties;

    public MiningService(AgentRepository agentRepository,
                         RewardAccumulator accumulator,
                         VestingLedgerService vestingLedger,
                         BlockClock blockClock,
                         LedgerSerializer serializer,
                         AgentProperties agentProperties) {
        this.agentRepository = agentRepository;
        this.accumulator = accumulator;
        this.vestingLedger = vestingLedger;
        this.blockClock = blockClock;
        this.serializer = serializer;
        this.agentProperties = agentProperties;
    }

    /**
     * Claims everything the agent has earned up to the current block.
     *
     * @return the claimed amount, 0 if nothing had accrued (no vesting entry is opened then)
     */
    public BigInteger claim(long agentId) {
        return serializer.call(() -> {
            Agent agent = requireAgent(agentId);
            long now = blockClock.currentBlock();
            long sinceRegistration = now - agent.getRegistrationBlock();
            if (sinceRegistration < agentProperties.getFirstMineDelayBlocks()) {
                throw new PreconditionException(EngineErrorType.FIRST_MINE_DELAY,
                        "agent " + agentId + " can claim in " + (agentProperties.getFirstMineDelayBlocks() - sinceRegistration) + " blocks");
            }
            BigInteger amount = accumulator.harvest(agent);
            agent.setLastTouchBlock(now);
            if (amount.signum() == 0) {
                return BigInteger.ZERO;
            }
            VestingEntry entry = vestingLedger.open(agent, amount);
            agent.setTotalClaimed(agent.getTotalClaimed().add(amount));
            log.info("Rewards claimed: agentId={}, amount={}, vestingEntryId={}", agentId, amount, entry.getId());
            return amount;
        });
    }

    public BigInteger getPendingRewards(long agentId) {
        return serializer.call(() -> accumulator.pendingRewards(requireAgent(agentId)));
    }

    public PendingRewardsVo getPendingRewardsView(long agentId) {
        return serializer.call(() -> {
            Agent agent = requireAgent(agentId);
            PendingRewardsVo vo = new PendingRewardsVo();
            vo.setAgentId(agentId);
            vo.setPendingRewards(accumulator.pendingRewards(agent));
            vo.setTotalClaimed(agent.getTotalClaimed());
            vo.setLockedInVesting(vestingLedger.lockedBalance(agentId));
            vo.setEffectiveHashrate(agent.getEffectiveHashrate());
            vo.setClaimableFromBlock(agent.getRegistrationBlock() + agentProperties.getFirstMineDelayBlocks());
            return vo;
        });
    }

    private Agent requireAgent(long agentId) {
        return agentRepository.selectById(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
    }
}
