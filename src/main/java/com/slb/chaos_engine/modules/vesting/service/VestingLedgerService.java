package com.slb.chaos_engine.modules.vesting.service;

import com.slb.chaos_engine.common.exception.EngineErrorType;
import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.common.exception.PreconditionException;
import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.token.enums.BurnSource;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import com.slb.chaos_engine.modules.vesting.config.VestingProperties;
import com.slb.chaos_engine.modules.vesting.entity.VestingEntry;
import com.slb.chaos_engine.modules.vesting.repository.VestingRepository;
import com.slb.chaos_engine.modules.vesting.vo.VestingEntryVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 归属账本服务 / Holds claimed rewards and releases them linearly to the agent's operator.
 * Tokens stay in the reserve account until released.
 */
@Service
@Slf4j
public class VestingLedgerService {

    private final VestingRepository vestingRepository;
    private final AgentRepository agentRepository;
    private final TokenLedgerService tokenLedger;
    private final BlockClock blockClock;
    private final LedgerSerializer serializer;
    private final VestingProperties properties;

    public VestingLedgerService(VestingRepository vestingRepository,
                                AgentRepository agentRepository,
                                TokenLedgerService tokenLedger,
                                BlockClock blockClock,
                                LedgerSerializer serializer,
                                VestingProperties properties) {
        this.vestingRepository = vestingRepository;
        this.agentRepository = agentRepository;
        this.tokenLedger = tokenLedger;
        this.blockClock = blockClock;
        this.serializer = serializer;
        this.properties = properties;
    }

    /**
     * Locks a freshly claimed amount, starting now.
     */
    public VestingEntry open(Agent agent, BigInteger amount) {
        return serializer.call(() -> {
            VestingEntry entry = new VestingEntry();
            entry.setAgentId(agent.getId());
            entry.setAmount(amount);
            entry.setStartBlock(blockClock.currentBlock());
            entry.setDurationBlocks(properties.getDurationBlocks());
            vestingRepository.insert(entry);
            agent.getVestingEntryIds().add(entry.getId());
            return entry;
        });
    }

    /**
     * {@code amount * min(1, (currentBlock - startBlock) / durationBlocks)}, including what was
     * already released.
     */
    public BigInteger availableToWithdraw(long entryId) {
        return serializer.call(() -> vestedAmount(requireEntry(entryId), blockClock.currentBlock()));
    }

    /**
     * Releases everything vested but not yet released.
     *
     * @return amount transferred to the operator
     */
    public BigInteger withdraw(long entryId) {
        return serializer.call(() -> {
            VestingEntry entry = requireEntry(entryId);
            BigInteger releasable = vestedAmount(entry, blockClock.currentBlock()).subtract(entry.getClaimedSoFar());
            if (releasable.signum() <= 0) {
                throw new PreconditionException(EngineErrorType.NOTHING_TO_WITHDRAW,
                        "vesting entry " + entryId + " has nothing new to release");
            }
            Agent agent = requireOwner(entry);
            tokenLedger.transfer(tokenLedger.getReserveAccount(), agent.getOperator(), releasable);
            entry.setClaimedSoFar(entry.getClaimedSoFar().add(releasable));
            log.info("Vesting released: entryId={}, agentId={}, amount={}", entryId, agent.getId(), releasable);
            consumeIfDone(entry, agent);
            return releasable;
        });
    }

    /**
     * Releases the whole remainder immediately, burning the early-claim penalty on it.
     *
     * @return amount transferred to the operator after the penalty
     */
    public BigInteger claimEarly(long entryId) {
        return serializer.call(() -> {
            VestingEntry entry = requireEntry(entryId);
            Agent agent = requireOwner(entry);
            BigInteger remainder = entry.getAmount().subtract(entry.getClaimedSoFar());
            BigInteger penalty = FixedPointMath.applyBps(remainder, properties.getEarlyClaimPenaltyBps());
            BigInteger payout = remainder.subtract(penalty);

            String reserve = tokenLedger.getReserveAccount();
            tokenLedger.burnFrom(reserve, penalty, BurnSource.EARLY_CLAIM);
            tokenLedger.transfer(reserve, agent.getOperator(), payout);
            entry.setClaimedSoFar(entry.getAmount());
            log.info("Vesting claimed early: entryId={}, agentId={}, payout={}, penalty={}", entryId, agent.getId(), payout, penalty);
            consumeIfDone(entry, agent);
            return payout;
        });
    }

    public List<VestingEntryVo> listEntries(long agentId) {
        return serializer.call(() -> vestingRepository.selectByAgentId(agentId).stream()
                .map(this::toVo)
                .collect(Collectors.toList()));
    }

    public VestingEntryVo getEntry(long entryId) {
        return serializer.call(() -> toVo(requireEntry(entryId)));
    }

    /**
     * Amount still locked in vesting for one agent.
     */
    public BigInteger lockedBalance(long agentId) {
        return serializer.call(() -> vestingRepository.selectByAgentId(agentId).stream()
                .map(e -> e.getAmount().subtract(e.getClaimedSoFar()))
                .reduce(BigInteger.ZERO, BigInteger::add));
    }

    BigInteger vestedAmount(VestingEntry entry, long currentBlock) {
        long elapsed = Math.max(0L, currentBlock - entry.getStartBlock());
        if (elapsed >= entry.getDurationBlocks()) {
            return entry.getAmount();
        }
        return FixedPointMath.mulDiv(entry.getAmount(), BigInteger.valueOf(elapsed), BigInteger.valueOf(entry.getDurationBlocks()));
    }

    private void consumeIfDone(VestingEntry entry, Agent agent) {
        if (entry.isFullyReleased()) {
            vestingRepository.deleteById(entry.getId());
            agent.getVestingEntryIds().remove(entry.getId());
        }
    }

    private VestingEntry requireEntry(long entryId) {
        return vestingRepository.selectById(entryId).orElseThrow(() -> NotFoundException.vestingEntry(entryId));
    }

    private Agent requireOwner(VestingEntry entry) {
        return agentRepository.selectById(entry.getAgentId()).orElseThrow(() -> NotFoundException.agent(entry.getAgentId()));
    }

    private VestingEntryVo toVo(VestingEntry entry) {
        VestingEntryVo vo = new VestingEntryVo();
        vo.setEntryId(entry.getId());
        vo.setAgentId(entry.getAgentId());
        vo.setAmount(entry.getAmount());
        vo.setAvailableToWithdraw(vestedAmount(entry, blockClock.currentBlock()));
        vo.setClaimedSoFar(entry.getClaimedSoFar());
        vo.setStartBlock(entry.getStartBlock());
        vo.setDurationBlocks(entry.getDurationBlocks());
        return vo;
    }
}
