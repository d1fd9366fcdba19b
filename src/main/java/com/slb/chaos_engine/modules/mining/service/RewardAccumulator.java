package com.slb.chaos_engine.modules.mining.service;

import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.agent.entity.Agent;
import com.slb.chaos_engine.modules.emission.service.EmissionScheduler;
import com.slb.chaos_engine.modules.mining.config.MiningProperties;
import com.slb.chaos_engine.modules.mining.entity.AccumulatorState;
import com.slb.chaos_engine.modules.mining.vo.AccumulatorStateVo;
import com.slb.chaos_engine.modules.token.domain.MintReceipt;
import com.slb.chaos_engine.modules.token.enums.BurnSource;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

import static com.slb.chaos_engine.common.util.FixedPointMath.WAD;

/**
 * 收益累加器 / O(1) lazy reward accounting.
 * <p>
 * {@link #touch()} converts the emission of every block since the last update into
 * {@code accRewardPerHash}; an agent's share is {@code (acc - rewardDebt) * hashrate / 1e18}.
 * Every hashrate change goes through {@link #updateHashrate}, which banks what the old hashrate
 * earned and resyncs the debt at the current accumulator value. Divisions truncate; the dust stays
 * in the reserve account.
 */
@Service
@Slf4j
public class RewardAccumulator {

    private final EmissionScheduler emissionScheduler;
    private final TokenLedgerService tokenLedger;
    private final BlockClock blockClock;
    private final LedgerSerializer serializer;
    private final MiningProperties properties;
    private final AccumulatorState state = new AccumulatorState();

    public RewardAccumulator(EmissionScheduler emissionScheduler,
                             TokenLedgerService tokenLedger,
                             BlockClock blockClock,
                             LedgerSerializer serializer,
                             MiningProperties properties) {
        this.emissionScheduler = emissionScheduler;
        this.tokenLedger = tokenLedger;
        this.blockClock = blockClock;
        this.serializer = serializer;
        this.properties = properties;
        this.state.setLastUpdateBlock(blockClock.currentBlock());
    }

    /**
     * Brings the accumulator up to the current block. Permissionless and idempotent: a second call
     * in the same block changes nothing.
     *
     * @return true if the accumulator advanced
     */
    public boolean touch() {
        return serializer.call(() -> {
            long now = blockClock.currentBlock();
            long elapsed = now - state.getLastUpdateBlock();
            if (elapsed <= 0) {
                log.debug("Accumulator already current at block {}", now);
                return false;
            }
            if (state.getTotalEffectiveHashrate() <= 0) {
                // nobody to pay: no mint, the window is skipped
                state.setLastUpdateBlock(now);
                return true;
            }
            BigInteger gross = emissionScheduler.emissionPerBlock().multiply(BigInteger.valueOf(elapsed));
            BigInteger burn = FixedPointMath.applyBps(gross, properties.getBurnOnEarnBps());
            BigInteger net = gross.subtract(burn);

            MintReceipt receipt = tokenLedger.mintNetOfBurn(tokenLedger.getReserveAccount(), net, burn, BurnSource.MINING);
            if (receipt.net().signum() > 0) {
                BigInteger increment = receipt.net().multiply(WAD)
                        .divide(BigInteger.valueOf(state.getTotalEffectiveHashrate()));
                state.setAccRewardPerHash(state.getAccRewardPerHash().add(increment));
                state.setTotalNetEmission(state.getTotalNetEmission().add(receipt.net()));
            }
            state.setLastUpdateBlock(now);
            if (receipt.clamped()) {
                log.warn("Emission clamped by supply cap: blocks={}, requestedNet={}, mintedNet={}", elapsed, net, receipt.net());
            }
            return true;
        });
    }

    /**
     * Moves everything the agent has earned so far into its buffer and resyncs its debt.
     */
    public void settle(Agent agent) {
        serializer.run(() -> {
            touch();
            BigInteger acc = state.getAccRewardPerHash();
            BigInteger earned = earnedSinceDebt(agent, acc);
            if (earned.signum() > 0) {
                agent.setBufferedRewards(agent.getBufferedRewards().add(earned));
            }
            agent.setRewardDebt(acc);
        });
    }

    /**
     * Applies a new effective hashrate. The old hashrate is paid up to this block first, so a
     * change never reaches back into the elapsed window.
     */
    public void updateHashrate(Agent agent, long newHashrate) {
        if (newHashrate < 0) {
            throw new IllegalArgumentException("hashrate must be >= 0");
        }
        serializer.run(() -> {
            settle(agent);
            long previous = agent.getEffectiveHashrate();
            if (previous == newHashrate) {
                return;
            }
            long total = state.getTotalEffectiveHashrate() - previous + newHashrate;
            state.setTotalEffectiveHashrate(Math.max(0L, total));
            agent.setEffectiveHashrate(newHashrate);
            log.info("Hashrate updated: agentId={}, from={}, to={}, networkTotal={}",
                    agent.getId(), previous, newHashrate, state.getTotalEffectiveHashrate());
        });
    }

    /**
     * Settles and empties the agent's claimable rewards.
     */
    public BigInteger harvest(Agent agent) {
        return serializer.call(() -> {
            settle(agent);
            BigInteger amount = agent.getBufferedRewards();
            agent.setBufferedRewards(BigInteger.ZERO);
            return amount;
        });
    }

    /**
     * Starts a new agent at the current accumulator value so it earns nothing retroactively.
     */
    public void enroll(Agent agent) {
        serializer.run(() -> {
            touch();
            agent.setRewardDebt(state.getAccRewardPerHash());
            agent.setEffectiveHashrate(0L);
        });
    }

    /**
     * Claimable rewards as of the current block, without mutating anything.
     */
    public BigInteger pendingRewards(Agent agent) {
        return serializer.call(() -> agent.getBufferedRewards().add(earnedSinceDebt(agent, projectedAccRewardPerHash())));
    }

    /**
     * What {@code accRewardPerHash} would be after a touch at the current block.
     */
    public BigInteger projectedAccRewardPerHash() {
        return serializer.call(() -> {
            long elapsed = blockClock.currentBlock() - state.getLastUpdateBlock();
            if (elapsed <= 0 || state.getTotalEffectiveHashrate() <= 0) {
                return state.getAccRewardPerHash();
            }
            BigInteger gross = emissionScheduler.emissionPerBlock().multiply(BigInteger.valueOf(elapsed));
            BigInteger net = gross.subtract(FixedPointMath.applyBps(gross, properties.getBurnOnEarnBps()));
            net = FixedPointMath.min(net, tokenLedger.remainingSupply());
            return state.getAccRewardPerHash()
                    .add(net.multiply(WAD).divide(BigInteger.valueOf(state.getTotalEffectiveHashrate())));
        });
    }

    public BigInteger getAccRewardPerHash() {
        return state.getAccRewardPerHash();
    }

    public long getTotalEffectiveHashrate() {
        return state.getTotalEffectiveHashrate();
    }

    public long getLastUpdateBlock() {
        return state.getLastUpdateBlock();
    }

    public BigInteger getTotalNetEmission() {
        return state.getTotalNetEmission();
    }

    public AccumulatorStateVo snapshot() {
        return serializer.call(() -> {
            AccumulatorStateVo vo = new AccumulatorStateVo();
            vo.setAccRewardPerHash(state.getAccRewardPerHash());
            vo.setTotalEffectiveHashrate(state.getTotalEffectiveHashrate());
            vo.setLastUpdateBlock(state.getLastUpdateBlock());
            vo.setTotalMinted(tokenLedger.totalMinted());
            vo.setTotalBurned(tokenLedger.totalBurned());
            vo.setTotalNetEmission(state.getTotalNetEmission());
            return vo;
        });
    }

    private static BigInteger earnedSinceDebt(Agent agent, BigInteger acc) {
        if (agent.getEffectiveHashrate() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger delta = acc.subtract(agent.getRewardDebt());
        if (delta.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return delta.multiply(BigInteger.valueOf(agent.getEffectiveHashrate())).divide(WAD);
    }
}
