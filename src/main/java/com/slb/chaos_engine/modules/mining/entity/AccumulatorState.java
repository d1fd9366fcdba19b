package com.slb.chaos_engine.modules.mining.entity;

import lombok.Data;

import java.math.BigInteger;

/**
 * Global reward accumulator. Singleton, only mutated by {@code RewardAccumulator}.
 */
@Data
public class AccumulatorState {

    /** Reward per unit of hashrate since genesis, scaled by 1e18. Never decreases. */
    private BigInteger accRewardPerHash = BigInteger.ZERO;
    private long totalEffectiveHashrate;
    private long lastUpdateBlock;
    /** Net emission minted into the reserve for miners. */
    private BigInteger totalNetEmission = BigInteger.ZERO;
}
