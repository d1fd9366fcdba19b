package com.slb.chaos_engine.modules.vesting.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;

/**
 * Claimed rewards released linearly over {@code durationBlocks}.
 */
@Data
public class VestingEntry implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Long agentId;
    private BigInteger amount;
    private long startBlock;
    private long durationBlocks;
    /** Already released to the operator. */
    private BigInteger claimedSoFar = BigInteger.ZERO;

    public boolean isFullyReleased() {
        return claimedSoFar.compareTo(amount) >= 0;
    }
}
