package com.slb.chaos_engine.modules.agent.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered mining agent. Never deleted; silence only flips {@code active}.
 */
@Data
public class Agent implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    /** Account that receives released rewards. One agent per operator. */
    private String operator;
    private int zone;
    /** Cosmic resilience, reduces event damage. */
    private int resilienceBps;
    /** Population phase at registration; fixes the pioneer bonus for life. */
    private int pioneerPhase;
    private long registrationBlock;
    /** Last heartbeat or claim. */
    private long lastTouchBlock;
    private boolean active;

    /** Cached result of the capacity calculator; 0 while inactive. */
    private long effectiveHashrate;
    /** Accumulator value at the last settlement. */
    private BigInteger rewardDebt = BigInteger.ZERO;
    /** Rewards settled on a hashrate change but not yet claimed. */
    private BigInteger bufferedRewards = BigInteger.ZERO;
    private BigInteger totalClaimed = BigInteger.ZERO;
    private List<Long> vestingEntryIds = new ArrayList<>();
}
