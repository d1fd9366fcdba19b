package com.slb.chaos_engine.modules.emission.domain;

import java.math.BigInteger;

/**
 * Breakdown of one per-block emission computation. Multipliers use 1e18 precision.
 */
public record EmissionQuote(
        long activeAgentCount,
        int eraIndex,
        long epoch,
        BigInteger targetEmission,
        BigInteger genesisMultiplier,
        BigInteger effectiveModifier,
        BigInteger maxForEpoch,
        BigInteger remainingSupply,
        BigInteger emissionPerBlock
) {
}
