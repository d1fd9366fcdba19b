package com.slb.chaos_engine.modules.capacity.domain;

/**
 * Intermediate values of one capacity calculation, in stage order.
 */
public record CapacityBreakdown(
        long unitSum,
        long poolAdjusted,
        int dominanceTaxBps,
        long afterTax,
        long pioneerBonus,
        long effectiveHashrate
) {

    public static CapacityBreakdown zero() {
        return new CapacityBreakdown(0L, 0L, 0, 0L, 0L, 0L);
    }
}
