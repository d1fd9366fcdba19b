package com.slb.chaos_engine.modules.token.enums;

/**
 * Why tokens left circulation. Ordinals follow the burner's source ids.
 */
public enum BurnSource {
    MINING,           // burn-on-earn share of every emission
    RIG_PURCHASE,
    FACILITY_UPGRADE,
    RIG_REPAIR,
    SHIELD_PURCHASE,
    EARLY_CLAIM,      // vesting penalty
    ZONE_MIGRATION
}
