package com.slb.chaos_engine.modules.event.service;

import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.event.config.EventProperties;
import org.springframework.stereotype.Component;

import static com.slb.chaos_engine.common.util.FixedPointMath.BPS_DENOMINATOR;

/**
 * {@code base * zoneMultiplier * (1 - min(shelter + shield, cap)) * (1 - resilience)}, all in bps,
 * truncated at each step and capped at full durability.
 */
@Component
public class DamageCalculator {

    private final EventProperties properties;

    public DamageCalculator(EventProperties properties) {
        this.properties = properties;
    }

    public int baseDamageBps(int tier) {
        int index = (int) FixedPointMath.clamp(tier - 1L, 0, properties.getTierBaseDamageBps().size() - 1L);
        return properties.getTierBaseDamageBps().get(index);
    }

    public int effectiveDamageBps(int baseDamageBps, int zoneMultiplierBps, int shelterBps, int shieldAbsorptionBps, int resilienceBps) {
        long defense = FixedPointMath.clamp((long) shelterBps + shieldAbsorptionBps, 0, properties.getMaxDefenseReductionBps());
        long resilience = FixedPointMath.clamp(resilienceBps, 0, BPS_DENOMINATOR);

        long damage = FixedPointMath.applyBps(baseDamageBps, Math.max(0, zoneMultiplierBps));
        damage = FixedPointMath.applyBps(damage, BPS_DENOMINATOR - defense);
        damage = FixedPointMath.applyBps(damage, BPS_DENOMINATOR - resilience);
        return (int) Math.min(damage, BPS_DENOMINATOR);
    }
}
