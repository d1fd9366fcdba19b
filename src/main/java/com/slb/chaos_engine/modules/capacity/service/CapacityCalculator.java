package com.slb.chaos_engine.modules.capacity.service;

import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.capacity.config.CapacityProperties;
import com.slb.chaos_engine.modules.capacity.domain.CapacityBreakdown;
import com.slb.chaos_engine.modules.capacity.domain.CapacityInput;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.domain.PoolMembership;
import com.slb.chaos_engine.modules.world.domain.ZoneConfig;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.slb.chaos_engine.common.util.FixedPointMath.BPS_DENOMINATOR;

/**
 * 有效算力计算器 / Effective hashrate as a pure function of equipment, zone, era, pool and pioneer phase.
 * <p>
 * Stages, in order: per-unit quirk and zone synergy (each unit clamped to [0, 10x base]), pool
 * bonus with share decay and penalty, dominance tax, pioneer bonus. Every stage clamps at zero.
 * Shares are taken against the other agents' hashrate plus this agent's own. A network total of
 * zero means no tax and no decay.
 */
@Component
public class CapacityCalculator {

    private final CapacityProperties properties;
    private final Map<Integer, CapacityProperties.Quirk> quirksById = new HashMap<>();

    public CapacityCalculator(CapacityProperties properties) {
        this.properties = properties;
        if (properties.getQuirks() != null) {
            for (CapacityProperties.Quirk quirk : properties.getQuirks()) {
                quirksById.put(quirk.getId(), quirk);
            }
        }
    }

    public long compute(CapacityInput input) {
        return breakdown(input).effectiveHashrate();
    }

    public CapacityBreakdown breakdown(CapacityInput input) {
        List<EquipmentUnit> units = input.units();
        if (units == null || units.isEmpty()) {
            return CapacityBreakdown.zero();
        }
        long unitSum = 0L;
        for (EquipmentUnit unit : units) {
            unitSum = Math.addExact(unitSum, unitContribution(unit, input.zone(), input.era()));
        }

        long others = Math.max(0L, input.othersHashrate());
        long poolAdjusted = applyPool(unitSum, input.pool().orElse(null), others + unitSum);

        int taxBps = dominanceTaxBps(shareBps(poolAdjusted, others + poolAdjusted));
        long afterTax = Math.max(0L, poolAdjusted - FixedPointMath.applyBps(poolAdjusted, taxBps));

        long pioneerBonus = FixedPointMath.applyBps(unitSum, pioneerBonusBps(input.pioneerPhase()));
        long effective = Math.max(0L, Math.addExact(afterTax, pioneerBonus));
        return new CapacityBreakdown(unitSum, poolAdjusted, taxBps, afterTax, pioneerBonus, effective);
    }

    long unitContribution(EquipmentUnit unit, ZoneConfig zone, EraConfig era) {
        long base = Math.max(0L, unit.baseCapacity());
        if (base == 0L) {
            return 0L;
        }
        long value = FixedPointMath.applyBps(base, quirkMultiplierBps(unit.quirkId(), era));
        value = FixedPointMath.applyBps(value, zoneSynergyBps(unit.quirkId(), zone));
        value = FixedPointMath.applyBps(value, FixedPointMath.clamp(unit.durabilityRatioBps(), 0, BPS_DENOMINATOR));
        long cap = Math.multiplyExact(base, (long) properties.getUnitCapMultiple());
        return FixedPointMath.clamp(value, 0L, cap);
    }

    int quirkMultiplierBps(int quirkId, EraConfig era) {
        CapacityProperties.Quirk quirk = quirksById.get(quirkId);
        int raw = BPS_DENOMINATOR;
        if (quirk != null && quirk.getEraMultiplierBps() != null && !quirk.getEraMultiplierBps().isEmpty()) {
            List<Integer> byEra = quirk.getEraMultiplierBps();
            raw = byEra.get(Math.min(era.index(), byEra.size() - 1));
        }
        return (int) FixedPointMath.clamp(raw, properties.getQuirkMinBps(), properties.getQuirkMaxBps());
    }

    int zoneSynergyBps(int quirkId, ZoneConfig zone) {
        long raw = BPS_DENOMINATOR + (long) zone.miningModifierBps();
        CapacityProperties.Quirk quirk = quirksById.get(quirkId);
        if (quirk != null && quirk.getAffinityZone() == zone.zoneId()) {
            raw += quirk.getAffinityBps();
        }
        return (int) FixedPointMath.clamp(raw, properties.getSynergyMinBps(), properties.getSynergyMaxBps());
    }

    long applyPool(long unitSum, PoolMembership pool, long networkHashrate) {
        if (pool == null || unitSum == 0L) {
            return unitSum;
        }
        CapacityProperties.Pool rules = properties.getPool();
        long bonusBps = rules.getBaseBonusBps();
        if (pool.homogeneous()) {
            bonusBps += rules.getHomogeneousBonusBps();
        }
        if (pool.tenureBlocks() >= rules.getLoyaltyTenureBlocks()) {
            bonusBps += rules.getLoyaltyBonusBps();
        }
        int poolShare = shareBps(pool.poolHashrate(), networkHashrate);
        long effectiveBonusBps = bonusBps * poolBonusRetentionBps(poolShare) / BPS_DENOMINATOR;
        long adjusted = unitSum
                + FixedPointMath.applyBps(unitSum, effectiveBonusBps)
                - FixedPointMath.applyBps(unitSum, poolPenaltyBps(poolShare));
        return Math.max(0L, adjusted);
    }

    /**
     * Fraction of the pool bonus kept: 100% up to the decay start, linearly down to 0% at the decay end.
     */
    public int poolBonusRetentionBps(int poolShareBps) {
        CapacityProperties.Pool rules = properties.getPool();
        return (int) FixedPointMath.interpolate(poolShareBps,
                rules.getDecayStartShareBps(), rules.getDecayEndShareBps(), BPS_DENOMINATOR, 0);
    }

    /**
     * Penalty for pools above the decay end, growing linearly to the maximum.
     */
    public int poolPenaltyBps(int poolShareBps) {
        CapacityProperties.Pool rules = properties.getPool();
        return (int) FixedPointMath.interpolate(poolShareBps,
                rules.getDecayEndShareBps(), rules.getPenaltyEndShareBps(), 0, rules.getMaxPenaltyBps());
    }

    /**
     * Linear from 0 at the start share to the maximum at the end share, capped beyond.
     */
    public int dominanceTaxBps(int personalShareBps) {
        CapacityProperties.Dominance rules = properties.getDominance();
        return (int) FixedPointMath.interpolate(personalShareBps,
                rules.getTaxStartShareBps(), rules.getTaxEndShareBps(), 0, rules.getMaxTaxBps());
    }

    public int pioneerBonusBps(int pioneerPhase) {
        List<Integer> byPhase = properties.getPioneerBonusBps();
        int index = pioneerPhase - 1;
        if (byPhase == null || index < 0 || index >= byPhase.size()) {
            return 0;
        }
        return Math.max(0, byPhase.get(index));
    }

    /**
     * Share of {@code part} in {@code total} in bps, 0 when the total is 0, at most 100%.
     */
    static int shareBps(long part, long total) {
        if (total <= 0L || part <= 0L) {
            return 0;
        }
        long share = FixedPointMath.mulDiv(BigInteger.valueOf(part), FixedPointMath.BPS, BigInteger.valueOf(total)).longValue();
        return (int) Math.min(BPS_DENOMINATOR, share);
    }
}
