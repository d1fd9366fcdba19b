package com.slb.chaos_engine.modules.capacity.service;

import com.slb.chaos_engine.modules.capacity.config.CapacityProperties;
import com.slb.chaos_engine.modules.capacity.domain.CapacityBreakdown;
import com.slb.chaos_engine.modules.capacity.domain.CapacityInput;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.domain.PoolMembership;
import com.slb.chaos_engine.modules.world.domain.ZoneConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CapacityCalculatorTest {

    private static final ZoneConfig NEUTRAL_ZONE = new ZoneConfig(2, "The Dark Forest", 0, Map.of());
    private static final ZoneConfig SOLAR_FLATS = new ZoneConfig(0, "The Solar Flats", 1_000, Map.of());
    private static final EraConfig GENESIS = new EraConfig(0, "Genesis", 0L, 2_000_000L, 15_000, 1, 50_000L);
    private static final EraConfig TURBULENCE = new EraConfig(2, "Turbulence", 7_000_000L, 17_000_000L, 10_000, 3, 20_000L);
    private static final int LATE_PHASE = 4;

    private final CapacityProperties properties = new CapacityProperties();
    private final CapacityCalculator calculator = new CapacityCalculator(properties);

    @Test
    void dominanceTax_isZeroAtOnePercentAndHalfAtFivePercent() {
        assertThat(calculator.dominanceTaxBps(0)).isZero();
        assertThat(calculator.dominanceTaxBps(100)).isZero();
        assertThat(calculator.dominanceTaxBps(300)).isEqualTo(2_500);
        assertThat(calculator.dominanceTaxBps(500)).isEqualTo(5_000);
        assertThat(calculator.dominanceTaxBps(10_000)).isEqualTo(5_000);
    }

    @Test
    void breakdown_smallShare_paysNoTax() {
        CapacityBreakdown result = calculator.breakdown(input(List.of(unit(1_000)), 100_000L));

        assertThat(result.dominanceTaxBps()).isZero();
        assertThat(result.effectiveHashrate()).isEqualTo(1_000L);
    }

    @Test
    void breakdown_fivePercentShare_isHalved() {
        // 1000 of 20000 including itself
        CapacityBreakdown result = calculator.breakdown(input(List.of(unit(1_000)), 19_000L));

        assertThat(result.dominanceTaxBps()).isEqualTo(5_000);
        assertThat(result.effectiveHashrate()).isEqualTo(500L);
    }

    @Test
    void breakdown_soleAgent_ownsTheWholeNetwork() {
        CapacityBreakdown result = calculator.breakdown(input(List.of(unit(1_000)), 0L));

        assertThat(result.dominanceTaxBps()).isEqualTo(5_000);
        assertThat(calculator.compute(input(List.of(unit(1_000)), 0L))).isEqualTo(500L);
    }

    @Test
    void breakdown_zeroCapacityUnits_skipTaxAndDecay() {
        EquipmentUnit broken = new EquipmentUnit(1_000, 0, 0);
        CapacityInput pooled = new CapacityInput(List.of(broken), NEUTRAL_ZONE, TURBULENCE,
                Optional.of(new PoolMembership(1L, 0L, true, 0L)), LATE_PHASE, 0L);

        CapacityBreakdown result = calculator.breakdown(pooled);

        assertThat(result.dominanceTaxBps()).isZero();
        assertThat(result.effectiveHashrate()).isZero();
    }

    @Test
    void breakdown_noUnits_isZero() {
        assertThat(calculator.compute(input(List.of(), 100L))).isZero();
        assertThat(calculator.breakdown(input(List.of(), 0L))).isEqualTo(CapacityBreakdown.zero());
    }

    @Test
    void unitContribution_scalesByDurability() {
        EquipmentUnit worn = new EquipmentUnit(1_000, 0, 5_000);

        assertThat(calculator.unitContribution(worn, NEUTRAL_ZONE, TURBULENCE)).isEqualTo(500L);
    }

    @Test
    void unitContribution_appliesQuirkAndZoneSynergy() {
        // overclocked in genesis: 1.5x, Solar Flats +10%
        EquipmentUnit overclocked = new EquipmentUnit(1_000, 1, 10_000);

        assertThat(calculator.unitContribution(overclocked, SOLAR_FLATS, GENESIS)).isEqualTo(1_650L);
    }

    @Test
    void unitContribution_neverExceedsCapMultiple() {
        properties.setUnitCapMultiple(1);
        EquipmentUnit overclocked = new EquipmentUnit(1_000, 1, 10_000);

        assertThat(calculator.unitContribution(overclocked, SOLAR_FLATS, GENESIS)).isEqualTo(1_000L);
    }

    @Test
    void quirkMultiplier_reusesLastEraValueAndIsClamped() {
        properties.getQuirks().get(2).setEraMultiplierBps(List.of(1_000, 90_000));
        CapacityCalculator custom = new CapacityCalculator(properties);

        assertThat(custom.quirkMultiplierBps(3, GENESIS)).isEqualTo(5_000);
        assertThat(custom.quirkMultiplierBps(3, TURBULENCE)).isEqualTo(20_000);
        assertThat(custom.quirkMultiplierBps(99, TURBULENCE)).isEqualTo(10_000);
    }

    @Test
    void poolPenalty_growsLinearlyFromThirtyToFiftyPercentAndCaps() {
        assertThat(calculator.poolPenaltyBps(2_000)).isZero();
        assertThat(calculator.poolPenaltyBps(3_000)).isZero();
        assertThat(calculator.poolPenaltyBps(4_000)).isEqualTo(1_000);
        assertThat(calculator.poolPenaltyBps(5_000)).isEqualTo(2_000);
        assertThat(calculator.poolPenaltyBps(9_000)).isEqualTo(2_000);
    }

    @Test
    void poolBonus_decaysWithPoolShare() {
        assertThat(calculator.poolBonusRetentionBps(1_000)).isEqualTo(10_000);
        assertThat(calculator.poolBonusRetentionBps(2_250)).isEqualTo(5_000);
        assertThat(calculator.poolBonusRetentionBps(3_000)).isZero();
    }

    @Test
    void applyPool_smallHomogeneousLoyalPool_getsFullBonus() {
        PoolMembership pool = new PoolMembership(1L, 5_000L, true, 600_000L);

        // 10% + 5% + 3%
        assertThat(calculator.applyPool(1_000L, pool, 1_000_000L)).isEqualTo(1_180L);
    }

    @Test
    void applyPool_dominantPool_isPenalised() {
        PoolMembership pool = new PoolMembership(1L, 400_000L, false, 0L);

        assertThat(calculator.applyPool(1_000L, pool, 1_000_000L)).isEqualTo(900L);
    }

    @Test
    void pioneerBonus_isAddedAfterTaxOnTheRawUnitSum() {
        CapacityInput pioneer = new CapacityInput(List.of(unit(1_000)), NEUTRAL_ZONE, TURBULENCE,
                Optional.empty(), 1, 19_000L);

        CapacityBreakdown result = calculator.breakdown(pioneer);

        assertThat(result.afterTax()).isEqualTo(500L);
        assertThat(result.pioneerBonus()).isEqualTo(200L);
        assertThat(result.effectiveHashrate()).isEqualTo(700L);
        assertThat(calculator.pioneerBonusBps(9)).isZero();
    }

    @Test
    void shareBps_zeroTotal_isZero() {
        assertThat(CapacityCalculator.shareBps(5L, 0L)).isZero();
        assertThat(CapacityCalculator.shareBps(5L, 1L)).isEqualTo(10_000);
    }

    private static EquipmentUnit unit(long capacity) {
        return new EquipmentUnit(capacity, 0, 10_000);
    }

    private static CapacityInput input(List<EquipmentUnit> units, long network) {
        return new CapacityInput(units, NEUTRAL_ZONE, TURBULENCE, Optional.empty(), LATE_PHASE, network);
    }
}
