package com.slb.chaos_engine.modules.event.service;

import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.event.config.EventProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DamageCalculatorTest {

    private final DamageCalculator calculator = new DamageCalculator(new EventProperties());

    @Test
    void baseDamageBps_followsTierTable() {
        assertThat(calculator.baseDamageBps(1)).isEqualTo(500);
        assertThat(calculator.baseDamageBps(3)).isEqualTo(2_000);
        assertThat(calculator.baseDamageBps(5)).isEqualTo(5_000);
        assertThat(calculator.baseDamageBps(9)).isEqualTo(5_000);
    }

    @Test
    void effectiveDamage_undefended_isBaseTimesZoneMultiplier() {
        assertThat(calculator.effectiveDamageBps(2_000, 15_000, 0, 0, 0)).isEqualTo(3_000);
    }

    @Test
    void effectiveDamage_combinedDefense_isCappedAtNinetyPercent() {
        assertThat(calculator.effectiveDamageBps(5_000, 10_000, 6_000, 6_000, 0)).isEqualTo(500);
        assertThat(calculator.effectiveDamageBps(5_000, 10_000, 10_000, 10_000, 0)).isEqualTo(500);
    }

    @Test
    void effectiveDamage_resilienceAppliesAfterDefense() {
        assertThat(calculator.effectiveDamageBps(5_000, 10_000, 4_000, 0, 5_000)).isEqualTo(1_500);
    }

    @Test
    void effectiveDamage_neverExceedsFullDurability() {
        assertThat(calculator.effectiveDamageBps(5_000, 30_000, 0, 0, 0)).isEqualTo(10_000);
    }

    @Test
    void effectiveDamage_staysBetweenTenPercentFloorAndUndefendedDamage() {
        int[] bases = {500, 1_000, 2_000, 3_500, 5_000};
        int[] multipliers = {5_000, 10_000, 12_500, 20_000};
        for (int base : bases) {
            for (int multiplier : multipliers) {
                long undefended = FixedPointMath.applyBps(base, multiplier);
                long floor = FixedPointMath.applyBps(undefended, 1_000);
                for (int shelter = 0; shelter <= 10_000; shelter += 1_250) {
                    for (int shield = 0; shield <= 10_000; shield += 2_500) {
                        int damage = calculator.effectiveDamageBps(base, multiplier, shelter, shield, 0);
                        assertThat((long) damage).isBetween(floor, undefended);
                        for (int resilience = 1_000; resilience <= 5_000; resilience += 1_000) {
                            assertThat(calculator.effectiveDamageBps(base, multiplier, shelter, shield, resilience))
                                    .isLessThanOrEqualTo(damage);
                        }
                    }
                }
            }
        }
    }
}
