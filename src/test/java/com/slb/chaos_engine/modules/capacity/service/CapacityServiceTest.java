package com.slb.chaos_engine.modules.capacity.service;

import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.modules.capacity.domain.CapacityBreakdown;
import com.slb.chaos_engine.modules.world.domain.PoolMembership;
import com.slb.chaos_engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapacityServiceTest {

    private EngineFixture fixture;
    private CapacityService capacityService;
    private long agentId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture().singleZone();
        // isolate the pool stage: no dominance tax, no pioneer bonus
        fixture.capacityProperties.getDominance().setMaxTaxBps(0);
        fixture.capacityProperties.setPioneerBonusBps(List.of());
        fixture.build();
        capacityService = fixture.capacityService;
        agentId = fixture.registerWithRig("alice", 0, 1_000L);
    }

    @Test
    void recompute_appliesHashrateToAccumulator() {
        assertThat(capacityService.getEffectiveHashrate(agentId)).isEqualTo(1_000L);
        assertThat(fixture.accumulator.getTotalEffectiveHashrate()).isEqualTo(1_000L);
    }

    @Test
    void computeEffectiveHashrate_doesNotApply() {
        fixture.world.joinPool(agentId, new PoolMembership(1L, 0L, true, 600_000L));

        CapacityBreakdown preview = capacityService.computeEffectiveHashrate(agentId);

        // base 10% + homogeneous 5% + loyalty 3%
        assertThat(preview.poolAdjusted()).isEqualTo(1_180L);
        assertThat(preview.effectiveHashrate()).isEqualTo(1_180L);
        assertThat(capacityService.getEffectiveHashrate(agentId)).isEqualTo(1_000L);
    }

    @Test
    void recompute_dominantPool_losesBonusAndPaysPenalty() {
        fixture.world.joinPool(agentId, new PoolMembership(1L, 1_000_000L, false, 0L));

        assertThat(capacityService.recompute(agentId)).isEqualTo(800L);

        fixture.world.leavePool(agentId);
        assertThat(capacityService.recompute(agentId)).isEqualTo(1_000L);
    }

    @Test
    void recompute_inactiveAgent_isZero() {
        fixture.clock.advance(fixture.agentProperties.getSilenceWindowBlocks() + 1);
        assertThat(fixture.agentRegistry.deactivateIfSilent(agentId)).isTrue();

        assertThat(capacityService.recompute(agentId)).isZero();
        assertThat(fixture.accumulator.getTotalEffectiveHashrate()).isZero();
    }

    @Test
    void recompute_isStableWhenNothingChanges() {
        EngineFixture taxed = new EngineFixture().singleZone().build();
        long alice = taxed.registerWithRig("alice", 0, 1_000L);

        // sole agent: 100% share pays the full 50% tax, pioneer bonus is 20% of the raw sum
        assertThat(taxed.capacityService.getEffectiveHashrate(alice)).isEqualTo(700L);
        assertThat(taxed.capacityService.recompute(alice)).isEqualTo(700L);
        assertThat(taxed.capacityService.recompute(alice)).isEqualTo(700L);

        long bob = taxed.registerWithRig("bob", 0, 1_000L);
        long aliceWithBob = taxed.capacityService.recompute(alice);
        long bobWithAlice = taxed.capacityService.recompute(bob);

        assertThat(taxed.capacityService.recompute(alice)).isEqualTo(aliceWithBob);
        assertThat(taxed.capacityService.recompute(bob)).isEqualTo(bobWithAlice);
        assertThat(taxed.capacityService.computeEffectiveHashrate(alice).effectiveHashrate()).isEqualTo(aliceWithBob);
        assertThat(taxed.accumulator.getTotalEffectiveHashrate()).isEqualTo(aliceWithBob + bobWithAlice);
    }

    @Test
    void recompute_unknownAgent_isNotFound() {
        assertThatThrownBy(() -> capacityService.recompute(42L)).isInstanceOf(NotFoundException.class);
    }
}
