package com.slb.chaos_engine.modules.event.service;

import com.slb.chaos_engine.common.ledger.SeededEntropySource;
import com.slb.chaos_engine.modules.event.domain.EventRoll;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRandomnessTest {

    private final EventRandomness randomness = new EventRandomness(new SeededEntropySource("seed-a"));

    @Test
    void roll_sameBlockAndId_isDeterministic() {
        EventRandomness replica = new EventRandomness(new SeededEntropySource("seed-a"));

        for (long eventId = 1; eventId <= 20; eventId++) {
            assertThat(replica.roll(5_000L, eventId, 5, 8)).isEqualTo(randomness.roll(5_000L, eventId, 5, 8));
        }
    }

    @Test
    void roll_differentSeeds_diverge() {
        EventRandomness other = new EventRandomness(new SeededEntropySource("seed-b"));
        Set<EventRoll> mine = new HashSet<>();
        Set<EventRoll> theirs = new HashSet<>();
        for (long eventId = 1; eventId <= 20; eventId++) {
            mine.add(randomness.roll(5_000L, eventId, 5, 8));
            theirs.add(other.roll(5_000L, eventId, 5, 8));
        }

        assertThat(mine).isNotEqualTo(theirs);
    }

    @Test
    void roll_staysWithinEraAndRing() {
        Set<Integer> tiers = new HashSet<>();
        for (long eventId = 1; eventId <= 300; eventId++) {
            EventRoll roll = randomness.roll(eventId * 7, eventId, 3, 8);
            assertThat(roll.severityTier()).isBetween(1, 3);
            assertThat(roll.originZone()).isBetween(0, 7);
            assertThat(roll.affectedZonesMask() & (1 << roll.originZone())).isNotZero();
            assertThat(roll.affectedZonesMask() >>> 8).isZero();
            tiers.add(roll.severityTier());
        }
        assertThat(tiers).containsExactlyInAnyOrder(1, 2, 3);
    }

    @Test
    void roll_tierOne_hitsOnlyTheOrigin() {
        EventRoll roll = randomness.roll(77L, 1L, 1, 8);

        assertThat(roll.severityTier()).isEqualTo(1);
        assertThat(Integer.bitCount(roll.affectedZonesMask())).isEqualTo(1);
    }

    @Test
    void affectedMask_wrapsAroundTheRing() {
        // tier 5: radius 2 around zone 0 -> zones 6, 7, 0, 1, 2
        assertThat(EventRandomness.affectedMask(0, 5, 8)).isEqualTo(0b1100_0111);
        assertThat(EventRandomness.affectedMask(3, 3, 8)).isEqualTo(0b0001_1100);
        assertThat(EventRandomness.affectedMask(0, 5, 3)).isEqualTo(0b111);
        assertThat(EventRandomness.affectedMask(0, 5, 1)).isEqualTo(0b1);
    }

    @Test
    void roll_invalidBounds_areRejected() {
        assertThatThrownBy(() -> randomness.roll(1L, 1L, 0, 8)).isInstanceOf(IllegalArgumentException.class);
    }
}
