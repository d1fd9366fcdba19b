package com.slb.chaos_engine.modules.world.service;

import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.modules.event.enums.CosmicEventType;
import com.slb.chaos_engine.modules.world.config.WorldProperties;
import com.slb.chaos_engine.modules.world.domain.ZoneConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZoneRegistryTest {

    @Test
    void defaultZones_buildTheEightZoneRing() {
        ZoneRegistry registry = new ZoneRegistry(new WorldProperties());

        assertThat(registry.zoneCount()).isEqualTo(ZoneRegistry.MAX_ZONES);
        assertThat(registry.require(0).name()).isEqualTo("The Solar Flats");
        assertThat(registry.require(0).damageMultiplierBps(CosmicEventType.SOLAR_FLARE)).isEqualTo(20_000);
    }

    @Test
    void zoneWithoutOverrides_takesNeutralDamage() {
        ZoneRegistry registry = new ZoneRegistry(new WorldProperties());

        ZoneConfig darkForest = registry.require(2);
        ZoneConfig pocketRim = registry.require(6);
        assertThat(darkForest.name()).isEqualTo("The Dark Forest");
        assertThat(darkForest.damageMultiplierBpsByType()).isEmpty();
        for (CosmicEventType type : CosmicEventType.values()) {
            assertThat(darkForest.damageMultiplierBps(type)).isEqualTo(10_000);
            assertThat(pocketRim.damageMultiplierBps(type)).isEqualTo(10_000);
        }
    }

    @Test
    void require_unknownZone_isNotFound() {
        ZoneRegistry registry = new ZoneRegistry(new WorldProperties());

        assertThatThrownBy(() -> registry.require(8)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.require(-1)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void emptyZoneTable_isRejected() {
        WorldProperties properties = new WorldProperties();
        properties.setZones(List.of());

        assertThatThrownBy(() -> new ZoneRegistry(properties)).isInstanceOf(IllegalStateException.class);
    }
}
