package com.slb.chaos_engine.modules.world.config;

import com.slb.chaos_engine.modules.event.enums.CosmicEventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app.world")
@Validated
@Data
public class WorldProperties {

    /**
     * Zone table, indexed by position. At most 8 zones fit in an event's affected-zone mask.
     */
    @NotEmpty
    @Size(max = 8)
    @Valid
    private List<Zone> zones = defaultZones();

    @Data
    public static class Zone {
        private String name;
        private int miningModifierBps;
        private Map<CosmicEventType, Integer> damageMultiplierBps = new EnumMap<>(CosmicEventType.class);

        public Zone() {
        }

        Zone(String name, int miningModifierBps, Map<CosmicEventType, Integer> damageMultiplierBps) {
            this.name = name;
            this.miningModifierBps = miningModifierBps;
            this.damageMultiplierBps.putAll(damageMultiplierBps);
        }
    }

    private static List<Zone> defaultZones() {
        List<Zone> zones = new ArrayList<>();
        zones.add(new Zone("The Solar Flats", 1_000, Map.of(CosmicEventType.SOLAR_FLARE, 20_000)));
        zones.add(new Zone("The Graviton Fields", 0, Map.of(
                CosmicEventType.SOLAR_FLARE, 5_000,
                CosmicEventType.METEOR_SHOWER, 5_000,
                CosmicEventType.VOID_RIFT, 5_000)));
        zones.add(new Zone("The Dark Forest", 0, Map.of()));
        zones.add(new Zone("The Nebula Depths", 1_000, Map.of(CosmicEventType.METEOR_SHOWER, 12_500)));
        zones.add(new Zone("The Kuiper Expanse", 500, Map.of(CosmicEventType.METEOR_SHOWER, 15_000)));
        zones.add(new Zone("The Trisolaran Reach", 2_000, Map.of(
                CosmicEventType.SOLAR_FLARE, 15_000,
                CosmicEventType.METEOR_SHOWER, 15_000,
                CosmicEventType.GRAVITY_WAVE, 15_000,
                CosmicEventType.VOID_RIFT, 15_000)));
        zones.add(new Zone("The Pocket Rim", 800, Map.of()));
        zones.add(new Zone("The Singer Void", 300, Map.of(
                CosmicEventType.SOLAR_FLARE, 7_000,
                CosmicEventType.METEOR_SHOWER, 7_000,
                CosmicEventType.GRAVITY_WAVE, 7_000,
                CosmicEventType.VOID_RIFT, 15_000)));
        return zones;
    }
}
