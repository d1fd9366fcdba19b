package com.slb.chaos_engine.modules.world.service;

import com.slb.chaos_engine.common.exception.NotFoundException;
import com.slb.chaos_engine.modules.event.enums.CosmicEventType;
import com.slb.chaos_engine.modules.world.config.WorldProperties;
import com.slb.chaos_engine.modules.world.domain.ZoneConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 区域注册表 / Immutable zone table built from {@code app.world.zones}.
 */
@Component
public class ZoneRegistry {

    public static final int MAX_ZONES = 8;

    private final List<ZoneConfig> zones;

    public ZoneRegistry(WorldProperties properties) {
        List<WorldProperties.Zone> definitions = properties.getZones();
        if (definitions == null || definitions.isEmpty() || definitions.size() > MAX_ZONES) {
            throw new IllegalStateException("app.world.zones must define between 1 and " + MAX_ZONES + " zones");
        }
        List<ZoneConfig> table = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            WorldProperties.Zone def = definitions.get(i);
            Map<CosmicEventType, Integer> multipliers = new EnumMap<>(CosmicEventType.class);
            if (def.getDamageMultiplierBps() != null) {
                multipliers.putAll(def.getDamageMultiplierBps());
            }
            String name = def.getName() != null ? def.getName() : "Zone " + i;
            table.add(new ZoneConfig(i, name, def.getMiningModifierBps(), Collections.unmodifiableMap(multipliers)));
        }
        this.zones = Collections.unmodifiableList(table);
    }

    public int zoneCount() {
        return zones.size();
    }

    public List<ZoneConfig> getZones() {
        return zones;
    }

    public boolean exists(int zoneId) {
        return zoneId >= 0 && zoneId < zones.size();
    }

    public ZoneConfig require(int zoneId) {
        if (!exists(zoneId)) {
            throw NotFoundException.zone(zoneId);
        }
        return zones.get(zoneId);
    }
}
