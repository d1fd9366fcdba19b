package com.slb.chaos_engine.modules.world.domain;

import com.slb.chaos_engine.modules.event.enums.CosmicEventType;

import java.util.Map;

/**
 * Static zone rules, read-only to the engine.
 *
 * @param miningModifierBps          additive hashrate modifier, e.g. 1000 = +10%
 * @param damageMultiplierBpsByType  per event type damage scale, 10000 = 1.0x
 */
public record ZoneConfig(int zoneId, String name, int miningModifierBps, Map<CosmicEventType, Integer> damageMultiplierBpsByType) {

    public int damageMultiplierBps(CosmicEventType type) {
        return damageMultiplierBpsByType.getOrDefault(type, 10_000);
    }
}
