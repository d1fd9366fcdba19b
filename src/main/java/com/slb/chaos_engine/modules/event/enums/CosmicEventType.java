package com.slb.chaos_engine.modules.event.enums;

/**
 * Kinds of cosmic event. Zones scale damage per kind.
 */
public enum CosmicEventType {
    SOLAR_FLARE,
    METEOR_SHOWER,
    GRAVITY_WAVE,
    VOID_RIFT;

    public static CosmicEventType fromIndex(int index) {
        CosmicEventType[] values = values();
        return values[Math.floorMod(index, values.length)];
    }
}
