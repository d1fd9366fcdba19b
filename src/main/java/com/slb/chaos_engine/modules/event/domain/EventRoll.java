package com.slb.chaos_engine.modules.event.domain;

import com.slb.chaos_engine.modules.event.enums.CosmicEventType;

/**
 * Deterministic outcome of an event trigger.
 *
 * @param affectedZonesMask bit {@code i} set when zone {@code i} is hit
 */
public record EventRoll(CosmicEventType type, int severityTier, int originZone, int affectedZonesMask) {
}
