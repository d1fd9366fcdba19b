package com.slb.chaos_engine.modules.world.domain;

/**
 * One equipped unit as reported by the equipment collaborator.
 *
 * @param baseCapacity       nominal hashrate of the unit
 * @param quirkId            behavioural quirk, 0 = none
 * @param durabilityRatioBps remaining durability, 10000 = pristine
 */
public record EquipmentUnit(long baseCapacity, int quirkId, int durabilityRatioBps) {
}
