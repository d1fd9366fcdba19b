package com.slb.chaos_engine.modules.world.domain;

import java.util.List;

/**
 * Narrow view of the equipment collaborator. The engine computes damage percentages; the
 * collaborator owns the equipment and applies them.
 */
public interface EquipmentGateway {

    List<EquipmentUnit> getAgentEquipmentState(long agentId);

    void applyDurabilityDamage(long agentId, int damageBps);
}
