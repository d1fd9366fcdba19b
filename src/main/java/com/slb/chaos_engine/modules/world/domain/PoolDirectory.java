package com.slb.chaos_engine.modules.world.domain;

import java.util.Optional;

public interface PoolDirectory {

    Optional<PoolMembership> findPool(long agentId);
}
