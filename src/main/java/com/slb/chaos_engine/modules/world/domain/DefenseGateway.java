package com.slb.chaos_engine.modules.world.domain;

public interface DefenseGateway {

    int getShelterBps(long agentId);

    int getShieldAbsorptionBps(long agentId);
}
