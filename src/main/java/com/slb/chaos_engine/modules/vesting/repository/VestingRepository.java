package com.slb.chaos_engine.modules.vesting.repository;

import com.slb.chaos_engine.modules.vesting.entity.VestingEntry;

import java.util.List;
import java.util.Optional;

public interface VestingRepository {

    VestingEntry insert(VestingEntry entry);

    Optional<VestingEntry> selectById(long entryId);

    List<VestingEntry> selectByAgentId(long agentId);

    void deleteById(long entryId);
}
