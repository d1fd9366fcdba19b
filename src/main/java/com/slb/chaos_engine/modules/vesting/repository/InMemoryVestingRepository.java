package com.slb.chaos_engine.modules.vesting.repository;

import com.slb.chaos_engine.modules.vesting.entity.VestingEntry;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class InMemoryVestingRepository implements VestingRepository {

    private final Map<Long, VestingEntry> entries = new LinkedHashMap<>();
    private long nextId = 1L;

    @Override
    public VestingEntry insert(VestingEntry entry) {
        entry.setId(nextId++);
        entries.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public Optional<VestingEntry> selectById(long entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public List<VestingEntry> selectByAgentId(long agentId) {
        return entries.values().stream()
                .filter(e -> e.getAgentId() != null && e.getAgentId() == agentId)
                .collect(Collectors.toList());
    }

    @Override
    public void deleteById(long entryId) {
        entries.remove(entryId);
    }
}
