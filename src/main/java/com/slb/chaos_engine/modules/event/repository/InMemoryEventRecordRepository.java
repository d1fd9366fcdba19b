package com.slb.chaos_engine.modules.event.repository;

import com.slb.chaos_engine.modules.event.entity.EventRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class InMemoryEventRecordRepository implements EventRecordRepository {

    // id - 1 is the list index
    private final List<EventRecord> events = new ArrayList<>();

    @Override
    public long nextId() {
        return events.size() + 1L;
    }

    @Override
    public EventRecord insert(EventRecord record) {
        record.setId(nextId());
        events.add(record);
        return record;
    }

    @Override
    public Optional<EventRecord> selectById(long eventId) {
        if (eventId < 1 || eventId > events.size()) {
            return Optional.empty();
        }
        return Optional.of(events.get((int) (eventId - 1)));
    }

    @Override
    public List<EventRecord> selectRecent(int limit) {
        List<EventRecord> recent = new ArrayList<>(Math.min(limit, events.size()));
        for (int i = events.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(events.get(i));
        }
        return recent;
    }

    @Override
    public Optional<Long> lastEventBlock() {
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(events.get(events.size() - 1).getTriggerBlock());
    }
}
