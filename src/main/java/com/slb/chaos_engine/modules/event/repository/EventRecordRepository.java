package com.slb.chaos_engine.modules.event.repository;

import com.slb.chaos_engine.modules.event.entity.EventRecord;

import java.util.List;
import java.util.Optional;

public interface EventRecordRepository {

    /** Next id that {@link #insert} will assign. */
    long nextId();

    EventRecord insert(EventRecord record);

    Optional<EventRecord> selectById(long eventId);

    /** Newest first. */
    List<EventRecord> selectRecent(int limit);

    /** Trigger block of the latest event, empty before the first one. */
    Optional<Long> lastEventBlock();
}
