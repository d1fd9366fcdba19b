package com.slb.chaos_engine.modules.event.enums;

/**
 * Event lifecycle. Only moves forward.
 */
public enum EventStatus {
    TRIGGERED,  // no shard processed yet
    SHARDING,   // some required shards processed
    PROCESSED   // every required shard processed
}
